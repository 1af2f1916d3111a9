package org.hivemind.runtime.spi.pathfinding;

import java.util.function.Supplier;

import org.hivemind.runtime.pathfinding.FlowFieldCache;
import org.hivemind.runtime.pathfinding.navmesh.NavMesh;
import org.hivemind.runtime.spatial.WorldBounds;
import org.hivemind.runtime.spi.IObstacleMap;

/**
 * What a pathfinding strategy may consult.
 *
 * @param bounds The world bounds.
 * @param obstacles Walkability query.
 * @param flowFields The orchestrator's flow field cache.
 * @param navMesh Supplies the currently loaded navigation mesh, or {@code null} when none is loaded.
 */
public record PathfindingEnvironment(
    WorldBounds bounds,
    IObstacleMap obstacles,
    FlowFieldCache flowFields,
    Supplier<NavMesh> navMesh
) {
}
