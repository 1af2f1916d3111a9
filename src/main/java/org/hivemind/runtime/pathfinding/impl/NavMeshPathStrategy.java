package org.hivemind.runtime.pathfinding.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Supplier;

import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.pathfinding.navmesh.NavMesh;
import org.hivemind.runtime.spi.pathfinding.IPathfindingStrategy;
import org.hivemind.runtime.spi.pathfinding.PathfindingEnvironment;

import com.typesafe.config.Config;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Routes through the polygons of the loaded {@link NavMesh}.
 * <p>
 * The start and goal polygons are located by containment and connected by a breadth-first
 * search over polygon adjacency. Waypoints are the centres of the polygons after the start
 * polygon, followed by the goal. Without a mesh, with a point outside the mesh or with
 * disconnected polygons the straight-line path is used.
 */
public class NavMeshPathStrategy implements IPathfindingStrategy {

    private Supplier<NavMesh> navMesh = () -> null;
    private DirectPathStrategy fallback = new DirectPathStrategy();

    @Override
    public void initialize(PathfindingEnvironment environment, Config options) {
        if (environment.navMesh() != null) {
            this.navMesh = environment.navMesh();
        }
        this.fallback = new DirectPathStrategy();
        this.fallback.initialize(environment, options);
    }

    @Override
    public List<Vector2> findPath(Vector2 start, Vector2 goal) {
        NavMesh mesh = navMesh.get();
        if (mesh == null || mesh.isEmpty()) {
            return fallback.findPath(start, goal);
        }
        OptionalInt from = mesh.findPolygon(start);
        OptionalInt to = mesh.findPolygon(goal);
        if (from.isEmpty() || to.isEmpty()) {
            return fallback.findPath(start, goal);
        }
        Optional<IntList> chain = mesh.findChain(from.getAsInt(), to.getAsInt());
        if (chain.isEmpty()) {
            return fallback.findPath(start, goal);
        }

        IntList polygons = chain.get();
        List<Vector2> path = new ArrayList<>(polygons.size());
        for (int i = 1; i < polygons.size(); i++) {
            path.add(mesh.getPolygon(polygons.getInt(i)).center());
        }
        path.add(goal);
        return List.copyOf(path);
    }
}
