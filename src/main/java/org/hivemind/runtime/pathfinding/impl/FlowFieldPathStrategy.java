package org.hivemind.runtime.pathfinding.impl;

import java.util.ArrayList;
import java.util.List;

import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.pathfinding.FlowField;
import org.hivemind.runtime.pathfinding.FlowFieldCache;
import org.hivemind.runtime.spatial.WorldBounds;
import org.hivemind.runtime.spi.IObstacleMap;
import org.hivemind.runtime.spi.pathfinding.IPathfindingStrategy;
import org.hivemind.runtime.spi.pathfinding.PathfindingEnvironment;

import com.typesafe.config.Config;

/**
 * Routes many agents towards a shared goal through a cached {@link FlowField}.
 * <p>
 * The path follows the field's steepest descent from the start cell, one cell centre per
 * step, until within one cell of the goal or {@code max-path-length} steps have been taken;
 * the goal is then appended. Starts outside the field or in unreachable cells use the
 * straight-line path.
 */
public class FlowFieldPathStrategy implements IPathfindingStrategy {

    public static final double DEFAULT_RESOLUTION = 32.0;
    public static final double DEFAULT_EXTENT = 1024.0;
    public static final int DEFAULT_MAX_PATH_LENGTH = 50;

    private double resolution = DEFAULT_RESOLUTION;
    private double extent = DEFAULT_EXTENT;
    private int maxPathLength = DEFAULT_MAX_PATH_LENGTH;
    private WorldBounds bounds = WorldBounds.centered(5000.0);
    private IObstacleMap obstacles = IObstacleMap.NONE;
    private FlowFieldCache cache;
    private DirectPathStrategy fallback = new DirectPathStrategy();

    @Override
    public void initialize(PathfindingEnvironment environment, Config options) {
        if (options.hasPath("flow-field-resolution")) {
            double configured = options.getDouble("flow-field-resolution");
            this.resolution = configured > 0.0 ? configured : DEFAULT_RESOLUTION;
        }
        if (options.hasPath("flow-field-extent")) {
            this.extent = Math.max(resolution, options.getDouble("flow-field-extent"));
        }
        if (options.hasPath("max-path-length")) {
            this.maxPathLength = Math.max(1, options.getInt("max-path-length"));
        }
        this.bounds = environment.bounds();
        this.obstacles = environment.obstacles() != null ? environment.obstacles() : IObstacleMap.NONE;
        this.cache = environment.flowFields();
        this.fallback = new DirectPathStrategy();
        this.fallback.initialize(environment, options);
    }

    @Override
    public void prepare(Vector2 sharedGoal) {
        fieldFor(sharedGoal);
    }

    @Override
    public List<Vector2> findPath(Vector2 start, Vector2 goal) {
        FlowField field = fieldFor(goal);
        int cx = field.cellOf(start.x());
        int cy = field.cellOf(start.y());
        if (field.getCost(cx, cy) == Double.POSITIVE_INFINITY) {
            return fallback.findPath(start, goal);
        }

        List<Vector2> path = new ArrayList<>();
        Vector2 current = start;
        for (int step = 0; step < maxPathLength && current.distance(goal) >= resolution; step++) {
            int direction = field.getDirection(cx, cy);
            if (direction == FlowField.NO_DIRECTION) {
                break;
            }
            cx += FlowField.directionX(direction);
            cy += FlowField.directionY(direction);
            current = new Vector2(field.cellCenterX(cx), field.cellCenterY(cy));
            path.add(current);
        }
        path.add(goal);
        return List.copyOf(path);
    }

    /**
     * Returns the cached field for the goal's cell, building it if absent.
     *
     * @param goal The goal position.
     * @return The flow field.
     */
    public FlowField fieldFor(Vector2 goal) {
        if (cache == null) {
            cache = new FlowFieldCache(10);
        }
        return cache.getOrBuild(goal, g -> FlowField.build(g, resolution, extent, bounds, obstacles));
    }
}
