package org.hivemind.runtime.pathfinding.impl;

import java.util.ArrayList;
import java.util.List;

import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.spi.pathfinding.IPathfindingStrategy;
import org.hivemind.runtime.spi.pathfinding.PathfindingEnvironment;

import com.typesafe.config.Config;

/**
 * Straight line from start to goal, one waypoint every {@code waypoint-spacing} units.
 * <p>
 * Ignores obstacles. Every other strategy falls back to this one when it cannot route.
 */
public class DirectPathStrategy implements IPathfindingStrategy {

    public static final double DEFAULT_WAYPOINT_SPACING = 50.0;

    private double spacing = DEFAULT_WAYPOINT_SPACING;

    public DirectPathStrategy() {
    }

    public DirectPathStrategy(double spacing) {
        this.spacing = spacing > 0.0 ? spacing : DEFAULT_WAYPOINT_SPACING;
    }

    @Override
    public void initialize(PathfindingEnvironment environment, Config options) {
        if (options.hasPath("waypoint-spacing")) {
            double configured = options.getDouble("waypoint-spacing");
            this.spacing = configured > 0.0 ? configured : DEFAULT_WAYPOINT_SPACING;
        }
    }

    @Override
    public List<Vector2> findPath(Vector2 start, Vector2 goal) {
        return interpolate(start, goal, spacing);
    }

    public double getSpacing() {
        return spacing;
    }

    /**
     * Interpolates {@code ceil(distance / spacing)} equal steps from start to goal.
     *
     * @param start The start, emitted as the first waypoint.
     * @param goal The goal, emitted exactly as the last waypoint.
     * @param spacing Maximum distance between consecutive waypoints.
     * @return The waypoints; just the goal when start and goal coincide.
     */
    public static List<Vector2> interpolate(Vector2 start, Vector2 goal, double spacing) {
        double distance = start.distance(goal);
        if (distance == 0.0) {
            return List.of(goal);
        }
        int steps = (int) Math.ceil(distance / spacing);
        List<Vector2> path = new ArrayList<>(steps + 1);
        for (int i = 0; i < steps; i++) {
            path.add(start.lerp(goal, (double) i / steps));
        }
        path.add(goal);
        return List.copyOf(path);
    }
}
