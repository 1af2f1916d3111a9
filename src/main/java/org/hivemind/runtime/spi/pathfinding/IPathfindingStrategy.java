package org.hivemind.runtime.spi.pathfinding;

import java.util.List;

import org.hivemind.runtime.model.Vector2;

import com.typesafe.config.Config;

/**
 * Service Provider Interface for pathfinding algorithms.
 * <p>
 * An orchestrator runs exactly one strategy. Strategies are created by
 * {@code PathfindingStrategyFactory}, either from the built-in algorithm names or reflectively
 * from a configured class name; custom implementations therefore need a public no-argument
 * constructor.
 * <p>
 * A strategy never fails a request: when it cannot route it returns the straight-line path.
 */
public interface IPathfindingStrategy {

    /**
     * Initializes the strategy. Called by the factory immediately after instantiation.
     *
     * @param environment The world the strategy routes through.
     * @param options The pathfinding options ({@code waypoint-spacing}, {@code search.*},
     *                {@code flow-field-*}, {@code max-path-length}). Missing keys fall back to
     *                the strategy's defaults.
     */
    void initialize(PathfindingEnvironment environment, Config options);

    /**
     * Computes a waypoint sequence from {@code start} to {@code goal}.
     *
     * @param start The start position.
     * @param goal The goal position.
     * @return The waypoints. The last waypoint is the goal; never {@code null}.
     */
    List<Vector2> findPath(Vector2 start, Vector2 goal);

    /**
     * Called once per tick with the goal most agents are heading for, so that strategies with
     * shared per-goal state can build it ahead of the requests. The default does nothing.
     *
     * @param sharedGoal The shared goal, usually the primary target's position.
     */
    default void prepare(Vector2 sharedGoal) {
    }
}
