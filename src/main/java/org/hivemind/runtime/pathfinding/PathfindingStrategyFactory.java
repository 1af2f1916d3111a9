package org.hivemind.runtime.pathfinding;

import java.lang.reflect.Constructor;

import org.hivemind.runtime.pathfinding.impl.AStarPathStrategy;
import org.hivemind.runtime.pathfinding.impl.DijkstraPathStrategy;
import org.hivemind.runtime.pathfinding.impl.DirectPathStrategy;
import org.hivemind.runtime.pathfinding.impl.FlowFieldPathStrategy;
import org.hivemind.runtime.pathfinding.impl.NavMeshPathStrategy;
import org.hivemind.runtime.spi.pathfinding.IPathfindingStrategy;
import org.hivemind.runtime.spi.pathfinding.PathfindingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Creates and initializes the orchestrator's pathfinding strategy.
 * <p>
 * A configured {@code strategy-class} takes precedence and is instantiated reflectively
 * through its public no-argument constructor; otherwise the built-in implementation of the
 * configured algorithm is used.
 */
public final class PathfindingStrategyFactory {

    private static final Logger LOG = LoggerFactory.getLogger(PathfindingStrategyFactory.class);

    private PathfindingStrategyFactory() {
    }

    /**
     * @param algorithm The configured algorithm.
     * @param strategyClass Fully qualified class name of a custom strategy, or {@code null}.
     * @param environment The world the strategy routes through.
     * @param options The pathfinding options passed to {@link IPathfindingStrategy#initialize}.
     * @return The initialized strategy.
     * @throws IllegalArgumentException if the custom class cannot be loaded or is not a strategy.
     */
    public static IPathfindingStrategy create(PathfindingAlgorithm algorithm, String strategyClass,
                                              PathfindingEnvironment environment, Config options) {
        IPathfindingStrategy strategy;
        if (strategyClass != null && !strategyClass.isBlank()) {
            strategy = instantiate(strategyClass.trim());
        } else {
            strategy = switch (algorithm) {
                case DIRECT -> new DirectPathStrategy();
                case ASTAR -> new AStarPathStrategy();
                case FLOW_FIELD -> new FlowFieldPathStrategy();
                case DIJKSTRA -> new DijkstraPathStrategy();
                case NAVMESH -> new NavMeshPathStrategy();
            };
        }
        strategy.initialize(environment, options);
        LOG.info("Pathfinding strategy selected: {}", strategy.getClass().getSimpleName());
        return strategy;
    }

    private static IPathfindingStrategy instantiate(String className) {
        Class<?> clazz;
        try {
            clazz = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Pathfinding strategy class not found: " + className, e);
        }
        if (!IPathfindingStrategy.class.isAssignableFrom(clazz)) {
            throw new IllegalArgumentException("Class " + className + " does not implement IPathfindingStrategy");
        }
        try {
            Constructor<?> constructor = clazz.getConstructor();
            return (IPathfindingStrategy) constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to instantiate pathfinding strategy: " + className, e);
        }
    }
}
