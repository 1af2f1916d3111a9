package org.hivemind.runtime.pathfinding;

import java.util.Arrays;
import java.util.Locale;

/**
 * The built-in pathfinding algorithms, selectable through {@code hivemind.ai.algorithm}.
 */
public enum PathfindingAlgorithm {
    DIRECT("direct"),
    ASTAR("astar"),
    FLOW_FIELD("flowfield"),
    DIJKSTRA("dijkstra"),
    NAVMESH("navmesh");

    private final String configName;

    PathfindingAlgorithm(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolves a configuration name such as {@code "astar"} (case-insensitive).
     *
     * @param name The configured name.
     * @return The matching algorithm.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static PathfindingAlgorithm fromConfigName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (PathfindingAlgorithm algorithm : values()) {
                if (algorithm.configName.equals(normalized)) {
                    return algorithm;
                }
            }
        }
        throw new IllegalArgumentException("Unknown pathfinding algorithm '" + name + "', expected one of "
                + Arrays.stream(values()).map(PathfindingAlgorithm::getConfigName).toList());
    }
}
