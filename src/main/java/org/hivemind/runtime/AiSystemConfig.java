package org.hivemind.runtime;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.hivemind.runtime.pathfinding.PathfindingAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Settings of one {@link AgentOrchestrator}.
 * <p>
 * Read from the {@code hivemind.ai} block by {@link #fromConfig(Config)}. Invalid tuning values
 * are replaced by their defaults with a WARN log. The per-tick budgets and the search cell size
 * are not repaired there: {@link #validate()} rejects them when an orchestrator is constructed,
 * and {@link #clampedForReconfigure()} repairs them for live reconfiguration.
 *
 * @param algorithm The built-in pathfinding algorithm.
 * @param strategyClass Class name of a custom strategy overriding {@code algorithm}, or {@code null}.
 * @param maxAgentUpdatesPerTick Agent updates allowed per tick.
 * @param maxPathfindsPerTick Pathfinding requests drained per tick.
 * @param flowFieldResolution Flow field cell size.
 * @param flowFieldExtent Half the edge of the window a flow field covers.
 * @param avoidanceRadius Default local-avoidance radius.
 * @param groupBehaviorEnabled Whether swarm agents flock.
 * @param maxPathLength Maximum flow field steps per path.
 * @param waypointSpacing Distance between straight-line waypoints.
 * @param searchCellSize A* and Dijkstra lattice spacing.
 * @param searchMaxNodes A* and Dijkstra closed-set limit.
 * @param pathQuantum Quantum of the path cache key.
 * @param maxCachedPaths Path cache capacity.
 * @param maxFlowFields Flow field cache capacity.
 * @param pathTtlMillis Age after which cached paths expire.
 * @param maintenanceIntervalMillis Time between cache maintenance passes.
 */
public record AiSystemConfig(
    PathfindingAlgorithm algorithm,
    String strategyClass,
    int maxAgentUpdatesPerTick,
    int maxPathfindsPerTick,
    double flowFieldResolution,
    double flowFieldExtent,
    double avoidanceRadius,
    boolean groupBehaviorEnabled,
    int maxPathLength,
    double waypointSpacing,
    double searchCellSize,
    int searchMaxNodes,
    double pathQuantum,
    int maxCachedPaths,
    int maxFlowFields,
    long pathTtlMillis,
    long maintenanceIntervalMillis
) {

    private static final Logger LOG = LoggerFactory.getLogger(AiSystemConfig.class);

    public static final PathfindingAlgorithm DEFAULT_ALGORITHM = PathfindingAlgorithm.FLOW_FIELD;
    public static final int DEFAULT_MAX_AGENT_UPDATES = 50;
    public static final int DEFAULT_MAX_PATHFINDS = 10;
    public static final double DEFAULT_FLOW_FIELD_RESOLUTION = 32.0;
    public static final double DEFAULT_FLOW_FIELD_EXTENT = 1024.0;
    public static final double DEFAULT_AVOIDANCE_RADIUS = 30.0;
    public static final int DEFAULT_MAX_PATH_LENGTH = 50;
    public static final double DEFAULT_WAYPOINT_SPACING = 50.0;
    public static final double DEFAULT_SEARCH_CELL_SIZE = 20.0;
    public static final int DEFAULT_SEARCH_MAX_NODES = 1000;
    public static final double DEFAULT_PATH_QUANTUM = 50.0;
    public static final int DEFAULT_MAX_CACHED_PATHS = 100;
    public static final int DEFAULT_MAX_FLOW_FIELDS = 10;
    public static final long DEFAULT_PATH_TTL_MILLIS = 30_000L;
    public static final long DEFAULT_MAINTENANCE_INTERVAL_MILLIS = 5_000L;

    /**
     * @return The built-in defaults, identical to {@code reference.conf}.
     */
    public static AiSystemConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the {@code hivemind.ai} block.
     *
     * @param ai The {@code hivemind.ai} configuration block.
     * @return The parsed configuration. Budgets and search cell size are taken as configured.
     * @throws IllegalArgumentException if the algorithm name is unknown.
     */
    public static AiSystemConfig fromConfig(Config ai) {
        Builder b = builder()
            .algorithm(PathfindingAlgorithm.fromConfigName(ai.getString("algorithm")))
            .strategyClass(ai.hasPath("strategy-class") ? ai.getString("strategy-class") : null)
            .maxAgentUpdatesPerTick(ai.getInt("max-agent-updates-per-tick"))
            .maxPathfindsPerTick(ai.getInt("max-pathfinds-per-tick"))
            .flowFieldResolution(positive(ai, "flow-field-resolution", DEFAULT_FLOW_FIELD_RESOLUTION))
            .flowFieldExtent(positive(ai, "flow-field-extent", DEFAULT_FLOW_FIELD_EXTENT))
            .avoidanceRadius(nonNegative(ai, "avoidance-radius", DEFAULT_AVOIDANCE_RADIUS))
            .groupBehaviorEnabled(ai.getBoolean("group-behavior-enabled"))
            .maxPathLength((int) positive(ai, "max-path-length", DEFAULT_MAX_PATH_LENGTH))
            .waypointSpacing(positive(ai, "waypoint-spacing", DEFAULT_WAYPOINT_SPACING))
            .searchCellSize(ai.getDouble("search.cell-size"))
            .searchMaxNodes((int) positive(ai, "search.max-nodes", DEFAULT_SEARCH_MAX_NODES))
            .pathQuantum(positive(ai, "cache.path-quantum", DEFAULT_PATH_QUANTUM))
            .maxCachedPaths((int) positive(ai, "cache.max-paths", DEFAULT_MAX_CACHED_PATHS))
            .maxFlowFields((int) positive(ai, "cache.max-flow-fields", DEFAULT_MAX_FLOW_FIELDS))
            .pathTtlMillis(positiveMillis(ai, "cache.path-ttl", DEFAULT_PATH_TTL_MILLIS))
            .maintenanceIntervalMillis(positiveMillis(ai, "cache.maintenance-interval", DEFAULT_MAINTENANCE_INTERVAL_MILLIS));
        return b.build();
    }

    /**
     * Rejects settings that would invalidate every scheduling or search operation.
     *
     * @throws IllegalArgumentException if a budget or the search cell size is not positive,
     *                                  or the algorithm is missing.
     */
    public void validate() {
        if (algorithm == null) {
            throw new IllegalArgumentException("Pathfinding algorithm must not be null");
        }
        if (maxAgentUpdatesPerTick <= 0) {
            throw new IllegalArgumentException("max-agent-updates-per-tick must be positive, got " + maxAgentUpdatesPerTick);
        }
        if (maxPathfindsPerTick <= 0) {
            throw new IllegalArgumentException("max-pathfinds-per-tick must be positive, got " + maxPathfindsPerTick);
        }
        if (!(searchCellSize > 0.0)) {
            throw new IllegalArgumentException("search.cell-size must be positive, got " + searchCellSize);
        }
        if (!(flowFieldResolution > 0.0)) {
            throw new IllegalArgumentException("flow-field-resolution must be positive, got " + flowFieldResolution);
        }
    }

    /**
     * Returns a copy in which invalid budgets and sizes are replaced by their defaults, each
     * with a WARN log. Used when reconfiguring a running orchestrator.
     *
     * @return The repaired configuration.
     */
    public AiSystemConfig clampedForReconfigure() {
        Builder b = toBuilder();
        if (algorithm == null) {
            LOG.warn("Missing pathfinding algorithm, using {}", DEFAULT_ALGORITHM.getConfigName());
            b.algorithm(DEFAULT_ALGORITHM);
        }
        if (maxAgentUpdatesPerTick <= 0) {
            LOG.warn("Invalid max-agent-updates-per-tick {}, using {}", maxAgentUpdatesPerTick, DEFAULT_MAX_AGENT_UPDATES);
            b.maxAgentUpdatesPerTick(DEFAULT_MAX_AGENT_UPDATES);
        }
        if (maxPathfindsPerTick <= 0) {
            LOG.warn("Invalid max-pathfinds-per-tick {}, using {}", maxPathfindsPerTick, DEFAULT_MAX_PATHFINDS);
            b.maxPathfindsPerTick(DEFAULT_MAX_PATHFINDS);
        }
        if (!(searchCellSize > 0.0)) {
            LOG.warn("Invalid search.cell-size {}, using {}", searchCellSize, DEFAULT_SEARCH_CELL_SIZE);
            b.searchCellSize(DEFAULT_SEARCH_CELL_SIZE);
        }
        if (!(flowFieldResolution > 0.0)) {
            LOG.warn("Invalid flow-field-resolution {}, using {}", flowFieldResolution, DEFAULT_FLOW_FIELD_RESOLUTION);
            b.flowFieldResolution(DEFAULT_FLOW_FIELD_RESOLUTION);
        }
        if (avoidanceRadius < 0.0 || Double.isNaN(avoidanceRadius)) {
            LOG.warn("Invalid avoidance-radius {}, using {}", avoidanceRadius, DEFAULT_AVOIDANCE_RADIUS);
            b.avoidanceRadius(DEFAULT_AVOIDANCE_RADIUS);
        }
        if (!(pathQuantum > 0.0)) {
            LOG.warn("Invalid cache.path-quantum {}, using {}", pathQuantum, DEFAULT_PATH_QUANTUM);
            b.pathQuantum(DEFAULT_PATH_QUANTUM);
        }
        if (maxCachedPaths < 1) {
            LOG.warn("Invalid cache.max-paths {}, using {}", maxCachedPaths, DEFAULT_MAX_CACHED_PATHS);
            b.maxCachedPaths(DEFAULT_MAX_CACHED_PATHS);
        }
        if (maxFlowFields < 1) {
            LOG.warn("Invalid cache.max-flow-fields {}, using {}", maxFlowFields, DEFAULT_MAX_FLOW_FIELDS);
            b.maxFlowFields(DEFAULT_MAX_FLOW_FIELDS);
        }
        return b.build();
    }

    /**
     * @return The options handed to {@link org.hivemind.runtime.spi.pathfinding.IPathfindingStrategy#initialize}.
     */
    public Config toStrategyOptions() {
        Map<String, Object> options = new HashMap<>();
        options.put("waypoint-spacing", waypointSpacing);
        options.put("search.cell-size", searchCellSize);
        options.put("search.max-nodes", searchMaxNodes);
        options.put("flow-field-resolution", flowFieldResolution);
        options.put("flow-field-extent", flowFieldExtent);
        options.put("max-path-length", maxPathLength);
        return ConfigFactory.parseMap(options);
    }

    public Builder toBuilder() {
        return new Builder()
            .algorithm(algorithm)
            .strategyClass(strategyClass)
            .maxAgentUpdatesPerTick(maxAgentUpdatesPerTick)
            .maxPathfindsPerTick(maxPathfindsPerTick)
            .flowFieldResolution(flowFieldResolution)
            .flowFieldExtent(flowFieldExtent)
            .avoidanceRadius(avoidanceRadius)
            .groupBehaviorEnabled(groupBehaviorEnabled)
            .maxPathLength(maxPathLength)
            .waypointSpacing(waypointSpacing)
            .searchCellSize(searchCellSize)
            .searchMaxNodes(searchMaxNodes)
            .pathQuantum(pathQuantum)
            .maxCachedPaths(maxCachedPaths)
            .maxFlowFields(maxFlowFields)
            .pathTtlMillis(pathTtlMillis)
            .maintenanceIntervalMillis(maintenanceIntervalMillis);
    }

    private static double positive(Config config, String path, double fallback) {
        double value = config.getDouble(path);
        if (!(value > 0.0) || Double.isInfinite(value)) {
            LOG.warn("Invalid value {} for '{}', using default {}", value, path, fallback);
            return fallback;
        }
        return value;
    }

    private static double nonNegative(Config config, String path, double fallback) {
        double value = config.getDouble(path);
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            LOG.warn("Invalid value {} for '{}', using default {}", value, path, fallback);
            return fallback;
        }
        return value;
    }

    private static long positiveMillis(Config config, String path, long fallback) {
        long value = config.getDuration(path, TimeUnit.MILLISECONDS);
        if (value <= 0L) {
            LOG.warn("Invalid duration {} ms for '{}', using default {} ms", value, path, fallback);
            return fallback;
        }
        return value;
    }

    /**
     * Builder for {@link AiSystemConfig}, pre-filled with the defaults.
     */
    public static final class Builder {
        private PathfindingAlgorithm algorithm = DEFAULT_ALGORITHM;
        private String strategyClass;
        private int maxAgentUpdatesPerTick = DEFAULT_MAX_AGENT_UPDATES;
        private int maxPathfindsPerTick = DEFAULT_MAX_PATHFINDS;
        private double flowFieldResolution = DEFAULT_FLOW_FIELD_RESOLUTION;
        private double flowFieldExtent = DEFAULT_FLOW_FIELD_EXTENT;
        private double avoidanceRadius = DEFAULT_AVOIDANCE_RADIUS;
        private boolean groupBehaviorEnabled = true;
        private int maxPathLength = DEFAULT_MAX_PATH_LENGTH;
        private double waypointSpacing = DEFAULT_WAYPOINT_SPACING;
        private double searchCellSize = DEFAULT_SEARCH_CELL_SIZE;
        private int searchMaxNodes = DEFAULT_SEARCH_MAX_NODES;
        private double pathQuantum = DEFAULT_PATH_QUANTUM;
        private int maxCachedPaths = DEFAULT_MAX_CACHED_PATHS;
        private int maxFlowFields = DEFAULT_MAX_FLOW_FIELDS;
        private long pathTtlMillis = DEFAULT_PATH_TTL_MILLIS;
        private long maintenanceIntervalMillis = DEFAULT_MAINTENANCE_INTERVAL_MILLIS;

        private Builder() {
        }

        public Builder algorithm(PathfindingAlgorithm algorithm) { this.algorithm = algorithm; return this; }

        public Builder strategyClass(String strategyClass) { this.strategyClass = strategyClass; return this; }

        public Builder maxAgentUpdatesPerTick(int value) { this.maxAgentUpdatesPerTick = value; return this; }

        public Builder maxPathfindsPerTick(int value) { this.maxPathfindsPerTick = value; return this; }

        public Builder flowFieldResolution(double value) { this.flowFieldResolution = value; return this; }

        public Builder flowFieldExtent(double value) { this.flowFieldExtent = value; return this; }

        public Builder avoidanceRadius(double value) { this.avoidanceRadius = value; return this; }

        public Builder groupBehaviorEnabled(boolean value) { this.groupBehaviorEnabled = value; return this; }

        public Builder maxPathLength(int value) { this.maxPathLength = value; return this; }

        public Builder waypointSpacing(double value) { this.waypointSpacing = value; return this; }

        public Builder searchCellSize(double value) { this.searchCellSize = value; return this; }

        public Builder searchMaxNodes(int value) { this.searchMaxNodes = value; return this; }

        public Builder pathQuantum(double value) { this.pathQuantum = value; return this; }

        public Builder maxCachedPaths(int value) { this.maxCachedPaths = value; return this; }

        public Builder maxFlowFields(int value) { this.maxFlowFields = value; return this; }

        public Builder pathTtlMillis(long value) { this.pathTtlMillis = value; return this; }

        public Builder maintenanceIntervalMillis(long value) { this.maintenanceIntervalMillis = value; return this; }

        public AiSystemConfig build() {
            return new AiSystemConfig(algorithm, strategyClass, maxAgentUpdatesPerTick, maxPathfindsPerTick,
                flowFieldResolution, flowFieldExtent, avoidanceRadius, groupBehaviorEnabled, maxPathLength,
                waypointSpacing, searchCellSize, searchMaxNodes, pathQuantum, maxCachedPaths, maxFlowFields,
                pathTtlMillis, maintenanceIntervalMillis);
        }
    }
}
