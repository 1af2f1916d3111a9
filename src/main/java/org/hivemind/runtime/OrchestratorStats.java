package org.hivemind.runtime;

import org.hivemind.runtime.pathfinding.PathfindingAlgorithm;

/**
 * Monitoring snapshot of an {@link AgentOrchestrator}. Per-tick counters refer to the most
 * recent {@code update} call.
 *
 * @param agentUpdates Agents updated in the last tick.
 * @param requestsProcessed Pathfinding requests dequeued in the last tick.
 * @param strategyInvocations Paths computed by the strategy in the last tick.
 * @param cacheHits Requests answered from the path cache in the last tick.
 * @param pathCacheSize Cached paths.
 * @param flowFieldCount Cached flow fields.
 * @param pendingRequests Requests waiting in the queue.
 * @param trackedAgents Agent records held.
 * @param algorithm The configured pathfinding algorithm.
 */
public record OrchestratorStats(
    int agentUpdates,
    int requestsProcessed,
    int strategyInvocations,
    int cacheHits,
    int pathCacheSize,
    int flowFieldCount,
    int pendingRequests,
    int trackedAgents,
    PathfindingAlgorithm algorithm
) {
}
