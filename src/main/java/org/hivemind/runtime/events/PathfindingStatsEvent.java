package org.hivemind.runtime.events;

/**
 * Per-tick pathfinding summary, emitted only for ticks in which pathfinding work happened.
 *
 * @param tick The tick number.
 * @param requestsProcessed Requests dequeued this tick.
 * @param strategyInvocations Paths actually computed by the strategy.
 * @param cacheHits Requests answered from the path cache.
 * @param pendingRequests Requests still waiting after the drain.
 * @param cachedPaths Size of the path cache.
 * @param cachedFlowFields Number of cached flow fields.
 */
public record PathfindingStatsEvent(
    long tick,
    int requestsProcessed,
    int strategyInvocations,
    int cacheHits,
    int pendingRequests,
    int cachedPaths,
    int cachedFlowFields
) {
}
