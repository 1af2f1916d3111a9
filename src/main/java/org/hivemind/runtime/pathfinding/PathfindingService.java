package org.hivemind.runtime.pathfinding;

import java.util.List;
import java.util.Optional;

import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.pathfinding.impl.DirectPathStrategy;
import org.hivemind.runtime.spi.pathfinding.IPathfindingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers path requests from the {@link PathCache} or, on a miss, from the active strategy.
 * <p>
 * Keeps per-tick counters of strategy invocations and cache hits for the orchestrator's
 * statistics. A strategy that throws is logged and answered with the straight-line path, so
 * a faulty custom strategy cannot abort a tick.
 */
public class PathfindingService {

    private static final Logger LOG = LoggerFactory.getLogger(PathfindingService.class);

    private final PathCache cache;
    private final DirectPathStrategy fallback;
    private IPathfindingStrategy strategy;

    private int strategyInvocations;
    private int cacheHits;

    /**
     * @param strategy The active strategy.
     * @param cache The path cache.
     * @param fallback Used when the strategy fails.
     */
    public PathfindingService(IPathfindingStrategy strategy, PathCache cache, DirectPathStrategy fallback) {
        this.strategy = strategy;
        this.cache = cache;
        this.fallback = fallback;
    }

    /**
     * Returns the path from {@code start} to {@code goal}, cached if possible.
     *
     * @param start The start position.
     * @param goal The goal position.
     * @param now The current simulation time, used as the cache insertion time.
     * @return The waypoints.
     */
    public List<Vector2> findPath(Vector2 start, Vector2 goal, long now) {
        Optional<List<Vector2>> cached = cache.get(start, goal);
        if (cached.isPresent()) {
            cacheHits++;
            return cached.get();
        }
        List<Vector2> path;
        try {
            path = strategy.findPath(start, goal);
            strategyInvocations++;
        } catch (RuntimeException e) {
            LOG.warn("Pathfinding strategy '{}' failed from {} to {}, using direct path: {}",
                    strategy.getClass().getSimpleName(), start, goal, e.getMessage());
            return fallback.findPath(start, goal);
        }
        if (path == null || path.isEmpty()) {
            path = fallback.findPath(start, goal);
        }
        cache.put(start, goal, path, now);
        return path;
    }

    /**
     * Lets the strategy build shared per-goal state ahead of this tick's requests.
     *
     * @param sharedGoal The goal most agents are heading for.
     */
    public void prepare(Vector2 sharedGoal) {
        try {
            strategy.prepare(sharedGoal);
        } catch (RuntimeException e) {
            LOG.warn("Pathfinding strategy '{}' failed to prepare for {}: {}",
                    strategy.getClass().getSimpleName(), sharedGoal, e.getMessage());
        }
    }

    public void resetTickCounters() {
        strategyInvocations = 0;
        cacheHits = 0;
    }

    public int getStrategyInvocations() {
        return strategyInvocations;
    }

    public int getCacheHits() {
        return cacheHits;
    }

    public IPathfindingStrategy getStrategy() {
        return strategy;
    }

    /**
     * Swaps the active strategy. Cached paths computed by the old strategy are dropped.
     */
    public void setStrategy(IPathfindingStrategy strategy) {
        this.strategy = strategy;
        cache.clear();
    }

    public PathCache getCache() {
        return cache;
    }
}
