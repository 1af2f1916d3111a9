package org.hivemind.runtime.pathfinding;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.spatial.GridKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizes computed paths by quantized (start, goal) pair.
 * <p>
 * Entries are kept in insertion order. When an insertion pushes the cache past its capacity,
 * the oldest half is evicted. {@link #maintain(long)} additionally drops entries older than
 * the configured time-to-live.
 */
public class PathCache {

    private static final Logger LOG = LoggerFactory.getLogger(PathCache.class);

    /**
     * Cache key: start and goal cells at the cache quantum.
     */
    public record PathKey(int startX, int startY, int goalX, int goalY) {}

    private record CachedPath(List<Vector2> waypoints, long insertedAt) {}

    private final double quantum;
    private final int maxEntries;
    private final long ttlMillis;
    private final LinkedHashMap<PathKey, CachedPath> entries = new LinkedHashMap<>();

    /**
     * @param quantum Cell size used to quantize start and goal, positive.
     * @param maxEntries Capacity, at least 1.
     * @param ttlMillis Maximum age of an entry at maintenance time.
     */
    public PathCache(double quantum, int maxEntries, long ttlMillis) {
        if (!(quantum > 0.0)) {
            throw new IllegalArgumentException("Path cache quantum must be positive, got " + quantum);
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Path cache capacity must be at least 1, got " + maxEntries);
        }
        this.quantum = quantum;
        this.maxEntries = maxEntries;
        this.ttlMillis = ttlMillis;
    }

    public PathKey keyFor(Vector2 start, Vector2 goal) {
        return new PathKey(
                GridKeys.quantize(start.x(), quantum), GridKeys.quantize(start.y(), quantum),
                GridKeys.quantize(goal.x(), quantum), GridKeys.quantize(goal.y(), quantum));
    }

    /**
     * @param start The path start.
     * @param goal The path goal.
     * @return The cached waypoints for the quantized pair, if present.
     */
    public Optional<List<Vector2>> get(Vector2 start, Vector2 goal) {
        CachedPath cached = entries.get(keyFor(start, goal));
        return cached == null ? Optional.empty() : Optional.of(cached.waypoints());
    }

    /**
     * Stores a path. Empty paths are not cached.
     *
     * @param start The path start.
     * @param goal The path goal.
     * @param waypoints The computed waypoints.
     * @param now The current simulation time.
     */
    public void put(Vector2 start, Vector2 goal, List<Vector2> waypoints, long now) {
        if (waypoints.isEmpty()) {
            return;
        }
        entries.put(keyFor(start, goal), new CachedPath(List.copyOf(waypoints), now));
        if (entries.size() > maxEntries) {
            evictOldestHalf();
        }
    }

    /**
     * Drops entries older than the time-to-live.
     *
     * @param now The current simulation time.
     * @return The number of entries removed.
     */
    public int maintain(long now) {
        int removed = 0;
        Iterator<Map.Entry<PathKey, CachedPath>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (now - it.next().getValue().insertedAt() > ttlMillis) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debug("Expired {} cached paths, {} remain", removed, entries.size());
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private void evictOldestHalf() {
        int toRemove = entries.size() / 2;
        Iterator<PathKey> it = entries.keySet().iterator();
        for (int i = 0; i < toRemove && it.hasNext(); i++) {
            it.next();
            it.remove();
        }
        LOG.debug("Path cache overflow, evicted {} oldest entries", toRemove);
    }
}
