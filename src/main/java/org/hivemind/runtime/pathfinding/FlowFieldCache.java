package org.hivemind.runtime.pathfinding;

import java.util.function.Function;

import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.spatial.GridKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;

/**
 * Flow fields keyed by quantized goal cell.
 * <p>
 * A field is built once per goal cell and reused by every agent heading into that cell. When
 * an insertion exceeds the capacity, the oldest half of the fields is evicted.
 */
public class FlowFieldCache {

    private static final Logger LOG = LoggerFactory.getLogger(FlowFieldCache.class);

    /** Goal quantum: goals within the same 100-unit cell share a field. */
    public static final double GOAL_QUANTUM = 100.0;

    private final int maxFields;
    private final Long2ObjectLinkedOpenHashMap<FlowField> fields = new Long2ObjectLinkedOpenHashMap<>();
    private int builds;

    /**
     * @param maxFields Capacity, at least 1.
     */
    public FlowFieldCache(int maxFields) {
        if (maxFields < 1) {
            throw new IllegalArgumentException("Flow field cache capacity must be at least 1, got " + maxFields);
        }
        this.maxFields = maxFields;
    }

    public static long keyFor(Vector2 goal) {
        return GridKeys.pack(GridKeys.quantize(goal.x(), GOAL_QUANTUM), GridKeys.quantize(goal.y(), GOAL_QUANTUM));
    }

    /**
     * Returns the field for the goal's cell, building it on a miss.
     *
     * @param goal The goal position.
     * @param builder Builds a field for a goal.
     * @return The cached or newly built field.
     */
    public FlowField getOrBuild(Vector2 goal, Function<Vector2, FlowField> builder) {
        long key = keyFor(goal);
        FlowField field = fields.get(key);
        if (field == null) {
            field = builder.apply(goal);
            fields.put(key, field);
            builds++;
            if (fields.size() > maxFields) {
                evictOldestHalf();
            }
        }
        return field;
    }

    public boolean contains(Vector2 goal) {
        return fields.containsKey(keyFor(goal));
    }

    public int size() {
        return fields.size();
    }

    /** @return How many fields have been built since creation. */
    public int getBuildCount() {
        return builds;
    }

    public void clear() {
        fields.clear();
    }

    private void evictOldestHalf() {
        int toRemove = fields.size() / 2;
        for (int i = 0; i < toRemove; i++) {
            fields.removeFirst();
        }
        LOG.debug("Flow field cache overflow, evicted {} oldest fields", toRemove);
    }
}
