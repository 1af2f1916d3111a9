package org.hivemind.runtime.model;

import java.util.Optional;
import java.util.OptionalInt;

import it.unimi.dsi.fastutil.ints.Int2DoubleMap;
import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * What an agent remembers about other entities.
 * <p>
 * All entries are keyed by entity id. The memory never holds entity objects, so a remembered
 * entity may have been destroyed in the meantime; callers resolve ids through the world.
 */
public class AgentMemory {

    private final Int2ObjectOpenHashMap<Vector2> lastSeenPositions = new Int2ObjectOpenHashMap<>();
    private final Int2DoubleOpenHashMap damageReceived = new Int2DoubleOpenHashMap();
    private final Int2DoubleOpenHashMap threatLevels = new Int2DoubleOpenHashMap();

    public void rememberPosition(int entityId, Vector2 position) {
        lastSeenPositions.put(entityId, position);
    }

    public Optional<Vector2> lastSeenPosition(int entityId) {
        return Optional.ofNullable(lastSeenPositions.get(entityId));
    }

    public boolean hasSeen(int entityId) {
        return lastSeenPositions.containsKey(entityId);
    }

    /**
     * Drops everything remembered about an entity.
     *
     * @param entityId The entity to forget.
     */
    public void forget(int entityId) {
        lastSeenPositions.remove(entityId);
        damageReceived.remove(entityId);
        threatLevels.remove(entityId);
    }

    /**
     * Records damage dealt by {@code sourceId} and raises its threat by {@code amount / 100}.
     *
     * @param sourceId The attacking entity.
     * @param amount The damage amount.
     */
    public void recordDamage(int sourceId, double amount) {
        damageReceived.addTo(sourceId, amount);
        updateThreat(sourceId, amount / 100.0);
    }

    public double getDamageFrom(int sourceId) {
        return damageReceived.get(sourceId);
    }

    /**
     * Adjusts the threat level of an entity. The result is clamped to [0, 1].
     *
     * @param entityId The entity.
     * @param delta The change in threat.
     */
    public void updateThreat(int entityId, double delta) {
        double current = threatLevels.get(entityId);
        threatLevels.put(entityId, Math.max(0.0, Math.min(1.0, current + delta)));
    }

    public double getThreat(int entityId) {
        return threatLevels.get(entityId);
    }

    /**
     * @return The id with the highest positive threat level, or empty if no entity is threatening.
     */
    public OptionalInt highestThreat() {
        double highest = 0.0;
        int highestId = 0;
        boolean found = false;
        for (Int2DoubleMap.Entry entry : threatLevels.int2DoubleEntrySet()) {
            if (entry.getDoubleValue() > highest) {
                highest = entry.getDoubleValue();
                highestId = entry.getIntKey();
                found = true;
            }
        }
        return found ? OptionalInt.of(highestId) : OptionalInt.empty();
    }
}
