package org.hivemind.runtime.spi;

import org.hivemind.runtime.model.Agent;

/**
 * Data-driven formula hook applied to an agent's derived stats.
 * <p>
 * Modifiers are chained in registration order. An implementation that throws or returns a
 * non-finite value is skipped for that evaluation and the incoming value is kept; the failure
 * is logged at WARN with the modifier's class name.
 * <p>
 * Stat names used by the engine are {@link #MOVE_SPEED}, {@link #ATTACK_RANGE} and
 * {@link #SIGHT_RANGE}.
 */
@FunctionalInterface
public interface IStatModifier {

    String MOVE_SPEED = "moveSpeed";
    String ATTACK_RANGE = "attackRange";
    String SIGHT_RANGE = "sightRange";

    /**
     * @param agent The agent whose stat is evaluated.
     * @param stat The stat name.
     * @param value The value produced by the previous modifier in the chain.
     * @return The modified value.
     */
    double modify(Agent agent, String stat, double value);
}
