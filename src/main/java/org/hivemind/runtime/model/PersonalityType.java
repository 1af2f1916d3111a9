package org.hivemind.runtime.model;

/**
 * Personality archetypes. Each maps to a preset {@link Personality}.
 */
public enum PersonalityType {
    /** High aggression, low fear. */
    AGGRESSIVE,
    /** Balanced, prioritizes survival. */
    DEFENSIVE,
    /** Low aggression, high fear. */
    COWARD,
    /** Ignores health, always attacks. */
    BERSERKER,
    /** Hit and run, retreats when outnumbered. */
    TACTICAL,
    /** Carries the support role: moves to wounded allies. */
    SUPPORT,
    /** Carries the guard role: holds a guard post. */
    GUARDIAN,
    /** Stalks and investigates. */
    HUNTER,
    /** Flocks with nearby allies. */
    SWARM
}
