package org.hivemind.runtime.model;

/**
 * Parameter bundle shaping one agent's transitions and movement blending.
 *
 * @param type The archetype this bundle was derived from. Determines roles.
 * @param aggression Willingness to engage, in [0, 1].
 * @param fear Tendency to avoid danger, in [0, 1].
 * @param curiosity Tendency to investigate unseen threats, in [0, 1].
 * @param loyalty Attachment to allies, in [0, 1].
 * @param speedMultiplier Factor applied to the entity's base move speed.
 * @param fleeHealthThreshold Health fraction below which a fighting agent flees. 0 disables fleeing.
 * @param swarm Whether flocking forces are blended into movement.
 */
public record Personality(
    PersonalityType type,
    double aggression,
    double fear,
    double curiosity,
    double loyalty,
    double speedMultiplier,
    double fleeHealthThreshold,
    boolean swarm
) {

    public Personality {
        if (type == null) {
            throw new IllegalArgumentException("Personality type must not be null");
        }
        aggression = clampUnit(aggression);
        fear = clampUnit(fear);
        curiosity = clampUnit(curiosity);
        loyalty = clampUnit(loyalty);
        fleeHealthThreshold = clampUnit(fleeHealthThreshold);
        if (!(speedMultiplier > 0.0) || Double.isInfinite(speedMultiplier)) {
            speedMultiplier = 1.0;
        }
    }

    /**
     * Returns the preset bundle for an archetype.
     *
     * @param type The archetype.
     * @return The preset personality.
     */
    public static Personality of(PersonalityType type) {
        return switch (type) {
            case AGGRESSIVE -> new Personality(type, 0.8, 0.2, 0.6, 0.4, 1.0, 0.0, false);
            case DEFENSIVE -> new Personality(type, 0.5, 0.5, 0.4, 0.6, 1.0, 0.2, false);
            case COWARD -> new Personality(type, 0.2, 0.8, 0.3, 0.2, 1.2, 0.3, false);
            case BERSERKER -> new Personality(type, 1.0, 0.0, 0.7, 0.3, 1.15, 0.0, false);
            case TACTICAL -> new Personality(type, 0.6, 0.4, 0.7, 0.5, 1.0, 0.2, false);
            case SUPPORT -> new Personality(type, 0.3, 0.6, 0.5, 0.8, 1.0, 0.3, false);
            case GUARDIAN -> new Personality(type, 0.7, 0.1, 0.2, 0.9, 0.9, 0.0, false);
            case HUNTER -> new Personality(type, 0.7, 0.3, 0.8, 0.4, 1.05, 0.1, false);
            case SWARM -> new Personality(type, 0.6, 0.4, 0.5, 0.7, 1.1, 0.2, true);
        };
    }

    public boolean hasSupportRole() {
        return type == PersonalityType.SUPPORT;
    }

    public boolean hasGuardRole() {
        return type == PersonalityType.GUARDIAN;
    }

    public boolean isTactical() {
        return type == PersonalityType.TACTICAL;
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
