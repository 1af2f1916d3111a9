package org.hivemind.runtime.behavior;

import org.hivemind.runtime.model.Vector2;

/**
 * Snapshot of an agent's situation, built once per agent update by {@link ContextBuilder}.
 * <p>
 * The sole input to state transitions and to the path refresh decision.
 *
 * @param health Current health. 100 when the entity has no health component.
 * @param maxHealth Maximum health. 100 when the entity has no health component.
 * @param distanceToTarget Distance to the current target, or positive infinity if it is not nearby.
 * @param targetVisible Whether the target is within sight range.
 * @param hasLastKnownTargetPosition Whether the agent remembers where its target was last seen.
 * @param nearbyAllies AI-controlled entities within detection range, excluding the agent.
 * @param nearbyEnemies Other entities within detection range.
 * @param weakestAllyHealthFraction Health fraction of the weakest nearby ally, 1 if there is none.
 * @param weakestAllyPosition Position of the weakest nearby ally, or {@code null}.
 * @param attackRange The agent's effective attack range.
 * @param underAttack Whether the agent took damage within {@link ContextBuilder#UNDER_ATTACK_WINDOW_MILLIS}.
 * @param timeSinceLastDamage Milliseconds since the last damage, {@link Long#MAX_VALUE} if never damaged.
 * @param currentStateTime Milliseconds spent in the current state.
 * @param hasPath Whether the agent has an active path.
 * @param stuck Whether the agent has not moved for too many consecutive checks.
 */
public record AiContext(
    double health,
    double maxHealth,
    double distanceToTarget,
    boolean targetVisible,
    boolean hasLastKnownTargetPosition,
    int nearbyAllies,
    int nearbyEnemies,
    double weakestAllyHealthFraction,
    Vector2 weakestAllyPosition,
    double attackRange,
    boolean underAttack,
    long timeSinceLastDamage,
    long currentStateTime,
    boolean hasPath,
    boolean stuck
) {

    /**
     * @return {@code health / maxHealth}, or 1 if the maximum is not positive.
     */
    public double healthFraction() {
        return maxHealth > 0.0 ? health / maxHealth : 1.0;
    }

    public boolean withinAttackRange() {
        return distanceToTarget <= attackRange;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder with neutral defaults: full health, no target, nobody nearby.
     */
    public static final class Builder {
        private double health = 100.0;
        private double maxHealth = 100.0;
        private double distanceToTarget = Double.POSITIVE_INFINITY;
        private boolean targetVisible;
        private boolean hasLastKnownTargetPosition;
        private int nearbyAllies;
        private int nearbyEnemies;
        private double weakestAllyHealthFraction = 1.0;
        private Vector2 weakestAllyPosition;
        private double attackRange = 50.0;
        private boolean underAttack;
        private long timeSinceLastDamage = Long.MAX_VALUE;
        private long currentStateTime;
        private boolean hasPath;
        private boolean stuck;

        private Builder() {
        }

        public Builder health(double health, double maxHealth) {
            this.health = health;
            this.maxHealth = maxHealth;
            return this;
        }

        public Builder target(double distance, boolean visible) {
            this.distanceToTarget = distance;
            this.targetVisible = visible;
            return this;
        }

        public Builder lastKnownTargetPosition(boolean remembered) {
            this.hasLastKnownTargetPosition = remembered;
            return this;
        }

        public Builder nearby(int allies, int enemies) {
            this.nearbyAllies = allies;
            this.nearbyEnemies = enemies;
            return this;
        }

        public Builder weakestAlly(double healthFraction, Vector2 position) {
            this.weakestAllyHealthFraction = healthFraction;
            this.weakestAllyPosition = position;
            return this;
        }

        public Builder attackRange(double attackRange) {
            this.attackRange = attackRange;
            return this;
        }

        public Builder damage(boolean underAttack, long timeSinceLastDamage) {
            this.underAttack = underAttack;
            this.timeSinceLastDamage = timeSinceLastDamage;
            return this;
        }

        public Builder currentStateTime(long millis) {
            this.currentStateTime = millis;
            return this;
        }

        public Builder hasPath(boolean hasPath) {
            this.hasPath = hasPath;
            return this;
        }

        public Builder stuck(boolean stuck) {
            this.stuck = stuck;
            return this;
        }

        public AiContext build() {
            return new AiContext(health, maxHealth, distanceToTarget, targetVisible, hasLastKnownTargetPosition,
                nearbyAllies, nearbyEnemies, weakestAllyHealthFraction, weakestAllyPosition, attackRange,
                underAttack, timeSinceLastDamage, currentStateTime, hasPath, stuck);
        }
    }
}
