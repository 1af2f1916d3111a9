package org.hivemind.runtime.model.component;

import java.util.List;

import org.hivemind.runtime.behavior.tree.BehaviorNode;
import org.hivemind.runtime.model.Personality;
import org.hivemind.runtime.model.PersonalityType;
import org.hivemind.runtime.model.Vector2;

/**
 * Marks an entity as AI-controlled and carries its static behavior profile.
 * <p>
 * The orchestrator creates its own {@link org.hivemind.runtime.model.Agent} record the first
 * time it sees an entity carrying this component together with {@link Transform} and
 * {@link Movement}. The profile is immutable; use {@link #builder(PersonalityType)} to create one.
 */
public final class AiComponent {

    /** Sentinel meaning "use the orchestrator's configured avoidance radius". */
    public static final double DEFAULT_AVOIDANCE_RADIUS = -1.0;

    private final Personality personality;
    private final double sightRange;
    private final double hearingRange;
    private final double attackRange;
    private final double fleeDistance;
    private final double preferredDistance;
    private final double avoidanceRadius;
    private final long updateIntervalMillis;
    private final double updatePriority;
    private final long pathfindCooldownMillis;
    private final long attackCooldownMillis;
    private final List<Vector2> patrolRoute;
    private final Vector2 guardPost;
    private final Vector2 homePosition;
    private final BehaviorNode behaviorTree;

    private AiComponent(Builder builder) {
        this.personality = builder.personality;
        this.sightRange = builder.sightRange;
        this.hearingRange = builder.hearingRange;
        this.attackRange = builder.attackRange;
        this.fleeDistance = builder.fleeDistance;
        this.preferredDistance = builder.preferredDistance;
        this.avoidanceRadius = builder.avoidanceRadius;
        this.updateIntervalMillis = builder.updateIntervalMillis;
        this.updatePriority = builder.updatePriority;
        this.pathfindCooldownMillis = builder.pathfindCooldownMillis;
        this.attackCooldownMillis = builder.attackCooldownMillis;
        this.patrolRoute = List.copyOf(builder.patrolRoute);
        this.guardPost = builder.guardPost;
        this.homePosition = builder.homePosition;
        this.behaviorTree = builder.behaviorTree;
    }

    public static Builder builder(PersonalityType type) {
        return new Builder(Personality.of(type));
    }

    public static Builder builder(Personality personality) {
        return new Builder(personality);
    }

    public Personality getPersonality() { return personality; }

    public double getSightRange() { return sightRange; }

    public double getHearingRange() { return hearingRange; }

    /** The larger of sight and hearing range; the radius of the context query. */
    public double getDetectionRadius() { return Math.max(sightRange, hearingRange); }

    public double getAttackRange() { return attackRange; }

    public double getFleeDistance() { return fleeDistance; }

    public double getPreferredDistance() { return preferredDistance; }

    public double getAvoidanceRadius() { return avoidanceRadius; }

    public long getUpdateIntervalMillis() { return updateIntervalMillis; }

    public double getUpdatePriority() { return updatePriority; }

    public long getPathfindCooldownMillis() { return pathfindCooldownMillis; }

    public long getAttackCooldownMillis() { return attackCooldownMillis; }

    public List<Vector2> getPatrolRoute() { return patrolRoute; }

    public boolean hasPatrolRoute() { return !patrolRoute.isEmpty(); }

    /** @return The guard post, or {@code null} if none is assigned. */
    public Vector2 getGuardPost() { return guardPost; }

    public boolean hasGuardPost() { return guardPost != null; }

    /** @return The home position, or {@code null} if none is assigned. */
    public Vector2 getHomePosition() { return homePosition; }

    /** @return The behavior tree, or {@code null} if this agent runs on the state machine alone. */
    public BehaviorNode getBehaviorTree() { return behaviorTree; }

    /**
     * Builder for {@link AiComponent}. Defaults follow the stock enemy profile:
     * sight 200, hearing 300, attack 50, flee 400, preferred 100, update every 100 ms.
     */
    public static final class Builder {
        private final Personality personality;
        private double sightRange = 200.0;
        private double hearingRange = 300.0;
        private double attackRange = 50.0;
        private double fleeDistance = 400.0;
        private double preferredDistance = 100.0;
        private double avoidanceRadius = DEFAULT_AVOIDANCE_RADIUS;
        private long updateIntervalMillis = 100L;
        private double updatePriority = 1.0;
        private long pathfindCooldownMillis = 500L;
        private long attackCooldownMillis = 1000L;
        private List<Vector2> patrolRoute = List.of();
        private Vector2 guardPost;
        private Vector2 homePosition;
        private BehaviorNode behaviorTree;

        private Builder(Personality personality) {
            if (personality == null) {
                throw new IllegalArgumentException("Personality must not be null");
            }
            this.personality = personality;
        }

        public Builder sightRange(double sightRange) {
            this.sightRange = Math.max(0.0, sightRange);
            return this;
        }

        public Builder hearingRange(double hearingRange) {
            this.hearingRange = Math.max(0.0, hearingRange);
            return this;
        }

        public Builder attackRange(double attackRange) {
            this.attackRange = Math.max(0.0, attackRange);
            return this;
        }

        public Builder fleeDistance(double fleeDistance) {
            this.fleeDistance = Math.max(0.0, fleeDistance);
            return this;
        }

        public Builder preferredDistance(double preferredDistance) {
            this.preferredDistance = Math.max(0.0, preferredDistance);
            return this;
        }

        public Builder avoidanceRadius(double avoidanceRadius) {
            this.avoidanceRadius = avoidanceRadius;
            return this;
        }

        public Builder updateInterval(long millis) {
            this.updateIntervalMillis = Math.max(0L, millis);
            return this;
        }

        /**
         * Higher priorities shorten the effective update interval ({@code interval / priority}).
         * Non-positive values are replaced by 1.
         */
        public Builder updatePriority(double priority) {
            this.updatePriority = priority > 0.0 ? priority : 1.0;
            return this;
        }

        public Builder pathfindCooldown(long millis) {
            this.pathfindCooldownMillis = Math.max(0L, millis);
            return this;
        }

        public Builder attackCooldown(long millis) {
            this.attackCooldownMillis = Math.max(0L, millis);
            return this;
        }

        public Builder patrolRoute(List<Vector2> route) {
            this.patrolRoute = route == null ? List.of() : route;
            return this;
        }

        public Builder guardPost(Vector2 guardPost) {
            this.guardPost = guardPost;
            return this;
        }

        public Builder homePosition(Vector2 homePosition) {
            this.homePosition = homePosition;
            return this;
        }

        public Builder behaviorTree(BehaviorNode behaviorTree) {
            this.behaviorTree = behaviorTree;
            return this;
        }

        public AiComponent build() {
            return new AiComponent(this);
        }
    }
}
