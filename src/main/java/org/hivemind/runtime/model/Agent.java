package org.hivemind.runtime.model;

import java.util.List;
import java.util.OptionalInt;

import org.hivemind.runtime.model.component.AiComponent;

/**
 * The orchestrator's per-agent record.
 * <p>
 * Holds the behavior state, the target relation (by id only), the active path and the
 * scheduling bookkeeping of one AI-controlled entity. Created when the entity is first seen
 * with the required components and discarded when it disappears.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. Only the orchestrator's tick touches agent records.
 */
public class Agent {

    /** Value of {@link #getTargetId()} when the agent has no target. */
    public static final int NO_TARGET = -1;

    /** Sentinel for "never happened" timestamps. */
    public static final long NEVER = Long.MIN_VALUE;

    /** Movement below this distance between two checks counts as not moving. */
    private static final double STUCK_DISTANCE = 1.0;

    /** Consecutive non-moving checks after which the agent is considered stuck. */
    private static final int STUCK_CHECKS = 10;

    private final int id;
    private final AiComponent profile;
    private final AgentMemory memory = new AgentMemory();

    private AgentState state = AgentState.IDLE;
    private AgentState previousState = AgentState.IDLE;
    private long stateStartTime;

    private int targetId = NO_TARGET;
    private Vector2 targetPosition;

    private List<Vector2> path = List.of();
    private int pathIndex;
    private long lastPathfindTime = NEVER;

    private int stuckCounter;
    private Vector2 lastPosition;

    private long nextUpdateTime;
    private long lastUpdateTime = NEVER;
    private long lastAttackTime = NEVER;
    private long lastDamageTime = NEVER;
    private double lastObservedHealth = Double.NaN;
    private int patrolIndex;

    /**
     * Creates a new agent in state {@link AgentState#IDLE} with an empty path.
     *
     * @param id The id of the owning entity.
     * @param profile The static behavior profile.
     * @param createdAt Simulation time of creation; the agent is first eligible at this time.
     */
    public Agent(int id, AiComponent profile, long createdAt) {
        this.id = id;
        this.profile = profile;
        this.stateStartTime = createdAt;
        this.nextUpdateTime = createdAt;
    }

    // ==================== State ====================

    /**
     * Moves the agent to a new state.
     * <p>
     * Re-entering the current state is a no-op, and nothing leaves {@link AgentState#DEAD}.
     *
     * @param newState The target state.
     * @param now The current simulation time.
     * @return {@code true} if the state actually changed.
     */
    public boolean changeState(AgentState newState, long now) {
        if (state == newState || state.isTerminal()) {
            return false;
        }
        previousState = state;
        state = newState;
        stateStartTime = now;
        return true;
    }

    public AgentState getState() { return state; }

    public AgentState getPreviousState() { return previousState; }

    public long getStateStartTime() { return stateStartTime; }

    public boolean isDead() { return state == AgentState.DEAD; }

    // ==================== Target ====================

    /**
     * Sets the current target and remembers where it was seen.
     *
     * @param targetId The target entity id.
     * @param position The position the target was observed at.
     */
    public void setTarget(int targetId, Vector2 position) {
        this.targetId = targetId;
        this.targetPosition = position;
        if (position != null) {
            memory.rememberPosition(targetId, position);
        }
    }

    public void clearTarget() {
        this.targetId = NO_TARGET;
        this.targetPosition = null;
    }

    public boolean hasTarget() { return targetId != NO_TARGET; }

    public int getTargetId() { return targetId; }

    /** @return The last position the current target was observed at, or {@code null}. */
    public Vector2 getTargetPosition() { return targetPosition; }

    public AgentMemory getMemory() { return memory; }

    // ==================== Path ====================

    /**
     * Replaces the active path. The previous path is discarded and the waypoint index reset.
     *
     * @param waypoints The new path; may be empty.
     */
    public void setPath(List<Vector2> waypoints) {
        this.path = waypoints == null ? List.of() : List.copyOf(waypoints);
        this.pathIndex = 0;
    }

    public void clearPath() {
        setPath(List.of());
    }

    public boolean hasPath() { return pathIndex < path.size(); }

    public List<Vector2> getPath() { return path; }

    public int getPathIndex() { return pathIndex; }

    /** @return The waypoint currently steered at, or {@code null} if there is none. */
    public Vector2 getCurrentWaypoint() {
        return hasPath() ? path.get(pathIndex) : null;
    }

    /** @return The final waypoint of the active path, or {@code null} if there is none. */
    public Vector2 getPathEnd() {
        return path.isEmpty() ? null : path.get(path.size() - 1);
    }

    /**
     * Advances to the next waypoint. Passing the last waypoint clears the path.
     */
    public void advanceWaypoint() {
        pathIndex++;
        if (pathIndex >= path.size()) {
            clearPath();
        }
    }

    public long getLastPathfindTime() { return lastPathfindTime; }

    public void setLastPathfindTime(long lastPathfindTime) { this.lastPathfindTime = lastPathfindTime; }

    /**
     * @param now The current simulation time.
     * @return {@code true} if the pathfinding cooldown has elapsed since the last computed path.
     */
    public boolean isPathfindCooldownOver(long now) {
        return lastPathfindTime == NEVER || now - lastPathfindTime >= profile.getPathfindCooldownMillis();
    }

    // ==================== Stuck detection ====================

    /**
     * Feeds the current position into the stuck detector.
     *
     * @param currentPosition The agent's position this check.
     * @return {@code true} if the agent has not moved for more than the stuck threshold of checks.
     */
    public boolean checkStuck(Vector2 currentPosition) {
        if (lastPosition == null) {
            lastPosition = currentPosition;
            return false;
        }
        if (currentPosition.distance(lastPosition) < STUCK_DISTANCE) {
            stuckCounter++;
        } else {
            stuckCounter = 0;
        }
        lastPosition = currentPosition;
        return stuckCounter > STUCK_CHECKS;
    }

    public int getStuckCounter() { return stuckCounter; }

    // ==================== Scheduling ====================

    /**
     * @param now The current simulation time.
     * @return {@code true} if the stagger schedule allows an update at {@code now}.
     */
    public boolean isEligible(long now) {
        return now >= nextUpdateTime;
    }

    /**
     * Records an update and schedules the next one at {@code now + interval / priority}.
     *
     * @param now The current simulation time.
     */
    public void markUpdated(long now) {
        lastUpdateTime = now;
        nextUpdateTime = now + (long) (profile.getUpdateIntervalMillis() / profile.getUpdatePriority());
    }

    public long getNextUpdateTime() { return nextUpdateTime; }

    public long getLastUpdateTime() { return lastUpdateTime; }

    // ==================== Combat bookkeeping ====================

    /**
     * Records damage taken from another entity.
     *
     * @param sourceId The attacker.
     * @param amount The damage amount.
     * @param now The current simulation time.
     */
    public void recordDamage(int sourceId, double amount, long now) {
        memory.recordDamage(sourceId, amount);
        lastDamageTime = now;
    }

    /**
     * Compares the observed health with the previous observation and records a damage time
     * when it dropped. Used when the combat system does not report damage explicitly.
     *
     * @param health The current health value.
     * @param now The current simulation time.
     */
    public void observeHealth(double health, long now) {
        if (!Double.isNaN(lastObservedHealth) && health < lastObservedHealth) {
            lastDamageTime = now;
        }
        lastObservedHealth = health;
    }

    public long getLastDamageTime() { return lastDamageTime; }

    public long getLastAttackTime() { return lastAttackTime; }

    public void setLastAttackTime(long lastAttackTime) { this.lastAttackTime = lastAttackTime; }

    public boolean isAttackCooldownOver(long now) {
        return lastAttackTime == NEVER || now - lastAttackTime >= profile.getAttackCooldownMillis();
    }

    public OptionalInt getHighestThreat() {
        return memory.highestThreat();
    }

    // ==================== Profile ====================

    public int getId() { return id; }

    public AiComponent getProfile() { return profile; }

    public Personality getPersonality() { return profile.getPersonality(); }

    public int getPatrolIndex() { return patrolIndex; }

    public void advancePatrolIndex() {
        int size = profile.getPatrolRoute().size();
        patrolIndex = size == 0 ? 0 : (patrolIndex + 1) % size;
    }

    @Override
    public String toString() {
        return String.format("Agent{id=%d, state=%s, target=%d, waypoint=%d/%d}",
                id, state, targetId, pathIndex, path.size());
    }
}
