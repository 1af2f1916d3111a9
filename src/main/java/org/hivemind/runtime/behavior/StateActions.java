package org.hivemind.runtime.behavior;

import java.util.List;

import org.hivemind.runtime.events.AiEventTypes;
import org.hivemind.runtime.events.AttackEvent;
import org.hivemind.runtime.model.Agent;
import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.model.component.AiComponent;
import org.hivemind.runtime.model.component.Movement;
import org.hivemind.runtime.spi.IEventSink;

/**
 * What an agent does while in a state. Kept apart from the transition function, which only
 * decides the state.
 * <p>
 * Actions never compute paths themselves. They pick a goal and, when the context says the
 * current path is missing, stale or leads elsewhere, hand the goal to the {@link PathRequester}.
 * Requests are only made once the agent's pathfinding cooldown has elapsed.
 */
public class StateActions {

    /** A path whose end is farther than this from the wanted goal is replaced. */
    public static final double GOAL_MOVED_THRESHOLD = 50.0;

    /** Distance at which a patrol point or the home position counts as reached. */
    public static final double POINT_REACHED_DISTANCE = 20.0;

    private final PathRequester requester;
    private final IEventSink events;

    public StateActions(PathRequester requester, IEventSink events) {
        this.requester = requester;
        this.events = events;
    }

    /**
     * Runs the action of the agent's current state.
     *
     * @param agent The agent.
     * @param context The agent's context for this update.
     * @param position The agent's position.
     * @param movement The agent's movement component.
     * @param now The current simulation time.
     */
    public void execute(Agent agent, AiContext context, Vector2 position, Movement movement, long now) {
        switch (agent.getState()) {
            case IDLE -> idle(agent, context, position, movement, now);
            case PATROL -> patrol(agent, context, position, now);
            case CHASE -> chase(agent, context, now);
            case ATTACK -> attack(agent, context, movement, now);
            case FLEE -> flee(agent, context, position, now);
            case INVESTIGATE -> investigate(agent, context, now);
            case RETREAT -> retreat(agent, context, position, now);
            case SUPPORT -> support(agent, context, now);
            case GUARD -> guard(agent, context, position, movement, now);
            case DEAD -> { }
        }
    }

    private void idle(Agent agent, AiContext context, Vector2 position, Movement movement, long now) {
        movement.stop();
        Vector2 home = agent.getProfile().getHomePosition();
        if (home != null && position.distance(home) > POINT_REACHED_DISTANCE) {
            seek(agent, context, home, now);
        }
    }

    private void patrol(Agent agent, AiContext context, Vector2 position, long now) {
        List<Vector2> route = agent.getProfile().getPatrolRoute();
        if (route.isEmpty()) {
            return;
        }
        Vector2 point = route.get(agent.getPatrolIndex() % route.size());
        if (position.distance(point) < POINT_REACHED_DISTANCE) {
            agent.advancePatrolIndex();
            agent.clearPath();
            return;
        }
        seek(agent, context, point, now);
    }

    private void chase(Agent agent, AiContext context, long now) {
        if (context.targetVisible()) {
            seek(agent, context, agent.getTargetPosition(), now);
        } else if (agent.hasTarget()) {
            agent.getMemory().lastSeenPosition(agent.getTargetId()).ifPresent(last -> seek(agent, context, last, now));
        }
    }

    private void attack(Agent agent, AiContext context, Movement movement, long now) {
        movement.stop();
        agent.clearPath();
        if (!agent.hasTarget() || !agent.isAttackCooldownOver(now)) {
            return;
        }
        events.emit(AiEventTypes.AI_ATTACK,
                new AttackEvent(agent.getId(), agent.getTargetId(), context.distanceToTarget(), now));
        agent.setLastAttackTime(now);
    }

    private void flee(Agent agent, AiContext context, Vector2 position, long now) {
        Vector2 threat = agent.getTargetPosition();
        if (threat == null) {
            return;
        }
        seek(agent, context, awayFrom(position, threat, position, agent.getProfile().getFleeDistance()), now);
    }

    private void investigate(Agent agent, AiContext context, long now) {
        if (agent.hasTarget()) {
            agent.getMemory().lastSeenPosition(agent.getTargetId()).ifPresent(last -> seek(agent, context, last, now));
        }
    }

    private void retreat(Agent agent, AiContext context, Vector2 position, long now) {
        Vector2 target = agent.getTargetPosition();
        if (target == null) {
            return;
        }
        seek(agent, context, awayFrom(position, target, target, agent.getProfile().getPreferredDistance()), now);
    }

    private void support(Agent agent, AiContext context, long now) {
        if (context.weakestAllyPosition() != null
                && context.weakestAllyHealthFraction() < BehaviorStateMachine.SUPPORT_HEALTH_THRESHOLD) {
            seek(agent, context, context.weakestAllyPosition(), now);
        }
    }

    private void guard(Agent agent, AiContext context, Vector2 position, Movement movement, long now) {
        AiComponent profile = agent.getProfile();
        Vector2 post = profile.getGuardPost();
        if (post == null) {
            return;
        }
        if (position.distance(post) > profile.getSightRange() / 2.0) {
            seek(agent, context, post, now);
        } else if (context.nearbyEnemies() > 0) {
            agent.clearPath();
            movement.stop();
        }
    }

    /**
     * Requests a path to {@code goal} if the agent is stuck, has no path, or its path ends
     * more than {@link #GOAL_MOVED_THRESHOLD} away from the goal.
     */
    private void seek(Agent agent, AiContext context, Vector2 goal, long now) {
        if (goal == null || !agent.isPathfindCooldownOver(now)) {
            return;
        }
        Vector2 end = agent.getPathEnd();
        if (context.stuck() || !context.hasPath() || end == null || end.distance(goal) > GOAL_MOVED_THRESHOLD) {
            requester.request(agent, goal, now);
        }
    }

    /**
     * @return The point {@code distance} from {@code origin}, in the direction from {@code threat} to {@code self}.
     */
    private static Vector2 awayFrom(Vector2 self, Vector2 threat, Vector2 origin, double distance) {
        Vector2 direction = self.subtract(threat).normalize();
        if (direction.isZero()) {
            direction = new Vector2(1.0, 0.0);
        }
        return origin.add(direction.scale(distance));
    }
}
