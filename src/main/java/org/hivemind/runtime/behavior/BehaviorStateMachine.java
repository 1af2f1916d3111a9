package org.hivemind.runtime.behavior;

import static org.hivemind.runtime.model.AgentState.ATTACK;
import static org.hivemind.runtime.model.AgentState.CHASE;
import static org.hivemind.runtime.model.AgentState.DEAD;
import static org.hivemind.runtime.model.AgentState.FLEE;
import static org.hivemind.runtime.model.AgentState.GUARD;
import static org.hivemind.runtime.model.AgentState.IDLE;
import static org.hivemind.runtime.model.AgentState.INVESTIGATE;
import static org.hivemind.runtime.model.AgentState.PATROL;
import static org.hivemind.runtime.model.AgentState.RETREAT;
import static org.hivemind.runtime.model.AgentState.SUPPORT;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;

import org.hivemind.runtime.model.AgentState;
import org.hivemind.runtime.model.component.AiComponent;

/**
 * The pure transition function {@code (state, context, profile) -> next state}.
 * <p>
 * Every agent with health at or below zero is DEAD, and DEAD never changes. Otherwise all
 * rules of the current state are evaluated; the highest-priority rule that fires decides the
 * next state, ties going to the rule listed first. If no rule fires the state is kept.
 * <p>
 * Instances are immutable and may be shared between orchestrators.
 */
public class BehaviorStateMachine {

    /** Weakest-ally health fraction below which support agents step in. */
    public static final double SUPPORT_HEALTH_THRESHOLD = 0.5;

    /** Time after which an unsuccessful investigation is given up. */
    public static final long INVESTIGATE_TIMEOUT_MILLIS = 5000L;

    private final Map<AgentState, List<StateTransition>> transitions;

    public BehaviorStateMachine() {
        this(defaultTransitions());
    }

    /**
     * @param table The transition table, in declaration order.
     */
    public BehaviorStateMachine(List<StateTransition> table) {
        Map<AgentState, List<StateTransition>> byState = new EnumMap<>(AgentState.class);
        for (StateTransition transition : table) {
            byState.computeIfAbsent(transition.from(), s -> new ArrayList<>()).add(transition);
        }
        byState.replaceAll((state, list) -> Collections.unmodifiableList(list));
        this.transitions = Collections.unmodifiableMap(byState);
    }

    /**
     * @param current The agent's current state.
     * @param context The agent's context.
     * @param profile The agent's static profile.
     * @return The state the agent should be in.
     */
    public AgentState nextState(AgentState current, AiContext context, AiComponent profile) {
        if (current == DEAD || context.health() <= 0.0) {
            return DEAD;
        }
        StateTransition best = null;
        for (StateTransition transition : transitions.getOrDefault(current, List.of())) {
            if ((best == null || transition.priority() > best.priority())
                    && transition.condition().test(context, profile)) {
                best = transition;
            }
        }
        return best == null ? current : best.to();
    }

    public List<StateTransition> getTransitions(AgentState from) {
        return transitions.getOrDefault(from, List.of());
    }

    /**
     * @return The stock transition table.
     */
    public static List<StateTransition> defaultTransitions() {
        BiPredicate<AiContext, AiComponent> visibleOutOfRange = (c, p) -> c.targetVisible() && !c.withinAttackRange();
        BiPredicate<AiContext, AiComponent> visibleInRange = (c, p) -> c.targetVisible() && c.withinAttackRange();
        BiPredicate<AiContext, AiComponent> shouldFlee = (c, p) -> c.healthFraction() < p.getPersonality().fleeHealthThreshold();

        return List.of(
            new StateTransition(IDLE, PATROL, 1, (c, p) -> p.hasPatrolRoute() && c.nearbyEnemies() == 0),
            new StateTransition(IDLE, GUARD, 1,
                (c, p) -> p.getPersonality().hasGuardRole() && p.hasGuardPost() && !c.targetVisible()),
            new StateTransition(IDLE, SUPPORT, 2,
                (c, p) -> p.getPersonality().hasSupportRole() && c.nearbyAllies() > 0
                    && c.weakestAllyHealthFraction() < SUPPORT_HEALTH_THRESHOLD),
            new StateTransition(IDLE, INVESTIGATE, 2,
                (c, p) -> p.getPersonality().curiosity() > 0.5 && c.nearbyEnemies() > 0 && !c.targetVisible()),
            new StateTransition(IDLE, CHASE, 3, visibleOutOfRange),
            new StateTransition(IDLE, ATTACK, 3, visibleInRange),

            new StateTransition(PATROL, INVESTIGATE, 2, (c, p) -> c.nearbyEnemies() > 0 && !c.targetVisible()),
            new StateTransition(PATROL, CHASE, 3, (c, p) -> c.targetVisible() && p.getPersonality().aggression() > 0.3),

            new StateTransition(CHASE, IDLE, 1, (c, p) -> !c.targetVisible() && !c.hasLastKnownTargetPosition()),
            new StateTransition(CHASE, INVESTIGATE, 2, (c, p) -> !c.targetVisible() && c.hasLastKnownTargetPosition()),
            new StateTransition(CHASE, ATTACK, 4, (c, p) -> c.withinAttackRange()),
            new StateTransition(CHASE, FLEE, 5, shouldFlee),

            new StateTransition(ATTACK, CHASE, 3, (c, p) -> !c.withinAttackRange()),
            new StateTransition(ATTACK, RETREAT, 4, (c, p) -> c.nearbyEnemies() > 3 && p.getPersonality().isTactical()),
            new StateTransition(ATTACK, FLEE, 5, shouldFlee),

            new StateTransition(FLEE, IDLE, 2, (c, p) -> c.distanceToTarget() > p.getFleeDistance()),
            new StateTransition(FLEE, SUPPORT, 3, (c, p) -> p.getPersonality().hasSupportRole() && c.nearbyAllies() > 2),

            new StateTransition(INVESTIGATE, IDLE, 1, (c, p) -> c.currentStateTime() > INVESTIGATE_TIMEOUT_MILLIS),
            new StateTransition(INVESTIGATE, CHASE, 3, (c, p) -> c.targetVisible()),

            new StateTransition(RETREAT, CHASE, 2, (c, p) -> c.targetVisible() && c.nearbyEnemies() <= 1),
            new StateTransition(RETREAT, FLEE, 5, shouldFlee),

            new StateTransition(SUPPORT, IDLE, 1,
                (c, p) -> c.nearbyAllies() == 0 || c.weakestAllyHealthFraction() >= SUPPORT_HEALTH_THRESHOLD),
            new StateTransition(SUPPORT, FLEE, 5, shouldFlee),

            new StateTransition(GUARD, IDLE, 1, (c, p) -> !p.hasGuardPost()),
            new StateTransition(GUARD, ATTACK, 4, visibleInRange)
        );
    }
}
