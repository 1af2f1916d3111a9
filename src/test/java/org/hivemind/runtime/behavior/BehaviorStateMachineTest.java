package org.hivemind.runtime.behavior;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.hivemind.runtime.model.AgentState;
import org.hivemind.runtime.model.PersonalityType;
import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.model.component.AiComponent;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/**
 * Unit tests for the transition function of {@link BehaviorStateMachine}.
 */
@Tag("unit")
class BehaviorStateMachineTest {

    private final BehaviorStateMachine machine = new BehaviorStateMachine();
    private final AiComponent aggressive = AiComponent.builder(PersonalityType.AGGRESSIVE).build();

    /**
     * Once DEAD, no context can bring an agent back, not even full health and a target in range.
     */
    @ParameterizedTest
    @EnumSource(PersonalityType.class)
    void deadIsAbsorbing(PersonalityType type) {
        AiComponent profile = AiComponent.builder(type).guardPost(Vector2.ZERO).patrolRoute(List.of(Vector2.ZERO)).build();
        List<AiContext> contexts = List.of(
                AiContext.builder().build(),
                AiContext.builder().target(10, true).nearby(3, 5).build(),
                AiContext.builder().health(1, 100).target(500, true).damage(true, 0).build(),
                AiContext.builder().nearby(4, 0).weakestAlly(0.1, Vector2.ZERO).build());

        for (AiContext context : contexts) {
            assertThat(machine.nextState(AgentState.DEAD, context, profile)).isEqualTo(AgentState.DEAD);
        }
    }

    @ParameterizedTest
    @EnumSource(AgentState.class)
    void depletedHealthMeansDead(AgentState state) {
        AiContext context = AiContext.builder().health(0, 100).target(10, true).build();

        assertThat(machine.nextState(state, context, aggressive)).isEqualTo(AgentState.DEAD);
    }

    @Test
    void idleChasesVisibleTargetOutOfRange() {
        AiContext context = AiContext.builder().target(150, true).nearby(0, 1).build();

        assertThat(machine.nextState(AgentState.IDLE, context, aggressive)).isEqualTo(AgentState.CHASE);
    }

    @Test
    void idleWithoutAnyoneNearbyStaysIdle() {
        assertThat(machine.nextState(AgentState.IDLE, AiContext.builder().build(), aggressive)).isEqualTo(AgentState.IDLE);
    }

    @Test
    void chaseEscalatesToAttackWithinRange() {
        AiContext context = AiContext.builder().target(30, true).build();

        assertThat(machine.nextState(AgentState.CHASE, context, aggressive)).isEqualTo(AgentState.ATTACK);
    }

    @Test
    void fleeingOutranksAttacking() {
        AiComponent coward = AiComponent.builder(PersonalityType.COWARD).build();
        AiContext context = AiContext.builder().health(20, 100).target(30, true).build();

        assertThat(machine.nextState(AgentState.CHASE, context, coward)).isEqualTo(AgentState.FLEE);
        assertThat(machine.nextState(AgentState.ATTACK, context, coward)).isEqualTo(AgentState.FLEE);
        // Berserkers never flee.
        AiComponent berserker = AiComponent.builder(PersonalityType.BERSERKER).build();
        assertThat(machine.nextState(AgentState.CHASE, context, berserker)).isEqualTo(AgentState.ATTACK);
    }

    @Test
    void attackFallsBackToChaseWhenTargetLeavesRange() {
        AiContext context = AiContext.builder().target(80, true).build();

        assertThat(machine.nextState(AgentState.ATTACK, context, aggressive)).isEqualTo(AgentState.CHASE);
    }

    @Test
    void lostTargetIsInvestigatedWhenRemembered() {
        AiContext remembered = AiContext.builder().lastKnownTargetPosition(true).build();

        assertThat(machine.nextState(AgentState.CHASE, remembered, aggressive)).isEqualTo(AgentState.INVESTIGATE);
    }

    /**
     * A chase whose target vanished without ever being seen has nothing left to follow.
     */
    @Test
    void chaseWithoutTargetOrMemoryReturnsToIdle() {
        AiContext forgotten = AiContext.builder().build();
        AiContext heardOnly = AiContext.builder().target(250, false).nearby(0, 1).build();

        assertThat(machine.nextState(AgentState.CHASE, forgotten, aggressive)).isEqualTo(AgentState.IDLE);
        assertThat(machine.nextState(AgentState.CHASE, heardOnly, aggressive)).isEqualTo(AgentState.IDLE);
    }

    @Test
    void investigationTimesOut() {
        AiContext context = AiContext.builder().currentStateTime(BehaviorStateMachine.INVESTIGATE_TIMEOUT_MILLIS + 1).build();

        assertThat(machine.nextState(AgentState.INVESTIGATE, context, aggressive)).isEqualTo(AgentState.IDLE);
    }

    @Test
    void tacticalAgentsRetreatWhenOutnumbered() {
        AiComponent tactical = AiComponent.builder(PersonalityType.TACTICAL).build();
        AiContext context = AiContext.builder().target(30, true).nearby(0, 4).build();

        assertThat(machine.nextState(AgentState.ATTACK, context, tactical)).isEqualTo(AgentState.RETREAT);
        assertThat(machine.nextState(AgentState.ATTACK, context, aggressive)).isEqualTo(AgentState.ATTACK);
    }

    @Test
    void supportRoleIsRequiredToSupport() {
        AiComponent support = AiComponent.builder(PersonalityType.SUPPORT).build();
        AiContext context = AiContext.builder().nearby(2, 0).weakestAlly(0.3, new Vector2(10, 0)).build();

        assertThat(machine.nextState(AgentState.IDLE, context, support)).isEqualTo(AgentState.SUPPORT);
        assertThat(machine.nextState(AgentState.IDLE, context, aggressive)).isEqualTo(AgentState.IDLE);
    }

    @Test
    void guardRoleWithPostGuards() {
        AiComponent guardian = AiComponent.builder(PersonalityType.GUARDIAN).guardPost(new Vector2(100, 100)).build();
        AiComponent postless = AiComponent.builder(PersonalityType.GUARDIAN).build();

        assertThat(machine.nextState(AgentState.IDLE, AiContext.builder().build(), guardian)).isEqualTo(AgentState.GUARD);
        assertThat(machine.nextState(AgentState.IDLE, AiContext.builder().build(), postless)).isEqualTo(AgentState.IDLE);
    }

    @Test
    void equalPriorityTiesGoToTheFirstListedRule() {
        BehaviorStateMachine custom = new BehaviorStateMachine(List.of(
                new StateTransition(AgentState.IDLE, AgentState.PATROL, 1, (c, p) -> true),
                new StateTransition(AgentState.IDLE, AgentState.GUARD, 1, (c, p) -> true),
                new StateTransition(AgentState.PATROL, AgentState.CHASE, 1, (c, p) -> false)));

        assertThat(custom.nextState(AgentState.IDLE, AiContext.builder().build(), aggressive)).isEqualTo(AgentState.PATROL);
        assertThat(custom.nextState(AgentState.PATROL, AiContext.builder().build(), aggressive)).isEqualTo(AgentState.PATROL);
        assertThat(custom.getTransitions(AgentState.FLEE)).isEmpty();
    }
}
