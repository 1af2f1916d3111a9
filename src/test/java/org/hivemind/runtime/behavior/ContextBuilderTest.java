package org.hivemind.runtime.behavior;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hivemind.test.utils.AgentTestUtils.agentEntity;
import static org.hivemind.test.utils.AgentTestUtils.playerEntity;

import org.hivemind.runtime.model.Agent;
import org.hivemind.runtime.model.PersonalityType;
import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.model.component.AiComponent;
import org.hivemind.runtime.model.component.Health;
import org.hivemind.runtime.model.component.Transform;
import org.hivemind.runtime.spatial.SpatialHashGrid;
import org.hivemind.runtime.spatial.WorldBounds;
import org.hivemind.runtime.spi.IStatModifier;
import org.hivemind.test.utils.TestEntity;
import org.hivemind.test.utils.TestWorld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ContextBuilder}: neighbour classification, target acquisition and
 * damage bookkeeping.
 */
@Tag("unit")
class ContextBuilderTest {

    private TestWorld world;
    private SpatialHashGrid grid;
    private StatModifierChain modifiers;
    private ContextBuilder builder;
    private TestEntity self;
    private Agent agent;

    @BeforeEach
    void setUp() {
        world = new TestWorld();
        grid = new SpatialHashGrid(100, WorldBounds.centered(5000));
        modifiers = new StatModifierChain();
        builder = new ContextBuilder(grid, world, modifiers);
        AiComponent profile = AiComponent.builder(PersonalityType.AGGRESSIVE).build();
        self = add(agentEntity(1, Vector2.ZERO, profile));
        agent = new Agent(1, profile, 0);
    }

    private TestEntity add(TestEntity entity) {
        world.add(entity);
        grid.insert(entity.getId(), entity.getComponent(Transform.class).orElseThrow().getPosition(), 0);
        return entity;
    }

    private AiContext build(int primaryTargetId, long now) {
        return builder.build(agent, self, Vector2.ZERO, primaryTargetId, now);
    }

    @Test
    void classifiesNeighboursAndAcquiresTheNearestEnemy() {
        add(agentEntity(2, new Vector2(50, 0), PersonalityType.AGGRESSIVE));
        add(playerEntity(3, new Vector2(100, 0)));
        add(playerEntity(4, new Vector2(1000, 0)));

        AiContext context = build(Agent.NO_TARGET, 0);

        assertThat(context.nearbyAllies()).isEqualTo(1);
        assertThat(context.nearbyEnemies()).isEqualTo(1);
        assertThat(agent.getTargetId()).isEqualTo(3);
        assertThat(context.distanceToTarget()).isEqualTo(100.0);
        assertThat(context.targetVisible()).isTrue();
        assertThat(context.hasLastKnownTargetPosition()).isTrue();
        assertThat(agent.getTargetPosition()).isEqualTo(new Vector2(100, 0));
    }

    @Test
    void primaryTargetWinsOverCloserEnemiesAndIsHeardBeforeSeen() {
        add(playerEntity(3, new Vector2(100, 0)));
        add(playerEntity(5, new Vector2(250, 0)));

        AiContext context = build(5, 0);

        assertThat(agent.getTargetId()).isEqualTo(5);
        assertThat(context.distanceToTarget()).isEqualTo(250.0);
        assertThat(context.targetVisible()).isFalse();
        assertThat(context.hasLastKnownTargetPosition()).isFalse();
    }

    @Test
    void targetOutsideDetectionHasInfiniteDistance() {
        add(playerEntity(3, new Vector2(100, 0)));
        build(Agent.NO_TARGET, 0);
        grid.update(3, new Vector2(2000, 0));

        AiContext context = build(Agent.NO_TARGET, 100);

        assertThat(agent.getTargetId()).isEqualTo(3);
        assertThat(context.distanceToTarget()).isInfinite();
        assertThat(context.targetVisible()).isFalse();
        assertThat(context.hasLastKnownTargetPosition()).isTrue();
    }

    @Test
    void deadTargetIsReplaced() {
        TestEntity first = add(playerEntity(3, new Vector2(100, 0)));
        add(playerEntity(4, new Vector2(180, 0)));
        build(Agent.NO_TARGET, 0);
        first.getComponent(Health.class).orElseThrow().setCurrent(0);

        build(Agent.NO_TARGET, 100);

        assertThat(agent.getTargetId()).isEqualTo(4);
    }

    @Test
    void deadPrimaryTargetInRangeIsIgnored() {
        add(playerEntity(5, new Vector2(100, 0))).getComponent(Health.class).orElseThrow().setCurrent(0);
        add(playerEntity(6, new Vector2(1000, 0)));

        AiContext context = build(5, 0);

        assertThat(agent.hasTarget()).isFalse();
        assertThat(context.nearbyEnemies()).isZero();
        assertThat(context.distanceToTarget()).isInfinite();
        assertThat(context.targetVisible()).isFalse();
    }

    @Test
    void reportsTheWeakestAlly() {
        add(agentEntity(2, new Vector2(50, 0), PersonalityType.SUPPORT))
                .getComponent(Health.class).orElseThrow().setCurrent(30);
        add(agentEntity(6, new Vector2(-50, 0), PersonalityType.SUPPORT))
                .getComponent(Health.class).orElseThrow().setCurrent(70);

        AiContext context = build(Agent.NO_TARGET, 0);

        assertThat(context.nearbyAllies()).isEqualTo(2);
        assertThat(context.weakestAllyHealthFraction()).isEqualTo(0.3);
        assertThat(context.weakestAllyPosition()).isEqualTo(new Vector2(50, 0));
    }

    @Test
    void recentDamageMarksTheAgentUnderAttack() {
        agent.recordDamage(3, 10, 1000);

        assertThat(build(Agent.NO_TARGET, 1500).underAttack()).isTrue();
        AiContext later = build(Agent.NO_TARGET, 4000);
        assertThat(later.underAttack()).isFalse();
        assertThat(later.timeSinceLastDamage()).isEqualTo(3000);
    }

    @Test
    void healthDropCountsAsDamage() {
        assertThat(build(Agent.NO_TARGET, 0).timeSinceLastDamage()).isEqualTo(Long.MAX_VALUE);
        self.getComponent(Health.class).orElseThrow().setCurrent(80);

        AiContext context = build(Agent.NO_TARGET, 700);

        assertThat(context.timeSinceLastDamage()).isZero();
        assertThat(context.underAttack()).isTrue();
        assertThat(context.healthFraction()).isEqualTo(0.8);
    }

    @Test
    void sightRangeModifiersAffectVisibility() {
        add(playerEntity(3, new Vector2(150, 0)));
        modifiers.add((a, stat, value) -> IStatModifier.SIGHT_RANGE.equals(stat) ? value / 2 : value);

        AiContext context = build(Agent.NO_TARGET, 0);

        assertThat(agent.getTargetId()).isEqualTo(3);
        assertThat(context.targetVisible()).isFalse();
    }

    @Test
    void stuckAfterRepeatedStandstill() {
        AiContext context = null;
        for (int i = 0; i <= 11; i++) {
            context = build(Agent.NO_TARGET, i * 100L);
        }

        assertThat(context.stuck()).isTrue();
        assertThat(builder.build(agent, self, new Vector2(20, 0), Agent.NO_TARGET, 1300).stuck()).isFalse();
    }
}
