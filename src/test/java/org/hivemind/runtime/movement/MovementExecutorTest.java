package org.hivemind.runtime.movement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.hivemind.test.utils.AgentTestUtils.agentEntity;
import static org.hivemind.test.utils.AgentTestUtils.playerEntity;

import java.util.List;

import org.hivemind.runtime.behavior.StatModifierChain;
import org.hivemind.runtime.model.Agent;
import org.hivemind.runtime.model.PersonalityType;
import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.model.component.AiComponent;
import org.hivemind.runtime.model.component.Movement;
import org.hivemind.runtime.spatial.SpatialHashGrid;
import org.hivemind.runtime.spatial.WorldBounds;
import org.hivemind.runtime.spi.IStatModifier;
import org.hivemind.test.utils.TestEntity;
import org.hivemind.test.utils.TestWorld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for waypoint following, local avoidance and flocking in {@link MovementExecutor}.
 */
@Tag("unit")
class MovementExecutorTest {

    private TestWorld world;
    private SpatialHashGrid grid;
    private StatModifierChain modifiers;
    private MovementExecutor executor;
    private Movement movement;

    @BeforeEach
    void setUp() {
        world = new TestWorld();
        grid = new SpatialHashGrid(100, WorldBounds.centered(5000));
        modifiers = new StatModifierChain();
        executor = new MovementExecutor(grid, world, modifiers);
        movement = new Movement(100);
    }

    private Agent agent(PersonalityType type) {
        Agent agent = new Agent(1, AiComponent.builder(type).build(), 0);
        grid.insert(1, Vector2.ZERO, 0);
        return agent;
    }

    private void place(TestEntity entity, Vector2 position) {
        world.add(entity);
        grid.insert(entity.getId(), position, 0);
    }

    @Test
    void withoutPathTheAgentStops() {
        Agent agent = agent(PersonalityType.AGGRESSIVE);
        movement.setVelocity(30, 30);

        executor.apply(agent, Vector2.ZERO, movement, 30, true);

        assertThat(movement.getVelocity()).isEqualTo(Vector2.ZERO);
    }

    @Test
    void steersAtTheCurrentWaypointWithPersonalitySpeed() {
        Agent agent = agent(PersonalityType.COWARD);
        agent.setPath(List.of(new Vector2(0, 200)));

        executor.apply(agent, Vector2.ZERO, movement, 30, true);

        assertThat(movement.getVelocity().x()).isCloseTo(0.0, within(1e-9));
        assertThat(movement.getVelocity().y()).isCloseTo(120.0, within(1e-9));
    }

    @Test
    void reachedWaypointsAreSkippedAndTheLastOneClearsThePath() {
        Agent agent = agent(PersonalityType.AGGRESSIVE);
        agent.setPath(List.of(new Vector2(5, 0), new Vector2(100, 0)));

        executor.apply(agent, Vector2.ZERO, movement, 0, false);

        assertThat(agent.getPathIndex()).isEqualTo(1);
        assertThat(movement.getVelocity().x()).isCloseTo(100.0, within(1e-9));

        executor.apply(agent, new Vector2(95, 0), movement, 0, false);

        assertThat(agent.hasPath()).isFalse();
        assertThat(movement.getVelocity()).isEqualTo(Vector2.ZERO);
    }

    @Test
    void moveSpeedModifiersScaleTheVelocity() {
        Agent agent = agent(PersonalityType.AGGRESSIVE);
        agent.setPath(List.of(new Vector2(100, 0)));
        modifiers.add((a, stat, value) -> IStatModifier.MOVE_SPEED.equals(stat) ? value * 0.5 : value);

        executor.apply(agent, Vector2.ZERO, movement, 0, false);

        assertThat(movement.getVelocity().length()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void nearbyEntitiesPushTheAgentAside() {
        Agent agent = agent(PersonalityType.AGGRESSIVE);
        agent.setPath(List.of(new Vector2(100, 0)));
        place(playerEntity(2, new Vector2(0, 10)), new Vector2(0, 10));

        executor.apply(agent, Vector2.ZERO, movement, 30, false);

        Vector2 velocity = movement.getVelocity();
        assertThat(velocity.x()).isGreaterThan(0.0);
        assertThat(velocity.y()).isLessThan(0.0);
        assertThat(velocity.length()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void zeroAvoidanceRadiusDisablesAvoidance() {
        Agent agent = agent(PersonalityType.AGGRESSIVE);
        place(playerEntity(2, new Vector2(0, 10)), new Vector2(0, 10));

        assertThat(executor.avoidance(1, Vector2.ZERO, 0)).isEqualTo(Vector2.ZERO);
        assertThat(executor.avoidance(1, Vector2.ZERO, 30).y()).isCloseTo(-1.0, within(1e-9));
        assertThat(executor.speedOf(agent, movement)).isEqualTo(100.0);
    }

    @Test
    void swarmAgentsBlendFlockingForces() {
        Agent agent = agent(PersonalityType.SWARM);
        agent.setPath(List.of(new Vector2(0, 200)));
        placeMovingAlly();

        executor.apply(agent, Vector2.ZERO, movement, 0, true);

        // 0.8 * (0, 110) + (separation (-0.05, 0) * 0.5 + alignment (0, 1) * 0.3 + cohesion (1, 0) * 0.2) * 0.2 * maxSpeed
        assertThat(movement.getVelocity().x()).isCloseTo(3.5, within(1e-9));
        assertThat(movement.getVelocity().y()).isCloseTo(94.0, within(1e-9));
    }

    @Test
    void stoppedSwarmAgentsDoNotDrift() {
        Agent agent = agent(PersonalityType.SWARM);
        placeMovingAlly();
        movement.setVelocity(10, 10);

        executor.apply(agent, Vector2.ZERO, movement, 0, true);

        assertThat(movement.getVelocity()).isEqualTo(Vector2.ZERO);
    }

    @Test
    void flockingRequiresGroupBehaviorAndSwarmPersonality() {
        placeMovingAlly();

        Agent swarm = agent(PersonalityType.SWARM);
        swarm.setPath(List.of(new Vector2(0, 200)));
        executor.apply(swarm, Vector2.ZERO, movement, 0, false);
        assertThat(movement.getVelocity().x()).isCloseTo(0.0, within(1e-9));
        assertThat(movement.getVelocity().y()).isCloseTo(110.0, within(1e-9));

        Agent hunter = agent(PersonalityType.HUNTER);
        hunter.setPath(List.of(new Vector2(0, 200)));
        executor.apply(hunter, Vector2.ZERO, movement, 0, true);
        assertThat(movement.getVelocity().x()).isCloseTo(0.0, within(1e-9));
        assertThat(movement.getVelocity().y()).isCloseTo(105.0, within(1e-9));
    }

    private void placeMovingAlly() {
        TestEntity ally = agentEntity(2, new Vector2(20, 0), PersonalityType.SWARM);
        ally.getComponent(Movement.class).orElseThrow().setVelocity(0, 50);
        place(ally, new Vector2(20, 0));
    }
}
