package org.hivemind.runtime.behavior;

import java.util.Optional;

import org.hivemind.runtime.model.Agent;
import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.model.component.AiComponent;
import org.hivemind.runtime.model.component.Health;
import org.hivemind.runtime.model.component.Transform;
import org.hivemind.runtime.spatial.SpatialHashGrid;
import org.hivemind.runtime.spi.IEntity;
import org.hivemind.runtime.spi.IStatModifier;
import org.hivemind.runtime.spi.IWorld;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Builds an {@link AiContext} for one agent from the spatial index and the world.
 * <p>
 * Neighbours are found with a spatial query at the agent's detection radius. Entities carrying
 * an {@link AiComponent} count as allies, other living entities as enemies; entities with
 * depleted health are ignored. An agent without a living target acquires one here: the
 * primary target if it is nearby, otherwise the nearest enemy.
 * Line of sight is approximated by distance.
 */
public class ContextBuilder {

    /** Damage within this window marks the agent as under attack. */
    public static final long UNDER_ATTACK_WINDOW_MILLIS = 2000L;

    private static final double DEFAULT_HEALTH = 100.0;

    private final SpatialHashGrid grid;
    private final IWorld world;
    private final StatModifierChain modifiers;

    public ContextBuilder(SpatialHashGrid grid, IWorld world, StatModifierChain modifiers) {
        this.grid = grid;
        this.world = world;
        this.modifiers = modifiers;
    }

    /**
     * @param agent The agent.
     * @param entity The agent's entity.
     * @param position The agent's current position.
     * @param primaryTargetId The primary target's id, or {@link Agent#NO_TARGET}.
     * @param now The current simulation time.
     * @return The agent's context.
     */
    public AiContext build(Agent agent, IEntity entity, Vector2 position, int primaryTargetId, long now) {
        AiComponent profile = agent.getProfile();
        Optional<Health> health = entity.getComponent(Health.class);
        double current = health.map(Health::getCurrent).orElse(DEFAULT_HEALTH);
        double maximum = health.map(Health::getMaximum).orElse(DEFAULT_HEALTH);
        agent.observeHealth(current, now);

        double sightRange = modifiers.apply(agent, IStatModifier.SIGHT_RANGE, profile.getSightRange());
        double attackRange = modifiers.apply(agent, IStatModifier.ATTACK_RANGE, profile.getAttackRange());
        double detectionRadius = Math.max(sightRange, profile.getHearingRange());

        int allies = 0;
        int enemies = 0;
        double weakestFraction = 1.0;
        Vector2 weakestPosition = null;
        int nearestEnemy = Agent.NO_TARGET;
        double nearestEnemyDistSq = Double.POSITIVE_INFINITY;
        boolean primaryNearby = false;

        IntList nearby = grid.query(position, detectionRadius);
        for (int i = 0; i < nearby.size(); i++) {
            int id = nearby.getInt(i);
            if (id == agent.getId()) {
                continue;
            }
            Optional<IEntity> other = world.getEntity(id);
            if (other.isEmpty()) {
                continue;
            }
            Vector2 otherPosition = grid.getPosition(id).orElse(position);
            if (other.get().hasComponent(AiComponent.class)) {
                allies++;
                Optional<Health> allyHealth = other.get().getComponent(Health.class);
                if (allyHealth.isPresent() && allyHealth.get().getFraction() < weakestFraction) {
                    weakestFraction = allyHealth.get().getFraction();
                    weakestPosition = otherPosition;
                }
            } else if (isAlive(other.get())) {
                enemies++;
                if (id == primaryTargetId) {
                    primaryNearby = true;
                }
                double distSq = otherPosition.distanceSquared(position);
                if (distSq < nearestEnemyDistSq) {
                    nearestEnemyDistSq = distSq;
                    nearestEnemy = id;
                }
            }
        }

        if (!hasLivingTarget(agent)) {
            agent.clearTarget();
            if (primaryNearby) {
                agent.setTarget(primaryTargetId, null);
            } else if (nearestEnemy != Agent.NO_TARGET) {
                agent.setTarget(nearestEnemy, null);
            }
        }

        double distanceToTarget = Double.POSITIVE_INFINITY;
        boolean targetVisible = false;
        if (agent.hasTarget() && nearby.contains(agent.getTargetId())) {
            Optional<Vector2> targetPosition = positionOf(agent.getTargetId());
            if (targetPosition.isPresent()) {
                distanceToTarget = position.distance(targetPosition.get());
                targetVisible = distanceToTarget <= sightRange;
                if (targetVisible) {
                    agent.setTarget(agent.getTargetId(), targetPosition.get());
                }
            }
        }

        boolean lastKnown = agent.hasTarget() && agent.getMemory().hasSeen(agent.getTargetId());
        boolean stuck = agent.checkStuck(position);
        long lastDamage = agent.getLastDamageTime();
        long sinceDamage = lastDamage == Agent.NEVER ? Long.MAX_VALUE : now - lastDamage;

        return new AiContext(
            current,
            maximum,
            distanceToTarget,
            targetVisible,
            lastKnown,
            allies,
            enemies,
            weakestFraction,
            weakestPosition,
            attackRange,
            sinceDamage < UNDER_ATTACK_WINDOW_MILLIS,
            sinceDamage,
            now - agent.getStateStartTime(),
            agent.hasPath(),
            stuck);
    }

    private boolean hasLivingTarget(Agent agent) {
        if (!agent.hasTarget()) {
            return false;
        }
        Optional<IEntity> target = world.getEntity(agent.getTargetId());
        return target.isPresent() && isAlive(target.get());
    }

    private Optional<Vector2> positionOf(int id) {
        Optional<Vector2> indexed = grid.getPosition(id);
        if (indexed.isPresent()) {
            return indexed;
        }
        return world.getEntity(id).flatMap(e -> e.getComponent(Transform.class)).map(Transform::getPosition);
    }

    private static boolean isAlive(IEntity entity) {
        return entity.getComponent(Health.class).map(h -> !h.isDepleted()).orElse(true);
    }
}
