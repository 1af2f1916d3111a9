package org.hivemind.runtime.movement;

import java.util.Optional;

import org.hivemind.runtime.behavior.StatModifierChain;
import org.hivemind.runtime.model.Agent;
import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.model.component.AiComponent;
import org.hivemind.runtime.model.component.Movement;
import org.hivemind.runtime.spatial.SpatialHashGrid;
import org.hivemind.runtime.spi.IEntity;
import org.hivemind.runtime.spi.IStatModifier;
import org.hivemind.runtime.spi.IWorld;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Turns an agent's current waypoint, local avoidance and flocking into a velocity command.
 * <p>
 * Neighbour positions come from the spatial index snapshot of the current tick; neighbour
 * velocities are read from their {@link Movement} components.
 */
public class MovementExecutor {

    /** Waypoints closer than this are considered reached. */
    public static final double ARRIVAL_RADIUS = 10.0;

    static final double DESIRED_WEIGHT = 0.7;
    static final double AVOIDANCE_WEIGHT = 0.3;

    /** Radius within which swarm agents flock with allies. */
    public static final double FLOCK_RADIUS = 100.0;
    /** Allies closer than this push a swarm agent away. */
    public static final double SEPARATION_RADIUS = 30.0;

    static final double SEPARATION_WEIGHT = 0.5;
    static final double ALIGNMENT_WEIGHT = 0.3;
    static final double COHESION_WEIGHT = 0.2;
    static final double CURRENT_VELOCITY_WEIGHT = 0.8;
    static final double FLOCKING_WEIGHT = 0.2;

    private final SpatialHashGrid grid;
    private final IWorld world;
    private final StatModifierChain modifiers;

    public MovementExecutor(SpatialHashGrid grid, IWorld world, StatModifierChain modifiers) {
        this.grid = grid;
        this.world = world;
        this.modifiers = modifiers;
    }

    /**
     * Assigns the agent's velocity for this update. An agent without a waypoint stands still,
     * swarm agents included.
     *
     * @param agent The agent.
     * @param position The agent's position.
     * @param movement The agent's movement component, receives the velocity.
     * @param avoidanceRadius The local-avoidance radius; 0 disables avoidance.
     * @param groupBehavior Whether swarm agents flock.
     */
    public void apply(Agent agent, Vector2 position, Movement movement, double avoidanceRadius, boolean groupBehavior) {
        Vector2 waypoint = agent.getCurrentWaypoint();
        while (waypoint != null && position.distance(waypoint) < ARRIVAL_RADIUS) {
            agent.advanceWaypoint();
            waypoint = agent.getCurrentWaypoint();
        }

        if (waypoint == null) {
            movement.stop();
        } else {
            double speed = speedOf(agent, movement);
            Vector2 desired = waypoint.subtract(position).normalize();
            Vector2 avoidance = avoidance(agent.getId(), position, avoidanceRadius);
            Vector2 direction = avoidance.isZero()
                    ? desired
                    : desired.scale(DESIRED_WEIGHT).add(avoidance.scale(AVOIDANCE_WEIGHT)).normalize();
            movement.setVelocity(direction.scale(speed));
            if (groupBehavior && agent.getPersonality().swarm()) {
                flock(agent.getId(), position, movement);
            }
        }
    }

    /**
     * @return {@code maxSpeed * speedMultiplier}, passed through the move speed modifiers.
     */
    double speedOf(Agent agent, Movement movement) {
        double base = movement.getMaxSpeed() * agent.getPersonality().speedMultiplier();
        return Math.max(0.0, modifiers.apply(agent, IStatModifier.MOVE_SPEED, base));
    }

    /**
     * Sums the separating directions to every neighbour within the radius, each weighted by
     * the inverse of its distance.
     *
     * @return The normalized repulsion, or zero if nothing is close.
     */
    Vector2 avoidance(int selfId, Vector2 position, double radius) {
        if (!(radius > 0.0)) {
            return Vector2.ZERO;
        }
        double fx = 0.0;
        double fy = 0.0;
        IntList nearby = grid.query(position, radius);
        for (int i = 0; i < nearby.size(); i++) {
            int id = nearby.getInt(i);
            if (id == selfId) {
                continue;
            }
            Optional<Vector2> other = grid.getPosition(id);
            if (other.isEmpty()) {
                continue;
            }
            double distance = position.distance(other.get());
            if (distance > 0.0 && distance < radius) {
                Vector2 away = position.subtract(other.get()).normalize();
                fx += away.x() / distance;
                fy += away.y() / distance;
            }
        }
        return new Vector2(fx, fy).normalize();
    }

    private void flock(int selfId, Vector2 position, Movement movement) {
        Vector2 separation = Vector2.ZERO;
        Vector2 velocitySum = Vector2.ZERO;
        Vector2 positionSum = Vector2.ZERO;
        int count = 0;

        IntList nearby = grid.query(position, FLOCK_RADIUS);
        for (int i = 0; i < nearby.size(); i++) {
            int id = nearby.getInt(i);
            if (id == selfId) {
                continue;
            }
            Optional<IEntity> ally = world.getEntity(id).filter(e -> e.hasComponent(AiComponent.class));
            Optional<Vector2> allyPosition = grid.getPosition(id);
            if (ally.isEmpty() || allyPosition.isEmpty()) {
                continue;
            }
            count++;
            double distance = position.distance(allyPosition.get());
            if (distance > 0.0 && distance < SEPARATION_RADIUS) {
                separation = separation.add(position.subtract(allyPosition.get()).normalize().scale(1.0 / distance));
            }
            velocitySum = velocitySum.add(ally.get().getComponent(Movement.class).map(Movement::getVelocity).orElse(Vector2.ZERO));
            positionSum = positionSum.add(allyPosition.get());
        }
        if (count == 0) {
            return;
        }

        Vector2 alignment = velocitySum.scale(1.0 / count).normalize();
        Vector2 cohesion = positionSum.scale(1.0 / count).subtract(position).normalize();
        Vector2 flocking = separation.scale(SEPARATION_WEIGHT)
                .add(alignment.scale(ALIGNMENT_WEIGHT))
                .add(cohesion.scale(COHESION_WEIGHT));
        if (!flocking.isZero()) {
            movement.setVelocity(movement.getVelocity().scale(CURRENT_VELOCITY_WEIGHT)
                    .add(flocking.scale(movement.getMaxSpeed() * FLOCKING_WEIGHT)));
        }
    }
}
