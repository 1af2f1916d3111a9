package org.hivemind.runtime.model.component;

import org.hivemind.runtime.model.Vector2;

/**
 * Movement component of an entity. The AI core writes the velocity; integrating it
 * into the position is the job of the surrounding movement system.
 */
public class Movement {

    private Vector2 velocity = Vector2.ZERO;
    private final double maxSpeed;

    /**
     * @param maxSpeed Base move speed in units per second.
     */
    public Movement(double maxSpeed) {
        this.maxSpeed = maxSpeed;
    }

    public Vector2 getVelocity() {
        return velocity;
    }

    public void setVelocity(Vector2 velocity) {
        this.velocity = velocity;
    }

    public void setVelocity(double vx, double vy) {
        this.velocity = new Vector2(vx, vy);
    }

    public void stop() {
        this.velocity = Vector2.ZERO;
    }

    public double getMaxSpeed() {
        return maxSpeed;
    }
}
