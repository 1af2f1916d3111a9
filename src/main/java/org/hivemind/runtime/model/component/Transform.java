package org.hivemind.runtime.model.component;

import org.hivemind.runtime.model.Vector2;

/**
 * Position component of an entity. Owned and written by the surrounding world;
 * the AI core only reads it.
 */
public class Transform {

    private Vector2 position;
    private final double radius;

    public Transform(Vector2 position) {
        this(position, 0.0);
    }

    /**
     * @param position The initial position.
     * @param radius The bounding radius used for spatial indexing. Negative values are treated as 0.
     */
    public Transform(Vector2 position, double radius) {
        this.position = position;
        this.radius = Math.max(0.0, radius);
    }

    public Vector2 getPosition() {
        return position;
    }

    public void setPosition(Vector2 position) {
        this.position = position;
    }

    public double getRadius() {
        return radius;
    }
}
