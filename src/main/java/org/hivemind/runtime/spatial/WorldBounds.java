package org.hivemind.runtime.spatial;

import org.hivemind.runtime.model.Vector2;

/**
 * Axis-aligned rectangle bounding the simulated world.
 *
 * @param minX Left edge.
 * @param minY Bottom edge.
 * @param maxX Right edge, strictly greater than {@code minX}.
 * @param maxY Top edge, strictly greater than {@code minY}.
 */
public record WorldBounds(double minX, double minY, double maxX, double maxY) {

    public WorldBounds {
        if (!(maxX > minX) || !(maxY > minY)) {
            throw new IllegalArgumentException(
                    "World bounds are inverted or empty: [" + minX + ", " + minY + "] - [" + maxX + ", " + maxY + "]");
        }
    }

    /**
     * Square bounds centred at the origin.
     *
     * @param halfExtent Distance from the origin to each edge.
     * @return The bounds {@code [-halfExtent, halfExtent]} on both axes.
     */
    public static WorldBounds centered(double halfExtent) {
        return new WorldBounds(-halfExtent, -halfExtent, halfExtent, halfExtent);
    }

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    public boolean contains(Vector2 point) {
        return contains(point.x(), point.y());
    }

    /**
     * Clamps a point into the bounds.
     *
     * @param point The point.
     * @return The nearest point inside the bounds.
     */
    public Vector2 clamp(Vector2 point) {
        return new Vector2(
                Math.max(minX, Math.min(maxX, point.x())),
                Math.max(minY, Math.min(maxY, point.y())));
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }
}
