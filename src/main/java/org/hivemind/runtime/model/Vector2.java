package org.hivemind.runtime.model;

/**
 * Immutable 2D vector used for positions, velocities and directions.
 *
 * @param x The x component.
 * @param y The y component.
 */
public record Vector2(double x, double y) {

    /** The zero vector. */
    public static final Vector2 ZERO = new Vector2(0.0, 0.0);

    public Vector2 add(Vector2 other) {
        return new Vector2(x + other.x, y + other.y);
    }

    public Vector2 subtract(Vector2 other) {
        return new Vector2(x - other.x, y - other.y);
    }

    public Vector2 scale(double factor) {
        return new Vector2(x * factor, y * factor);
    }

    public double length() {
        return Math.sqrt(x * x + y * y);
    }

    public double lengthSquared() {
        return x * x + y * y;
    }

    /**
     * Returns the unit vector pointing in the same direction.
     * The zero vector normalizes to itself.
     *
     * @return The normalized vector, or {@link #ZERO} if this vector has no length.
     */
    public Vector2 normalize() {
        double len = length();
        if (len == 0.0) {
            return ZERO;
        }
        return new Vector2(x / len, y / len);
    }

    public double distance(Vector2 other) {
        return Math.sqrt(distanceSquared(other));
    }

    public double distanceSquared(Vector2 other) {
        double dx = other.x - x;
        double dy = other.y - y;
        return dx * dx + dy * dy;
    }

    /**
     * Linear interpolation between this vector and {@code target}.
     *
     * @param target The end point.
     * @param t The interpolation parameter, 0 yields this vector and 1 yields {@code target}.
     * @return The interpolated vector.
     */
    public Vector2 lerp(Vector2 target, double t) {
        return new Vector2(x + (target.x - x) * t, y + (target.y - y) * t);
    }

    public boolean isZero() {
        return x == 0.0 && y == 0.0;
    }
}
