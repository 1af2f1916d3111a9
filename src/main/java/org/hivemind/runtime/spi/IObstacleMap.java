package org.hivemind.runtime.spi;

/**
 * Static walkability query consulted by the grid-based pathfinding strategies.
 */
@FunctionalInterface
public interface IObstacleMap {

    /** Map in which nothing is blocked. */
    IObstacleMap NONE = (x, y) -> false;

    /**
     * @param x World x coordinate.
     * @param y World y coordinate.
     * @return {@code true} if the point cannot be walked through.
     */
    boolean isBlocked(double x, double y);
}
