package org.hivemind.runtime.pathfinding;

import java.util.Arrays;
import java.util.PriorityQueue;

import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.spatial.GridKeys;
import org.hivemind.runtime.spatial.WorldBounds;
import org.hivemind.runtime.spi.IObstacleMap;

/**
 * Cost and direction grid leading every reachable cell to one goal.
 * <p>
 * The field covers a square window of cells around the goal, clipped to the world bounds.
 * Costs are in cell units: 1 for a cardinal step and {@link #DIAGONAL_COST} for a diagonal
 * step. Each reachable cell points at its lowest-cost neighbour; the goal cell points nowhere.
 * Instances are immutable once built.
 */
public final class FlowField {

    public static final double DIAGONAL_COST = 1.414;

    /** Direction index of cells without a descending neighbour. */
    public static final int NO_DIRECTION = -1;

    static final int[] DX = {0, 1, 0, -1, -1, 1, 1, -1};
    static final int[] DY = {-1, 0, 1, 0, -1, -1, 1, 1};

    private final double resolution;
    private final int originX;
    private final int originY;
    private final int width;
    private final int height;
    private final int goalX;
    private final int goalY;
    private final double[] costs;
    private final byte[] directions;

    private FlowField(double resolution, int originX, int originY, int width, int height, int goalX, int goalY) {
        this.resolution = resolution;
        this.originX = originX;
        this.originY = originY;
        this.width = width;
        this.height = height;
        this.goalX = goalX;
        this.goalY = goalY;
        this.costs = new double[width * height];
        this.directions = new byte[width * height];
        Arrays.fill(costs, Double.POSITIVE_INFINITY);
        Arrays.fill(directions, (byte) NO_DIRECTION);
    }

    /**
     * Builds the field for a goal with a uniform-cost wave from the goal cell.
     *
     * @param goal The goal position.
     * @param resolution Cell size in world units, positive.
     * @param extent Half the window edge in world units.
     * @param bounds The world bounds the window is clipped to.
     * @param obstacles Blocked cells are never entered.
     * @return The built field.
     */
    public static FlowField build(Vector2 goal, double resolution, double extent, WorldBounds bounds, IObstacleMap obstacles) {
        int gx = GridKeys.quantize(goal.x(), resolution);
        int gy = GridKeys.quantize(goal.y(), resolution);
        int half = (int) Math.ceil(extent / resolution);
        int minX = Math.max(gx - half, GridKeys.quantize(bounds.minX(), resolution));
        int maxX = Math.min(gx + half, GridKeys.quantize(bounds.maxX(), resolution));
        int minY = Math.max(gy - half, GridKeys.quantize(bounds.minY(), resolution));
        int maxY = Math.min(gy + half, GridKeys.quantize(bounds.maxY(), resolution));
        int width = Math.max(0, maxX - minX + 1);
        int height = Math.max(0, maxY - minY + 1);

        FlowField field = new FlowField(resolution, minX, minY, width, height, gx, gy);
        if (field.contains(gx, gy)) {
            field.propagate(obstacles);
            field.assignDirections();
        }
        return field;
    }

    private void propagate(IObstacleMap obstacles) {
        PriorityQueue<double[]> open = new PriorityQueue<>((a, b) -> Double.compare(a[0], b[0]));
        costs[index(goalX, goalY)] = 0.0;
        open.add(new double[] {0.0, goalX, goalY});
        while (!open.isEmpty()) {
            double[] current = open.poll();
            int cx = (int) current[1];
            int cy = (int) current[2];
            if (current[0] > costs[index(cx, cy)]) {
                continue;
            }
            for (int d = 0; d < DX.length; d++) {
                int nx = cx + DX[d];
                int ny = cy + DY[d];
                if (!contains(nx, ny)) {
                    continue;
                }
                double step = d < 4 ? 1.0 : DIAGONAL_COST;
                double next = current[0] + step;
                int ni = index(nx, ny);
                if (next < costs[ni] && !obstacles.isBlocked(cellCenterX(nx), cellCenterY(ny))) {
                    costs[ni] = next;
                    open.add(new double[] {next, nx, ny});
                }
            }
        }
    }

    private void assignDirections() {
        for (int y = originY; y < originY + height; y++) {
            for (int x = originX; x < originX + width; x++) {
                double best = costs[index(x, y)];
                if (best == Double.POSITIVE_INFINITY) {
                    continue;
                }
                int bestDir = NO_DIRECTION;
                for (int d = 0; d < DX.length; d++) {
                    int nx = x + DX[d];
                    int ny = y + DY[d];
                    if (contains(nx, ny) && costs[index(nx, ny)] < best) {
                        best = costs[index(nx, ny)];
                        bestDir = d;
                    }
                }
                directions[index(x, y)] = (byte) bestDir;
            }
        }
    }

    public boolean contains(int cellX, int cellY) {
        return cellX >= originX && cellX < originX + width && cellY >= originY && cellY < originY + height;
    }

    /**
     * @return The propagation cost of a cell, or positive infinity outside the field or when unreachable.
     */
    public double getCost(int cellX, int cellY) {
        return contains(cellX, cellY) ? costs[index(cellX, cellY)] : Double.POSITIVE_INFINITY;
    }

    /**
     * @return The index (0-7) of the neighbour a cell points at, or {@link #NO_DIRECTION}.
     */
    public int getDirection(int cellX, int cellY) {
        return contains(cellX, cellY) ? directions[index(cellX, cellY)] : NO_DIRECTION;
    }

    public static int directionX(int direction) {
        return DX[direction];
    }

    public static int directionY(int direction) {
        return DY[direction];
    }

    public int cellOf(double coordinate) {
        return GridKeys.quantize(coordinate, resolution);
    }

    public double cellCenterX(int cellX) {
        return (cellX + 0.5) * resolution;
    }

    public double cellCenterY(int cellY) {
        return (cellY + 0.5) * resolution;
    }

    public double getResolution() { return resolution; }

    public int getGoalX() { return goalX; }

    public int getGoalY() { return goalY; }

    public int getWidth() { return width; }

    public int getHeight() { return height; }

    private int index(int cellX, int cellY) {
        return (cellY - originY) * width + (cellX - originX);
    }
}
