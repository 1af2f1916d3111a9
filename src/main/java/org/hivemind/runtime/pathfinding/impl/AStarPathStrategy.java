package org.hivemind.runtime.pathfinding.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.spatial.GridKeys;
import org.hivemind.runtime.spi.IObstacleMap;
import org.hivemind.runtime.spi.pathfinding.IPathfindingStrategy;
import org.hivemind.runtime.spi.pathfinding.PathfindingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

/**
 * A* search over a square lattice anchored at the start position.
 * <p>
 * Lattice node {@code (i, j)} sits at {@code start + (i, j) * cellSize}. Expansion is
 * 8-directional with a cardinal step cost of {@code cellSize} and a diagonal step cost of
 * {@code 1.414 * cellSize}; the heuristic is the straight-line distance to the goal. The
 * search ends at the first node within one cell of the goal, and the goal is appended as the
 * final waypoint. If the closed set grows beyond {@code search.max-nodes} or the open set runs
 * dry, the straight-line path is returned instead. Blocked nodes are never expanded.
 */
public class AStarPathStrategy implements IPathfindingStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(AStarPathStrategy.class);

    public static final double DEFAULT_CELL_SIZE = 20.0;
    public static final int DEFAULT_MAX_NODES = 1000;
    public static final double DIAGONAL_COST = 1.414;

    private static final int[] DX = {0, 1, 0, -1, -1, 1, 1, -1};
    private static final int[] DY = {-1, 0, 1, 0, -1, -1, 1, 1};

    private double cellSize = DEFAULT_CELL_SIZE;
    private int maxNodes = DEFAULT_MAX_NODES;
    private IObstacleMap obstacles = IObstacleMap.NONE;
    private DirectPathStrategy fallback = new DirectPathStrategy();
    private int lastNodesVisited;

    private record Node(int i, int j, double g, double f) {}

    @Override
    public void initialize(PathfindingEnvironment environment, Config options) {
        if (options.hasPath("search.cell-size")) {
            double configured = options.getDouble("search.cell-size");
            if (!(configured > 0.0)) {
                throw new IllegalArgumentException("search.cell-size must be positive, got " + configured);
            }
            this.cellSize = configured;
        }
        if (options.hasPath("search.max-nodes")) {
            this.maxNodes = Math.max(1, options.getInt("search.max-nodes"));
        }
        if (environment != null && environment.obstacles() != null) {
            this.obstacles = environment.obstacles();
        }
        this.fallback = new DirectPathStrategy();
        this.fallback.initialize(environment, options);
    }

    /**
     * Weight of the heuristic term in {@code f = g + w * h}. 1 gives A*, 0 gives a uniform-cost search.
     */
    protected double heuristicWeight() {
        return 1.0;
    }

    @Override
    public List<Vector2> findPath(Vector2 start, Vector2 goal) {
        double weight = heuristicWeight();
        PriorityQueue<Node> open = new PriorityQueue<>((a, b) -> Double.compare(a.f(), b.f()));
        Long2DoubleOpenHashMap bestG = new Long2DoubleOpenHashMap();
        bestG.defaultReturnValue(Double.POSITIVE_INFINITY);
        Long2LongOpenHashMap parents = new Long2LongOpenHashMap();
        LongOpenHashSet closed = new LongOpenHashSet();

        long startKey = GridKeys.pack(0, 0);
        bestG.put(startKey, 0.0);
        open.add(new Node(0, 0, 0.0, weight * start.distance(goal)));

        while (!open.isEmpty()) {
            Node current = open.poll();
            long key = GridKeys.pack(current.i(), current.j());
            if (closed.contains(key) || current.g() > bestG.get(key)) {
                continue;
            }
            Vector2 position = positionOf(start, current.i(), current.j());
            if (position.distance(goal) < cellSize) {
                lastNodesVisited = closed.size();
                return reconstruct(start, goal, key, parents);
            }
            closed.add(key);
            if (closed.size() > maxNodes) {
                break;
            }
            for (int d = 0; d < DX.length; d++) {
                int ni = current.i() + DX[d];
                int nj = current.j() + DY[d];
                long neighborKey = GridKeys.pack(ni, nj);
                if (closed.contains(neighborKey)) {
                    continue;
                }
                Vector2 neighbor = positionOf(start, ni, nj);
                if (obstacles.isBlocked(neighbor.x(), neighbor.y())) {
                    continue;
                }
                double g = current.g() + (d < 4 ? cellSize : DIAGONAL_COST * cellSize);
                if (g < bestG.get(neighborKey)) {
                    bestG.put(neighborKey, g);
                    parents.put(neighborKey, key);
                    open.add(new Node(ni, nj, g, g + weight * neighbor.distance(goal)));
                }
            }
        }

        lastNodesVisited = closed.size();
        LOG.debug("{} gave up after {} nodes from {} to {}, using direct path",
                getClass().getSimpleName(), lastNodesVisited, start, goal);
        return fallback.findPath(start, goal);
    }

    /**
     * @return The closed-set size of the most recent search.
     */
    public int getLastNodesVisited() {
        return lastNodesVisited;
    }

    public double getCellSize() {
        return cellSize;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    private Vector2 positionOf(Vector2 start, int i, int j) {
        return new Vector2(start.x() + i * cellSize, start.y() + j * cellSize);
    }

    private List<Vector2> reconstruct(Vector2 start, Vector2 goal, long endKey, Long2LongOpenHashMap parents) {
        List<Vector2> path = new ArrayList<>();
        long key = endKey;
        while (true) {
            path.add(positionOf(start, GridKeys.unpackX(key), GridKeys.unpackY(key)));
            if (!parents.containsKey(key)) {
                break;
            }
            key = parents.get(key);
        }
        Collections.reverse(path);
        path.add(goal);
        return List.copyOf(path);
    }
}
