package org.hivemind.runtime.pathfinding.impl;

/**
 * Uniform-cost search over the same lattice as {@link AStarPathStrategy}.
 * <p>
 * Identical to A* with the heuristic switched off, so the result is the shortest lattice path
 * within the node limit. Expands far more nodes than A* for the same request.
 */
public class DijkstraPathStrategy extends AStarPathStrategy {

    @Override
    protected double heuristicWeight() {
        return 0.0;
    }
}
