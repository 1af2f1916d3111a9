package org.hivemind.runtime.events;

import org.hivemind.runtime.pathfinding.PathfindingAlgorithm;

/**
 * Emitted once by {@code AgentOrchestrator.initialize()}.
 *
 * @param algorithm The active pathfinding algorithm.
 * @param strategyName Simple class name of the active strategy.
 * @param maxAgentUpdatesPerTick Agent update budget.
 * @param maxPathfindsPerTick Pathfinding budget.
 */
public record SystemInitializedEvent(
    PathfindingAlgorithm algorithm,
    String strategyName,
    int maxAgentUpdatesPerTick,
    int maxPathfindsPerTick
) {
}
