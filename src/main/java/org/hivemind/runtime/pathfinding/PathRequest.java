package org.hivemind.runtime.pathfinding;

import org.hivemind.runtime.model.Vector2;

/**
 * A pending pathfinding request.
 *
 * @param agentId The requesting agent's entity id.
 * @param goal Where the agent wants to go.
 * @param enqueuedAt Simulation time at which the request first entered the queue.
 */
public record PathRequest(int agentId, Vector2 goal, long enqueuedAt) {
}
