package org.hivemind.runtime.pathfinding;

import java.util.function.Consumer;

import org.hivemind.runtime.model.Vector2;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;

/**
 * FIFO of pending pathfinding requests, drained under a per-tick budget.
 * <p>
 * Each agent has at most one pending request. Enqueueing again while a request is pending
 * replaces its goal but keeps its position in the queue, so a busy agent can never jump ahead
 * of older requests nor be pushed to the back by its own refreshes. Requests beyond the
 * budget stay queued; nothing is dropped.
 */
public class PathRequestQueue {

    private final Int2ObjectLinkedOpenHashMap<PathRequest> pending = new Int2ObjectLinkedOpenHashMap<>();

    /**
     * Adds a request or updates the goal of the agent's pending one.
     *
     * @param agentId The agent.
     * @param goal The requested goal.
     * @param now The current simulation time.
     * @return {@code true} if a new request was queued, {@code false} if a pending one was updated.
     */
    public boolean enqueue(int agentId, Vector2 goal, long now) {
        PathRequest existing = pending.get(agentId);
        if (existing != null) {
            pending.put(agentId, new PathRequest(agentId, goal, existing.enqueuedAt()));
            return false;
        }
        pending.put(agentId, new PathRequest(agentId, goal, now));
        return true;
    }

    /**
     * Removes up to {@code budget} requests in FIFO order and hands each to {@code handler}.
     *
     * @param budget The maximum number of requests to remove.
     * @param handler Receives each removed request.
     * @return The number of requests removed.
     */
    public int drain(int budget, Consumer<PathRequest> handler) {
        int drained = 0;
        while (drained < budget && !pending.isEmpty()) {
            PathRequest request = pending.removeFirst();
            drained++;
            handler.accept(request);
        }
        return drained;
    }

    /**
     * Drops the pending request of an agent, if any.
     *
     * @param agentId The agent.
     * @return {@code true} if a request was pending.
     */
    public boolean discard(int agentId) {
        return pending.remove(agentId) != null;
    }

    public boolean isPending(int agentId) {
        return pending.containsKey(agentId);
    }

    public int size() {
        return pending.size();
    }

    public void clear() {
        pending.clear();
    }
}
