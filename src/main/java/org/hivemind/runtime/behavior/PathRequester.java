package org.hivemind.runtime.behavior;

import org.hivemind.runtime.model.Agent;
import org.hivemind.runtime.model.Vector2;

/**
 * Accepts path requests from state actions. The orchestrator queues them for its budgeted drain.
 */
@FunctionalInterface
public interface PathRequester {

    void request(Agent agent, Vector2 goal, long now);
}
