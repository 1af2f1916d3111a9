package org.hivemind.runtime.events;

import org.hivemind.runtime.model.AgentState;

/**
 * Emitted on every actual state transition. Re-entering the current state emits nothing.
 *
 * @param entityId The agent's entity id.
 * @param from The state left.
 * @param to The state entered.
 * @param timestamp Simulation time of the transition in milliseconds.
 */
public record StateChangedEvent(int entityId, AgentState from, AgentState to, long timestamp) {
}
