package org.hivemind.runtime.model;

/**
 * Discrete behavior states of an agent.
 * <p>
 * {@link #DEAD} is terminal: once entered, the state machine never leaves it.
 */
public enum AgentState {
    IDLE,
    PATROL,
    CHASE,
    ATTACK,
    FLEE,
    INVESTIGATE,
    RETREAT,
    SUPPORT,
    GUARD,
    DEAD;

    public boolean isTerminal() {
        return this == DEAD;
    }
}
