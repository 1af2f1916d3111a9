package org.hivemind.runtime.events;

/**
 * Event type names emitted by the orchestrator through
 * {@link org.hivemind.runtime.spi.IEventSink}.
 */
public final class AiEventTypes {

    /** Payload: {@link SystemInitializedEvent}. */
    public static final String AI_SYSTEM_INITIALIZED = "AI_SYSTEM_INITIALIZED";

    /** Payload: {@link StateChangedEvent}. */
    public static final String AI_STATE_CHANGED = "AI_STATE_CHANGED";

    /** Payload: {@link PathfindingStatsEvent}. */
    public static final String AI_PATHFINDING_STATS = "AI_PATHFINDING_STATS";

    /** Payload: {@link AttackEvent}. */
    public static final String AI_ATTACK = "AI_ATTACK";

    private AiEventTypes() {
    }
}
