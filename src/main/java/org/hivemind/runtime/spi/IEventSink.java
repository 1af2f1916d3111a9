package org.hivemind.runtime.spi;

/**
 * Fire-and-forget event output.
 * <p>
 * The orchestrator catches and logs anything an implementation throws, so a faulty listener
 * cannot abort a tick. Event type names are listed in
 * {@link org.hivemind.runtime.events.AiEventTypes}.
 */
@FunctionalInterface
public interface IEventSink {

    /** Sink that drops every event. */
    IEventSink NONE = (eventType, payload) -> { };

    /**
     * Publishes an event.
     *
     * @param eventType The event type name.
     * @param payload The event payload record.
     */
    void emit(String eventType, Object payload);
}
