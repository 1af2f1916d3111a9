package org.hivemind.runtime;

/**
 * Timing of one orchestrator tick.
 *
 * @param deltaMillis Milliseconds since the previous tick.
 * @param totalMillis Simulation time in milliseconds; the clock all agent timestamps use.
 * @param tick The tick number.
 */
public record TickContext(long deltaMillis, long totalMillis, long tick) {
}
