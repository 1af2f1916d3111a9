package org.hivemind.runtime.events;

/**
 * Emitted when an attacking agent's cooldown allows a strike. Resolving the hit is up to
 * the host's combat system.
 *
 * @param attackerId The attacking agent's entity id.
 * @param targetId The target's entity id.
 * @param distance Distance between the two at the time of the attack.
 * @param timestamp Simulation time in milliseconds.
 */
public record AttackEvent(int attackerId, int targetId, double distance, long timestamp) {
}
