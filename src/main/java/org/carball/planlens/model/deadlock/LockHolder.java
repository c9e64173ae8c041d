package org.carball.planlens.model.deadlock;

/**
 * An owner or waiter of a lock resource. {@code victim} mirrors the referenced participant.
 */
public record LockHolder(String participantId, String mode, boolean victim) {}
