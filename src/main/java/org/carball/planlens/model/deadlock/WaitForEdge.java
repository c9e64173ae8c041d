package org.carball.planlens.model.deadlock;

/**
 * Directed edge from the owner of a lock to a session waiting on it.
 * {@code resourceIndex} points into {@link DeadlockGraph#getResources()}.
 */
public record WaitForEdge(String ownerId, String waiterId, int resourceIndex, String ownerMode, String waiterMode) {}
