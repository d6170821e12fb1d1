package com.baton.coordinator.model;

/**
 * Lifecycle of a coordination session.
 *
 * A session is ACTIVE from creation until the validator gate accepts it.
 * Nothing else closes a session.
 */
public enum SessionStatus {
    ACTIVE,
    COMPLETED
}
