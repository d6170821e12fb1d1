package com.baton.coordinator.event;

/**
 * Answer recorded against one issue.
 *
 * REJECTED_AND_ACCEPTED is never sent by the implementer: the ledger writes
 * it once the reviewer accepts the rejection.
 */
public enum ResponseStatus {
    FIXED,
    REJECTED,
    DEFERRED,
    REJECTED_AND_ACCEPTED
}
