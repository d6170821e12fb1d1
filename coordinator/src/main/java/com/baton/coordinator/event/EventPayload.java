package com.baton.coordinator.event;

import com.baton.coordinator.model.EventType;

/**
 * Typed body of an {@link com.baton.coordinator.model.Event}.
 *
 * There is one record per {@link EventType}. The store serialises the record
 * to JSON and keeps {@link #type()} in its own column, so a payload can always
 * be decoded back into the right record.
 */
public interface EventPayload {

    /** The discriminator this payload is stored under. */
    EventType type();

    /**
     * Schema check run at the store boundary before anything is written.
     *
     * @throws com.baton.coordinator.store.CoordinationException VALIDATION_ERROR on a malformed payload
     */
    void validate();
}
