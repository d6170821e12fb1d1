package com.baton.coordinator.api.dto;

import com.baton.coordinator.model.Event;
import com.baton.coordinator.model.EventType;
import com.fasterxml.jackson.annotation.JsonRawValue;

import java.time.Instant;

/**
 * One stored event. payload is emitted as the stored JSON document.
 *
 * duplicate is true when an append found the dedup key already present.
 */
public record EventResponse(
        Long      id,
        String    sessionId,
        String    groupId,
        EventType type,
        @JsonRawValue String payload,
        String    dedupKey,
        Instant   createdAt,
        boolean   duplicate
) {
    public static EventResponse from(Event e) {
        return from(e, false);
    }

    public static EventResponse from(Event e, boolean duplicate) {
        return new EventResponse(
                e.getId(),
                e.getSessionId(),
                e.getGroupId(),
                e.getEventType(),
                e.getPayload(),
                e.getDedupKey(),
                e.getCreatedAt(),
                duplicate
        );
    }
}
