package com.baton.coordinator.store;

import com.baton.coordinator.model.EventType;

import java.time.Instant;

/**
 * Filter for event reads. Every field is optional.
 *
 * @param groupId Only events of this group.
 * @param type    Only events of this type.
 * @param since   Only events created at or after this instant (recency window).
 * @param limit   Keep only the most recent {@code limit} matches.
 */
public record EventQuery(String groupId, EventType type, Instant since, Integer limit) {

    public static EventQuery all() {
        return new EventQuery(null, null, null, null);
    }

    public static EventQuery of(String groupId, EventType type) {
        return new EventQuery(groupId, type, null, null);
    }
}
