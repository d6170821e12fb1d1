package com.baton.coordinator.event;

import com.baton.coordinator.model.EventType;

import java.util.Map;

/**
 * Free-form audit line. Warnings meant for the manager (auto-accepted
 * re-rejections, inconsistent escalations) are recorded this way.
 */
public record AuditEntry(String message, Map<String, String> attributes) implements EventPayload {

    @Override
    public EventType type() { return EventType.AUDIT; }

    @Override
    public void validate() {
        Payloads.requireText(message, "message");
    }
}
