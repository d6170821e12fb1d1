package com.baton.coordinator.api.dto;

import com.baton.coordinator.model.EventType;
import com.fasterxml.jackson.databind.JsonNode;

/** Request body for POST /sessions/{sessionId}/events. groupId is optional. */
public record AppendEventRequest(String groupId, EventType type, JsonNode payload, String dedupKey) {}
