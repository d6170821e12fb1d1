package com.baton.coordinator.api.dto;

import com.baton.coordinator.model.Role;

import java.time.Instant;

/** Request body for POST /sessions/{sessionId}/groups/{groupId}/timeouts. */
public record TimeoutRequest(Role role, Instant deadline, String reason) {}
