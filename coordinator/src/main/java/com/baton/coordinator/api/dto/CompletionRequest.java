package com.baton.coordinator.api.dto;

/** Request body for POST /sessions/{sessionId}/completion. */
public record CompletionRequest(String summary) {}
