package com.baton.coordinator.api.dto;

import java.util.List;

/**
 * Request body for POST /sessions/{sessionId}/scope-changes.
 * approvedBy names whoever signed off the reduction (normally the user).
 */
public record ScopeChangeRequest(List<String> removedItemIds, String reason, String approvedBy, String dedupKey) {}
