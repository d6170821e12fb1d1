package com.baton.coordinator.model;

/**
 * One originally agreed work item of a session.
 *
 * @param id          Short identifier referenced by task groups and scope changes.
 * @param description What the item delivers.
 */
public record ScopeItem(String id, String description) {}
