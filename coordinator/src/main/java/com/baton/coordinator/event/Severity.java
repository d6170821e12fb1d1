package com.baton.coordinator.event;

/** How bad a reviewer-raised issue is. Blocking is tracked separately. */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
