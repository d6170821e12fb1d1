package com.baton.coordinator.model;

/**
 * How much quality checking a session asks for.
 *
 * MINIMAL and DISABLED skip the quality-checker role: work that would be
 * routed there goes straight to the reviewer instead. Security-sensitive
 * groups are checked regardless.
 */
public enum TestingMode {
    FULL,
    MINIMAL,
    DISABLED;

    public boolean skipsQualityCheck() {
        return this != FULL;
    }
}
