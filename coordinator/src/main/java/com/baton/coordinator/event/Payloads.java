package com.baton.coordinator.event;

import com.baton.coordinator.store.CoordinationException;

import java.util.Collection;

/** Shared precondition helpers for payload validation. */
final class Payloads {

    private Payloads() {}

    static void require(boolean condition, String message) {
        if (!condition) {
            throw CoordinationException.validation(message);
        }
    }

    static void requireText(String value, String field) {
        require(value != null && !value.isBlank(), field + " is required");
    }

    static void requireNoNulls(Collection<?> values, String field) {
        require(values != null, field + " is required");
        require(values.stream().noneMatch(v -> v == null), field + " cannot contain null entries");
    }
}
