package com.baton.coordinator.service;

import com.baton.coordinator.store.CoordinationException;

/**
 * Tag on every command result.
 *
 * CONFLICT is a safe success: the request had already been applied (or the
 * resource already exists) and nothing changed.
 */
public enum ResultStatus {
    OK,
    VALIDATION_ERROR,
    NOT_FOUND,
    CONFLICT,
    INTERNAL_ERROR;

    static ResultStatus of(CoordinationException.Kind kind) {
        return switch (kind) {
            case VALIDATION_ERROR -> VALIDATION_ERROR;
            case NOT_FOUND        -> NOT_FOUND;
            case CONFLICT         -> CONFLICT;
            // Inconsistent stored state is a server-side fault from the caller's point of view.
            case STATE_INCONSISTENCY, INTERNAL_ERROR -> INTERNAL_ERROR;
        };
    }
}
