package com.baton.coordinator.store;

/**
 * Thrown when a coordination command cannot be carried out as asked.
 *
 * Unchecked so callers only catch it when they have a specific recovery
 * strategy. The command layer turns the {@link Kind} into the result tag
 * returned to the caller.
 */
public class CoordinationException extends RuntimeException {

    public enum Kind {
        VALIDATION_ERROR,     // malformed identifier or payload, nothing persisted
        NOT_FOUND,            // unknown session or group
        CONFLICT,             // duplicate dedup key or existing session, safe to treat as success
        STATE_INCONSISTENCY,  // stored state contradicts the request
        INTERNAL_ERROR        // store failure, retryable
    }

    private final Kind kind;

    public CoordinationException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public CoordinationException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public static CoordinationException validation(String message) {
        return new CoordinationException(Kind.VALIDATION_ERROR, message);
    }

    public static CoordinationException notFound(String message) {
        return new CoordinationException(Kind.NOT_FOUND, message);
    }
}
