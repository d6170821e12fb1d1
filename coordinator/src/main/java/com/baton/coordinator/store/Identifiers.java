package com.baton.coordinator.store;

import com.baton.coordinator.model.StateSnapshot;

import java.util.regex.Pattern;

/**
 * Fail-fast checks for every identifier that reaches the store.
 *
 * A malformed identifier is rejected with a VALIDATION_ERROR before any
 * row is written.
 */
public final class Identifiers {

    public static final int MAX_SESSION_ID = 64;
    public static final int MAX_GROUP_ID   = 32;
    public static final int MAX_TYPE_NAME  = 100;
    public static final int MAX_DEDUP_KEY  = 200;

    private static final Pattern ID_CHARS   = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Pattern CODE_CHARS = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");
    private static final Pattern TYPE_CHARS = Pattern.compile("[a-z][a-z0-9_.]*");
    // Dedup keys are composed from ids, so ':' and '.' are allowed as separators.
    private static final Pattern KEY_CHARS  = Pattern.compile("[A-Za-z0-9_:.\\-]+");

    private Identifiers() {}

    public static String sessionId(String value) {
        return check("session_id", value, MAX_SESSION_ID, ID_CHARS,
                "alphanumeric characters, '_' or '-'");
    }

    public static String groupId(String value) {
        return check("group_id", value, MAX_GROUP_ID, ID_CHARS,
                "alphanumeric characters, '_' or '-'");
    }

    public static String scopeItemId(String value) {
        return check("scope_item_id", value, MAX_SESSION_ID, ID_CHARS,
                "alphanumeric characters, '_' or '-'");
    }

    /** Status codes reported by roles, e.g. READY_FOR_QA. */
    public static String statusCode(String value) {
        return check("status_code", value, MAX_SESSION_ID, CODE_CHARS,
                "letters, digits or '_', starting with a letter");
    }

    /** A state scope is either the literal global scope or a group id. */
    public static String scope(String value) {
        if (StateSnapshot.GLOBAL_SCOPE.equals(value)) {
            return value;
        }
        return groupId(value);
    }

    public static String stateType(String value) {
        return check("state_type", value, MAX_TYPE_NAME, TYPE_CHARS,
                "lower-case letters, digits, '_' or '.'");
    }

    public static String dedupKey(String value) {
        return check("dedup_key", value, MAX_DEDUP_KEY, KEY_CHARS,
                "alphanumeric characters, '_', '-', ':' or '.'");
    }

    private static String check(String field, String value, int maxLength,
                                Pattern allowed, String allowedDescription) {
        if (value == null || value.isEmpty()) {
            throw CoordinationException.validation(field + " cannot be empty");
        }
        if (value.length() > maxLength) {
            throw CoordinationException.validation("%s is %d characters (limit: %d)"
                    .formatted(field, value.length(), maxLength));
        }
        if (!allowed.matcher(value).matches()) {
            throw CoordinationException.validation(field + " must contain only " + allowedDescription
                    + ": '" + value + "'");
        }
        return value;
    }
}
