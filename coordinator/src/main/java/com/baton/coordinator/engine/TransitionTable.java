package com.baton.coordinator.engine;

import com.baton.coordinator.model.Role;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable (role, status code) → {@link Transition} lookup.
 *
 * Status codes are matched case-insensitively. A missing entry is an
 * unknown status; the engine decides what to do with it.
 */
public final class TransitionTable {

    private record Key(Role role, String statusCode) {}

    private final Map<Key, Transition> rows;

    private TransitionTable(Map<Key, Transition> rows) {
        this.rows = Map.copyOf(rows);
    }

    public Optional<Transition> lookup(Role role, String statusCode) {
        if (role == null || statusCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rows.get(new Key(role, normalise(statusCode))));
    }

    public int size() {
        return rows.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String normalise(String statusCode) {
        return statusCode.trim().toUpperCase(Locale.ROOT);
    }

    public static final class Builder {

        private final Map<Key, Transition> rows = new HashMap<>();

        public Builder add(Role role, String statusCode, Transition transition) {
            Key key = new Key(role, normalise(statusCode));
            if (rows.putIfAbsent(key, transition) != null) {
                throw new IllegalArgumentException("duplicate transition for " + role.key() + " + " + statusCode);
            }
            return this;
        }

        public TransitionTable build() {
            return new TransitionTable(rows);
        }
    }
}
