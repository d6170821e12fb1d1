package com.baton.coordinator.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The task-executor roles that hand work to each other.
 *
 * Roles are ordered in tiers. A stalled group is escalated to the next tier:
 * the three first-tier roles escalate to the lead reviewer, the lead reviewer
 * escalates to the manager, and the manager has nobody above it.
 */
public enum Role {
    IMPLEMENTER(1),       // Writes the change for a task group
    QUALITY_CHECKER(1),   // Runs tests and static checks
    REVIEWER(1),          // Raises issues, signs off
    LEAD_REVIEWER(2),     // Unblocks, arbitrates, takes escalations
    MANAGER(3);           // Plans groups, declares completion

    private final int tier;

    Role(int tier) {
        this.tier = tier;
    }

    public int tier() {
        return tier;
    }

    /** Lower-case key used in the transition table resource and on the wire. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** The role one tier up, or empty for the manager. */
    public Optional<Role> escalationTarget() {
        return switch (this) {
            case IMPLEMENTER, QUALITY_CHECKER, REVIEWER -> Optional.of(LEAD_REVIEWER);
            case LEAD_REVIEWER -> Optional.of(MANAGER);
            case MANAGER -> Optional.empty();
        };
    }

    /** True for the roles allowed to submit a review pass. */
    public boolean reviews() {
        return this == REVIEWER || this == LEAD_REVIEWER;
    }

    public static Optional<Role> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(r -> r.name().equals(normalized)).findFirst();
    }
}
