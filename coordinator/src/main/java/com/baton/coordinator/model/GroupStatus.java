package com.baton.coordinator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a task group.
 *
 * Transitions (happy path):
 *   PENDING → IN_PROGRESS → READY_FOR_REVIEW → UNDER_REVIEW → APPROVED
 *
 * A review can also end in APPROVED_WITH_NOTES, CHANGES_REQUIRED (back to the
 * implementer) or ESCALATED (handed to a higher-tier role). APPROVED and
 * REJECTED are terminal.
 */
public enum GroupStatus {
    PENDING,
    IN_PROGRESS,
    READY_FOR_REVIEW,
    UNDER_REVIEW,
    APPROVED,
    APPROVED_WITH_NOTES,
    CHANGES_REQUIRED,
    ESCALATED,
    REJECTED;

    private static final Set<GroupStatus> SIGNED_OFF = EnumSet.of(APPROVED, APPROVED_WITH_NOTES);

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED;
    }

    /** True when the group carries a reviewer sign-off the validator will accept. */
    public boolean isSignedOff() {
        return SIGNED_OFF.contains(this);
    }
}
