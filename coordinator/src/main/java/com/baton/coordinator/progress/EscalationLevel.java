package com.baton.coordinator.progress;

/**
 * Outcome of comparing a group's counters against the session limits.
 *
 *   NONE     - keep going
 *   WARNING  - one more pass without progress escalates
 *   ESCALATE - hand the group to the next-tier role
 *   HARD_CAP - total iterations exhausted, stop the group whatever its tier
 */
public enum EscalationLevel {
    NONE,
    WARNING,
    ESCALATE,
    HARD_CAP
}
