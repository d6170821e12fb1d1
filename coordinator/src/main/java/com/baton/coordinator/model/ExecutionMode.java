package com.baton.coordinator.model;

/** Whether the manager runs task groups one at a time or several in parallel. */
public enum ExecutionMode {
    SINGLE_TRACK,
    MULTI_TRACK
}
