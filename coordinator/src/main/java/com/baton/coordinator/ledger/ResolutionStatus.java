package com.baton.coordinator.ledger;

import com.baton.coordinator.event.ResponseStatus;

public enum ResolutionStatus {
    OPEN,
    FIXED,
    REJECTED,
    DEFERRED,
    REJECTED_AND_ACCEPTED;

    static ResolutionStatus of(ResponseStatus response) {
        return switch (response) {
            case FIXED                 -> FIXED;
            case REJECTED              -> REJECTED;
            case DEFERRED              -> DEFERRED;
            case REJECTED_AND_ACCEPTED -> REJECTED_AND_ACCEPTED;
        };
    }

    public boolean resolved() {
        return this == FIXED || this == REJECTED_AND_ACCEPTED;
    }
}
