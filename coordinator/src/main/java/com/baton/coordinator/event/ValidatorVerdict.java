package com.baton.coordinator.event;

import com.baton.coordinator.model.EventType;
import com.baton.coordinator.validator.MissingItem;

import java.util.List;

public record ValidatorVerdict(boolean accepted, List<MissingItem> missing) implements EventPayload {

    @Override
    public EventType type() { return EventType.VALIDATOR_VERDICT; }

    @Override
    public void validate() {
        Payloads.requireNoNulls(missing, "missing");
        Payloads.require(accepted == missing.isEmpty(), "a verdict is accepted exactly when nothing is missing");
    }
}
