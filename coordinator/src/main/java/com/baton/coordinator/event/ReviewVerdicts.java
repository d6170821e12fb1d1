package com.baton.coordinator.event;

import com.baton.coordinator.model.EventType;

import java.util.List;

public record ReviewVerdicts(int iteration, List<RejectionVerdict> verdicts) implements EventPayload {


    @Override
    public EventType type() { return EventType.REVIEW_VERDICTS; }

    @Override
    public void validate() {
        Payloads.require(iteration >= 1, "iteration must be >= 1, was " + iteration);
        Payloads.requireNoNulls(verdicts, "verdicts");
        verdicts.forEach(RejectionVerdict::validate);
    }
}
