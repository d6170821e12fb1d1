package com.baton.coordinator.api.dto;

import com.baton.coordinator.service.VerdictOutcome;

import java.util.List;

public record VerdictResponse(List<String> accepted, TaskGroupResponse group, TransitionResponse transition) {

    public static VerdictResponse from(VerdictOutcome o) {
        return new VerdictResponse(
                o.accepted(),
                TaskGroupResponse.from(o.group()),
                o.decision() == null ? null
                        : TransitionResponse.of(o.group().getGroupId(), o.group().getStatus(), o.decision(), false)
        );
    }
}
