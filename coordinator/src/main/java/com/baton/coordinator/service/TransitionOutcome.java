package com.baton.coordinator.service;

import com.baton.coordinator.engine.RoutingDecision;
import com.baton.coordinator.model.TaskGroup;

/**
 * @param decision  Where the group goes next.
 * @param group     The group after the decision was applied.
 * @param duplicate The report had already been applied; the stored decision is returned.
 */
public record TransitionOutcome(RoutingDecision decision, TaskGroup group, boolean duplicate) {}
