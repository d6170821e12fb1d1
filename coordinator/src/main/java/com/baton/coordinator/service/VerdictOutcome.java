package com.baton.coordinator.service;

import com.baton.coordinator.engine.RoutingDecision;
import com.baton.coordinator.model.TaskGroup;

import java.util.List;

/**
 * @param accepted Issue ids whose rejection the reviewer accepted.
 * @param decision Set only when the verdicts cleared the last blocking issue and the group was signed off.
 */
public record VerdictOutcome(List<String> accepted, TaskGroup group, RoutingDecision decision) {}
