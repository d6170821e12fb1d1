package com.baton.coordinator.service;

import com.baton.coordinator.engine.RoutingDecision;
import com.baton.coordinator.ledger.ReviewRecord;
import com.baton.coordinator.model.TaskGroup;
import com.baton.coordinator.progress.ProgressEvaluation;

/**
 * Result of one review pass.
 *
 * @param progress Null when the pass was a repeat or arrived too late to count.
 */
public record ReviewOutcome(
        ReviewRecord       review,
        ProgressEvaluation progress,
        RoutingDecision    decision,
        TaskGroup          group,
        boolean            duplicate) {}
