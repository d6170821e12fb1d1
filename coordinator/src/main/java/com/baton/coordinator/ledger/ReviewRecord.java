package com.baton.coordinator.ledger;

import com.baton.coordinator.event.Issue;

import java.util.List;

/**
 * What a review pass left in the ledger.
 *
 * @param iteration      The review iteration this pass was recorded as.
 * @param issues         Issues stored for the iteration, with their ids.
 * @param dropped        Non-blocking issues refused because they were new on a re-review.
 * @param autoAccepted   Ids of blocking issues closed by the re-rejection guard.
 * @param blockingCount  Blocking issues still unresolved after this pass.
 * @param nonBlockingCount Non-blocking issues stored for this pass.
 * @param duplicate      The pass had already been recorded; nothing new was written.
 */
public record ReviewRecord(
        int               iteration,
        List<Issue>       issues,
        List<IssueDraft>  dropped,
        List<String>      autoAccepted,
        int               blockingCount,
        int               nonBlockingCount,
        boolean           duplicate) {}
