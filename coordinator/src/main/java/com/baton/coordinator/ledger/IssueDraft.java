package com.baton.coordinator.ledger;

import com.baton.coordinator.event.Severity;

/**
 * An issue as submitted by a reviewer, before the ledger assigns its id.
 */
public record IssueDraft(
        String   title,
        String   description,
        Severity severity,
        boolean  blocking,
        String   location) {}
