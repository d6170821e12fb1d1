package com.baton.coordinator.model;

/**
 * Discriminator stored beside every event payload.
 *
 * Each constant has exactly one payload record in the
 * {@code com.baton.coordinator.event} package.
 */
public enum EventType {
    ISSUES_RAISED,        // Full issue list of one review pass
    ISSUE_RESPONSES,      // Implementer answers to the issues of one iteration
    REVIEW_VERDICTS,      // Reviewer accepts or overrules rejected issues
    TRANSITION,           // Routing decision taken for a status report
    NO_PROGRESS,          // Synthetic: a role missed its deadline
    SCOPE_CHANGE,         // Approved removal of original scope items
    ROLE_VIOLATION,       // A role reported without its mandatory capabilities
    COMPLETION_DECLARED,  // Manager says the session is done
    VALIDATOR_VERDICT,    // Outcome of the validator gate
    AUDIT                 // Free-form audit entry
}
