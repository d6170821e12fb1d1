package com.baton.coordinator.progress;

/**
 * @param iteration  The iteration that was evaluated.
 * @param progressed True when remaining blocking issues went down (or there was no baseline yet).
 * @param streak     No-progress streak after this pass.
 * @param level      What the streak means against the session limits.
 */
public record ProgressEvaluation(int iteration, boolean progressed, int streak, EscalationLevel level) {}
