package com.baton.coordinator.event;

import java.util.Locale;

/**
 * One issue raised by a review pass.
 *
 * @param id          {@code {group}-{iteration}-{sequence}}, assigned by the issue ledger.
 * @param title       Short statement of the problem.
 * @param description Optional detail.
 * @param severity    How bad it is.
 * @param blocking    True when the group cannot be approved while this is open.
 * @param location    File, symbol or area the issue points at (optional).
 */
public record Issue(
        String   id,
        String   title,
        String   description,
        Severity severity,
        boolean  blocking,
        String   location) {

    void validate() {
        Payloads.requireText(id, "issue.id");
        Payloads.requireText(title, "issue.title");
        Payloads.require(severity != null, "issue.severity is required for " + id);
    }

    /**
     * Identity of the issue across iterations: normalised title plus location.
     * Ids change every iteration, fingerprints do not.
     */
    public String fingerprint() {
        return fingerprintOf(title, location);
    }

    public static String fingerprintOf(String title, String location) {
        return normalise(title) + "|" + normalise(location);
    }

    private static String normalise(String s) {
        return s == null ? "" : s.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
