package com.baton.coordinator.validator;

import com.baton.coordinator.model.Role;

import java.util.List;

/**
 * Outcome of a completion check.
 *
 * @param verdict ACCEPT closes the session, REJECT sends it back.
 * @param missing Itemised reasons, in check order; empty exactly when accepted.
 * @param routeTo Role that receives the session next (manager on reject, null on accept).
 */
public record ValidationReport(Verdict verdict, List<MissingItem> missing, Role routeTo) {

    public enum Verdict { ACCEPT, REJECT }

    public ValidationReport {
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public static ValidationReport accept() {
        return new ValidationReport(Verdict.ACCEPT, List.of(), null);
    }

    public static ValidationReport reject(List<MissingItem> missing) {
        return new ValidationReport(Verdict.REJECT, missing, Role.MANAGER);
    }

    public boolean accepted() {
        return verdict == Verdict.ACCEPT;
    }
}
