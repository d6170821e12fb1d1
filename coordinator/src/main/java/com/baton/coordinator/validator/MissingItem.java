package com.baton.coordinator.validator;

/**
 * One reason the validator refused a completion claim.
 *
 * @param category  Which check failed.
 * @param reference Scope item id, issue id or group id the item is about.
 * @param detail    Human-readable explanation.
 */
public record MissingItem(Category category, String reference, String detail) {

    public enum Category {
        SCOPE_ITEM,
        UNRESOLVED_BLOCKING_ISSUE,
        MISSING_SIGN_OFF
    }
}
