package com.baton.coordinator.event;

import com.baton.coordinator.model.EventType;

import java.util.List;

/**
 * Explicit, approved removal of original scope items. Without one of these
 * the validator gate treats a missing item as silently dropped.
 */
public record ScopeChange(List<String> removedItemIds, String reason, String approvedBy)
        implements EventPayload {

    @Override
    public EventType type() { return EventType.SCOPE_CHANGE; }

    @Override
    public void validate() {
        Payloads.requireNoNulls(removedItemIds, "removed_item_ids");
        Payloads.require(!removedItemIds.isEmpty(), "removed_item_ids cannot be empty");
        Payloads.requireText(reason, "reason");
        Payloads.requireText(approvedBy, "approved_by");
    }
}
