package com.baton.coordinator.store;

import com.baton.coordinator.model.Event;

/**
 * @param event     The stored row (the earlier one when this append was a repeat).
 * @param duplicate True when the dedup key was already present and nothing was written.
 */
public record AppendResult(Event event, boolean duplicate) {}
