package com.baton.coordinator.engine;

/**
 * What the caller does with the next role.
 *
 *   RESPAWN   - start the same kind of role again on the group (another pass)
 *   ROUTE     - hand the group to a different role
 *   TERMINATE - stop driving the group; the manager takes it from here
 */
public enum TransitionAction {
    RESPAWN,
    ROUTE,
    TERMINATE
}
