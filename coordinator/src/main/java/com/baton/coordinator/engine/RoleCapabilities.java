package com.baton.coordinator.engine;

import java.util.List;
import java.util.Set;

/**
 * Capabilities a role must (or may) show in its status report.
 */
public record RoleCapabilities(Set<String> mandatory, Set<String> optional) {

    public static final RoleCapabilities NONE = new RoleCapabilities(Set.of(), Set.of());

    public RoleCapabilities {
        mandatory = mandatory == null ? Set.of() : Set.copyOf(mandatory);
        optional  = optional == null ? Set.of() : Set.copyOf(optional);
    }

    /** Mandatory capabilities absent from {@code reported}, sorted. */
    public List<String> missingFrom(Set<String> reported) {
        Set<String> present = reported == null ? Set.of() : reported;
        return mandatory.stream().filter(c -> !present.contains(c)).sorted().toList();
    }
}
