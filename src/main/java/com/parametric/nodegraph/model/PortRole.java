package com.parametric.nodegraph.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Role of a port. Fixed when the port is declared.
 */
public enum PortRole {
    INPUT,
    OUTPUT;

    public PortRole opposite() {
        return this == INPUT ? OUTPUT : INPUT;
    }

    /**
     * Legacy naming convention used by old documents whose nodes are no longer
     * present: ids containing "input" are inputs, ids containing "output" are
     * outputs. Only consulted when declared membership cannot be checked.
     */
    public static Optional<PortRole> inferFromLegacyId(String portId) {
        if (portId == null)
            return Optional.empty();
        String id = portId.toLowerCase(Locale.ROOT);
        if (id.contains("input"))
            return Optional.of(INPUT);
        if (id.contains("output"))
            return Optional.of(OUTPUT);
        return Optional.empty();
    }
}
