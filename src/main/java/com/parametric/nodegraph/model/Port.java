package com.parametric.nodegraph.model;

import java.util.Objects;

/**
 * A socket declared on a node. Its role is given by the list it is declared
 * on, see {@link NodeData#inputs()} and {@link NodeData#outputs()}.
 */
public record Port(String id, String label) {

    public Port {
        Objects.requireNonNull(id, "port id");
    }

    /** Label if present, otherwise {@code fallback}. */
    public String labelOr(String fallback) {
        return label == null || label.isEmpty() ? fallback : label;
    }
}
