package com.parametric.nodegraph.store;

/**
 * Thrown when a write would break a structural invariant of the graph:
 * node-id uniqueness, connection uniqueness, or endpoint existence.
 */
public class GraphIntegrityException extends IllegalStateException {

    public GraphIntegrityException(String message) {
        super(message);
    }
}
