package com.parametric.nodegraph.util;

import java.util.function.Predicate;

/**
 * Source of fresh element ids.
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * Returns an id starting with {@code prefix} for which {@code taken}
     * answers false.
     */
    String next(String prefix, Predicate<String> taken);

    default String next(String prefix) {
        return next(prefix, id -> false);
    }
}
