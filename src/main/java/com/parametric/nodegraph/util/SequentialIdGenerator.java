package com.parametric.nodegraph.util;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Generates {@code prefix-N} ids from one counter per prefix, skipping ids
 * that are already taken.
 */
public final class SequentialIdGenerator implements IdGenerator {
    private final Map<String, Long> counters = new HashMap<>();

    @Override
    public String next(String prefix, Predicate<String> taken) {
        long n = counters.getOrDefault(prefix, 0L);
        String id;
        do {
            id = prefix + "-" + (++n);
        } while (taken.test(id));
        counters.put(prefix, n);
        return id;
    }
}
