package com.parametric.nodegraph.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep-freezing of the loosely typed values carried in node properties.
 *
 * <p>
 * Property values arrive from JSON as nested {@link Map}s and {@link List}s.
 * Freezing copies every level into an unmodifiable container so a node value,
 * once built, cannot be changed through a reference held elsewhere. Scalars
 * (strings, numbers, booleans) are already immutable and pass through.
 */
public final class Immutables {
    private Immutables() {
        // Utility class
    }

    /** Unmodifiable deep copy of a property map, insertion order kept. Null values are allowed. */
    public static Map<String, Object> freezeMap(Map<String, ?> source) {
        if (source == null || source.isEmpty())
            return Collections.emptyMap();
        Map<String, Object> copy = new LinkedHashMap<>(source.size() * 2);
        for (Map.Entry<String, ?> e : source.entrySet())
            copy.put(e.getKey(), freeze(e.getValue()));
        return Collections.unmodifiableMap(copy);
    }

    /** Unmodifiable deep copy of a property list. */
    public static List<Object> freezeList(List<?> source) {
        if (source == null || source.isEmpty())
            return Collections.emptyList();
        List<Object> copy = new ArrayList<>(source.size());
        for (Object o : source)
            copy.add(freeze(o));
        return Collections.unmodifiableList(copy);
    }

    @SuppressWarnings("unchecked")
    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> m)
            return freezeMap((Map<String, ?>) m);
        if (value instanceof List<?> l)
            return freezeList(l);
        return value;
    }
}
