package com.parametric.nodegraph.component;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.parametric.nodegraph.model.ComponentDefinition;
import com.parametric.nodegraph.model.Node;

import lombok.extern.log4j.Log4j2;

/**
 * Library of published {@link ComponentDefinition}s for one editor session.
 *
 * <p>
 * Each definition is written once, when a group is compiled (or a document is
 * imported), and read whenever an instance is expanded. Definitions are
 * immutable values, so readers always get a snapshot that no instance edit
 * can reach back into.
 */
@Log4j2
public final class ComponentRegistry {
    private final Map<String, ComponentDefinition> definitions = new LinkedHashMap<>();

    /**
     * Publishes a definition.
     *
     * @throws IllegalStateException    if a definition with the same id exists.
     * @throws IllegalArgumentException if the definition contains an instance of
     *                                  itself, directly or through other
     *                                  published definitions.
     */
    public void publish(ComponentDefinition definition) {
        publishAll(List.of(definition));
    }

    /**
     * Publishes several definitions that may refer to one another. Either all
     * are published or, on failure, none.
     *
     * @throws IllegalStateException    if an id is already published or repeated.
     * @throws IllegalArgumentException if the definitions would form a cycle.
     */
    public void publishAll(Collection<ComponentDefinition> batch) {
        Map<String, ComponentDefinition> merged = new LinkedHashMap<>(definitions);
        for (ComponentDefinition d : batch) {
            if (merged.putIfAbsent(d.id(), d) != null)
                throw new IllegalStateException("Component already published: " + d.id());
        }
        for (ComponentDefinition d : batch) {
            if (reaches(merged, d, d.id(), new HashSet<>()))
                throw new IllegalArgumentException("Component " + d.id() + " contains an instance of itself");
        }
        for (ComponentDefinition d : batch) {
            definitions.put(d.id(), d);
            log.debug("Published component {} ({} nodes, {} in, {} out)", d.id(),
                    d.internalNodes().size(), d.inputPorts().size(), d.outputPorts().size());
        }
    }

    private static boolean reaches(Map<String, ComponentDefinition> all, ComponentDefinition from, String target,
            Set<String> visited) {
        if (!visited.add(from.id()))
            return false;
        for (Node n : from.internalNodes()) {
            if (!n.isComponentInstance() || n.data().componentId() == null)
                continue;
            String ref = n.data().componentId();
            if (ref.equals(target))
                return true;
            ComponentDefinition next = all.get(ref);
            if (next != null && reaches(all, next, target, visited))
                return true;
        }
        return false;
    }

    public Optional<ComponentDefinition> find(String id) {
        return Optional.ofNullable(definitions.get(id));
    }

    public boolean contains(String id) {
        return definitions.containsKey(id);
    }

    public Collection<ComponentDefinition> definitions() {
        return Collections.unmodifiableCollection(definitions.values());
    }

    public int size() {
        return definitions.size();
    }
}
