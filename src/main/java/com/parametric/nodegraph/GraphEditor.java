package com.parametric.nodegraph;

import java.util.ArrayList;
import java.util.List;

import com.parametric.nodegraph.component.ComponentCompiler;
import com.parametric.nodegraph.component.ComponentExpander;
import com.parametric.nodegraph.component.ComponentRegistry;
import com.parametric.nodegraph.config.EditorConfig;
import com.parametric.nodegraph.connect.ConnectionRouter;
import com.parametric.nodegraph.edit.GroupOperations;
import com.parametric.nodegraph.edit.NodeOperations;
import com.parametric.nodegraph.history.HistoryManager;
import com.parametric.nodegraph.io.GraphDocument;
import com.parametric.nodegraph.model.ComponentDefinition;
import com.parametric.nodegraph.store.GraphState;
import com.parametric.nodegraph.store.GraphStore;
import com.parametric.nodegraph.util.IdGenerator;
import com.parametric.nodegraph.util.NodeBounds;
import com.parametric.nodegraph.util.SequentialIdGenerator;

import lombok.extern.log4j.Log4j2;

/**
 * One editing session: the graph, its history, the component library and the
 * operations that act on them.
 *
 * <p>
 * Hosts (renderers, gesture handlers, persistence) hold a {@code GraphEditor}
 * and reach every mutating operation through it, so that all writes pass
 * through the {@link HistoryManager}.
 */
@Log4j2
public final class GraphEditor {
    private final EditorConfig config;
    private final GraphStore store;
    private final HistoryManager history;
    private final ComponentRegistry registry;
    private final ConnectionRouter router;
    private final ComponentCompiler compiler;
    private final ComponentExpander expander;
    private final NodeOperations nodes;
    private final GroupOperations groups;

    GraphEditor(EditorConfig config, IdGenerator ids) {
        this.config = config;
        this.store = new GraphStore();
        this.history = new HistoryManager(store, config.getMaxHistorySize());
        this.registry = new ComponentRegistry();
        NodeBounds bounds = new NodeBounds(config);
        this.router = new ConnectionRouter(history, ids);
        this.compiler = new ComponentCompiler(history, registry, ids);
        this.expander = new ComponentExpander(history, registry, ids, bounds);
        this.groups = new GroupOperations(history, ids, bounds);
        this.nodes = new NodeOperations(history, ids, groups, config);
    }

    GraphEditor(EditorConfig config) {
        this(config, new SequentialIdGenerator());
    }

    public EditorConfig config() {
        return config;
    }

    public GraphStore store() {
        return store;
    }

    public HistoryManager history() {
        return history;
    }

    public ComponentRegistry registry() {
        return registry;
    }

    public ConnectionRouter connections() {
        return router;
    }

    public ComponentCompiler compiler() {
        return compiler;
    }

    public ComponentExpander expander() {
        return expander;
    }

    public NodeOperations nodes() {
        return nodes;
    }

    public GroupOperations groups() {
        return groups;
    }

    /** Snapshot of the session for a persistence collaborator. */
    public GraphDocument exportDocument() {
        GraphState state = store.state();
        return new GraphDocument(state.nodes(), state.connections(), new ArrayList<>(registry.definitions()));
    }

    /**
     * Replaces the session's graph with a loaded document. The load is not
     * undoable and clears undo/redo. Component definitions are published;
     * one already present with identical content is kept as is.
     *
     * @throws IllegalStateException    if a definition conflicts with a
     *                                  different published definition of the
     *                                  same id, the graph breaks id or
     *                                  connection uniqueness, or a connection
     *                                  ends on a missing node or undeclared
     *                                  port.
     * @throws IllegalArgumentException if the definitions contain themselves.
     *                                  The session is unchanged on any failure.
     */
    public void importDocument(GraphDocument document) {
        List<ComponentDefinition> fresh = new ArrayList<>();
        for (ComponentDefinition d : nullToEmpty(document.getComponents())) {
            var existing = registry.find(d.id());
            if (existing.isEmpty())
                fresh.add(d);
            else if (!existing.get().equals(d))
                throw new IllegalStateException("Component " + d.id() + " conflicts with a published definition");
        }
        GraphState state = new GraphState(nullToEmpty(document.getNodes()), nullToEmpty(document.getConnections()));
        state.checkIntegrity();
        registry.publishAll(fresh);
        history.reset(state);
        log.info("Imported {} nodes, {} connections, {} new components", state.nodes().size(),
                state.connections().size(), fresh.size());
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
