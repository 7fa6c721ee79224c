package com.parametric.nodegraph;

import java.io.IOException;

import com.parametric.nodegraph.config.EditorConfig;
import com.parametric.nodegraph.util.IdGenerator;

/**
 * Node-graph editor core.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Nodes</b> are typed vertices with declared input and output ports.</li>
 * <li><b>Connections</b> are directed edges from an output port to an input
 * port; no two connections share the same endpoints.</li>
 * <li><b>Groups</b> are nodes listing member node ids. A group can be
 * compiled into an opaque <b>component</b> instance and expanded back.</li>
 * </ul>
 *
 * <p>
 * Every edit is recorded by the session's
 * {@link com.parametric.nodegraph.history.HistoryManager} for undo/redo.
 * All calls are expected on a single editing thread.
 */
public final class NodeGraph {

    private NodeGraph() {
        // Prevent instantiation of utility class
    }

    /** A new editing session with the given tunables. */
    public static GraphEditor editor(EditorConfig config) {
        return new GraphEditor(config);
    }

    /** A session with a custom id source, e.g. for deterministic ids in tests. */
    public static GraphEditor editor(EditorConfig config, IdGenerator ids) {
        return new GraphEditor(config, ids);
    }

    /**
     * A session configured from the {@value EditorConfig#RESOURCE} classpath
     * resource, or defaults if it is absent.
     */
    public static GraphEditor editor() throws IOException {
        return editor(EditorConfig.load());
    }
}
