package com.parametric.nodegraph.history;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.parametric.nodegraph.api.ChangeSource;
import com.parametric.nodegraph.api.GraphListener;
import com.parametric.nodegraph.model.Connection;
import com.parametric.nodegraph.model.Node;
import com.parametric.nodegraph.model.PortRole;
import com.parametric.nodegraph.store.GraphIntegrityException;
import com.parametric.nodegraph.store.GraphState;
import com.parametric.nodegraph.store.GraphStore;
import com.parametric.nodegraph.util.CompositeGraphListener;

import lombok.extern.log4j.Log4j2;

/**
 * Undo/redo transaction log over the {@link GraphStore}.
 *
 * <h3>Recording</h3>
 * Every committed change pushes the pre-change state onto a bounded undo
 * stack (oldest entries are evicted) and clears the redo stack. A commit that
 * yields an identical state records nothing.
 *
 * <h3>Batching</h3>
 * Between {@link #startAction()} and the matching {@link #endAction()} commits
 * are applied but not recorded individually; on the outermost
 * {@code endAction()} the state from before the action becomes a single undo
 * step, if anything changed. Actions nest.
 *
 * <h3>Restoring</h3>
 * While undo or redo swap the state in, {@link #isRestoring()} is true and any
 * attempt to edit or raw-write the graph is refused, so an observer that
 * mirrors the graph elsewhere cannot feed the restored state back in.
 *
 * <h3>Raw writes</h3>
 * {@link #writeRaw(UnaryOperator)} replaces the state without recording it.
 * It exists for synchronization collaborators only.
 *
 * <p>
 * Not thread-safe: all calls are expected on the single editing thread.
 */
@Log4j2
public final class HistoryManager {
    public static final int DEFAULT_MAX_SIZE = 500;

    private final GraphStore store;
    private final int maxSize;
    private final Deque<GraphState> undoStack = new ArrayDeque<>();
    private final Deque<GraphState> redoStack = new ArrayDeque<>();
    private final CompositeGraphListener listeners = new CompositeGraphListener();

    private int actionDepth;
    private GraphState actionBase;
    private boolean restoring;

    public HistoryManager(GraphStore store) {
        this(store, DEFAULT_MAX_SIZE);
    }

    public HistoryManager(GraphStore store, int maxSize) {
        if (maxSize < 1)
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        this.store = store;
        this.maxSize = maxSize;
    }

    public GraphStore store() {
        return store;
    }

    public GraphState state() {
        return store.state();
    }

    public void addListener(GraphListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(GraphListener listener) {
        return listeners.remove(listener);
    }

    // ── Transactions ──────────────────────────────────────────────

    /** Opens a transaction against the current state. */
    public GraphTransaction begin() {
        return new GraphTransaction(this, store.state());
    }

    boolean commit(GraphTransaction tx) {
        if (tx.base() != store.state())
            throw new IllegalStateException("Stale transaction: graph changed since it was opened");
        return record(tx.snapshot());
    }

    /**
     * History-aware replacement of the node list. Connections touching a node
     * that is no longer present are dropped in the same step.
     *
     * @throws GraphIntegrityException if the result breaks id uniqueness or a
     *                                 kept connection ends on an undeclared
     *                                 port.
     */
    public boolean setNodes(UnaryOperator<List<Node>> updater) {
        GraphState current = store.state();
        List<Node> nodes = updater.apply(current.nodes());
        Set<String> ids = new HashSet<>(nodes.size() * 2);
        for (Node n : nodes)
            ids.add(n.id());
        List<Connection> kept = current.connections().stream()
                .filter(c -> ids.contains(c.sourceNodeId()) && ids.contains(c.targetNodeId()))
                .toList();
        if (kept.size() < current.connections().size())
            log.debug("Dropping {} connections on removed nodes", current.connections().size() - kept.size());
        return record(new GraphState(nodes, kept));
    }

    /**
     * History-aware replacement of the connection list. A connection that is
     * new or changed must run from a declared output to a declared input.
     *
     * @throws GraphIntegrityException if a new or changed connection breaks
     *                                 the role rule, or the result breaks
     *                                 uniqueness.
     */
    public boolean setConnections(UnaryOperator<List<Connection>> updater) {
        GraphState current = store.state();
        List<Connection> connections = updater.apply(current.connections());
        Set<Connection> unchanged = new HashSet<>(current.connections());
        for (Connection c : connections) {
            if (unchanged.contains(c))
                continue;
            checkRole(current, c, c.sourceNodeId(), c.sourcePort(), PortRole.OUTPUT);
            checkRole(current, c, c.targetNodeId(), c.targetPort(), PortRole.INPUT);
        }
        return record(new GraphState(current.nodes(), connections));
    }

    private static void checkRole(GraphState state, Connection c, String nodeId, String portId, PortRole role) {
        Node node = state.node(nodeId).orElseThrow(() -> new GraphIntegrityException(
                "Connection " + c.id() + " references missing node " + nodeId));
        if (!node.hasPort(portId, role))
            throw new GraphIntegrityException("Connection " + c.id() + " references " + nodeId + "." + portId
                    + ", which is not a declared " + role.name().toLowerCase(Locale.ROOT) + " port");
    }

    private boolean record(GraphState next) {
        if (restoring) {
            log.warn("Edit refused while history is restoring");
            return false;
        }
        GraphState current = store.state();
        if (current.equals(next))
            return false;
        store.replace(next);
        if (actionDepth == 0)
            pushBounded(undoStack, current);
        redoStack.clear();
        listeners.onGraphChanged(next, ChangeSource.EDIT);
        return true;
    }

    // ── Batched actions ───────────────────────────────────────────

    /** Starts a batched action; nested calls extend the outermost one. */
    public void startAction() {
        if (actionDepth++ == 0)
            actionBase = store.state();
    }

    /** Ends a batched action, recording one undo step if the graph changed. */
    public void endAction() {
        if (actionDepth == 0) {
            log.debug("endAction() without matching startAction()");
            return;
        }
        if (--actionDepth > 0)
            return;
        GraphState base = actionBase;
        actionBase = null;
        if (!base.equals(store.state()))
            pushBounded(undoStack, base);
    }

    public boolean isActionInProgress() {
        return actionDepth > 0;
    }

    // ── Undo / redo ───────────────────────────────────────────────

    /**
     * Restores the state before the last recorded step.
     *
     * @return false if there was nothing to undo or undo is not possible right
     *         now (restoring, or inside a batched action).
     */
    public boolean undo() {
        if (!canRestore("undo"))
            return false;
        if (undoStack.isEmpty()) {
            log.debug("Nothing to undo");
            return false;
        }
        GraphState target = undoStack.removeLast();
        redoStack.addLast(store.state());
        restore(target, ChangeSource.UNDO);
        return true;
    }

    /**
     * Re-applies the last undone step.
     *
     * @return false if there was nothing to redo.
     */
    public boolean redo() {
        if (!canRestore("redo"))
            return false;
        if (redoStack.isEmpty()) {
            log.debug("Nothing to redo");
            return false;
        }
        GraphState target = redoStack.removeLast();
        pushBounded(undoStack, store.state());
        restore(target, ChangeSource.REDO);
        return true;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int undoDepth() {
        return undoStack.size();
    }

    public int redoDepth() {
        return redoStack.size();
    }

    public boolean isRestoring() {
        return restoring;
    }

    private boolean canRestore(String op) {
        if (restoring) {
            log.debug("Ignoring {} while restoring", op);
            return false;
        }
        if (actionDepth > 0) {
            log.warn("Ignoring {} while a batched action is in progress", op);
            return false;
        }
        return true;
    }

    private void restore(GraphState target, ChangeSource source) {
        restoring = true;
        try {
            store.replace(target);
            listeners.onGraphChanged(target, source);
        } finally {
            restoring = false;
        }
    }

    // ── Non-recorded writes ───────────────────────────────────────

    /**
     * Replaces the state without recording an undo step. For mirroring
     * external state only.
     *
     * @return false if refused because history is restoring, or nothing changed.
     */
    public boolean writeRaw(UnaryOperator<GraphState> updater) {
        if (restoring) {
            log.debug("Raw write suppressed while restoring");
            return false;
        }
        GraphState current = store.state();
        GraphState next = updater.apply(current);
        if (current.equals(next))
            return false;
        store.replace(next);
        listeners.onGraphChanged(next, ChangeSource.SYNC);
        return true;
    }

    /** Replaces the state and forgets all history. */
    public void reset(GraphState state) {
        if (restoring)
            throw new IllegalStateException("Cannot reset history while restoring");
        store.replace(state);
        undoStack.clear();
        redoStack.clear();
        actionDepth = 0;
        actionBase = null;
        listeners.onGraphChanged(state, ChangeSource.LOAD);
    }

    private void pushBounded(Deque<GraphState> stack, GraphState state) {
        stack.addLast(state);
        while (stack.size() > maxSize)
            stack.removeFirst();
    }
}
