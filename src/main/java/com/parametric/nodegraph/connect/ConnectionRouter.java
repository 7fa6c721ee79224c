package com.parametric.nodegraph.connect;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.parametric.nodegraph.api.CanvasViewport;
import com.parametric.nodegraph.history.GraphTransaction;
import com.parametric.nodegraph.history.HistoryManager;
import com.parametric.nodegraph.model.Connection;
import com.parametric.nodegraph.model.Node;
import com.parametric.nodegraph.model.Port;
import com.parametric.nodegraph.model.PortRole;
import com.parametric.nodegraph.model.Position;
import com.parametric.nodegraph.store.GraphIntegrityException;
import com.parametric.nodegraph.store.GraphStore;
import com.parametric.nodegraph.util.IdGenerator;

import lombok.extern.log4j.Log4j2;

/**
 * Creates and removes connections, and owns the connection-drag gesture.
 *
 * <h3>Drag state machine</h3>
 * {@code Idle -> Dragging} on {@link #startConnection}; back to {@code Idle}
 * on {@link #completeConnection}, {@link #cancelConnection} or
 * {@link #releaseOverEmptyCanvas}. Only one drag exists at a time; starting a
 * new one replaces the old. Leaving the drag without completing it never
 * touches the graph.
 *
 * <h3>Completion</h3>
 * Both endpoints are classified by declared port membership. Same-role pairs
 * and exact duplicates are rejected silently. Otherwise the connection is
 * normalized so that its source is the output-role endpoint, whichever end the
 * gesture started from, and committed as one undo step. If the target node
 * has elastic input arity and no free input slot is left, a new slot is
 * appended in the same step.
 */
@Log4j2
public final class ConnectionRouter {
    private final HistoryManager history;
    private final IdGenerator ids;
    private CanvasViewport viewport;
    private DragSession drag;

    public ConnectionRouter(HistoryManager history, IdGenerator ids) {
        this(history, ids, CanvasViewport.IDENTITY);
    }

    public ConnectionRouter(HistoryManager history, IdGenerator ids, CanvasViewport viewport) {
        this.history = history;
        this.ids = ids;
        this.viewport = viewport;
    }

    public void setViewport(CanvasViewport viewport) {
        this.viewport = viewport == null ? CanvasViewport.IDENTITY : viewport;
    }

    // ── Gesture ───────────────────────────────────────────────────

    /**
     * Begins a drag from a port.
     *
     * @param clientPos Pointer position in client space.
     */
    public DragSession startConnection(String nodeId, String portId, Position clientPos) {
        if (drag != null)
            log.debug("Replacing drag from {}.{}", drag.nodeId(), drag.portId());
        drag = new DragSession(nodeId, portId, viewport.toCanvas(clientPos));
        return drag;
    }

    /** Tracks the pointer; ignored when no drag is in progress. */
    public void updateDrag(Position clientPos) {
        if (drag != null)
            drag = drag.withPointer(viewport.toCanvas(clientPos));
    }

    /**
     * Ends the drag on a port, creating the connection if it is valid.
     *
     * @return The new connection, or empty if none was created (no drag, same
     *         roles, unknown port, duplicate).
     */
    public Optional<Connection> completeConnection(String targetNodeId, String targetPort) {
        DragSession session = drag;
        drag = null;
        if (session == null) {
            log.debug("completeConnection({}.{}) without a drag", targetNodeId, targetPort);
            return Optional.empty();
        }
        return connect(session.nodeId(), session.portId(), targetNodeId, targetPort);
    }

    /** Pointer released over empty canvas: the drag is dropped. */
    public void releaseOverEmptyCanvas() {
        cancelConnection();
    }

    public void cancelConnection() {
        if (drag != null)
            log.debug("Drag from {}.{} cancelled", drag.nodeId(), drag.portId());
        drag = null;
    }

    public boolean isDragging() {
        return drag != null;
    }

    public Optional<DragSession> dragSession() {
        return Optional.ofNullable(drag);
    }

    // ── Connections ───────────────────────────────────────────────

    /**
     * Connects two ports directly, with the same validation as a completed
     * drag. Either endpoint may be the output.
     */
    public Optional<Connection> connect(String nodeA, String portA, String nodeB, String portB) {
        if (history.isRestoring()) {
            log.debug("Connection refused while history is restoring");
            return Optional.empty();
        }
        GraphStore store = history.store();
        Optional<PortRole> roleA = store.portRole(nodeA, portA);
        Optional<PortRole> roleB = store.portRole(nodeB, portB);
        if (roleA.isEmpty() || roleB.isEmpty()) {
            log.debug("Unknown port in {}.{} -> {}.{}", nodeA, portA, nodeB, portB);
            return Optional.empty();
        }
        if (roleB.get() != roleA.get().opposite()) {
            log.debug("Rejecting {} -> {} connection {}.{} -> {}.{}", roleA.get(), roleB.get(), nodeA, portA, nodeB,
                    portB);
            return Optional.empty();
        }

        boolean swap = roleA.get() == PortRole.INPUT;
        String sourceNode = swap ? nodeB : nodeA;
        String sourcePort = swap ? portB : portA;
        String targetNode = swap ? nodeA : nodeB;
        String targetPort = swap ? portA : portB;

        Connection.Endpoints endpoints = new Connection.Endpoints(sourceNode, sourcePort, targetNode, targetPort);
        if (store.containsConnection(endpoints)) {
            log.debug("Duplicate connection {}", endpoints);
            return Optional.empty();
        }

        String id = ids.next("conn", candidate -> store.state().connection(candidate).isPresent());
        Connection connection = Connection.of(id, sourceNode, sourcePort, targetNode, targetPort);
        GraphTransaction tx = history.begin();
        try {
            tx.addConnection(connection);
            tx.node(targetNode)
                    .filter(n -> n.type().hasElasticInputs())
                    .filter(n -> !hasFreeInput(tx, n))
                    .ifPresent(n -> tx.replaceNode(withAppendedInput(n)));
            tx.commit();
        } catch (GraphIntegrityException e) {
            log.debug("Connection {} rejected: {}", endpoints, e.getMessage());
            tx.rollback();
            return Optional.empty();
        }
        return Optional.of(connection);
    }

    /** Removes a connection by id; nodes and other connections are untouched. */
    public boolean deleteConnection(String connectionId) {
        if (history.isRestoring())
            return false;
        GraphTransaction tx = history.begin();
        if (!tx.removeConnection(connectionId)) {
            log.debug("No connection {} to delete", connectionId);
            tx.rollback();
            return false;
        }
        return tx.commit();
    }

    private static boolean hasFreeInput(GraphTransaction tx, Node node) {
        for (Port p : node.inputs()) {
            boolean used = false;
            for (Connection c : tx.connections()) {
                if (c.targetNodeId().equals(node.id()) && c.targetPort().equals(p.id())) {
                    used = true;
                    break;
                }
            }
            if (!used)
                return true;
        }
        return false;
    }

    private static Node withAppendedInput(Node node) {
        int n = node.inputs().size() + 1;
        String id = "input-" + n;
        while (node.roleOf(id).isPresent())
            id = "input-" + (++n);
        Port slot = new Port(id, "Input " + n);
        log.debug("Appending input slot {} to {}", id, node.id());
        return node.withData(node.data().withInputsMapped(inputs -> {
            List<Port> next = new ArrayList<>(inputs);
            next.add(slot);
            return next;
        }));
    }
}
