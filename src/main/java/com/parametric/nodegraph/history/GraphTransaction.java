package com.parametric.nodegraph.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import com.parametric.nodegraph.model.Connection;
import com.parametric.nodegraph.model.Node;
import com.parametric.nodegraph.model.PortRole;
import com.parametric.nodegraph.store.GraphIntegrityException;
import com.parametric.nodegraph.store.GraphState;

/**
 * A pending edit over nodes and connections together.
 *
 * <p>
 * Obtained from {@link HistoryManager#begin()}. The transaction works on a
 * private copy of the state it was opened against; nothing is visible to the
 * store until {@link #commit()}, which records exactly one undo step (or joins
 * the open batched action). {@link #rollback()} discards the copy.
 *
 * <p>
 * Node-id and connection uniqueness are enforced as each element is added.
 * Endpoints of connections created or rewired in this transaction are
 * checked at commit, against the final node set, with the
 * {@link EndpointCheck} chosen when the connection was written.
 */
public final class GraphTransaction {

    /** How strictly a written connection's endpoints are checked at commit. */
    public enum EndpointCheck {
        /** Source must be a declared output, target a declared input. */
        ROLE,
        /**
         * Each endpoint port must be declared on its node, in either list. Used
         * when structure is moved rather than created, so that wiring carried
         * over from existing data is preserved as it was.
         */
        DECLARED
    }

    private final HistoryManager history;
    private final GraphState base;
    private final List<Node> nodes;
    private final List<Connection> connections;
    private final Set<String> nodeIds = new HashSet<>();
    private final Map<String, Connection> created = new LinkedHashMap<>();
    private final Map<String, EndpointCheck> createdChecks = new HashMap<>();
    private final Map<String, Connection> rewiredFrom = new LinkedHashMap<>();
    private boolean open = true;

    GraphTransaction(HistoryManager history, GraphState base) {
        this.history = history;
        this.base = base;
        this.nodes = new ArrayList<>(base.nodes());
        this.connections = new ArrayList<>(base.connections());
        for (Node n : nodes)
            nodeIds.add(n.id());
    }

    /** The state this transaction was opened against. */
    public GraphState base() {
        return base;
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Connection> connections() {
        return Collections.unmodifiableList(connections);
    }

    public boolean containsNode(String id) {
        return nodeIds.contains(id);
    }

    public Optional<Node> node(String id) {
        int i = indexOfNode(id);
        return i < 0 ? Optional.empty() : Optional.of(nodes.get(i));
    }

    public boolean containsConnection(Connection.Endpoints endpoints) {
        for (Connection c : connections)
            if (c.endpoints().equals(endpoints))
                return true;
        return false;
    }

    /** Appends a node. */
    public void addNode(Node node) {
        ensureOpen();
        claimNodeId(node.id());
        nodes.add(node);
    }

    /** Inserts a node at the front of the node order (drawn behind the others). */
    public void addNodeFirst(Node node) {
        ensureOpen();
        claimNodeId(node.id());
        nodes.add(0, node);
    }

    /** Replaces the node with the same id, keeping its position in the order. */
    public boolean replaceNode(Node node) {
        ensureOpen();
        int i = indexOfNode(node.id());
        if (i < 0)
            return false;
        nodes.set(i, node);
        return true;
    }

    public boolean updateNode(String id, UnaryOperator<Node> fn) {
        ensureOpen();
        int i = indexOfNode(id);
        if (i < 0)
            return false;
        Node updated = fn.apply(nodes.get(i));
        if (!updated.id().equals(id))
            throw new IllegalArgumentException("Node update must keep id " + id + ", got " + updated.id());
        nodes.set(i, updated);
        return true;
    }

    /** Applies {@code fn} to every node; ids must be preserved. */
    public void updateNodes(UnaryOperator<Node> fn) {
        ensureOpen();
        for (int i = 0; i < nodes.size(); i++) {
            Node before = nodes.get(i);
            Node after = fn.apply(before);
            if (!after.id().equals(before.id()))
                throw new IllegalArgumentException("Node update must keep id " + before.id());
            nodes.set(i, after);
        }
    }

    /** Removes a node. Connections touching it are left alone. */
    public Optional<Node> removeNode(String id) {
        ensureOpen();
        int i = indexOfNode(id);
        if (i < 0)
            return Optional.empty();
        nodeIds.remove(id);
        return Optional.of(nodes.remove(i));
    }

    /**
     * Adds a new connection whose endpoints are role-checked at commit.
     *
     * @throws GraphIntegrityException if the id or the endpoint tuple is
     *                                 already present.
     */
    public void addConnection(Connection connection) {
        addConnection(connection, EndpointCheck.ROLE);
    }

    public void addConnection(Connection connection, EndpointCheck check) {
        ensureOpen();
        for (Connection c : connections) {
            if (c.id().equals(connection.id()))
                throw new GraphIntegrityException("Duplicate connection id: " + connection.id());
            if (c.endpoints().equals(connection.endpoints()))
                throw new GraphIntegrityException("Duplicate connection: " + connection.endpoints());
        }
        connections.add(connection);
        created.put(connection.id(), connection);
        createdChecks.put(connection.id(), check);
    }

    /**
     * Replaces an existing connection, matched by id, with new endpoints.
     * Only the endpoints that changed are checked at commit, with
     * {@link EndpointCheck#DECLARED}.
     */
    public void rewire(Connection replacement) {
        ensureOpen();
        int index = -1;
        for (int i = 0; i < connections.size(); i++) {
            Connection c = connections.get(i);
            if (c.id().equals(replacement.id()))
                index = i;
            else if (c.endpoints().equals(replacement.endpoints()))
                throw new GraphIntegrityException("Duplicate connection: " + replacement.endpoints());
        }
        if (index < 0)
            throw new IllegalArgumentException("No connection with id " + replacement.id());
        Connection previous = connections.set(index, replacement);
        if (created.containsKey(replacement.id()))
            created.put(replacement.id(), replacement);
        else
            rewiredFrom.putIfAbsent(replacement.id(), previous);
    }

    public boolean removeConnection(String id) {
        return !removeConnectionsIf(c -> c.id().equals(id)).isEmpty();
    }

    public List<Connection> removeConnectionsIf(Predicate<Connection> filter) {
        ensureOpen();
        List<Connection> removed = new ArrayList<>();
        connections.removeIf(c -> {
            if (filter.test(c)) {
                removed.add(c);
                return true;
            }
            return false;
        });
        for (Connection c : removed) {
            created.remove(c.id());
            createdChecks.remove(c.id());
            rewiredFrom.remove(c.id());
        }
        return removed;
    }

    /** The state this transaction would commit. */
    public GraphState snapshot() {
        return new GraphState(nodes, connections);
    }

    /**
     * Publishes the edit through the history manager.
     *
     * @return true if the graph changed; false for an identical state.
     * @throws GraphIntegrityException if an endpoint check fails; nothing is
     *                                 committed in that case.
     * @throws IllegalStateException   if the transaction is closed or the graph
     *                                 changed since it was opened.
     */
    public boolean commit() {
        ensureOpen();
        validate();
        open = false;
        return history.commit(this);
    }

    public void rollback() {
        open = false;
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Runs the commit-time endpoint checks without committing.
     *
     * @throws GraphIntegrityException on the first failing endpoint.
     */
    public void validate() {
        for (Connection c : created.values()) {
            EndpointCheck check = createdChecks.get(c.id());
            checkEndpoint(c, c.sourceNodeId(), c.sourcePort(), PortRole.OUTPUT, check);
            checkEndpoint(c, c.targetNodeId(), c.targetPort(), PortRole.INPUT, check);
        }
        for (Map.Entry<String, Connection> e : rewiredFrom.entrySet()) {
            Connection before = e.getValue();
            Connection after = connectionById(e.getKey());
            if (after == null)
                continue;
            if (!after.sourceNodeId().equals(before.sourceNodeId()) || !after.sourcePort().equals(before.sourcePort()))
                checkEndpoint(after, after.sourceNodeId(), after.sourcePort(), PortRole.OUTPUT, EndpointCheck.DECLARED);
            if (!after.targetNodeId().equals(before.targetNodeId()) || !after.targetPort().equals(before.targetPort()))
                checkEndpoint(after, after.targetNodeId(), after.targetPort(), PortRole.INPUT, EndpointCheck.DECLARED);
        }
    }

    private void checkEndpoint(Connection c, String nodeId, String portId, PortRole role, EndpointCheck check) {
        Node node = node(nodeId).orElseThrow(() -> new GraphIntegrityException(
                "Connection " + c.id() + " references missing node " + nodeId));
        if (check == EndpointCheck.ROLE) {
            if (!node.hasPort(portId, role))
                throw new GraphIntegrityException("Connection " + c.id() + " references " + nodeId + "." + portId
                        + ", which is not a declared " + role.name().toLowerCase(Locale.ROOT) + " port");
        } else if (node.roleOf(portId).isEmpty()) {
            throw new GraphIntegrityException("Connection " + c.id() + " references undeclared port "
                    + nodeId + "." + portId);
        }
    }

    private Connection connectionById(String id) {
        for (Connection c : connections)
            if (c.id().equals(id))
                return c;
        return null;
    }

    private void claimNodeId(String id) {
        if (!nodeIds.add(id))
            throw new GraphIntegrityException("Duplicate node id: " + id);
    }

    private int indexOfNode(String id) {
        for (int i = 0; i < nodes.size(); i++)
            if (nodes.get(i).id().equals(id))
                return i;
        return -1;
    }

    private void ensureOpen() {
        if (!open)
            throw new IllegalStateException("Transaction already closed");
    }
}
