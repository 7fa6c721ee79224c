package com.parametric.nodegraph.store;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.parametric.nodegraph.model.Connection;
import com.parametric.nodegraph.model.Node;

/**
 * Immutable value of the whole graph at one point in time. Used both as the
 * live state held by {@link GraphStore} and as an undo/redo snapshot.
 */
public record GraphState(List<Node> nodes, List<Connection> connections) {

    public static final GraphState EMPTY = new GraphState(List.of(), List.of());

    public GraphState {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        connections = connections == null ? List.of() : List.copyOf(connections);
    }

    public Optional<Node> node(String id) {
        for (Node n : nodes)
            if (n.id().equals(id))
                return Optional.of(n);
        return Optional.empty();
    }

    public Optional<Connection> connection(String id) {
        for (Connection c : connections)
            if (c.id().equals(id))
                return Optional.of(c);
        return Optional.empty();
    }

    public boolean containsNode(String id) {
        return node(id).isPresent();
    }

    public boolean containsConnection(Connection.Endpoints endpoints) {
        for (Connection c : connections)
            if (c.endpoints().equals(endpoints))
                return true;
        return false;
    }

    public List<Connection> connectionsTouching(String nodeId) {
        return connections.stream().filter(c -> c.touches(nodeId)).toList();
    }

    /**
     * Checks node-id and connection-id uniqueness, that no two connections
     * share the same endpoints, and that every connection ends on ports
     * declared by live nodes.
     *
     * <p>
     * Port roles are not checked here: wiring rewired through a component
     * boundary may end on a port of either list. New connections get the role
     * check where they are written.
     *
     * @throws GraphIntegrityException on the first violation found.
     */
    public void checkIntegrity() {
        Map<String, Node> nodeIds = new HashMap<>(nodes.size() * 2);
        for (Node n : nodes)
            if (nodeIds.putIfAbsent(n.id(), n) != null)
                throw new GraphIntegrityException("Duplicate node id: " + n.id());

        Set<String> connectionIds = new HashSet<>(connections.size() * 2);
        Set<Connection.Endpoints> endpoints = new HashSet<>(connections.size() * 2);
        for (Connection c : connections) {
            if (!connectionIds.add(c.id()))
                throw new GraphIntegrityException("Duplicate connection id: " + c.id());
            if (!endpoints.add(c.endpoints()))
                throw new GraphIntegrityException("Duplicate connection: " + c.endpoints());
            checkDeclared(c, nodeIds.get(c.sourceNodeId()), c.sourceNodeId(), c.sourcePort());
            checkDeclared(c, nodeIds.get(c.targetNodeId()), c.targetNodeId(), c.targetPort());
        }
    }

    private static void checkDeclared(Connection c, Node node, String nodeId, String portId) {
        if (node == null)
            throw new GraphIntegrityException("Connection " + c.id() + " references missing node " + nodeId);
        if (node.roleOf(portId).isEmpty())
            throw new GraphIntegrityException("Connection " + c.id() + " references undeclared port "
                    + nodeId + "." + portId);
    }
}
