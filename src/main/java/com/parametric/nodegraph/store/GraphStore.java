package com.parametric.nodegraph.store;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.parametric.nodegraph.model.Connection;
import com.parametric.nodegraph.model.Node;
import com.parametric.nodegraph.model.PortRole;

import lombok.extern.log4j.Log4j2;

/**
 * Canonical holder of the graph's nodes and connections.
 *
 * <p>
 * The store itself only validates and swaps whole {@link GraphState} values.
 * All edits go through {@link com.parametric.nodegraph.history.HistoryManager},
 * which decides whether a write is recorded for undo. Readers (renderers,
 * operations) use the lookup helpers here.
 */
@Log4j2
public final class GraphStore {
    private GraphState state = GraphState.EMPTY;
    private Map<String, Node> nodesById = Map.of();

    public GraphState state() {
        return state;
    }

    public List<Node> nodes() {
        return state.nodes();
    }

    public List<Connection> connections() {
        return state.connections();
    }

    public Optional<Node> node(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public boolean containsNode(String id) {
        return nodesById.containsKey(id);
    }

    public boolean containsConnection(Connection.Endpoints endpoints) {
        return state.containsConnection(endpoints);
    }

    /**
     * Resolves a port's role from the node's declared inputs/outputs.
     *
     * <p>
     * Declared membership is authoritative. The legacy id-naming convention is
     * consulted only when the node itself cannot be found; a port that exists
     * on a live node but on neither list resolves to empty.
     */
    public Optional<PortRole> portRole(String nodeId, String portId) {
        Node node = nodesById.get(nodeId);
        if (node == null) {
            Optional<PortRole> legacy = PortRole.inferFromLegacyId(portId);
            log.debug("Node {} not found; legacy role for port {} is {}", nodeId, portId, legacy);
            return legacy;
        }
        return node.roleOf(portId);
    }

    /**
     * Replaces the whole state after checking its integrity. A failing check
     * leaves the store unchanged.
     */
    public void replace(GraphState next) {
        next.checkIntegrity();
        Map<String, Node> index = new HashMap<>(next.nodes().size() * 2);
        for (Node n : next.nodes())
            index.put(n.id(), n);
        this.state = next;
        this.nodesById = index;
    }
}
