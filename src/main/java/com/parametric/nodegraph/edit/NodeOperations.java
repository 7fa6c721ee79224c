package com.parametric.nodegraph.edit;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.parametric.nodegraph.config.EditorConfig;
import com.parametric.nodegraph.history.GraphTransaction;
import com.parametric.nodegraph.history.HistoryManager;
import com.parametric.nodegraph.model.Node;
import com.parametric.nodegraph.model.NodeData;
import com.parametric.nodegraph.model.NodeType;
import com.parametric.nodegraph.model.Position;
import com.parametric.nodegraph.store.GraphIntegrityException;
import com.parametric.nodegraph.store.GraphState;
import com.parametric.nodegraph.util.IdGenerator;

import lombok.extern.log4j.Log4j2;

/**
 * Single-node edits. Each call is one undo step covering nodes and
 * connections together.
 */
@Log4j2
public final class NodeOperations {
    private final HistoryManager history;
    private final IdGenerator ids;
    private final GroupOperations groups;
    private final EditorConfig config;

    public NodeOperations(HistoryManager history, IdGenerator ids, GroupOperations groups, EditorConfig config) {
        this.history = history;
        this.ids = ids;
        this.groups = groups;
        this.config = config;
    }

    /** Adds a node of {@code type} with the type's default name and ports. */
    public Node addNode(NodeType type, Position position) {
        if (type == NodeType.GROUP || type == NodeType.COMPONENT)
            throw new IllegalArgumentException(type.wireName() + " nodes are created by grouping or compiling");
        String id = ids.next("node", history.state()::containsNode);
        Node node = new Node(id, type, position, new NodeData(type.defaultName(), type.defaultInputs(),
                type.defaultOutputs(), null, null, null, null, null));
        GraphTransaction tx = history.begin();
        tx.addNode(node);
        tx.commit();
        return node;
    }

    /**
     * Deletes a node and every connection touching it, and drops it from its
     * group.
     *
     * @param deleteChildren For a group: also delete its members. Otherwise the
     *                       members stay, ungrouped.
     * @return false if there is no such node.
     */
    public boolean deleteNode(String id, boolean deleteChildren) {
        GraphState state = history.state();
        Node node = state.node(id).orElse(null);
        if (node == null) {
            log.debug("No node {} to delete", id);
            return false;
        }
        Set<String> removed = new HashSet<>();
        removed.add(id);
        if (deleteChildren && node.isGroup())
            removed.addAll(node.childNodeIds());

        GraphTransaction tx = history.begin();
        for (String r : removed)
            tx.removeNode(r);
        tx.removeConnectionsIf(c -> removed.contains(c.sourceNodeId()) || removed.contains(c.targetNodeId()));
        tx.updateNodes(n -> n.isGroup() ? GroupOperations.withoutMembers(n, removed) : n);
        return tx.commit();
    }

    /** Copies a node, without its connections, offset from the original. */
    public Optional<Node> duplicateNode(String id) {
        GraphState state = history.state();
        Node node = state.node(id).orElse(null);
        if (node == null || node.isGroup()) {
            log.debug("Cannot duplicate {}", id);
            return Optional.empty();
        }
        Node copy = node.withId(ids.next("node", state::containsNode))
                .translate(new Position(config.getDuplicateOffset(), config.getDuplicateOffset()));
        GraphTransaction tx = history.begin();
        tx.addNode(copy);
        tx.commit();
        return Optional.of(copy);
    }

    /**
     * Replaces a node's data. Renaming a component instance renames only the
     * instance; the published definition is unchanged.
     *
     * <p>
     * Removing a port that still has connections is rejected.
     */
    public boolean updateNodeData(String id, UnaryOperator<NodeData> updater) {
        GraphTransaction tx = history.begin();
        if (!tx.updateNode(id, n -> n.withData(updater.apply(n.data())))) {
            tx.rollback();
            return false;
        }
        Node updated = tx.node(id).orElseThrow();
        boolean dangling = tx.connections().stream().anyMatch(c ->
                (c.sourceNodeId().equals(id) && updated.roleOf(c.sourcePort()).isEmpty())
                        || (c.targetNodeId().equals(id) && updated.roleOf(c.targetPort()).isEmpty()));
        if (dangling) {
            log.debug("Update of {} would leave connections on removed ports", id);
            tx.rollback();
            return false;
        }
        GroupOperations.parentOf(tx.snapshot(), id).ifPresent(g -> groups.refit(tx, g.id()));
        try {
            return tx.commit();
        } catch (GraphIntegrityException e) {
            log.debug("Update of {} rejected: {}", id, e.getMessage());
            tx.rollback();
            return false;
        }
    }

    /**
     * Moves a node. A group drags its members along; a grouped node makes its
     * group refit around the new layout.
     */
    public boolean moveNode(String id, Position position) {
        GraphState state = history.state();
        Node node = state.node(id).orElse(null);
        if (node == null)
            return false;
        Position delta = position.minus(node.position());
        GraphTransaction tx = history.begin();
        tx.replaceNode(node.withPosition(position));
        if (node.isGroup()) {
            Set<String> children = new HashSet<>(node.childNodeIds());
            tx.updateNodes(n -> children.contains(n.id()) ? n.translate(delta) : n);
        } else {
            GroupOperations.parentOf(state, id).ifPresent(g -> groups.refit(tx, g.id()));
        }
        return tx.commit();
    }
}
