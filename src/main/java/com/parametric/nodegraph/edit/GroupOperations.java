package com.parametric.nodegraph.edit;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.parametric.nodegraph.history.GraphTransaction;
import com.parametric.nodegraph.history.HistoryManager;
import com.parametric.nodegraph.model.Node;
import com.parametric.nodegraph.model.NodeData;
import com.parametric.nodegraph.model.NodeType;
import com.parametric.nodegraph.store.GraphState;
import com.parametric.nodegraph.util.Bounds;
import com.parametric.nodegraph.util.IdGenerator;
import com.parametric.nodegraph.util.NodeBounds;

import lombok.extern.log4j.Log4j2;

/**
 * Group membership edits. A node belongs to at most one group; a group's frame
 * is recomputed from its members whenever membership changes.
 */
@Log4j2
public final class GroupOperations {
    private final HistoryManager history;
    private final IdGenerator ids;
    private final NodeBounds bounds;

    public GroupOperations(HistoryManager history, IdGenerator ids, NodeBounds bounds) {
        this.history = history;
        this.ids = ids;
        this.bounds = bounds;
    }

    /**
     * Creates a group around existing nodes. The group is placed first in node
     * order so that it is drawn behind its members.
     *
     * @param nodeIds At least two ids of existing non-group nodes.
     * @return The new group, or empty if fewer than two eligible nodes were given.
     */
    public Optional<Node> createGroup(List<String> nodeIds) {
        GraphState state = history.state();
        Set<String> wanted = new LinkedHashSet<>(nodeIds);
        List<Node> members = state.nodes().stream()
                .filter(n -> wanted.contains(n.id()) && !n.isGroup())
                .toList();
        if (members.size() < 2) {
            log.debug("Group needs at least two nodes, got {} of {}", members.size(), nodeIds);
            return Optional.empty();
        }
        Bounds frame = bounds.groupFrame(members).orElseThrow();
        Set<String> memberIds = new HashSet<>();
        for (Node m : members)
            memberIds.add(m.id());

        String id = ids.next("group", state::containsNode);
        Node group = new Node(id, NodeType.GROUP, frame.topLeft(), new NodeData(
                "Group(" + members.size() + ")", null, null, frame.width(), frame.height(),
                members.stream().map(Node::id).toList(), null, null));

        GraphTransaction tx = history.begin();
        tx.updateNodes(n -> n.isGroup() ? withoutMembers(n, memberIds) : n);
        tx.addNodeFirst(group);
        if (!tx.commit())
            return Optional.empty();
        log.info("Created group {} around {}", id, group.childNodeIds());
        return Optional.of(group);
    }

    /** Moves a node into a group, taking it out of any other group. */
    public boolean joinGroup(String nodeId, String groupId) {
        GraphState state = history.state();
        Node node = state.node(nodeId).orElse(null);
        Node group = state.node(groupId).filter(Node::isGroup).orElse(null);
        if (node == null || group == null || node.isGroup()) {
            log.debug("Cannot join {} to {}", nodeId, groupId);
            return false;
        }
        if (group.childNodeIds().contains(nodeId))
            return false;

        GraphTransaction tx = history.begin();
        tx.updateNodes(n -> n.isGroup() && !n.id().equals(groupId) ? withoutMembers(n, Set.of(nodeId)) : n);
        tx.updateNode(groupId, g -> g.withData(g.data().withChildNodeIdsMapped(children -> {
            List<String> next = new ArrayList<>(children);
            next.add(nodeId);
            return next;
        })));
        refit(tx, groupId);
        return tx.commit();
    }

    /** Removes a node from whichever group holds it. */
    public boolean leaveGroup(String nodeId) {
        Optional<Node> parent = parentOf(history.state(), nodeId);
        if (parent.isEmpty())
            return false;
        GraphTransaction tx = history.begin();
        tx.updateNode(parent.get().id(), g -> withoutMembers(g, Set.of(nodeId)));
        refit(tx, parent.get().id());
        return tx.commit();
    }

    /** Recomputes a group's frame from its members. */
    public boolean fitGroup(String groupId) {
        GraphTransaction tx = history.begin();
        if (!refit(tx, groupId)) {
            tx.rollback();
            return false;
        }
        return tx.commit();
    }

    /**
     * The group whose frame contains the centre of an ungrouped node, if any.
     * Hosts use this to offer joining after a node is dropped.
     */
    public Optional<Node> joinCandidate(String nodeId) {
        GraphState state = history.state();
        Node node = state.node(nodeId).orElse(null);
        if (node == null || node.isGroup() || parentOf(state, nodeId).isPresent())
            return Optional.empty();
        Bounds nodeBounds = bounds.of(node);
        return state.nodes().stream()
                .filter(Node::isGroup)
                .filter(g -> frameOf(g).containsCentreOf(nodeBounds))
                .findFirst();
    }

    public static Optional<Node> parentOf(GraphState state, String nodeId) {
        return state.nodes().stream()
                .filter(n -> n.isGroup() && n.childNodeIds().contains(nodeId))
                .findFirst();
    }

    /**
     * Refits {@code groupId} inside {@code tx}. A group whose members are all
     * gone keeps its frame.
     *
     * @return false if there is no such group.
     */
    boolean refit(GraphTransaction tx, String groupId) {
        Node group = tx.node(groupId).filter(Node::isGroup).orElse(null);
        if (group == null)
            return false;
        Set<String> memberIds = new HashSet<>(group.childNodeIds());
        List<Node> members = tx.nodes().stream().filter(n -> memberIds.contains(n.id())).toList();
        bounds.groupFrame(members).ifPresent(frame -> tx.replaceNode(group
                .withPosition(frame.topLeft())
                .withData(group.data().withWidth(frame.width()).withHeight(frame.height()))));
        return true;
    }

    private Bounds frameOf(Node group) {
        Double w = group.data().width();
        Double h = group.data().height();
        if (w == null || h == null)
            return bounds.of(group);
        return new Bounds(group.position().x(), group.position().y(), w, h);
    }

    static Node withoutMembers(Node group, Set<String> removed) {
        if (group.childNodeIds().stream().noneMatch(removed::contains))
            return group;
        return group.withData(group.data().withChildNodeIdsMapped(
                children -> children.stream().filter(id -> !removed.contains(id)).toList()));
    }
}
