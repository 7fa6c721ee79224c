package com.parametric.nodegraph.component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.parametric.nodegraph.history.GraphTransaction;
import com.parametric.nodegraph.history.HistoryManager;
import com.parametric.nodegraph.model.ComponentDefinition;
import com.parametric.nodegraph.model.Connection;
import com.parametric.nodegraph.model.Node;
import com.parametric.nodegraph.model.NodeData;
import com.parametric.nodegraph.model.NodeType;
import com.parametric.nodegraph.model.PortBinding;
import com.parametric.nodegraph.model.Position;
import com.parametric.nodegraph.store.GraphIntegrityException;
import com.parametric.nodegraph.store.GraphState;
import com.parametric.nodegraph.util.Bounds;
import com.parametric.nodegraph.util.IdGenerator;
import com.parametric.nodegraph.util.NodeBounds;

import lombok.extern.log4j.Log4j2;

/**
 * Inverse of {@link ComponentCompiler}: replaces a component instance with a
 * group holding a fresh copy of the definition's nodes.
 *
 * <p>
 * Internal node ids that collide with live nodes are remapped, because one
 * definition may be instantiated several times. Restored nodes are translated
 * by {@code instance.position - definition.origin}. Internal connections are
 * recreated with fresh ids; every live connection on the instance is rewired
 * through the definition's bindings to the remapped internal endpoint, and
 * one whose port has no binding is dropped. The restored nodes go into a new
 * group sized to them; if the instance already sat in a group, they take its
 * place in that group instead, so groups never nest. Everything happens in
 * one undo step; unrelated content is untouched.
 *
 * <p>
 * Internal node ids are not stable across a compile/expand round trip; the
 * external wiring is.
 */
@Log4j2
public final class ComponentExpander {
    private final HistoryManager history;
    private final ComponentRegistry registry;
    private final IdGenerator ids;
    private final NodeBounds bounds;

    public ComponentExpander(HistoryManager history, ComponentRegistry registry, IdGenerator ids, NodeBounds bounds) {
        this.history = history;
        this.registry = registry;
        this.ids = ids;
        this.bounds = bounds;
    }

    /**
     * Expands a component instance in place.
     *
     * @param instanceId Id of a component instance node.
     * @return The group now holding the restored nodes (new, or the refitted
     *         enclosing group), or empty if the instance could not be
     *         expanded (nothing is changed in that case).
     */
    public Optional<Node> expand(String instanceId) {
        if (history.isRestoring()) {
            log.warn("Cannot expand {} while history is restoring", instanceId);
            return Optional.empty();
        }
        GraphState state = history.state();
        Node instance = state.node(instanceId).filter(Node::isComponentInstance).orElse(null);
        if (instance == null) {
            log.warn("Cannot expand {}: no such component instance", instanceId);
            return Optional.empty();
        }
        String definitionId = instance.data().componentId() != null ? instance.data().componentId() : instanceId;
        ComponentDefinition definition = registry.find(definitionId).orElse(null);
        if (definition == null) {
            log.warn("Cannot expand {}: unresolved component definition {}", instanceId, definitionId);
            return Optional.empty();
        }
        if (definition.internalNodes().isEmpty()) {
            log.warn("Cannot expand {}: definition {} has no nodes", instanceId, definitionId);
            return Optional.empty();
        }

        // 2. Id remapping, valid for this call only
        Set<String> taken = new HashSet<>();
        for (Node n : state.nodes())
            taken.add(n.id());
        Map<String, String> idMap = new HashMap<>();
        for (Node n : definition.internalNodes()) {
            String id = taken.contains(n.id()) ? ids.next("node", taken::contains) : n.id();
            taken.add(id);
            idMap.put(n.id(), id);
        }

        // 3. Translation
        Position origin = definition.origin() != null ? definition.origin() : instance.position();
        Position delta = instance.position().minus(origin);
        List<Node> restored = new ArrayList<>(definition.internalNodes().size());
        for (Node n : definition.internalNodes()) {
            Node copy = n.withId(idMap.get(n.id())).translate(delta);
            if (!copy.childNodeIds().isEmpty())
                copy = copy.withData(copy.data().withChildNodeIdsMapped(
                        children -> children.stream().map(c -> idMap.getOrDefault(c, c)).toList()));
            restored.add(copy);
        }

        // 4. Internal connections
        Set<String> takenConnections = new HashSet<>();
        for (Connection c : state.connections())
            takenConnections.add(c.id());
        List<Connection> restoredConnections = new ArrayList<>(definition.internalConnections().size());
        for (Connection c : definition.internalConnections()) {
            String id = ids.next("conn", takenConnections::contains);
            takenConnections.add(id);
            restoredConnections.add(new Connection(id,
                    idMap.getOrDefault(c.sourceNodeId(), c.sourceNodeId()), c.sourcePort(),
                    idMap.getOrDefault(c.targetNodeId(), c.targetNodeId()), c.targetPort(),
                    c.dashed(), c.ghost()));
        }

        // 5. Rebinding
        List<Connection> rebound = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        for (Connection c : state.connectionsTouching(instanceId)) {
            Connection next = c;
            if (instanceId.equals(next.targetNodeId()))
                next = rebind(next, definition.inputBinding(next.targetPort()), idMap, false);
            if (next != null && instanceId.equals(next.sourceNodeId()))
                next = rebind(next, definition.outputBinding(next.sourcePort()), idMap, true);
            if (next == null) {
                log.warn("Dropping connection {} on {}: port has no binding in {}", c.id(), instanceId, definitionId);
                dropped.add(c.id());
            } else {
                rebound.add(next);
            }
        }

        // 6. Holding group: the enclosing one if the instance has a parent
        Node parent = state.nodes().stream()
                .filter(n -> n.isGroup() && n.childNodeIds().contains(instanceId))
                .findFirst().orElse(null);
        String groupId = parent != null ? parent.id() : ids.next("group", taken::contains);
        Node group = null;
        if (parent == null) {
            Bounds frame = bounds.groupFrame(restored).orElseThrow();
            group = new Node(groupId, NodeType.GROUP, frame.topLeft(), new NodeData(
                    definition.name(), null, null, frame.width(), frame.height(),
                    restored.stream().map(Node::id).toList(), null, null));
        }
        List<String> restoredIds = restored.stream().map(Node::id).toList();

        // 7. Replace
        GraphTransaction tx = history.begin();
        try {
            tx.removeNode(instanceId);
            if (parent == null) {
                for (int i = restored.size() - 1; i >= 0; i--)
                    tx.addNodeFirst(restored.get(i));
                tx.addNodeFirst(group);
            } else {
                for (Node n : restored)
                    tx.addNode(n);
            }
            for (String id : dropped)
                tx.removeConnection(id);
            for (Connection c : restoredConnections)
                tx.addConnection(c, GraphTransaction.EndpointCheck.DECLARED);
            for (Connection c : rebound)
                tx.rewire(c);
            if (parent != null) {
                tx.updateNode(groupId, g -> withInstanceReplaced(g, instanceId, restoredIds));
                group = refit(tx, groupId);
            }
            tx.commit();
        } catch (GraphIntegrityException e) {
            log.warn("Cannot expand {}: {}", instanceId, e.getMessage());
            tx.rollback();
            return Optional.empty();
        }

        log.info("Expanded component {} (definition {}) into group {} with {} nodes, {} rebound wires, {} dropped",
                instanceId, definitionId, groupId, restored.size(), rebound.size(), dropped.size());
        return Optional.of(group);
    }

    private static Connection rebind(Connection c, Optional<PortBinding> binding, Map<String, String> idMap,
            boolean sourceSide) {
        if (binding.isEmpty() || !idMap.containsKey(binding.get().nodeId()))
            return null;
        String nodeId = idMap.get(binding.get().nodeId());
        return sourceSide
                ? c.withSource(nodeId, binding.get().portId())
                : c.withTarget(nodeId, binding.get().portId());
    }

    private static Node withInstanceReplaced(Node group, String instanceId, List<String> restoredIds) {
        return group.withData(group.data().withChildNodeIdsMapped(children -> {
            List<String> next = new ArrayList<>(children.size() + restoredIds.size());
            for (String id : children) {
                if (id.equals(instanceId))
                    next.addAll(restoredIds);
                else
                    next.add(id);
            }
            return next;
        }));
    }

    private Node refit(GraphTransaction tx, String groupId) {
        Node group = tx.node(groupId).orElseThrow();
        Set<String> memberIds = new HashSet<>(group.childNodeIds());
        List<Node> members = tx.nodes().stream().filter(n -> memberIds.contains(n.id())).toList();
        Node fitted = bounds.groupFrame(members)
                .map(frame -> group.withPosition(frame.topLeft())
                        .withData(group.data().withWidth(frame.width()).withHeight(frame.height())))
                .orElse(group);
        tx.replaceNode(fitted);
        return fitted;
    }
}
