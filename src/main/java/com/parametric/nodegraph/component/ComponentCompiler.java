package com.parametric.nodegraph.component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.parametric.nodegraph.history.GraphTransaction;
import com.parametric.nodegraph.history.HistoryManager;
import com.parametric.nodegraph.model.ComponentDefinition;
import com.parametric.nodegraph.model.Connection;
import com.parametric.nodegraph.model.Node;
import com.parametric.nodegraph.model.NodeData;
import com.parametric.nodegraph.model.NodeType;
import com.parametric.nodegraph.model.Port;
import com.parametric.nodegraph.store.GraphIntegrityException;
import com.parametric.nodegraph.store.GraphState;
import com.parametric.nodegraph.util.IdGenerator;

import lombok.extern.log4j.Log4j2;

/**
 * Folds a group's members into one opaque component instance.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Partition the connections touching the members into internal (both
 * ends inside) and external (exactly one end inside).</li>
 * <li>Boundary pass: every output socket of a source-like member becomes a
 * component input, every input socket of a sink-like member a component
 * output. Label: the socket label, else the member's display name, else
 * {@code Input N}/{@code Output N}.</li>
 * <li>External pass: an external connection whose inside endpoint has no
 * port yet gets one, labeled with the inside port's label or raw id.</li>
 * <li>Each synthesized port is bound to the inside endpoint it represents,
 * and each external connection is rewired to the instance's port, keeping its
 * id and direction.</li>
 * <li>Members and internal connections are snapshotted, with the group's
 * position as origin, into a {@link ComponentDefinition} that is published to
 * the {@link ComponentRegistry}.</li>
 * <li>The group and its members are replaced by the instance, in one undo
 * step.</li>
 * </ol>
 *
 * <p>
 * Groups nested inside the group are rejected: they must be flattened first.
 * Several external connections may share one port (fan-in), and one port may
 * feed several consumers (fan-out).
 */
@Log4j2
public final class ComponentCompiler {
    private final HistoryManager history;
    private final ComponentRegistry registry;
    private final IdGenerator ids;

    public ComponentCompiler(HistoryManager history, ComponentRegistry registry, IdGenerator ids) {
        this.history = history;
        this.registry = registry;
        this.ids = ids;
    }

    /**
     * Compiles a group into a component instance.
     *
     * @param groupId Id of a group node.
     * @return The new instance, or empty if the group could not be compiled
     *         (nothing is changed in that case).
     */
    public Optional<Node> compile(String groupId) {
        if (history.isRestoring()) {
            log.warn("Cannot compile {} while history is restoring", groupId);
            return Optional.empty();
        }
        GraphState state = history.state();
        Node group = state.node(groupId).filter(Node::isGroup).orElse(null);
        if (group == null) {
            log.warn("Cannot compile {}: no such group", groupId);
            return Optional.empty();
        }
        if (group.childNodeIds().contains(groupId)) {
            log.warn("Cannot compile {}: group lists itself as a member", groupId);
            return Optional.empty();
        }

        Set<String> memberIds = new HashSet<>(group.childNodeIds());
        List<Node> members = state.nodes().stream().filter(n -> memberIds.contains(n.id())).toList();
        if (members.isEmpty()) {
            log.warn("Cannot compile {}: group has no members", groupId);
            return Optional.empty();
        }
        for (Node m : members) {
            if (m.isGroup()) {
                log.warn("Cannot compile {}: member {} is a group; flatten nested groups first", groupId, m.id());
                return Optional.empty();
            }
        }
        Set<String> inside = new HashSet<>();
        for (Node m : members)
            inside.add(m.id());

        // 1. Partition
        List<Connection> internal = new ArrayList<>();
        List<Connection> external = new ArrayList<>();
        for (Connection c : state.connections()) {
            boolean src = inside.contains(c.sourceNodeId());
            boolean tgt = inside.contains(c.targetNodeId());
            if (src && tgt)
                internal.add(c);
            else if (src || tgt)
                external.add(c);
        }

        // 2. Boundary pass
        BoundaryInterface iface = new BoundaryInterface();
        for (Node m : members) {
            if (m.type().boundaryRole() != NodeType.BoundaryRole.SOURCE)
                continue;
            for (Port socket : m.outputs()) {
                String label = socket.labelOr(fallbackLabel(m, "Input " + iface.nextInputOrdinal()));
                iface.inputFor(new BoundaryInterface.Endpoint(m.id(), socket.id()), label);
            }
        }
        for (Node m : members) {
            if (m.type().boundaryRole() != NodeType.BoundaryRole.SINK)
                continue;
            for (Port socket : m.inputs()) {
                String label = socket.labelOr(fallbackLabel(m, "Output " + iface.nextOutputOrdinal()));
                iface.outputFor(new BoundaryInterface.Endpoint(m.id(), socket.id()), label);
            }
        }

        // 3-4. External pass and rewiring
        String instanceId = ids.next("component", state::containsNode);
        List<Connection> rewired = new ArrayList<>(external.size());
        for (Connection c : external) {
            if (inside.contains(c.targetNodeId())) {
                var key = new BoundaryInterface.Endpoint(c.targetNodeId(), c.targetPort());
                Port port = iface.input(key)
                        .orElseGet(() -> iface.inputFor(key, insideLabel(state, key)));
                rewired.add(c.withTarget(instanceId, port.id()));
            } else {
                var key = new BoundaryInterface.Endpoint(c.sourceNodeId(), c.sourcePort());
                Port port = iface.output(key)
                        .orElseGet(() -> iface.outputFor(key, insideLabel(state, key)));
                rewired.add(c.withSource(instanceId, port.id()));
            }
        }

        // 5. Snapshot
        String name = group.data().displayName() != null ? group.data().displayName() : "Component";
        String definitionId = ids.next("component-def", registry::contains);
        ComponentDefinition definition = new ComponentDefinition(definitionId, name,
                iface.inputPorts(), iface.outputPorts(), members, internal,
                iface.inputBindings(), iface.outputBindings(), group.position());

        Node instance = new Node(instanceId, NodeType.COMPONENT, group.position(), new NodeData(
                name, definition.inputPorts(), definition.outputPorts(),
                group.data().width(), group.data().height(), null, definitionId, null));

        // 6. Replace
        GraphTransaction tx = history.begin();
        tx.removeNode(groupId);
        for (Node m : members)
            tx.removeNode(m.id());
        tx.removeConnectionsIf(c -> inside.contains(c.sourceNodeId()) && inside.contains(c.targetNodeId()));
        tx.addNode(instance);
        for (Connection c : rewired)
            tx.rewire(c);
        tx.updateNodes(n -> n.isGroup() ? withMembershipReplaced(n, groupId, inside, instanceId) : n);

        try {
            tx.validate();
        } catch (GraphIntegrityException e) {
            log.warn("Cannot compile {}: {}", groupId, e.getMessage());
            tx.rollback();
            return Optional.empty();
        }
        registry.publish(definition);
        tx.commit();

        log.info("Compiled group {} into component {} (definition {}, {} inputs, {} outputs, {} external wires)",
                groupId, instanceId, definitionId, definition.inputPorts().size(),
                definition.outputPorts().size(), rewired.size());
        return Optional.of(instance);
    }

    private static String fallbackLabel(Node node, String ordinalLabel) {
        String name = node.data().displayName();
        return name != null && !name.isEmpty() ? name : ordinalLabel;
    }

    private static String insideLabel(GraphState state, BoundaryInterface.Endpoint key) {
        return state.node(key.nodeId())
                .flatMap(n -> n.portLabel(key.portId()))
                .orElse(key.portId());
    }

    /**
     * An enclosing group that listed the compiled group now lists the instance;
     * member ids are dropped from any other group.
     */
    private static Node withMembershipReplaced(Node group, String groupId, Set<String> members, String instanceId) {
        List<String> children = group.childNodeIds();
        if (children.stream().noneMatch(id -> id.equals(groupId) || members.contains(id)))
            return group;
        List<String> next = new ArrayList<>(children.size());
        for (String id : children) {
            if (id.equals(groupId))
                next.add(instanceId);
            else if (!members.contains(id))
                next.add(id);
        }
        return group.withData(group.data().withChildNodeIds(next));
    }
}
