package com.parametric.nodegraph.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.With;

/**
 * A graph vertex. Immutable; edits produce a new value through the
 * {@code with*} methods.
 */
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public record Node(String id, NodeType type, Position position, NodeData data) {

    public Node {
        Objects.requireNonNull(id, "node id");
        Objects.requireNonNull(type, "node type");
        position = position == null ? Position.ORIGIN : position;
        data = data == null ? NodeData.EMPTY : data;
    }

    public List<Port> inputs() {
        return data.inputs();
    }

    public List<Port> outputs() {
        return data.outputs();
    }

    public Optional<PortRole> roleOf(String portId) {
        return data.roleOf(portId);
    }

    public boolean hasPort(String portId, PortRole role) {
        return role == PortRole.INPUT ? data.input(portId).isPresent() : data.output(portId).isPresent();
    }

    /** Label of a declared port, or empty if undeclared or unlabeled. */
    public Optional<String> portLabel(String portId) {
        return data.input(portId).or(() -> data.output(portId))
                .map(Port::label)
                .filter(l -> !l.isEmpty());
    }

    @JsonIgnore
    public boolean isGroup() {
        return type == NodeType.GROUP;
    }

    @JsonIgnore
    public boolean isComponentInstance() {
        return type == NodeType.COMPONENT;
    }

    public List<String> childNodeIds() {
        return data.childNodeIds();
    }

    public int maxPortCount() {
        return Math.max(data.inputs().size(), data.outputs().size());
    }

    public Node translate(Position delta) {
        return withPosition(position.translate(delta));
    }
}
