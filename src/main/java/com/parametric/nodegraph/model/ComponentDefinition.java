package com.parametric.nodegraph.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Published snapshot of an extracted subgraph and its boundary interface.
 * All lists are unmodifiable and the contained nodes are immutable values, so
 * a definition can be shared by any number of instances.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComponentDefinition(
        String id,
        String name,
        List<Port> inputPorts,
        List<Port> outputPorts,
        List<Node> internalNodes,
        List<Connection> internalConnections,
        List<PortBinding> inputBindings,
        List<PortBinding> outputBindings,
        Position origin) {

    public ComponentDefinition {
        Objects.requireNonNull(id, "component id");
        inputPorts = inputPorts == null ? List.of() : List.copyOf(inputPorts);
        outputPorts = outputPorts == null ? List.of() : List.copyOf(outputPorts);
        internalNodes = internalNodes == null ? List.of() : List.copyOf(internalNodes);
        internalConnections = internalConnections == null ? List.of() : List.copyOf(internalConnections);
        inputBindings = inputBindings == null ? List.of() : List.copyOf(inputBindings);
        outputBindings = outputBindings == null ? List.of() : List.copyOf(outputBindings);
    }

    public Optional<PortBinding> inputBinding(String componentPortId) {
        return inputBindings.stream().filter(b -> b.componentPortId().equals(componentPortId)).findFirst();
    }

    public Optional<PortBinding> outputBinding(String componentPortId) {
        return outputBindings.stream().filter(b -> b.componentPortId().equals(componentPortId)).findFirst();
    }
}
