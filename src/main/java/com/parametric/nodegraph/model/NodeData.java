package com.parametric.nodegraph.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.parametric.nodegraph.util.Immutables;

import lombok.With;

/**
 * Payload of a node: declared ports, optional dimensions, display name and the
 * type-specific fields (group membership, component reference, free-form
 * properties). Deeply immutable.
 */
@With
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record NodeData(
        @JsonProperty("customName") String displayName,
        List<Port> inputs,
        List<Port> outputs,
        Double width,
        Double height,
        List<String> childNodeIds,
        String componentId,
        Map<String, Object> properties) {

    public static final NodeData EMPTY = new NodeData(null, null, null, null, null, null, null, null);

    public NodeData {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        childNodeIds = childNodeIds == null ? List.of() : List.copyOf(childNodeIds);
        properties = Immutables.freezeMap(properties);
    }

    public Optional<Port> input(String portId) {
        return inputs.stream().filter(p -> p.id().equals(portId)).findFirst();
    }

    public Optional<Port> output(String portId) {
        return outputs.stream().filter(p -> p.id().equals(portId)).findFirst();
    }

    /** Role by declared membership; empty if the port is declared on neither list. */
    public Optional<PortRole> roleOf(String portId) {
        if (input(portId).isPresent())
            return Optional.of(PortRole.INPUT);
        if (output(portId).isPresent())
            return Optional.of(PortRole.OUTPUT);
        return Optional.empty();
    }

    public NodeData withInputsMapped(UnaryOperator<List<Port>> fn) {
        return withInputs(fn.apply(inputs));
    }

    public NodeData withChildNodeIdsMapped(UnaryOperator<List<String>> fn) {
        return withChildNodeIds(fn.apply(childNodeIds));
    }
}
