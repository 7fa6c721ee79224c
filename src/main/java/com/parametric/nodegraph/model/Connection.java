package com.parametric.nodegraph.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.With;

/**
 * A directed edge from an output-role port to an input-role port.
 */
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public record Connection(
        String id,
        String sourceNodeId,
        String sourcePort,
        String targetNodeId,
        String targetPort,
        @JsonProperty("isDashed") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean dashed,
        @JsonProperty("isGhost") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean ghost) {

    /** The identity of an edge for duplicate detection; the id is not part of it. */
    public record Endpoints(String sourceNodeId, String sourcePort, String targetNodeId, String targetPort) {
    }

    public Connection {
        Objects.requireNonNull(id, "connection id");
        Objects.requireNonNull(sourceNodeId, "sourceNodeId");
        Objects.requireNonNull(sourcePort, "sourcePort");
        Objects.requireNonNull(targetNodeId, "targetNodeId");
        Objects.requireNonNull(targetPort, "targetPort");
    }

    public static Connection of(String id, String sourceNodeId, String sourcePort,
            String targetNodeId, String targetPort) {
        return new Connection(id, sourceNodeId, sourcePort, targetNodeId, targetPort, false, false);
    }

    public Endpoints endpoints() {
        return new Endpoints(sourceNodeId, sourcePort, targetNodeId, targetPort);
    }

    public boolean touches(String nodeId) {
        return sourceNodeId.equals(nodeId) || targetNodeId.equals(nodeId);
    }

    public Connection withSource(String nodeId, String portId) {
        return new Connection(id, nodeId, portId, targetNodeId, targetPort, dashed, ghost);
    }

    public Connection withTarget(String nodeId, String portId) {
        return new Connection(id, sourceNodeId, sourcePort, nodeId, portId, dashed, ghost);
    }
}
