package com.parametric.nodegraph.model;

/**
 * Maps a synthesized component port back to the internal endpoint it stands for.
 */
public record PortBinding(String componentPortId, String nodeId, String portId) {
}
