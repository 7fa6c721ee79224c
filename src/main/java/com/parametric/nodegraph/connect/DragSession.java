package com.parametric.nodegraph.connect;

import com.parametric.nodegraph.model.Position;

/**
 * The single in-flight connection drag: the endpoint the gesture started on
 * and the pointer position in canvas space.
 */
public record DragSession(String nodeId, String portId, Position pointer) {

    public DragSession withPointer(Position next) {
        return new DragSession(nodeId, portId, next);
    }
}
