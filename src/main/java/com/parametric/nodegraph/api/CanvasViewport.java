package com.parametric.nodegraph.api;

import com.parametric.nodegraph.model.Position;

/**
 * Converts pointer coordinates reported by the host (client space) into
 * canvas-local space.
 */
@FunctionalInterface
public interface CanvasViewport {

    /** Client space is canvas space. */
    CanvasViewport IDENTITY = client -> client;

    Position toCanvas(Position client);

    /** Viewport whose canvas element's top-left corner sits at {@code (left, top)} in client space. */
    static CanvasViewport offset(double left, double top) {
        return client -> client.translate(-left, -top);
    }
}
