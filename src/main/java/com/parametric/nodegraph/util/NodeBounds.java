package com.parametric.nodegraph.util;

import java.util.Collection;
import java.util.Optional;

import com.parametric.nodegraph.config.EditorConfig;
import com.parametric.nodegraph.model.Node;
import com.parametric.nodegraph.model.NodeType;

/**
 * Size heuristics for nodes whose rendered size is unknown to the core.
 *
 * <p>
 * Measured dimensions stored on the node win when they are plausible;
 * otherwise each {@link NodeType} supplies an estimate. Port sockets extend
 * the box sideways.
 */
public final class NodeBounds {
    private static final double MIN_SIZE = 100;
    private static final double MIN_OVERRIDE = 50;

    private final EditorConfig config;

    public NodeBounds(EditorConfig config) {
        this.config = config;
    }

    /** Estimated on-canvas rectangle of a node, sockets included. */
    public Bounds of(Node node) {
        NodeType type = node.type();
        double extraLeft = 0;
        double extraRight = 0;
        if (type != NodeType.SERIES) {
            if (!node.inputs().isEmpty())
                extraLeft = config.getPortStickout();
            if (!node.outputs().isEmpty())
                extraRight = config.getPortStickout();
        }

        Double w = node.data().width();
        Double h = node.data().height();
        double width;
        double height;
        if (!type.isPrimitive() && w != null && h != null && w > 1 && h > 1) {
            width = w;
            height = h;
        } else {
            double fw = type.fallbackWidth(node);
            double fh = type.fallbackHeight(node);
            if (Double.isNaN(fw))
                fw = config.getDefaultNodeWidth();
            if (Double.isNaN(fh))
                fh = config.getDefaultNodeHeight();
            width = w != null && w > MIN_OVERRIDE ? w : fw;
            height = !type.isPrimitive() && h != null && h > MIN_OVERRIDE ? h : fh;
        }

        return new Bounds(node.position().x() - extraLeft, node.position().y(),
                Math.max(MIN_SIZE, width) + extraLeft + extraRight, Math.max(MIN_SIZE, height));
    }

    /** Union of the members' rectangles, or empty for no members. */
    public Optional<Bounds> enclosing(Collection<Node> nodes) {
        Bounds acc = null;
        for (Node n : nodes) {
            Bounds b = of(n);
            acc = acc == null ? b : acc.union(b);
        }
        return Optional.ofNullable(acc);
    }

    /**
     * Frame of a group enclosing {@code members}: their union plus side and
     * bottom padding and a header band on top.
     */
    public Optional<Bounds> groupFrame(Collection<Node> members) {
        double pad = config.getGroupPadding();
        double header = config.getGroupHeaderHeight();
        return enclosing(members).map(b -> new Bounds(
                b.x() - pad,
                b.y() - pad - header,
                b.width() + pad * 2,
                b.height() + pad + config.getGroupPaddingBottom() + header));
    }
}
