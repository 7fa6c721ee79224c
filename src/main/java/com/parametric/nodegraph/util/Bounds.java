package com.parametric.nodegraph.util;

import com.parametric.nodegraph.model.Position;

/** Axis-aligned rectangle in canvas space. */
public record Bounds(double x, double y, double width, double height) {

    public double maxX() {
        return x + width;
    }

    public double maxY() {
        return y + height;
    }

    public Position topLeft() {
        return new Position(x, y);
    }

    public Bounds union(Bounds other) {
        double minX = Math.min(x, other.x);
        double minY = Math.min(y, other.y);
        return new Bounds(minX, minY, Math.max(maxX(), other.maxX()) - minX, Math.max(maxY(), other.maxY()) - minY);
    }

    /** True if the centre of {@code inner} lies inside this rectangle. */
    public boolean containsCentreOf(Bounds inner) {
        double cx = inner.x + inner.width / 2;
        double cy = inner.y + inner.height / 2;
        return cx >= x && cx <= maxX() && cy >= y && cy <= maxY();
    }
}
