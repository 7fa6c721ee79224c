package com.parametric.nodegraph.model;

/**
 * A point in canvas space.
 */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);

    public Position translate(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }

    public Position translate(Position delta) {
        return translate(delta.x, delta.y);
    }

    /** Component-wise difference {@code this - other}. */
    public Position minus(Position other) {
        return new Position(x - other.x, y - other.y);
    }
}
