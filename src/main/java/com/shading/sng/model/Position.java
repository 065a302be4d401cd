package com.shading.sng.model;

/**
 * Editor canvas coordinates of a node. Immutable; moves produce a new instance.
 */
public record Position(double x, double y) {
    public static final Position ORIGIN = new Position(0, 0);

    public Position {
        if (!Double.isFinite(x) || !Double.isFinite(y))
            throw new IllegalArgumentException("Position coordinates must be finite numbers");
    }

    public Position move(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }

    public double distanceTo(Position other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
