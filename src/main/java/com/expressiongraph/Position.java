package com.expressiongraph;

/** 2D point of a laid-out node. */
public final class Position {
    public static final Position ORIGIN = new Position(0.0, 0.0);

    public final double x;
    public final double y;

    public Position(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double distanceTo(Position o) {
        return Math.hypot(x - o.x, y - o.y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position p = (Position) o;
        return Double.compare(x, p.x) == 0 && Double.compare(y, p.y) == 0;
    }

    @Override
    public int hashCode() { return 31 * Double.hashCode(x) + Double.hashCode(y); }

    @Override
    public String toString() { return String.format("(%.4f, %.4f)", x, y); }
}
