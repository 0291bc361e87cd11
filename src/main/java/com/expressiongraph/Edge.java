package com.expressiongraph;

import java.util.Objects;

/** Undirected edge; {@code u} is always the lexicographically smaller id. */
public final class Edge {
    public final String u;
    public final String v;
    public final int weight;

    public Edge(String a, String b, int weight) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.equals(b)) throw new IllegalArgumentException("Self loop on " + a);
        if (weight < 1) throw new IllegalArgumentException("Weight must be positive: " + weight);
        if (a.compareTo(b) <= 0) { this.u = a; this.v = b; }
        else { this.u = b; this.v = a; }
        this.weight = weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge e = (Edge) o;
        return weight == e.weight && u.equals(e.u) && v.equals(e.v);
    }

    @Override
    public int hashCode() { return Objects.hash(u, v, weight); }

    @Override
    public String toString() { return "(" + u + "," + v + ")" + (weight == 1 ? "" : "x" + weight); }
}
