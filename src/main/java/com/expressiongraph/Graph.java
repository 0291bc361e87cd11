package com.expressiongraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable undirected co-occurrence graph. Nodes keep the order they were
 * given in; algorithms work on node indices through {@link #neighbours(int)}
 * and {@link #neighbourWeights(int)}.
 */
public final class Graph {
    private final List<String> nodes;
    private final List<Edge> edges;
    private final Map<String, Integer> index;
    private final int[][] adj;          // neighbour indices per node
    private final int[][] adjWeight;    // parallel to adj

    public Graph(List<String> nodes, List<Edge> edges) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        this.index = new HashMap<>(nodes.size() * 2);
        for (int i = 0; i < nodes.size(); i++) {
            if (index.put(nodes.get(i), i) != null)
                throw new IllegalArgumentException("Duplicate node: " + nodes.get(i));
        }

        int n = nodes.size();
        int[] degree = new int[n];
        for (Edge e : edges) {
            degree[require(e.u)]++;
            degree[require(e.v)]++;
        }
        adj = new int[n][];
        adjWeight = new int[n][];
        for (int i = 0; i < n; i++) { adj[i] = new int[degree[i]]; adjWeight[i] = new int[degree[i]]; }
        int[] fill = new int[n];
        for (Edge e : edges) {
            int a = index.get(e.u), b = index.get(e.v);
            adj[a][fill[a]] = b; adjWeight[a][fill[a]++] = e.weight;
            adj[b][fill[b]] = a; adjWeight[b][fill[b]++] = e.weight;
        }
    }

    private int require(String id) {
        Integer i = index.get(id);
        if (i == null) throw new IllegalArgumentException("Edge endpoint is not a node: " + id);
        return i;
    }

    public List<String> getNodes() { return nodes; }
    public List<Edge> getEdges() { return edges; }
    public int nodeCount() { return nodes.size(); }
    public int edgeCount() { return edges.size(); }
    public String node(int i) { return nodes.get(i); }

    /** Index of {@code id}, or -1 when absent. */
    public int indexOf(String id) {
        Integer i = index.get(id);
        return i == null ? -1 : i;
    }

    public int[] neighbours(int i) { return adj[i].clone(); }
    public int[] neighbourWeights(int i) { return adjWeight[i].clone(); }
    public int degree(int i) { return adj[i].length; }

    // package-private, no copy; callers must not write
    int[][] adjacency() { return adj; }
    int[][] adjacencyWeights() { return adjWeight; }
}
