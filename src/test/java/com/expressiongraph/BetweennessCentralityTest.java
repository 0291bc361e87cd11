package com.expressiongraph;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;
import java.util.*;

public class BetweennessCentralityTest {

    private static Graph graph(String nodes, String... edges) {
        List<Edge> es = new ArrayList<>();
        for (String e : edges) {
            String[] p = e.split("-");
            es.add(new Edge(p[0], p[1], 1));
        }
        return new Graph(Arrays.asList(nodes.split(",")), es);
    }

    @Test
    public void pathMiddleIsOnlyBroker() {
        Map<String, Double> c = new BetweennessCentrality().compute(graph("a,b,c", "a-b", "b-c"));
        assertTrue(c.get("b") > c.get("a"));
        assertEquals(0.0, c.get("a"), 1e-12);
        assertEquals(0.0, c.get("c"), 1e-12);
        assertEquals(1.0, c.get("b"), 1e-12);
    }

    @Test
    public void starCentreIsOne() {
        Map<String, Double> c = new BetweennessCentrality().compute(graph("h,l1,l2,l3,l4", "h-l1", "h-l2", "h-l3", "h-l4"));
        assertEquals(1.0, c.get("h"), 1e-12);
        for (String leaf : Arrays.asList("l1", "l2", "l3", "l4")) assertEquals(0.0, c.get(leaf), 1e-12);
    }

    @Test
    public void longerPathValues() {
        // path a-b-c-d-e: b lies on 3 of 6 pairs avoiding it, c on 4
        Map<String, Double> c = new BetweennessCentrality().compute(graph("a,b,c,d,e", "a-b", "b-c", "c-d", "d-e"));
        assertEquals(0.5, c.get("b"), 1e-12);
        assertEquals(4.0 / 6.0, c.get("c"), 1e-12);
        assertEquals(0.5, c.get("d"), 1e-12);
        assertEquals(0.0, c.get("e"), 1e-12);
    }

    @Test
    public void splitShortestPathsShareCredit() {
        // square a-b-c-d-a: a..c has two shortest paths, via b and via d
        Map<String, Double> c = new BetweennessCentrality().compute(graph("a,b,c,d", "a-b", "b-c", "c-d", "a-d"));
        for (double v : c.values()) assertEquals(1.0 / 6.0, v, 1e-12);
    }

    @Test
    public void completeGraphHasNoBrokers() {
        Map<String, Double> c = new BetweennessCentrality().compute(graph("a,b,c,d", "a-b", "a-c", "a-d", "b-c", "b-d", "c-d"));
        for (double v : c.values()) assertEquals(0.0, v, 1e-12);
    }

    @Test
    public void isolatedNodesAndComponents() {
        Map<String, Double> c = new BetweennessCentrality().compute(graph("a,b,c,x,y", "a-b", "b-c", "x-y"));
        assertEquals(0.0, c.get("x"), 1e-12);
        assertEquals(0.0, c.get("y"), 1e-12);
        // b brokers a<->c only: 2 / (4*3)
        assertEquals(2.0 / 12.0, c.get("b"), 1e-12);
        assertEquals(5, c.size());
    }

    @Test
    public void edgeWeightsAreIgnored() {
        Graph light = graph("a,b,c", "a-b", "b-c", "a-c");
        Graph heavy = new Graph(Arrays.asList("a", "b", "c"),
                Arrays.asList(new Edge("a", "b", 1), new Edge("b", "c", 1), new Edge("a", "c", 50)));
        assertEquals(new BetweennessCentrality().compute(light), new BetweennessCentrality().compute(heavy));
    }

    @Test
    public void tinyGraphsAreAllZero() {
        assertTrue(new BetweennessCentrality().compute(graph("a")).values().stream().allMatch(v -> v == 0.0));
        assertEquals(Map.of("a", 0.0, "b", 0.0), new BetweennessCentrality().compute(graph("a,b", "a-b")));
        assertTrue(new BetweennessCentrality().compute(new Graph(List.of(), List.of())).isEmpty());
    }

    @Test
    public void threadsGiveSameResult() {
        List<String> nodes = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < 60; i++) nodes.add("n" + i);
        Random r = new Random(9);
        Set<String> seen = new HashSet<>();
        for (int k = 0; k < 150; k++) {
            int a = r.nextInt(60), b = r.nextInt(60);
            if (a == b) continue;
            Edge e = new Edge("n" + a, "n" + b, 1);
            if (seen.add(e.u + "|" + e.v)) edges.add(e);
        }
        Graph g = new Graph(nodes, edges);
        Map<String, Double> one = new BetweennessCentrality(1).compute(g);
        Map<String, Double> four = new BetweennessCentrality(4).compute(g);
        for (String id : nodes) {
            assertEquals(one.get(id), four.get(id), 1e-12, id);
            assertTrue(one.get(id) >= 0.0 && one.get(id) <= 1.0);
        }
    }
}
