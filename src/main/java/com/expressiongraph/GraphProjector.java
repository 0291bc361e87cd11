package com.expressiongraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a model into its variable co-occurrence graph.
 *
 * Every unordered pair of distinct variables in a constraint is one
 * co-occurrence; a pair counts at most once per constraint no matter how
 * often either variable repeats in that row. In weighted mode the edge weight
 * is the number of constraints the pair shares, otherwise it is 1.
 *
 * Cost is quadratic in the row length, so a single row with thousands of
 * variables dominates the run time.
 */
public final class GraphProjector {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphProjector.class);

    private GraphProjector() {}

    public static Graph project(Model model, boolean weighted) {
        List<String> nodes = new ArrayList<>(model.variableCount());
        for (Variable v : model.getVariables()) nodes.add(v.getId());

        Map<PairKey, int[]> counts = new LinkedHashMap<>();
        for (Constraint c : model.getConstraints()) {
            List<String> ids = new ArrayList<>(new LinkedHashSet<>(c.getVariableIds()));
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    counts.computeIfAbsent(PairKey.of(ids.get(i), ids.get(j)), k -> new int[1])[0]++;
                }
            }
        }

        List<Edge> edges = new ArrayList<>(counts.size());
        for (Map.Entry<PairKey, int[]> e : counts.entrySet()) {
            edges.add(new Edge(e.getKey().a, e.getKey().b, weighted ? e.getValue()[0] : 1));
        }
        LOGGER.debug("Projected {} nodes and {} edges (weighted={})", nodes.size(), edges.size(), weighted);
        return new Graph(nodes, edges);
    }

    // canonical unordered pair, a < b
    private static final class PairKey {
        final String a, b;

        private PairKey(String a, String b) { this.a = a; this.b = b; }

        static PairKey of(String x, String y) {
            return x.compareTo(y) < 0 ? new PairKey(x, y) : new PairKey(y, x);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof PairKey)) return false;
            PairKey p = (PairKey) o;
            return a.equals(p.a) && b.equals(p.b);
        }

        @Override
        public int hashCode() { return 31 * a.hashCode() + b.hashCode(); }
    }
}
