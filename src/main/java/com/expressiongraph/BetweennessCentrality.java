package com.expressiongraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalized betweenness centrality (Brandes 2001) on the unweighted graph.
 * Edge weights are ignored: every edge has length 1.
 *
 * <p>Summing the dependencies over all sources counts every unordered pair
 * twice (once from each end), so the sum is divided by (n-1)(n-2), the number
 * of ordered pairs not involving the node. Values lie in [0, 1]; with fewer
 * than three nodes all values are 0.</p>
 *
 * <p>Sources are split into contiguous blocks, one per worker. Partial sums
 * are added in block order so the result does not depend on scheduling.</p>
 */
public final class BetweennessCentrality {
    private static final Logger LOGGER = LoggerFactory.getLogger(BetweennessCentrality.class);

    private final int threads;

    public BetweennessCentrality() { this(1); }

    public BetweennessCentrality(int threads) {
        this.threads = Math.max(1, threads);
    }

    public Map<String, Double> compute(Graph g) {
        final int n = g.nodeCount();
        double[] cb = n <= 2 ? new double[n] : accumulate(g);

        double scale = n <= 2 ? 0.0 : 1.0 / ((double) (n - 1) * (n - 2));
        Map<String, Double> out = new LinkedHashMap<>(n * 2);
        for (int i = 0; i < n; i++) out.put(g.node(i), Math.min(1.0, cb[i] * scale));
        return Collections.unmodifiableMap(out);
    }

    private double[] accumulate(Graph g) {
        final int n = g.nodeCount();
        final int[][] adj = g.adjacency();
        int workers = Math.min(threads, n);
        if (workers == 1) return sourceBlock(adj, 0, n);

        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<double[]>> parts = new ArrayList<>(workers);
            int block = (n + workers - 1) / workers;
            for (int from = 0; from < n; from += block) {
                final int lo = from, hi = Math.min(n, from + block);
                parts.add(pool.submit(() -> sourceBlock(adj, lo, hi)));
            }
            double[] cb = new double[n];
            for (Future<double[]> f : parts) {
                double[] part = f.get();
                for (int i = 0; i < n; i++) cb[i] += part[i];
            }
            LOGGER.debug("Betweenness over {} sources on {} workers", n, parts.size());
            return cb;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while computing betweenness", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Betweenness worker failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    /** Dependency sums for sources lo..hi-1. */
    static double[] sourceBlock(int[][] adj, int lo, int hi) {
        final int n = adj.length;
        double[] cb = new double[n];

        // per-source scratch, reused
        int[] order = new int[n];        // BFS discovery order
        int[] dist = new int[n];
        double[] sigma = new double[n];  // shortest path counts
        double[] delta = new double[n];

        for (int s = lo; s < hi; s++) {
            Arrays.fill(dist, -1);
            Arrays.fill(sigma, 0.0);
            Arrays.fill(delta, 0.0);
            dist[s] = 0;
            sigma[s] = 1.0;

            int head = 0, tail = 0;
            order[tail++] = s;
            while (head < tail) {
                int v = order[head++];
                for (int w : adj[v]) {
                    if (dist[w] < 0) {
                        dist[w] = dist[v] + 1;
                        order[tail++] = w;
                    }
                    if (dist[w] == dist[v] + 1) sigma[w] += sigma[v];
                }
            }

            // farthest first; predecessors of w are its neighbours one level closer
            for (int idx = tail - 1; idx > 0; idx--) {
                int w = order[idx];
                double coeff = (1.0 + delta[w]) / sigma[w];
                for (int v : adj[w]) {
                    if (dist[v] == dist[w] - 1) delta[v] += sigma[v] * coeff;
                }
                cb[w] += delta[w];
            }
        }
        return cb;
    }
}
