package com.expressiongraph;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fruchterman–Reingold spring layout.
 *
 * Nodes start at random points of the unit square. Each iteration every
 * pair of nodes repels with strength k²/d and every edge pulls its ends
 * together with strength w·d²/k, where k = 1/sqrt(n). A node moves along its
 * net force by the current temperature, which starts at a tenth of the
 * initial extent and falls linearly to zero over the iteration budget.
 * The result is centred on the origin and scaled into [-1, 1].
 *
 * Forces of one iteration are computed from a read-only snapshot of the
 * previous positions; with {@code parallel} they are computed per node on
 * the common fork/join pool.
 */
public final class ForceDirectedLayout {
    private static final Logger LOGGER = LoggerFactory.getLogger(ForceDirectedLayout.class);

    static final double MIN_DISTANCE = 0.01;
    static final double INITIAL_TEMPERATURE = 0.1;

    private final Long seed;            // null = unseeded
    private final int iterations;
    private final double threshold;
    private final Duration timeBudget;  // null = no limit
    private final boolean parallel;

    private int lastIterations;

    private ForceDirectedLayout(Builder b) {
        this.seed = b.seed;
        this.iterations = b.iterations;
        this.threshold = b.threshold;
        this.timeBudget = b.timeBudget;
        this.parallel = b.parallel;
    }

    public static Builder builder() { return new Builder(); }

    /** Iterations run by the last {@link #layout(Graph)} call. */
    public int getLastIterations() { return lastIterations; }

    public Map<String, Position> layout(Graph g) {
        final int n = g.nodeCount();
        lastIterations = 0;
        if (n == 0) return Collections.emptyMap();
        if (n == 1) return Collections.singletonMap(g.node(0), Position.ORIGIN);

        Random rnd = seed == null ? new Random() : new Random(seed);
        double[] x = new double[n], y = new double[n];
        for (int i = 0; i < n; i++) { x[i] = rnd.nextDouble(); y[i] = rnd.nextDouble(); }

        final double k = Math.sqrt(1.0 / n);
        double t = INITIAL_TEMPERATURE * Math.max(extent(x), extent(y));
        final double dt = t / (iterations + 1);
        final long deadline = timeBudget == null ? Long.MAX_VALUE : System.nanoTime() + timeBudget.toNanos();

        final int[][] adj = g.adjacency();
        final int[][] w = g.adjacencyWeights();
        final double[] dx = new double[n], dy = new double[n];

        for (int iter = 0; iter < iterations; iter++) {
            IntStream nodes = IntStream.range(0, n);
            if (parallel) nodes = nodes.parallel();
            nodes.forEach(i -> displacement(i, x, y, adj[i], w[i], k, dx, dy));

            // move each node by t along its displacement
            double moved = 0.0;
            for (int i = 0; i < n; i++) {
                double len = Math.hypot(dx[i], dy[i]);
                if (len < MIN_DISTANCE) len = 0.1;
                double sx = dx[i] * t / len, sy = dy[i] * t / len;
                x[i] += sx;
                y[i] += sy;
                moved += sx * sx + sy * sy;
            }
            t -= dt;
            lastIterations = iter + 1;

            if (Math.sqrt(moved) / n < threshold) {
                LOGGER.debug("Layout converged after {} iterations", lastIterations);
                break;
            }
            if (System.nanoTime() > deadline) {
                LOGGER.warn("Layout time budget of {} exhausted after {} iterations", timeBudget, lastIterations);
                break;
            }
        }

        rescale(x, y);
        Map<String, Position> out = new LinkedHashMap<>(n * 2);
        for (int i = 0; i < n; i++) out.put(g.node(i), new Position(x[i], y[i]));
        return Collections.unmodifiableMap(out);
    }

    // net force on node i; writes dx[i], dy[i] only
    private static void displacement(int i, double[] x, double[] y, int[] nbrs, int[] weights,
                                     double k, double[] dx, double[] dy) {
        final double k2 = k * k;
        double fx = 0.0, fy = 0.0;
        for (int j = 0; j < x.length; j++) {
            if (j == i) continue;
            double ex = x[i] - x[j], ey = y[i] - y[j];
            double d = Math.max(Math.hypot(ex, ey), MIN_DISTANCE);
            double f = k2 / (d * d);
            fx += ex * f;
            fy += ey * f;
        }
        for (int a = 0; a < nbrs.length; a++) {
            int j = nbrs[a];
            double ex = x[i] - x[j], ey = y[i] - y[j];
            double d = Math.max(Math.hypot(ex, ey), MIN_DISTANCE);
            double f = weights[a] * d / k;
            fx -= ex * f;
            fy -= ey * f;
        }
        dx[i] = fx;
        dy[i] = fy;
    }

    private static double extent(double[] v) {
        double lo = Double.POSITIVE_INFINITY, hi = Double.NEGATIVE_INFINITY;
        for (double a : v) { lo = Math.min(lo, a); hi = Math.max(hi, a); }
        return hi - lo;
    }

    // centre on the origin, largest |coordinate| becomes 1
    static void rescale(double[] x, double[] y) {
        int n = x.length;
        double mx = 0.0, my = 0.0;
        for (int i = 0; i < n; i++) { mx += x[i]; my += y[i]; }
        mx /= n;
        my /= n;
        double lim = 0.0;
        for (int i = 0; i < n; i++) {
            x[i] -= mx;
            y[i] -= my;
            lim = Math.max(lim, Math.max(Math.abs(x[i]), Math.abs(y[i])));
        }
        if (lim > 0.0) {
            for (int i = 0; i < n; i++) { x[i] /= lim; y[i] /= lim; }
        }
    }

    public static final class Builder {
        private Long seed;
        private int iterations = 50;
        private double threshold = 1e-4;
        private Duration timeBudget;
        private boolean parallel;

        public Builder seed(Long v){ this.seed=v; return this; }
        public Builder iterations(int v){
            if (v < 0) throw new IllegalArgumentException("iterations must be >= 0: " + v);
            this.iterations=v; return this;
        }
        public Builder threshold(double v){ this.threshold=v; return this; }
        public Builder timeBudget(Duration v){ this.timeBudget=v; return this; }
        public Builder parallel(boolean v){ this.parallel=v; return this; }
        public ForceDirectedLayout build(){ return new ForceDirectedLayout(this); }
    }
}
