package com.expressiongraph;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One visualization run:
 *  - parse the command line (OptionsParser)
 *  - pick the reader from the file name, before touching the file
 *  - read the model, project it to the co-occurrence graph
 *  - compute layout and centrality side by side
 *  - render the PNG and, if asked, the JSON export
 */
public final class VisualizeDriver {
    private static final Logger LOGGER = LoggerFactory.getLogger(VisualizeDriver.class);

    /** Everything a renderer needs, plus run statistics. */
    public static final class Products {
        public final Model model;
        public final Graph graph;
        public final Map<String, Position> layout;
        public final Map<String, Double> centrality;   // raw, before any log transform
        public final RunStats stats;

        Products(Model model, Graph graph, Map<String, Position> layout,
                 Map<String, Double> centrality, RunStats stats) {
            this.model = model;
            this.graph = graph;
            this.layout = layout;
            this.centrality = centrality;
            this.stats = stats;
        }
    }

    /** Entry point for one job; returns the process exit code. */
    public int run(String[] args) {
        VisualizeOptions opts;
        try {
            opts = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage();
            System.err.println("Argument error: " + e.getMessage());
            return 2;
        }

        try {
            visualize(opts);
            return 0;
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        } catch (FileNotFoundException | NoSuchFileException e) {
            System.err.println("File not found: " + opts.inputPath);
            return 1;
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            LOGGER.error("Unrecoverable error", e);
            return -1;
        }
    }

    public Products visualize(VisualizeOptions opts) throws IOException {
        Products p = analyse(opts);

        long t0 = System.nanoTime();
        Map<String, Double> colours = opts.log ? logScale(p.centrality) : p.centrality;
        LOGGER.info("Saving graph to {}...", opts.outputPath);
        new GraphRenderer(opts.imageSize, opts.dark).render(p.graph, p.layout, colours, Paths.get(opts.outputPath));
        if (opts.jsonPath != null) {
            LOGGER.info("Writing JSON to {}...", opts.jsonPath);
            GraphExport.write(GraphExport.toDocument(p.graph, p.layout, colours, opts.weighted, opts.log),
                    Paths.get(opts.jsonPath));
        }
        p.stats.renderMillis = millisSince(t0);
        LOGGER.info("{}", p.stats);
        return p;
    }

    /** Read, project, lay out and score; no output is written. */
    public Products analyse(VisualizeOptions opts) throws IOException {
        RunStats st = new RunStats();
        InputFormat format = InputFormat.detect(opts.inputPath);   // fails before any I/O

        long t0 = System.nanoTime();
        LOGGER.info("Reading nodes and edges from {}...", opts.inputPath);
        Model model;
        try (BufferedReader in = InputStreams.open(Paths.get(opts.inputPath), format)) {
            model = ModelReader.forFormat(format.kind).read(in);
        }
        st.variables = model.variableCount();
        st.constraints = model.constraintCount();
        st.readMillis = millisSince(t0);
        LOGGER.info("Found {} variables and {} constraints.", st.variables, st.constraints);

        t0 = System.nanoTime();
        Graph graph = GraphProjector.project(model, opts.weighted);
        st.edges = graph.edgeCount();
        st.projectMillis = millisSince(t0);

        t0 = System.nanoTime();
        LOGGER.info("Computing layout...");
        ForceDirectedLayout layout = ForceDirectedLayout.builder()
                .seed(opts.seed)
                .iterations(opts.iterations)
                .timeBudget(opts.layoutBudget)
                .parallel(opts.threads > 1)
                .build();
        BetweennessCentrality centrality = new BetweennessCentrality(opts.threads);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        Map<String, Position> positions;
        Map<String, Double> scores;
        try {
            CompletableFuture<Map<String, Position>> lf = CompletableFuture.supplyAsync(() -> layout.layout(graph), pool);
            CompletableFuture<Map<String, Double>> cf = CompletableFuture.supplyAsync(() -> centrality.compute(graph), pool);
            positions = lf.join();
            scores = cf.join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Layout or centrality failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
        st.layoutIterations = layout.getLastIterations();
        st.analyseMillis = millisSince(t0);

        return new Products(model, graph, positions, scores, st);
    }

    /** log(c + 1) per node; applied for colouring only. */
    public static Map<String, Double> logScale(Map<String, Double> scores) {
        Map<String, Double> out = new LinkedHashMap<>(scores.size() * 2);
        for (Map.Entry<String, Double> e : scores.entrySet()) out.put(e.getKey(), Math.log(e.getValue() + 1.0));
        return Collections.unmodifiableMap(out);
    }

    private static long millisSince(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }

    static void usage() {
        System.err.println(
                "Usage: exvis-java [options] -i <input-file>\n" +
                        "Input: .lp / .mps, optionally .gz or .tar.gz compressed\n" +
                        "Options:\n" +
                        "  -i, --input <path>     model file\n" +
                        "  -o, --output <path>    PNG to write (default: input with .png extension)\n" +
                        "  -l, --log              log scale for centrality colours\n" +
                        "  -d, --dark             dark theme\n" +
                        "  -w, --weighted         weight edges by number of shared constraints\n" +
                        "  -s, --seed <n>         layout seed (default: random)\n" +
                        "  --iterations <n>       layout iterations (default 50)\n" +
                        "  --time-budget <sec>    stop layout after this many seconds\n" +
                        "  --threads <n>          worker threads for layout and centrality (default 1)\n" +
                        "  --size <px>            image side in pixels (default 4500)\n" +
                        "  --json <path>          also write nodes, edges, positions and scores as JSON\n"
        );
    }
}
