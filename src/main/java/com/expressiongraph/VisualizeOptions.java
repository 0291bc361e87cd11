package com.expressiongraph;

import java.time.Duration;

public final class VisualizeOptions {
    public final String inputPath;
    public final String outputPath;        // never null; derived from input when not given
    public final String jsonPath;          // null = no export

    // style
    public final boolean log;              // log(c + 1) on centrality before colouring
    public final boolean dark;
    public final boolean weighted;         // edge weight = shared constraint count
    public final int imageSize;            // canvas side in px

    // layout / centrality
    public final Long seed;                // null = random placement
    public final int iterations;
    public final Duration layoutBudget;    // null = iteration budget only
    public final int threads;

    private VisualizeOptions(Builder b) {
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath != null ? b.outputPath : defaultOutput(b.inputPath);
        this.jsonPath = b.jsonPath;
        this.log = b.log;
        this.dark = b.dark;
        this.weighted = b.weighted;
        this.imageSize = b.imageSize;
        this.seed = b.seed;
        this.iterations = b.iterations;
        this.layoutBudget = b.layoutBudget;
        this.threads = b.threads;
    }

    /** {@code model.mps.gz -> model.mps.png}: only the final extension is replaced. */
    static String defaultOutput(String input) {
        int dot = input.lastIndexOf('.');
        int sep = Math.max(input.lastIndexOf('/'), input.lastIndexOf('\\'));
        if (dot <= sep) return input + ".png";
        return input.substring(0, dot) + ".png";
    }

    public static final class Builder {
        private String inputPath, outputPath, jsonPath;
        private boolean log, dark, weighted;
        private int imageSize = GraphRenderer.DEFAULT_SIZE;
        private Long seed;
        private int iterations = 50, threads = 1;
        private Duration layoutBudget;

        public Builder inputPath(String v){ this.inputPath=v; return this; }
        public Builder outputPath(String v){ this.outputPath=v; return this; }
        public Builder jsonPath(String v){ this.jsonPath=v; return this; }
        public Builder log(boolean v){ this.log=v; return this; }
        public Builder dark(boolean v){ this.dark=v; return this; }
        public Builder weighted(boolean v){ this.weighted=v; return this; }
        public Builder imageSize(int v){ this.imageSize=v; return this; }
        public Builder seed(Long v){ this.seed=v; return this; }
        public Builder iterations(int v){ this.iterations=v; return this; }
        public Builder layoutBudget(Duration v){ this.layoutBudget=v; return this; }
        public Builder threads(int v){ this.threads=Math.max(1,v); return this; }
        public VisualizeOptions build(){
            if (inputPath == null || inputPath.isEmpty()) throw new IllegalArgumentException("Missing input file");
            return new VisualizeOptions(this);
        }
    }
}
