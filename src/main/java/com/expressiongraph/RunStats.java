package com.expressiongraph;

public final class RunStats {
    public int variables;
    public int constraints;
    public int edges;
    public int layoutIterations;
    public long readMillis;
    public long projectMillis;
    public long analyseMillis;   // layout and centrality, run side by side
    public long renderMillis;

    @Override
    public String toString() {
        return "*Totals: variables=" + variables +
                " constraints=" + constraints +
                " edges=" + edges +
                " layout_iterations=" + layoutIterations +
                "  time(ms) read=" + readMillis +
                " project=" + projectMillis +
                " analyse=" + analyseMillis +
                " render=" + renderMillis;
    }
}
