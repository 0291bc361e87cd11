package com.expressiongraph;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON form of a visualization: nodes with position and score, edges with
 * weight. Lets other renderers draw the same picture.
 */
public final class GraphExport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final class NodeEntry {
        public final String id;
        public final double x;
        public final double y;
        public final double centrality;

        @JsonCreator
        public NodeEntry(@JsonProperty("id") String id,
                         @JsonProperty("x") double x,
                         @JsonProperty("y") double y,
                         @JsonProperty("centrality") double centrality) {
            this.id = id;
            this.x = x;
            this.y = y;
            this.centrality = centrality;
        }
    }

    public static final class EdgeEntry {
        public final String source;
        public final String target;
        public final int weight;

        @JsonCreator
        public EdgeEntry(@JsonProperty("source") String source,
                         @JsonProperty("target") String target,
                         @JsonProperty("weight") int weight) {
            this.source = source;
            this.target = target;
            this.weight = weight;
        }
    }

    public static final class Document {
        public final List<NodeEntry> nodes;
        public final List<EdgeEntry> edges;
        public final boolean weighted;
        public final boolean log;

        @JsonCreator
        public Document(@JsonProperty("nodes") List<NodeEntry> nodes,
                        @JsonProperty("edges") List<EdgeEntry> edges,
                        @JsonProperty("weighted") boolean weighted,
                        @JsonProperty("log") boolean log) {
            this.nodes = nodes;
            this.edges = edges;
            this.weighted = weighted;
            this.log = log;
        }
    }

    private GraphExport() {}

    public static Document toDocument(Graph g, Map<String, Position> pos, Map<String, Double> scores,
                                      boolean weighted, boolean log) {
        List<NodeEntry> nodes = new ArrayList<>(g.nodeCount());
        for (String id : g.getNodes()) {
            Position p = pos.getOrDefault(id, Position.ORIGIN);
            nodes.add(new NodeEntry(id, p.x, p.y, scores.getOrDefault(id, 0.0)));
        }
        List<EdgeEntry> edges = new ArrayList<>(g.edgeCount());
        for (Edge e : g.getEdges()) edges.add(new EdgeEntry(e.u, e.v, e.weight));
        return new Document(nodes, edges, weighted, log);
    }

    public static void write(Document doc, Path out) throws IOException {
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), doc);
    }

    public static Document read(Path in) throws IOException {
        return MAPPER.readValue(in.toFile(), Document.class);
    }
}
