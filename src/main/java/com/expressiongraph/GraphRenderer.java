package com.expressiongraph;

import java.awt.AlphaComposite;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Line2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import javax.imageio.ImageIO;

/**
 * Draws a laid-out graph onto a square PNG. Nodes are coloured by their
 * score through {@link ColorMap#plasma(double)}; markers and edges get
 * thinner as the graph grows and bottom out at 4000 nodes.
 */
public final class GraphRenderer {

    public static final int DEFAULT_SIZE = 4500;   // 30in at 150dpi
    static final double DPI = 150.0;
    static final double SIZE_SATURATION = 4000.0;
    static final float EDGE_ALPHA = 0.3f;

    private final int size;
    private final boolean dark;

    public GraphRenderer(int size, boolean dark) {
        if (size < 16) throw new IllegalArgumentException("Canvas too small: " + size);
        this.size = size;
        this.dark = dark;
    }

    /** 1 for tiny graphs, 0 from 4000 nodes on. */
    static double sizeFactor(int nodeCount) {
        return 1.0 - Math.min(1.0, nodeCount / SIZE_SATURATION);
    }

    /** Marker area in pt². */
    static double nodeArea(int nodeCount) { return 25.0 + sizeFactor(nodeCount) * 300.0; }

    /** Edge width in pt. */
    static double edgeWidth(int nodeCount) { return 0.1 + sizeFactor(nodeCount); }

    static double toPixels(double points) { return points * DPI / 72.0; }

    public void render(Graph g, Map<String, Position> pos, Map<String, Double> scores, Path out)
            throws IOException {
        BufferedImage img = draw(g, pos, scores);
        if (!ImageIO.write(img, "png", out.toFile()))
            throw new IOException("No PNG writer available");
    }

    public BufferedImage draw(Graph g, Map<String, Position> pos, Map<String, Double> scores) {
        final int n = g.nodeCount();
        final double diameter = toPixels(Math.sqrt(nodeArea(n)));
        final double margin = diameter;

        double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (Position p : pos.values()) {
            minX = Math.min(minX, p.x); maxX = Math.max(maxX, p.x);
            minY = Math.min(minY, p.y); maxY = Math.max(maxY, p.y);
        }
        if (pos.isEmpty()) { minX = maxX = minY = maxY = 0.0; }
        double span = Math.max(maxX - minX, maxY - minY);
        if (!(span > 0.0)) span = 1.0;
        final double scale = (size - 2 * margin) / span;
        final double ox = margin + ((size - 2 * margin) - (maxX - minX) * scale) / 2 - minX * scale;
        final double oy = margin + ((size - 2 * margin) - (maxY - minY) * scale) / 2 + maxY * scale;

        double lo = Double.POSITIVE_INFINITY, hi = Double.NEGATIVE_INFINITY;
        for (double s : scores.values()) { lo = Math.min(lo, s); hi = Math.max(hi, s); }
        final double range = hi > lo ? hi - lo : 0.0;

        BufferedImage img = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D gr = img.createGraphics();
        try {
            gr.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            gr.setColor(dark ? Color.BLACK : Color.WHITE);
            gr.fillRect(0, 0, size, size);

            // edges below nodes
            gr.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, EDGE_ALPHA));
            gr.setColor(dark ? Color.WHITE : Color.BLACK);
            gr.setStroke(new BasicStroke((float) toPixels(edgeWidth(n))));
            for (Edge e : g.getEdges()) {
                Position a = pos.get(e.u), b = pos.get(e.v);
                if (a == null || b == null) continue;
                gr.draw(new Line2D.Double(ox + a.x * scale, oy - a.y * scale, ox + b.x * scale, oy - b.y * scale));
            }

            gr.setComposite(AlphaComposite.SrcOver);
            for (String id : g.getNodes()) {
                Position p = pos.get(id);
                if (p == null) continue;
                double s = scores.getOrDefault(id, 0.0);
                gr.setColor(ColorMap.plasma(range > 0.0 ? (s - lo) / range : 0.0));
                double cx = ox + p.x * scale, cy = oy - p.y * scale;
                gr.fill(new Ellipse2D.Double(cx - diameter / 2, cy - diameter / 2, diameter, diameter));
            }
        } finally {
            gr.dispose();
        }
        return img;
    }
}
