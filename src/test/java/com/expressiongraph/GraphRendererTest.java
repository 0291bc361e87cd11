package com.expressiongraph;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GraphRendererTest {

    @TempDir
    Path dir;

    private static Graph pair() {
        return new Graph(Arrays.asList("a", "b"), Collections.singletonList(new Edge("a", "b", 1)));
    }

    private static Map<String, Position> pairLayout() {
        Map<String, Position> p = new LinkedHashMap<>();
        p.put("a", new Position(-1, 0));
        p.put("b", new Position(1, 0));
        return p;
    }

    @Test
    public void sizeScaling() {
        assertEquals(1.0, GraphRenderer.sizeFactor(0), 1e-12);
        assertEquals(0.5, GraphRenderer.sizeFactor(2000), 1e-12);
        assertEquals(0.0, GraphRenderer.sizeFactor(10_000), 1e-12);
        assertEquals(325.0, GraphRenderer.nodeArea(0), 1e-12);
        assertEquals(25.0, GraphRenderer.nodeArea(4000), 1e-12);
        assertEquals(1.1, GraphRenderer.edgeWidth(0), 1e-12);
        assertEquals(0.1, GraphRenderer.edgeWidth(5000), 1e-12);
    }

    @Test
    public void darkThemeBackgroundAndNodeColours() {
        Map<String, Double> scores = Map.of("a", 0.0, "b", 1.0);
        BufferedImage img = new GraphRenderer(200, true).draw(pair(), pairLayout(), scores);
        assertEquals(200, img.getWidth());
        assertEquals(Color.BLACK.getRGB(), img.getRGB(1, 1));

        // node centres sit on the horizontal midline, lowest score left, highest right
        int y = 100;
        int left = -1, right = -1;
        for (int x = 0; x < 200; x++) {
            int rgb = img.getRGB(x, y) | 0xFF000000;
            if (left < 0 && rgb == ColorMap.plasma(0.0).getRGB()) left = x;
            if (rgb == ColorMap.plasma(1.0).getRGB()) right = x;
        }
        assertTrue(left >= 0 && right > left, "left=" + left + " right=" + right);
    }

    @Test
    public void lightThemeBackground() {
        BufferedImage img = new GraphRenderer(120, false).draw(pair(), pairLayout(), Map.of("a", 0.2, "b", 0.2));
        assertEquals(Color.WHITE.getRGB(), img.getRGB(0, 0));
    }

    @Test
    public void writesPng() throws IOException {
        Path out = dir.resolve("g.png");
        new GraphRenderer(64, false).render(pair(), pairLayout(), Map.of("a", 0.0, "b", 0.0), out);
        BufferedImage back = ImageIO.read(out.toFile());
        assertNotNull(back);
        assertEquals(64, back.getHeight());
    }

    @Test
    public void emptyGraphRendersBackgroundOnly() {
        BufferedImage img = new GraphRenderer(32, true).draw(
                new Graph(List.of(), List.of()), Collections.emptyMap(), Collections.emptyMap());
        assertEquals(Color.BLACK.getRGB(), img.getRGB(16, 16));
    }

    @Test
    public void rejectsTinyCanvas() {
        assertThrows(IllegalArgumentException.class, () -> new GraphRenderer(4, false));
    }

    @Test
    public void plasmaEndpointsAndClamping() {
        assertEquals(new Color(13, 8, 135), ColorMap.plasma(0.0));
        assertEquals(new Color(240, 249, 33), ColorMap.plasma(1.0));
        assertEquals(ColorMap.plasma(0.0), ColorMap.plasma(-3.0));
        assertEquals(ColorMap.plasma(1.0), ColorMap.plasma(7.0));
        assertEquals(ColorMap.plasma(0.0), ColorMap.plasma(Double.NaN));
        assertEquals(new Color(204, 71, 120), ColorMap.plasma(0.5));
    }
}
