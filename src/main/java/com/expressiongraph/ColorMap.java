package com.expressiongraph;

import java.awt.Color;

/** Piecewise-linear approximation of matplotlib's "plasma" colour map. */
public final class ColorMap {

    // evenly spaced stops from 0 to 1
    private static final int[][] PLASMA = {
            { 13,   8, 135 },
            { 92,   1, 166 },
            { 126,  3, 168 },
            { 168, 34, 150 },
            { 204, 71, 120 },
            { 230, 108, 92 },
            { 248, 149, 64 },
            { 253, 195, 40 },
            { 240, 249, 33 }
    };

    private ColorMap() {}

    /** Colour for {@code t} in [0, 1]; values outside are clamped, NaN maps to 0. */
    public static Color plasma(double t) {
        if (Double.isNaN(t) || t < 0.0) t = 0.0;
        if (t > 1.0) t = 1.0;
        double pos = t * (PLASMA.length - 1);
        int lo = (int) Math.floor(pos);
        if (lo >= PLASMA.length - 1) return rgb(PLASMA[PLASMA.length - 1]);
        double f = pos - lo;
        int[] a = PLASMA[lo], b = PLASMA[lo + 1];
        return new Color(
                (int) Math.round(a[0] + f * (b[0] - a[0])),
                (int) Math.round(a[1] + f * (b[1] - a[1])),
                (int) Math.round(a[2] + f * (b[2] - a[2])));
    }

    private static Color rgb(int[] c) { return new Color(c[0], c[1], c[2]); }
}
