package com.expressiongraph;

import java.util.Locale;

/** Format and compression of an input file, derived from its name. */
public final class InputFormat {
    public enum Kind { LP, MPS }
    public enum Compression { NONE, GZIP, TAR_GZIP }

    public final Kind kind;
    public final Compression compression;

    private InputFormat(Kind kind, Compression compression) {
        this.kind = kind;
        this.compression = compression;
    }

    public static InputFormat of(Kind kind, Compression compression) {
        return new InputFormat(kind, compression);
    }

    /**
     * Accepts {@code .lp}, {@code .mps} and their {@code .gz} / {@code .tar.gz}
     * variants (case-insensitive).
     *
     * @throws IllegalArgumentException for any other extension
     */
    public static InputFormat detect(String fileName) {
        String low = fileName.toLowerCase(Locale.ROOT);
        Compression c = Compression.NONE;
        // .tar.gz before .gz, otherwise tar archives would be read as plain gzip
        if (low.endsWith(".tar.gz")) {
            c = Compression.TAR_GZIP;
            low = low.substring(0, low.length() - ".tar.gz".length());
        } else if (low.endsWith(".gz")) {
            c = Compression.GZIP;
            low = low.substring(0, low.length() - ".gz".length());
        }
        if (low.endsWith(".lp")) return new InputFormat(Kind.LP, c);
        if (low.endsWith(".mps")) return new InputFormat(Kind.MPS, c);
        throw new IllegalArgumentException("Unrecognized file extension: " + fileName);
    }

    @Override
    public String toString() {
        return kind + (compression == Compression.NONE ? "" : "/" + compression);
    }
}
