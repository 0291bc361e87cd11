package com.expressiongraph;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;

/** Reads variable/constraint structure from decoded text, one line at a time. */
public interface ModelReader {

    /** Reads all lines of {@code in} and returns the frozen model. */
    Model read(BufferedReader in) throws IOException;

    default Model read(String text) {
        try (BufferedReader br = new BufferedReader(new StringReader(text))) {
            return read(br);
        } catch (IOException e) {
            throw new IllegalStateException("I/O error on in-memory text", e);
        }
    }

    static ModelReader forFormat(InputFormat.Kind kind) {
        switch (kind) {
            case LP: return new LpReader();
            case MPS: return new MpsReader();
            default: throw new IllegalArgumentException("No reader for " + kind);
        }
    }
}
