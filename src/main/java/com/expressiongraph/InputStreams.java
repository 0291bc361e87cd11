package com.expressiongraph;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;

/** Opens model files as decoded line readers, undoing gzip / tar.gz packing. */
public final class InputStreams {

    private InputStreams() {}

    public static BufferedReader open(Path file, InputFormat format) throws IOException {
        InputStream raw = new BufferedInputStream(Files.newInputStream(file));
        try {
            return reader(decompress(raw, format.compression, file));
        } catch (IOException | RuntimeException e) {
            raw.close();
            throw e;
        }
    }

    static InputStream decompress(InputStream raw, InputFormat.Compression compression, Path file)
            throws IOException {
        switch (compression) {
            case NONE:
                return raw;
            case GZIP:
                return new GZIPInputStream(raw);
            case TAR_GZIP: {
                TarArchiveInputStream tar = new TarArchiveInputStream(new GZIPInputStream(raw));
                TarArchiveEntry entry;
                while ((entry = tar.getNextEntry()) != null) {
                    if (!entry.isDirectory()) return tar;   // first regular entry
                }
                throw new IOException("No file entry in archive: " + file);
            }
            default:
                throw new IllegalStateException("Unknown compression: " + compression);
        }
    }

    private static BufferedReader reader(InputStream in) {
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }
}
