package com.example.objectcompressor.service;

import com.example.objectcompressor.config.CompressorProperties;

import java.io.IOException;
import java.io.OutputStream;
import java.util.zip.Deflater;
import java.util.zip.GZIPOutputStream;

/**
 * Gzip streams at a configurable deflate level.
 */
public final class Compressors {

    public static final String GZIP_ENCODING = "gzip";

    private static final int BUFFER_SIZE = 64 * 1024;

    private Compressors() {
    }

    /**
     * Wraps {@code out} in a gzip stream. {@code level} follows the deflate scale: -1 default,
     * 0 stored, 1 through 9, and -2 for Huffman-only coding.
     */
    public static GZIPOutputStream gzip(OutputStream out, int level) throws IOException {
        if (level < CompressorProperties.HUFFMAN_ONLY || level > CompressorProperties.BEST_COMPRESSION) {
            throw new IllegalArgumentException("unsupported compression level " + level);
        }
        return new LeveledGzipOutputStream(out, level);
    }

    private static final class LeveledGzipOutputStream extends GZIPOutputStream {

        LeveledGzipOutputStream(OutputStream out, int level) throws IOException {
            super(out, BUFFER_SIZE);
            if (level == CompressorProperties.HUFFMAN_ONLY) {
                def.setLevel(Deflater.DEFAULT_COMPRESSION);
                def.setStrategy(Deflater.HUFFMAN_ONLY);
            } else {
                def.setLevel(level);
            }
        }
    }
}
