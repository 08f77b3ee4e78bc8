package io.liparakis.nbtis.region;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;
import java.util.zip.ZipException;

/**
 * Reusable zlib state for chunk blobs. Not thread-safe; hold one per thread.
 */
final class CompressionContext {
    private static final int COMPRESSION_BUFFER_SIZE = 8192;

    private final Deflater deflater;
    private final Inflater inflater;
    private final byte[] buffer = new byte[COMPRESSION_BUFFER_SIZE];
    private final ByteArrayOutputStream outputStream = new ByteArrayOutputStream(COMPRESSION_BUFFER_SIZE);

    CompressionContext(int level) {
        this(new Deflater(level), new Inflater());
    }

    // Visible for testing
    CompressionContext(Deflater deflater, Inflater inflater) {
        this.deflater = deflater;
        this.inflater = inflater;
    }

    /**
     * Compresses data into a zlib stream.
     *
     * @param data the raw data
     * @return the compressed data
     */
    byte[] compress(byte[] data) {
        deflater.reset();
        deflater.setInput(data);
        deflater.finish();
        outputStream.reset();

        while (!deflater.finished()) {
            int bytesCompressed = deflater.deflate(buffer);
            outputStream.write(buffer, 0, bytesCompressed);
        }

        return outputStream.toByteArray();
    }

    /**
     * Decompresses a complete zlib stream.
     *
     * @param data the compressed data
     * @return the raw data
     * @throws ZipException if the stream is corrupt, truncated or needs a preset dictionary
     */
    byte[] decompress(byte[] data) throws ZipException {
        inflater.reset();
        inflater.setInput(data);
        outputStream.reset();

        try {
            while (!inflater.finished()) {
                int bytesDecompressed = inflater.inflate(buffer);
                if (bytesDecompressed == 0) {
                    if (inflater.needsInput()) {
                        throw new ZipException("Compressed data ended before the stream was complete");
                    }
                    if (inflater.needsDictionary()) {
                        throw new ZipException("Decompression requires a dictionary");
                    }
                    // Not finished, not starved, no dictionary: the inflater made no progress.
                    throw new ZipException("Decompression stalled");
                }
                outputStream.write(buffer, 0, bytesDecompressed);
            }
        } catch (DataFormatException e) {
            ZipException failure = new ZipException("Corrupt compressed data: " + e.getMessage());
            failure.initCause(e);
            throw failure;
        }

        return outputStream.toByteArray();
    }

    /** Releases the native zlib state. */
    void end() {
        deflater.end();
        inflater.end();
    }
}
