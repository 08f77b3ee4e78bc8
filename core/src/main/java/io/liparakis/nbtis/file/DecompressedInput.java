package io.liparakis.nbtis.file;

import io.liparakis.nbtis.io.NbtError;
import io.liparakis.nbtis.io.NbtException;

import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.ZipException;

/**
 * Decompressed view of a document stream.
 * <p>
 * A compressed stream that ends early fails with
 * {@link NbtError#UNEXPECTED_END_OF_INPUT}; corrupt compressed data or a bad
 * checksum fails with {@link NbtError#INVALID_ENCODING}. Offsets count
 * decompressed bytes.
 * </p>
 */
final class DecompressedInput extends FilterInputStream {

    private final Compression compression;
    private long position;

    private DecompressedInput(Compression compression, InputStream decompressed) {
        super(decompressed);
        this.compression = compression;
    }

    static DecompressedInput open(Compression compression, InputStream source) throws IOException {
        try {
            return new DecompressedInput(compression, compression.decompress(source));
        } catch (EOFException | ZipException e) {
            throw translate(compression, e, 0);
        }
    }

    @Override
    public int read() throws IOException {
        try {
            int b = super.read();
            if (b >= 0) {
                position++;
            }
            return b;
        } catch (EOFException | ZipException e) {
            throw translate(compression, e, position);
        }
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        try {
            int read = super.read(buffer, offset, length);
            if (read > 0) {
                position += read;
            }
            return read;
        } catch (EOFException | ZipException e) {
            throw translate(compression, e, position);
        }
    }

    @Override
    public long skip(long count) throws IOException {
        try {
            long skipped = super.skip(count);
            position += skipped;
            return skipped;
        } catch (EOFException | ZipException e) {
            throw translate(compression, e, position);
        }
    }

    /**
     * Consumes whatever follows the document up to the end of the compressed
     * stream, so that its trailer and checksum are checked.
     */
    static void drain(InputStream in) throws IOException {
        in.transferTo(OutputStream.nullOutputStream());
    }

    private static NbtException translate(Compression compression, IOException e, long position) {
        if (e instanceof EOFException) {
            return new NbtException(NbtError.UNEXPECTED_END_OF_INPUT,
                    compression + " stream is truncated: " + e.getMessage(), position, e);
        }
        return new NbtException(NbtError.INVALID_ENCODING,
                compression + " stream is corrupt: " + e.getMessage(), position, e);
    }
}
