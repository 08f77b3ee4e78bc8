package io.liparakis.nbtis.region;

import io.liparakis.nbtis.io.NbtError;
import io.liparakis.nbtis.io.NbtException;

/**
 * Per-chunk compression identifiers stored after a blob's length.
 */
public enum CompressionScheme {
    /** Slot was allocated but the chunk was erased; read as absent. */
    ERASED(0),
    GZIP(1),
    /** The scheme written in practice. */
    ZLIB(2),
    UNCOMPRESSED(3);

    private final int id;

    CompressionScheme(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    /**
     * @param offset byte offset of the scheme byte, used in the error message
     * @throws NbtException with {@link NbtError#UNSUPPORTED_COMPRESSION_SCHEME} for any other id
     */
    public static CompressionScheme byId(int id, long offset) throws NbtException {
        for (CompressionScheme scheme : values()) {
            if (scheme.id == id) {
                return scheme;
            }
        }
        throw new NbtException(NbtError.UNSUPPORTED_COMPRESSION_SCHEME,
                "Unknown chunk compression scheme " + id, offset);
    }
}
