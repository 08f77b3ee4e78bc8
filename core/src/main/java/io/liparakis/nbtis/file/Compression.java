package io.liparakis.nbtis.file;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * Whole-stream compression applied around a tag document.
 */
public enum Compression {
    NONE {
        @Override
        public InputStream decompress(InputStream in) {
            return in;
        }

        @Override
        OutputStream compress(OutputStream out, int level) {
            return out;
        }
    },
    GZIP {
        @Override
        public InputStream decompress(InputStream in) throws IOException {
            return new GZIPInputStream(in);
        }

        @Override
        OutputStream compress(OutputStream out, int level) throws IOException {
            return new GZIPOutputStream(out) {
                {
                    def.setLevel(level);
                }
            };
        }
    },
    ZLIB {
        @Override
        public InputStream decompress(InputStream in) {
            return new InflaterInputStream(in);
        }

        @Override
        OutputStream compress(OutputStream out, int level) {
            Deflater deflater = new Deflater(level);
            return new DeflaterOutputStream(out, deflater) {
                @Override
                public void close() throws IOException {
                    try {
                        super.close();
                    } finally {
                        deflater.end();
                    }
                }
            };
        }
    };

    private static final int GZIP_MAGIC_0 = 0x1F;
    private static final int GZIP_MAGIC_1 = 0x8B;
    private static final int ZLIB_DEFLATE_METHOD = 0x08;

    /**
     * Wraps {@code in} so that reads return decompressed bytes.
     */
    public abstract InputStream decompress(InputStream in) throws IOException;

    abstract OutputStream compress(OutputStream out, int level) throws IOException;

    /**
     * Compresses a complete buffer.
     *
     * @param data  the uncompressed bytes
     * @param level deflate level, or {@link Deflater#DEFAULT_COMPRESSION}
     */
    public byte[] compress(byte[] data, int level) throws IOException {
        if (this == NONE) {
            return data;
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        try (OutputStream out = compress(buffer, level)) {
            out.write(data);
        }
        return buffer.toByteArray();
    }

    /**
     * Guesses the compression of a stream from its first two bytes.
     * Anything that is neither a gzip nor a zlib header is treated as uncompressed.
     */
    public static Compression detect(byte[] prefix) {
        if (prefix.length < 2) {
            return NONE;
        }
        int b0 = prefix[0] & 0xFF;
        int b1 = prefix[1] & 0xFF;
        if (b0 == GZIP_MAGIC_0 && b1 == GZIP_MAGIC_1) {
            return GZIP;
        }
        if ((b0 & 0x0F) == ZLIB_DEFLATE_METHOD && ((b0 << 8) | b1) % 31 == 0) {
            return ZLIB;
        }
        return NONE;
    }
}
