package io.liparakis.nbtis.io;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Sequential writer of fixed-width values in a configurable byte order.
 */
public final class TagOutput {
    private static final int CHUNK_SIZE = 8192;

    private final OutputStream out;
    private final ByteOrder order;
    private final ByteBuffer scratch;
    private long written;

    public TagOutput(OutputStream out, ByteOrder order) {
        this.out = out;
        this.order = order;
        this.scratch = ByteBuffer.allocate(CHUNK_SIZE).order(order);
    }

    public TagOutput(OutputStream out) {
        this(out, ByteOrder.BIG_ENDIAN);
    }

    public ByteOrder order() {
        return order;
    }

    /** Number of bytes written so far. */
    public long written() {
        return written;
    }

    public void writeByte(int value) throws IOException {
        out.write(value);
        written++;
    }

    public void writeShort(int value) throws IOException {
        scratch.clear();
        scratch.putShort((short) value);
        drain();
    }

    public void writeInt(int value) throws IOException {
        scratch.clear();
        scratch.putInt(value);
        drain();
    }

    public void writeLong(long value) throws IOException {
        scratch.clear();
        scratch.putLong(value);
        drain();
    }

    public void writeFloat(float value) throws IOException {
        writeInt(Float.floatToRawIntBits(value));
    }

    public void writeDouble(double value) throws IOException {
        writeLong(Double.doubleToRawLongBits(value));
    }

    /**
     * Writes a string as an unsigned 16-bit byte count followed by its
     * modified UTF-8 bytes.
     *
     * @throws NbtException with {@link NbtError#MALFORMED_LENGTH} if the encoded form exceeds 65535 bytes
     */
    public void writeString(String text) throws IOException {
        int length = ModifiedUtf8.encodedLength(text);
        if (length > ModifiedUtf8.MAX_ENCODED_LENGTH) {
            throw new NbtException(NbtError.MALFORMED_LENGTH,
                    "String encodes to " + length + " bytes, limit is " + ModifiedUtf8.MAX_ENCODED_LENGTH,
                    written);
        }
        writeShort(length);
        writeBytes(ModifiedUtf8.encode(text));
    }

    public void writeBytes(byte[] bytes) throws IOException {
        out.write(bytes);
        written += bytes.length;
    }

    public void writeIntArray(int[] values) throws IOException {
        int done = 0;
        while (done < values.length) {
            int count = Math.min(values.length - done, CHUNK_SIZE / Integer.BYTES);
            scratch.clear();
            scratch.asIntBuffer().put(values, done, count);
            scratch.position(count * Integer.BYTES);
            drain();
            done += count;
        }
    }

    public void writeLongArray(long[] values) throws IOException {
        int done = 0;
        while (done < values.length) {
            int count = Math.min(values.length - done, CHUNK_SIZE / Long.BYTES);
            scratch.clear();
            scratch.asLongBuffer().put(values, done, count);
            scratch.position(count * Long.BYTES);
            drain();
            done += count;
        }
    }

    public void flush() throws IOException {
        out.flush();
    }

    private void drain() throws IOException {
        int length = scratch.position();
        out.write(scratch.array(), 0, length);
        written += length;
    }
}
