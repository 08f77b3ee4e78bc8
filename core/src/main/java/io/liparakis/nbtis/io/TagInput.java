package io.liparakis.nbtis.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Sequential reader of fixed-width values in a configurable byte order.
 * <p>
 * Any read that finds fewer bytes than it needs fails with
 * {@link NbtError#UNEXPECTED_END_OF_INPUT}; the position reported is the
 * offset of the value that could not be completed.
 * </p>
 */
public final class TagInput {
    private static final int CHUNK_SIZE = 8192;

    private final InputStream in;
    private final ByteOrder order;
    private final byte[] scratch = new byte[8];
    private final ByteBuffer scratchView;
    private long position;

    public TagInput(InputStream in, ByteOrder order) {
        this.in = in;
        this.order = order;
        this.scratchView = ByteBuffer.wrap(scratch).order(order);
    }

    public TagInput(InputStream in) {
        this(in, ByteOrder.BIG_ENDIAN);
    }

    public ByteOrder order() {
        return order;
    }

    /** Number of bytes consumed so far. */
    public long position() {
        return position;
    }

    public byte readByte() throws IOException {
        fill(scratch, 0, 1);
        return scratch[0];
    }

    public int readUnsignedByte() throws IOException {
        return readByte() & 0xFF;
    }

    public short readShort() throws IOException {
        fill(scratch, 0, 2);
        return scratchView.getShort(0);
    }

    public int readUnsignedShort() throws IOException {
        return readShort() & 0xFFFF;
    }

    public int readInt() throws IOException {
        fill(scratch, 0, 4);
        return scratchView.getInt(0);
    }

    public long readLong() throws IOException {
        fill(scratch, 0, 8);
        return scratchView.getLong(0);
    }

    public float readFloat() throws IOException {
        return Float.intBitsToFloat(readInt());
    }

    public double readDouble() throws IOException {
        return Double.longBitsToDouble(readLong());
    }

    /**
     * Reads a string: an unsigned 16-bit byte count followed by that many
     * bytes of modified UTF-8.
     */
    public String readString() throws IOException {
        int length = readUnsignedShort();
        long start = position;
        byte[] bytes = readBytes(length);
        return ModifiedUtf8.decode(bytes, start);
    }

    /**
     * Reads exactly {@code length} raw bytes. Memory grows with the bytes
     * actually received, not with the declared length.
     */
    public byte[] readBytes(int length) throws IOException {
        byte[] bytes = in.readNBytes(length);
        if (bytes.length < length) {
            long start = position;
            position += bytes.length;
            throw new NbtException(NbtError.UNEXPECTED_END_OF_INPUT,
                    String.format("Needed %d bytes but only %d remained", length, bytes.length), start);
        }
        position += length;
        return bytes;
    }

    /**
     * Reads {@code length} 32-bit values. The source is consumed in bounded
     * chunks and the result array grows as they arrive, so a declared length
     * larger than the stream fails without allocating for it.
     */
    public int[] readIntArray(int length) throws IOException {
        int[] values = new int[Math.min(length, CHUNK_SIZE / Integer.BYTES)];
        byte[] chunk = new byte[(int) Math.min(CHUNK_SIZE, (long) length * Integer.BYTES)];
        int done = 0;
        while (done < length) {
            int count = Math.min(length - done, chunk.length / Integer.BYTES);
            fill(chunk, 0, count * Integer.BYTES);
            if (done + count > values.length) {
                values = Arrays.copyOf(values, grownCapacity(values.length, done + count, length));
            }
            ByteBuffer.wrap(chunk, 0, count * Integer.BYTES).order(order).asIntBuffer().get(values, done, count);
            done += count;
        }
        return values;
    }

    /** Reads {@code length} 64-bit values, chunked like {@link #readIntArray(int)}. */
    public long[] readLongArray(int length) throws IOException {
        long[] values = new long[Math.min(length, CHUNK_SIZE / Long.BYTES)];
        byte[] chunk = new byte[(int) Math.min(CHUNK_SIZE, (long) length * Long.BYTES)];
        int done = 0;
        while (done < length) {
            int count = Math.min(length - done, chunk.length / Long.BYTES);
            fill(chunk, 0, count * Long.BYTES);
            if (done + count > values.length) {
                values = Arrays.copyOf(values, grownCapacity(values.length, done + count, length));
            }
            ByteBuffer.wrap(chunk, 0, count * Long.BYTES).order(order).asLongBuffer().get(values, done, count);
            done += count;
        }
        return values;
    }

    private static int grownCapacity(int current, int needed, int length) {
        return (int) Math.min(length, Math.max(needed, (long) current * 2));
    }

    private void fill(byte[] target, int offset, int length) throws IOException {
        int read = in.readNBytes(target, offset, length);
        if (read < length) {
            long start = position;
            position += read;
            throw new NbtException(NbtError.UNEXPECTED_END_OF_INPUT,
                    String.format("Needed %d bytes but only %d remained", length, read), start);
        }
        position += length;
    }
}
