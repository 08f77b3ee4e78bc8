package io.liparakis.nbtis.io;

import java.io.IOException;

/**
 * A malformed tag stream or container.
 * <p>
 * Every instance carries the {@link NbtError} reason and, where known, the
 * byte offset at which the problem was detected.
 * </p>
 */
public class NbtException extends IOException {

    /** Offset value used when the position in the source is unknown. */
    public static final long UNKNOWN_OFFSET = -1;

    private final NbtError error;
    private final long offset;

    public NbtException(NbtError error, String message, long offset) {
        super(format(error, message, offset));
        this.error = error;
        this.offset = offset;
    }

    public NbtException(NbtError error, String message, long offset, Throwable cause) {
        super(format(error, message, offset), cause);
        this.error = error;
        this.offset = offset;
    }

    public NbtException(NbtError error, String message) {
        this(error, message, UNKNOWN_OFFSET);
    }

    public NbtError getError() {
        return error;
    }

    /** The byte offset of the failure, or {@link #UNKNOWN_OFFSET}. */
    public long getOffset() {
        return offset;
    }

    private static String format(NbtError error, String message, long offset) {
        return offset == UNKNOWN_OFFSET
                ? String.format("[%s] %s", error, message)
                : String.format("[%s at offset %d] %s", error, offset, message);
    }
}
