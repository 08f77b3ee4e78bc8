package io.liparakis.nbtis.file;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Fixed-size header some vendors place in front of the root compound.
 * <p>
 * Both known layouts end with a version and the byte length of the tag
 * payload that follows, stored as little-endian 32-bit integers:
 * <ul>
 * <li>{@link Kind#LEVEL}: {@code version:i32 length:i32}</li>
 * <li>{@link Kind#ENTITIES}: {@code "ENT\0" version:i32 length:i32}</li>
 * </ul>
 * </p>
 *
 * @param kind          the header layout
 * @param version       the vendor format version
 * @param payloadLength the payload length declared by the header
 */
public record VendorHeader(Kind kind, int version, int payloadLength) {

    /** Number of leading bytes needed to recognise any known header. */
    public static final int SNIFF_LENGTH = 13;

    private static final byte[] ENTITIES_MAGIC = {'E', 'N', 'T', 0};
    private static final int ROOT_KIND = 0x0A;

    public enum Kind {
        LEVEL(8),
        ENTITIES(12);

        private final int size;

        Kind(int size) {
            this.size = size;
        }

        /** Total header size in bytes. */
        public int size() {
            return size;
        }
    }

    /**
     * Recognises a header from the first bytes of an uncompressed document.
     * <p>
     * An {@code "ENT\0"} prefix followed by a compound at byte 12 is an
     * entities header. Otherwise a first byte other than {@code 0x0A} with a
     * compound at byte 8 is a level header. Anything else is standard framing.
     * </p>
     *
     * @param prefix up to {@link #SNIFF_LENGTH} leading bytes
     * @return the header, or {@code null} for standard framing
     */
    public static @Nullable VendorHeader sniff(byte[] prefix) {
        if (startsWithEntitiesMagic(prefix) && isRootAt(prefix, Kind.ENTITIES.size())) {
            return parse(Kind.ENTITIES, prefix);
        }
        if (prefix.length > 0 && (prefix[0] & 0xFF) != ROOT_KIND && isRootAt(prefix, Kind.LEVEL.size())) {
            return parse(Kind.LEVEL, prefix);
        }
        return null;
    }

    /**
     * Returns a header of the same kind and version describing a new payload length.
     */
    public VendorHeader withPayloadLength(int length) {
        return new VendorHeader(kind, version, length);
    }

    /** Writes this header. */
    public void writeTo(OutputStream out) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(kind.size()).order(ByteOrder.LITTLE_ENDIAN);
        if (kind == Kind.ENTITIES) {
            buffer.put(ENTITIES_MAGIC);
        }
        buffer.putInt(version);
        buffer.putInt(payloadLength);
        out.write(buffer.array());
    }

    private static VendorHeader parse(Kind kind, byte[] prefix) {
        ByteBuffer buffer = ByteBuffer.wrap(prefix, 0, kind.size()).order(ByteOrder.LITTLE_ENDIAN);
        if (kind == Kind.ENTITIES) {
            buffer.position(ENTITIES_MAGIC.length);
        }
        int version = buffer.getInt();
        int length = buffer.getInt();
        return new VendorHeader(kind, version, length);
    }

    private static boolean startsWithEntitiesMagic(byte[] prefix) {
        if (prefix.length < ENTITIES_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < ENTITIES_MAGIC.length; i++) {
            if (prefix[i] != ENTITIES_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    private static boolean isRootAt(byte[] prefix, int index) {
        return prefix.length > index && (prefix[index] & 0xFF) == ROOT_KIND;
    }
}
