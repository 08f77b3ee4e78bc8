package io.liparakis.nbtis.io;

/**
 * Transcoder for the modified UTF-8 used by tag strings.
 * <p>
 * Differences from standard UTF-8:
 * <ul>
 * <li>{@code U+0000} is written as the two bytes {@code C0 80}, never as a raw zero byte</li>
 * <li>supplementary characters are written as two three-byte surrogate sequences, never as
 * one four-byte sequence</li>
 * </ul>
 * The 16-bit length prefix is handled by {@link TagInput} and {@link TagOutput}.
 * </p>
 */
public final class ModifiedUtf8 {

    /** Largest encoded string the 16-bit length prefix can describe. */
    public static final int MAX_ENCODED_LENGTH = 0xFFFF;

    private ModifiedUtf8() {
        throw new AssertionError("ModifiedUtf8 is a utility class and should not be instantiated");
    }

    /**
     * Returns the number of bytes {@link #encode(String)} produces for {@code text}.
     */
    public static int encodedLength(String text) {
        int length = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != 0 && c <= 0x7F) {
                length += 1;
            } else if (c <= 0x7FF) {
                length += 2;
            } else {
                length += 3;
            }
        }
        return length;
    }

    /**
     * Encodes {@code text} without a length prefix.
     */
    public static byte[] encode(String text) {
        byte[] out = new byte[encodedLength(text)];
        int pos = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != 0 && c <= 0x7F) {
                out[pos++] = (byte) c;
            } else if (c <= 0x7FF) {
                out[pos++] = (byte) (0xC0 | (c >> 6));
                out[pos++] = (byte) (0x80 | (c & 0x3F));
            } else {
                out[pos++] = (byte) (0xE0 | (c >> 12));
                out[pos++] = (byte) (0x80 | ((c >> 6) & 0x3F));
                out[pos++] = (byte) (0x80 | (c & 0x3F));
            }
        }
        return out;
    }

    /**
     * Decodes a complete modified UTF-8 byte sequence.
     *
     * @throws NbtException with {@link NbtError#INVALID_ENCODING} on a malformed sequence
     */
    public static String decode(byte[] bytes) throws NbtException {
        return decode(bytes, 0);
    }

    /**
     * Decodes a complete modified UTF-8 byte sequence that started at
     * {@code baseOffset} in the enclosing stream, so errors report absolute offsets.
     */
    public static String decode(byte[] bytes, long baseOffset) throws NbtException {
        char[] chars = new char[bytes.length];
        int count = 0;
        int i = 0;

        while (i < bytes.length) {
            int b = bytes[i] & 0xFF;

            if (b < 0x80) {
                chars[count++] = (char) b;
                i += 1;
            } else if ((b & 0xE0) == 0xC0) {
                int b2 = continuation(bytes, i, 1, baseOffset);
                chars[count++] = (char) (((b & 0x1F) << 6) | b2);
                i += 2;
            } else if ((b & 0xF0) == 0xE0) {
                int b2 = continuation(bytes, i, 1, baseOffset);
                int b3 = continuation(bytes, i, 2, baseOffset);
                chars[count++] = (char) (((b & 0x0F) << 12) | (b2 << 6) | b3);
                i += 3;
            } else {
                throw new NbtException(NbtError.INVALID_ENCODING,
                        String.format("Illegal lead byte 0x%02X", b), baseOffset + i);
            }
        }

        return new String(chars, 0, count);
    }

    private static int continuation(byte[] bytes, int lead, int index, long baseOffset) throws NbtException {
        int pos = lead + index;
        if (pos >= bytes.length) {
            throw new NbtException(NbtError.INVALID_ENCODING,
                    "Truncated multi-byte sequence", baseOffset + lead);
        }
        int b = bytes[pos] & 0xFF;
        if ((b & 0xC0) != 0x80) {
            throw new NbtException(NbtError.INVALID_ENCODING,
                    String.format("Expected continuation byte but found 0x%02X", b), baseOffset + pos);
        }
        return b & 0x3F;
    }
}
