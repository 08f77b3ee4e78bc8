package io.liparakis.nbtis.io;

/**
 * Reasons a tag stream or container can be rejected.
 */
public enum NbtError {
    /** The source ran out of bytes in the middle of a value. */
    UNEXPECTED_END_OF_INPUT,
    /** A kind identifier outside the known table. */
    UNKNOWN_TAG_KIND,
    /** The document does not start with a compound. */
    NOT_A_COMPOUND_DOCUMENT,
    /** A negative or implausibly large declared length. */
    MALFORMED_LENGTH,
    /** Bytes that are not valid modified UTF-8. */
    INVALID_ENCODING,
    /** A region chunk declares a compression scheme outside the known set. */
    UNSUPPORTED_COMPRESSION_SCHEME,
    /** Lists and compounds nested deeper than the configured limit. */
    NESTING_TOO_DEEP
}
