package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a value of the wrong kind is inserted into a typed container or
 * read through a typed accessor.
 */
public class TagTypeMismatchException extends IllegalArgumentException {

    private final TagType expected;
    private final @Nullable TagType actual;

    public TagTypeMismatchException(TagType expected, @Nullable TagType actual, String message) {
        super(message);
        this.expected = expected;
        this.actual = actual;
    }

    public TagTypeMismatchException(TagType expected, @Nullable TagType actual) {
        this(expected, actual, "Expected " + expected.displayName() + " but got "
                + (actual == null ? "an unconvertible value" : actual.displayName()));
    }

    public TagType getExpected() {
        return expected;
    }

    /** The kind that was supplied, or {@code null} for a raw value with no tag kind. */
    public @Nullable TagType getActual() {
        return actual;
    }
}
