package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Objects;

/**
 * A sequence of signed 64-bit values, introduced by later revisions of the format.
 * <p>
 * The backing array is held by reference; {@link #getValue()} exposes it for
 * in-place edits.
 * </p>
 */
public final class LongArrayTag extends Tag {
    private final long[] value;

    public LongArrayTag(long[] value) {
        this(null, value);
    }

    public LongArrayTag(@Nullable String name, long[] value) {
        super(name);
        this.value = Objects.requireNonNull(value, "value");
    }

    public long[] getValue() {
        return value;
    }

    public int length() {
        return value.length;
    }

    @Override
    public TagType type() {
        return TagType.LONG_ARRAY;
    }

    @Override
    public LongArrayTag copy() {
        return new LongArrayTag(getName(), value.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LongArrayTag other)) {
            return false;
        }
        return Arrays.equals(value, other.value) && Objects.equals(getName(), other.getName());
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(getName()) + Arrays.hashCode(value);
    }
}
