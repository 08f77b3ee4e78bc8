package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Objects;

/**
 * A sequence of signed 32-bit values.
 * <p>
 * The backing array is held by reference; {@link #getValue()} exposes it for
 * in-place edits.
 * </p>
 */
public final class IntArrayTag extends Tag {
    private final int[] value;

    public IntArrayTag(int[] value) {
        this(null, value);
    }

    public IntArrayTag(@Nullable String name, int[] value) {
        super(name);
        this.value = Objects.requireNonNull(value, "value");
    }

    public int[] getValue() {
        return value;
    }

    public int length() {
        return value.length;
    }

    @Override
    public TagType type() {
        return TagType.INT_ARRAY;
    }

    @Override
    public IntArrayTag copy() {
        return new IntArrayTag(getName(), value.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IntArrayTag other)) {
            return false;
        }
        return Arrays.equals(value, other.value) && Objects.equals(getName(), other.getName());
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(getName()) + Arrays.hashCode(value);
    }
}
