package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Objects;

/**
 * A sequence of signed 8-bit values.
 * <p>
 * The backing array is held by reference; {@link #getValue()} exposes it for
 * in-place edits.
 * </p>
 */
public final class ByteArrayTag extends Tag {
    private final byte[] value;

    public ByteArrayTag(byte[] value) {
        this(null, value);
    }

    public ByteArrayTag(@Nullable String name, byte[] value) {
        super(name);
        this.value = Objects.requireNonNull(value, "value");
    }

    public byte[] getValue() {
        return value;
    }

    public int length() {
        return value.length;
    }

    @Override
    public TagType type() {
        return TagType.BYTE_ARRAY;
    }

    @Override
    public ByteArrayTag copy() {
        return new ByteArrayTag(getName(), value.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ByteArrayTag other)) {
            return false;
        }
        return Arrays.equals(value, other.value) && Objects.equals(getName(), other.getName());
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(getName()) + Arrays.hashCode(value);
    }
}
