package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A signed 8-bit value.
 */
public final class ByteTag extends Tag {
    private final byte value;

    public ByteTag(byte value) {
        this(null, value);
    }

    public ByteTag(@Nullable String name, byte value) {
        super(name);
        this.value = value;
    }

    public byte getValue() {
        return value;
    }

    @Override
    public TagType type() {
        return TagType.BYTE;
    }

    @Override
    public ByteTag copy() {
        return new ByteTag(getName(), value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ByteTag other)) {
            return false;
        }
        return value == other.value && Objects.equals(getName(), other.getName());
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(getName()) + Byte.hashCode(value);
    }
}
