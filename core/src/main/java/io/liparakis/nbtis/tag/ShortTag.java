package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A signed 16-bit value.
 */
public final class ShortTag extends Tag {
    private final short value;

    public ShortTag(short value) {
        this(null, value);
    }

    public ShortTag(@Nullable String name, short value) {
        super(name);
        this.value = value;
    }

    public short getValue() {
        return value;
    }

    @Override
    public TagType type() {
        return TagType.SHORT;
    }

    @Override
    public ShortTag copy() {
        return new ShortTag(getName(), value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ShortTag other)) {
            return false;
        }
        return value == other.value && Objects.equals(getName(), other.getName());
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(getName()) + Short.hashCode(value);
    }
}
