package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A signed 32-bit value.
 */
public final class IntTag extends Tag {
    private final int value;

    public IntTag(int value) {
        this(null, value);
    }

    public IntTag(@Nullable String name, int value) {
        super(name);
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public TagType type() {
        return TagType.INT;
    }

    @Override
    public IntTag copy() {
        return new IntTag(getName(), value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IntTag other)) {
            return false;
        }
        return value == other.value && Objects.equals(getName(), other.getName());
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(getName()) + Integer.hashCode(value);
    }
}
