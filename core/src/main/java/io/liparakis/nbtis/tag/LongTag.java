package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A signed 64-bit value.
 */
public final class LongTag extends Tag {
    private final long value;

    public LongTag(long value) {
        this(null, value);
    }

    public LongTag(@Nullable String name, long value) {
        super(name);
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public TagType type() {
        return TagType.LONG;
    }

    @Override
    public LongTag copy() {
        return new LongTag(getName(), value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LongTag other)) {
            return false;
        }
        return value == other.value && Objects.equals(getName(), other.getName());
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(getName()) + Long.hashCode(value);
    }
}
