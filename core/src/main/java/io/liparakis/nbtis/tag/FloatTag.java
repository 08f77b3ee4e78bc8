package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * An IEEE-754 single precision value. Equality compares bit patterns, so {@code NaN} equals itself.
 */
public final class FloatTag extends Tag {
    private final float value;

    public FloatTag(float value) {
        this(null, value);
    }

    public FloatTag(@Nullable String name, float value) {
        super(name);
        this.value = value;
    }

    public float getValue() {
        return value;
    }

    @Override
    public TagType type() {
        return TagType.FLOAT;
    }

    @Override
    public FloatTag copy() {
        return new FloatTag(getName(), value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FloatTag other)) {
            return false;
        }
        return Float.compare(value, other.value) == 0 && Objects.equals(getName(), other.getName());
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(getName()) + Float.hashCode(value);
    }
}
