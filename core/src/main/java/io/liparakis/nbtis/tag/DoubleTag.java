package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * An IEEE-754 double precision value. Equality compares bit patterns, so {@code NaN} equals itself.
 */
public final class DoubleTag extends Tag {
    private final double value;

    public DoubleTag(double value) {
        this(null, value);
    }

    public DoubleTag(@Nullable String name, double value) {
        super(name);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public TagType type() {
        return TagType.DOUBLE;
    }

    @Override
    public DoubleTag copy() {
        return new DoubleTag(getName(), value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DoubleTag other)) {
            return false;
        }
        return Double.compare(value, other.value) == 0 && Objects.equals(getName(), other.getName());
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(getName()) + Double.hashCode(value);
    }
}
