package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A text value, stored on the wire as length-prefixed modified UTF-8.
 */
public final class StringTag extends Tag {
    private final String value;

    public StringTag(String value) {
        this(null, value);
    }

    public StringTag(@Nullable String name, String value) {
        super(name);
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    @Override
    public TagType type() {
        return TagType.STRING;
    }

    @Override
    public StringTag copy() {
        return new StringTag(getName(), value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StringTag other)) {
            return false;
        }
        return value.equals(other.value) && Objects.equals(getName(), other.getName());
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(getName()) + value.hashCode();
    }
}
