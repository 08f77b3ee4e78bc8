package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of tags that all share one kind.
 * <p>
 * The element kind is fixed at construction and survives even when the list
 * is empty. A list declared with {@link TagType#END} accepts no elements; it
 * is how the format writes an empty list of unknown kind.
 * </p>
 * <p>
 * Elements never carry a name. Adding a tag clears its name. Like
 * {@link CompoundTag}, a list only accepts tags no other container holds.
 * </p>
 */
public final class ListTag extends Tag implements Iterable<Tag> {
    private final TagType elementType;
    private final List<Tag> elements;

    public ListTag(TagType elementType) {
        this(null, elementType);
    }

    public ListTag(@Nullable String name, TagType elementType) {
        super(name);
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        this.elements = new ArrayList<>();
    }

    /**
     * Creates a list and fills it with the given values, converting raw values
     * to {@code elementType} through {@link TagConversions#convert}.
     *
     * @throws TagTypeMismatchException if any value cannot be represented as the element kind
     */
    public ListTag(@Nullable String name, TagType elementType, Collection<?> values) {
        this(name, elementType);
        for (Object value : values) {
            addValue(value);
        }
    }

    public TagType getElementType() {
        return elementType;
    }

    /**
     * Appends a tag.
     *
     * @throws TagTypeMismatchException if the tag's kind differs from the element kind
     */
    public void add(Tag tag) {
        elements.add(adopt(tag));
    }

    /**
     * Converts a raw value to the element kind and appends it.
     *
     * @throws TagTypeMismatchException if the value cannot be represented as the element kind
     */
    public void addValue(Object value) {
        add(TagConversions.convert(elementType, value));
    }

    /**
     * Replaces the element at {@code index}.
     *
     * @return the element previously at that position
     * @throws TagTypeMismatchException if the tag's kind differs from the element kind
     */
    public Tag set(int index, Tag tag) {
        Tag previous = elements.get(index);
        if (previous == tag) {
            return previous;
        }
        elements.set(index, adopt(tag));
        previous.detach();
        return previous;
    }

    public Tag get(int index) {
        return elements.get(index);
    }

    public Tag remove(int index) {
        Tag removed = elements.remove(index);
        removed.detach();
        return removed;
    }

    public void clear() {
        elements.forEach(Tag::detach);
        elements.clear();
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /** Read-only view of the elements in order. */
    public List<Tag> elements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public @NotNull Iterator<Tag> iterator() {
        return elements().iterator();
    }

    private Tag adopt(Tag tag) {
        Objects.requireNonNull(tag, "tag");
        if (tag.type() != elementType) {
            throw new TagTypeMismatchException(elementType, tag.type(),
                    "List of " + elementType.displayName() + " cannot hold " + tag.type().displayName());
        }
        tag.attachTo(this);
        tag.setName(null);
        return tag;
    }

    @Override
    public TagType type() {
        return TagType.LIST;
    }

    @Override
    public ListTag copy() {
        ListTag copy = new ListTag(getName(), elementType);
        for (Tag element : elements) {
            copy.add(element.copy());
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ListTag other)) {
            return false;
        }
        return elementType == other.elementType
                && elements.equals(other.elements)
                && Objects.equals(getName(), other.getName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName(), elementType, elements);
    }
}
