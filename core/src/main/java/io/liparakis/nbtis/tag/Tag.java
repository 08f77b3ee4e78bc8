package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

/**
 * One node of a tag tree.
 * <p>
 * A tag carries an optional name and a kind-specific value. The name is
 * present for direct children of a compound (where it always equals the entry
 * key) and for the document root; list elements carry no name.
 * </p>
 * <p>
 * Composite tags exclusively own their children. A tag held by one container
 * cannot be inserted into another until it is removed from the first; insert
 * a {@link #copy()} instead.
 * </p>
 */
public abstract sealed class Tag
        permits ByteTag, ShortTag, IntTag, LongTag, FloatTag, DoubleTag,
        ByteArrayTag, StringTag, ListTag, CompoundTag, IntArrayTag, LongArrayTag {

    private @Nullable String name;
    private @Nullable Tag owner;

    protected Tag(@Nullable String name) {
        this.name = name;
    }

    /** Returns the kind of this tag. */
    public abstract TagType type();

    /** Returns a deep copy of this tag, including its name. */
    public abstract Tag copy();

    public @Nullable String getName() {
        return name;
    }

    /**
     * Only containers rename their children, so that a compound key and the
     * name of the tag stored under it cannot diverge.
     */
    void setName(@Nullable String name) {
        this.name = name;
    }

    /** Whether a compound or list currently holds this tag. */
    public boolean isAttached() {
        return owner != null;
    }

    /**
     * Records {@code container} as the owner of this tag.
     *
     * @throws IllegalArgumentException if the tag already has an owner, or if
     *                                  it is {@code container} or one of its ancestors
     */
    void attachTo(Tag container) {
        if (owner != null) {
            throw new IllegalArgumentException(type().displayName()
                    + " is already held by another container; remove it first or insert a copy");
        }
        for (Tag ancestor = container; ancestor != null; ancestor = ancestor.owner) {
            if (ancestor == this) {
                throw new IllegalArgumentException(container.type().displayName()
                        + " cannot contain itself or one of its ancestors");
            }
        }
        owner = container;
    }

    void detach() {
        owner = null;
    }

    @Override
    public String toString() {
        return TagPrinter.describe(this);
    }
}
