package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * A mapping from names to child tags.
 * <p>
 * Entries keep their insertion order, which is the order they are written in.
 * Storing a tag under a key renames the tag to that key, so a child's name and
 * its key are always equal.
 * </p>
 * <p>
 * Equality ignores entry order but not names.
 * </p>
 */
public non-sealed class CompoundTag extends Tag {
    private final Map<String, Tag> entries = new LinkedHashMap<>();

    public CompoundTag() {
        this(null);
    }

    public CompoundTag(@Nullable String name) {
        super(name);
    }

    /**
     * Stores {@code tag} under {@code key}, replacing any previous entry and
     * setting the tag's name to {@code key}. The replaced entry is released and
     * may be inserted elsewhere.
     *
     * @return the previous entry, or {@code null}
     * @throws IllegalArgumentException if {@code tag} is held by a container
     *                                  (this one included, under another key)
     *                                  or would make the tree cyclic
     */
    public @Nullable Tag put(String key, Tag tag) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(tag, "tag");
        Tag previous = entries.get(key);
        if (previous == tag) {
            return previous;
        }
        tag.attachTo(this);
        tag.setName(key);
        entries.put(key, tag);
        if (previous != null) {
            previous.detach();
        }
        return previous;
    }

    /**
     * Infers a tag kind for a raw value and stores it.
     *
     * @throws TagTypeMismatchException if no kind can be inferred for the value
     * @see TagConversions#infer(Object)
     */
    public @Nullable Tag putValue(String key, Object value) {
        return put(key, TagConversions.infer(value));
    }

    public void putByte(String key, byte value) {
        put(key, new ByteTag(value));
    }

    public void putShort(String key, short value) {
        put(key, new ShortTag(value));
    }

    public void putInt(String key, int value) {
        put(key, new IntTag(value));
    }

    public void putLong(String key, long value) {
        put(key, new LongTag(value));
    }

    public void putFloat(String key, float value) {
        put(key, new FloatTag(value));
    }

    public void putDouble(String key, double value) {
        put(key, new DoubleTag(value));
    }

    public void putString(String key, String value) {
        put(key, new StringTag(value));
    }

    public void putByteArray(String key, byte[] value) {
        put(key, new ByteArrayTag(value));
    }

    public void putIntArray(String key, int[] value) {
        put(key, new IntArrayTag(value));
    }

    public void putLongArray(String key, long[] value) {
        put(key, new LongArrayTag(value));
    }

    public @Nullable Tag get(String key) {
        return entries.get(key);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public boolean contains(String key, TagType type) {
        Tag tag = entries.get(key);
        return tag != null && tag.type() == type;
    }

    /**
     * Removes an entry. The removed tag keeps its name and may be inserted elsewhere.
     */
    public @Nullable Tag remove(String key) {
        Tag removed = entries.remove(key);
        if (removed != null) {
            removed.detach();
        }
        return removed;
    }

    public void clear() {
        entries.values().forEach(Tag::detach);
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Set<String> keySet() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Collection<Tag> values() {
        return Collections.unmodifiableCollection(entries.values());
    }

    /** Read-only view of the entries in insertion order. */
    public Map<String, Tag> entries() {
        return Collections.unmodifiableMap(entries);
    }

    // ==================== Typed Accessors ====================

    public byte getByte(String key) {
        return require(key, TagType.BYTE, ByteTag.class).getValue();
    }

    public short getShort(String key) {
        return require(key, TagType.SHORT, ShortTag.class).getValue();
    }

    public int getInt(String key) {
        return require(key, TagType.INT, IntTag.class).getValue();
    }

    public long getLong(String key) {
        return require(key, TagType.LONG, LongTag.class).getValue();
    }

    public float getFloat(String key) {
        return require(key, TagType.FLOAT, FloatTag.class).getValue();
    }

    public double getDouble(String key) {
        return require(key, TagType.DOUBLE, DoubleTag.class).getValue();
    }

    public String getString(String key) {
        return require(key, TagType.STRING, StringTag.class).getValue();
    }

    public byte[] getByteArray(String key) {
        return require(key, TagType.BYTE_ARRAY, ByteArrayTag.class).getValue();
    }

    public int[] getIntArray(String key) {
        return require(key, TagType.INT_ARRAY, IntArrayTag.class).getValue();
    }

    public long[] getLongArray(String key) {
        return require(key, TagType.LONG_ARRAY, LongArrayTag.class).getValue();
    }

    public CompoundTag getCompound(String key) {
        return require(key, TagType.COMPOUND, CompoundTag.class);
    }

    /**
     * Returns the list stored under {@code key}, checking its element kind.
     * An empty list matches any requested element kind.
     *
     * @throws NoSuchElementException   if there is no entry for {@code key}
     * @throws TagTypeMismatchException if the entry is not a list of {@code elementType}
     */
    public ListTag getList(String key, TagType elementType) {
        ListTag list = require(key, TagType.LIST, ListTag.class);
        if (list.getElementType() != elementType && !list.isEmpty()) {
            throw new TagTypeMismatchException(elementType, list.getElementType(),
                    "Entry '" + key + "' is a list of " + list.getElementType().displayName()
                            + ", not " + elementType.displayName());
        }
        return list;
    }

    private <T extends Tag> T require(String key, TagType type, Class<T> tagClass) {
        Tag tag = entries.get(key);
        if (tag == null) {
            throw new NoSuchElementException("No entry named '" + key + "'");
        }
        if (tag.type() != type) {
            throw new TagTypeMismatchException(type, tag.type(),
                    "Entry '" + key + "' is " + tag.type().displayName() + ", not " + type.displayName());
        }
        return tagClass.cast(tag);
    }

    @Override
    public TagType type() {
        return TagType.COMPOUND;
    }

    @Override
    public CompoundTag copy() {
        CompoundTag copy = new CompoundTag(getName());
        copyEntriesInto(copy);
        return copy;
    }

    /** Deep-copies every entry of this compound into {@code target}. */
    protected void copyEntriesInto(CompoundTag target) {
        for (Map.Entry<String, Tag> entry : entries.entrySet()) {
            target.put(entry.getKey(), entry.getValue().copy());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompoundTag other)) {
            return false;
        }
        return entries.equals(other.entries) && Objects.equals(getName(), other.getName());
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(getName()) + entries.hashCode();
    }
}
