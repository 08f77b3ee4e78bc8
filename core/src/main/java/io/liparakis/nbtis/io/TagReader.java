package io.liparakis.nbtis.io;

import io.liparakis.nbtis.NbtisSettings;
import io.liparakis.nbtis.tag.ByteArrayTag;
import io.liparakis.nbtis.tag.ByteTag;
import io.liparakis.nbtis.tag.CompoundTag;
import io.liparakis.nbtis.tag.DoubleTag;
import io.liparakis.nbtis.tag.FloatTag;
import io.liparakis.nbtis.tag.IntArrayTag;
import io.liparakis.nbtis.tag.IntTag;
import io.liparakis.nbtis.tag.ListTag;
import io.liparakis.nbtis.tag.LongArrayTag;
import io.liparakis.nbtis.tag.LongTag;
import io.liparakis.nbtis.tag.ShortTag;
import io.liparakis.nbtis.tag.StringTag;
import io.liparakis.nbtis.tag.Tag;
import io.liparakis.nbtis.tag.TagType;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/**
 * Recursive-descent decoder for tag streams.
 * <p>
 * The grammar omits the kind byte and the name for list elements, so every
 * step of the recursion knows whether the tag it is about to read is named.
 * Any failure aborts the whole decode; there is no partial tree.
 * </p>
 */
public final class TagReader {

    private final TagInput in;
    private final NbtisSettings settings;

    public TagReader(TagInput in) {
        this(in, NbtisSettings.defaults());
    }

    public TagReader(TagInput in, NbtisSettings settings) {
        this.in = in;
        this.settings = settings;
    }

    /**
     * Reads a document root: the compound kind byte, the root name and the
     * compound payload.
     *
     * @throws NbtException with {@link NbtError#NOT_A_COMPOUND_DOCUMENT} if the first byte is not {@code 0x0A}
     */
    public CompoundTag readRoot() throws IOException {
        long start = in.position();
        int id = in.readUnsignedByte();
        if (id != TagType.COMPOUND.id()) {
            throw new NbtException(NbtError.NOT_A_COMPOUND_DOCUMENT,
                    String.format("Document starts with 0x%02X, expected 0x%02X", id, TagType.COMPOUND.id()),
                    start);
        }
        return (CompoundTag) readTag(TagType.COMPOUND, true, 0);
    }

    /**
     * Reads one named tag including its kind byte.
     *
     * @return the tag, or {@code null} if the kind byte was the end marker
     */
    public @Nullable Tag readNamedTag() throws IOException {
        TagType type = readType();
        return type == TagType.END ? null : readTag(type, true, 0);
    }

    /**
     * Reads a tag of a known kind.
     *
     * @param type    the kind, already consumed from the stream
     * @param hasName whether a name string precedes the payload
     * @param depth   number of enclosing lists and compounds
     */
    Tag readTag(TagType type, boolean hasName, int depth) throws IOException {
        String name = hasName ? in.readString() : null;
        return readPayload(type, name, depth);
    }

    private Tag readPayload(TagType type, @Nullable String name, int depth) throws IOException {
        return switch (type) {
            case BYTE -> new ByteTag(name, in.readByte());
            case SHORT -> new ShortTag(name, in.readShort());
            case INT -> new IntTag(name, in.readInt());
            case LONG -> new LongTag(name, in.readLong());
            case FLOAT -> new FloatTag(name, in.readFloat());
            case DOUBLE -> new DoubleTag(name, in.readDouble());
            case BYTE_ARRAY -> new ByteArrayTag(name, in.readBytes(readLength(type)));
            case STRING -> new StringTag(name, in.readString());
            case LIST -> readList(name, depth + 1);
            case COMPOUND -> readCompound(name, depth + 1);
            case INT_ARRAY -> new IntArrayTag(name, in.readIntArray(readLength(type)));
            case LONG_ARRAY -> new LongArrayTag(name, in.readLongArray(readLength(type)));
            case END -> throw new NbtException(NbtError.UNKNOWN_TAG_KIND,
                    "TAG_End cannot carry a value", in.position());
        };
    }

    private ListTag readList(@Nullable String name, int depth) throws IOException {
        checkDepth(depth);

        TagType elementType = readType();
        long countOffset = in.position();
        int count = readLength(TagType.LIST);

        if (elementType == TagType.END && count > 0) {
            throw new NbtException(NbtError.MALFORMED_LENGTH,
                    "List of TAG_End declares " + count + " elements", countOffset);
        }

        ListTag list = new ListTag(name, elementType);
        for (int i = 0; i < count; i++) {
            list.add(readPayload(elementType, null, depth));
        }
        return list;
    }

    private CompoundTag readCompound(@Nullable String name, int depth) throws IOException {
        checkDepth(depth);

        CompoundTag compound = new CompoundTag(name);
        while (true) {
            TagType type = readType();
            if (type == TagType.END) {
                return compound;
            }
            Tag child = readTag(type, true, depth);
            // Duplicate names: the later entry wins.
            compound.put(child.getName(), child);
        }
    }

    private TagType readType() throws IOException {
        long offset = in.position();
        int id = in.readUnsignedByte();
        TagType type = TagType.byId(id);
        if (type == null) {
            throw new NbtException(NbtError.UNKNOWN_TAG_KIND,
                    String.format("Unknown tag kind 0x%02X", id), offset);
        }
        return type;
    }

    private int readLength(TagType owner) throws IOException {
        long offset = in.position();
        int length = in.readInt();
        if (length < 0 || length > settings.maxArrayLength()) {
            throw new NbtException(NbtError.MALFORMED_LENGTH,
                    String.format("%s declares length %d (allowed 0..%d)",
                            owner.displayName(), length, settings.maxArrayLength()),
                    offset);
        }
        return length;
    }

    private void checkDepth(int depth) throws NbtException {
        if (depth > settings.maxDepth()) {
            throw new NbtException(NbtError.NESTING_TOO_DEEP,
                    "Nesting exceeds " + settings.maxDepth() + " levels", in.position());
        }
    }
}
