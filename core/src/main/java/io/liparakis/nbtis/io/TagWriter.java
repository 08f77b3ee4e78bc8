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

import java.io.IOException;
import java.util.Map;

/**
 * Encoder for tag streams, the mirror image of {@link TagReader}.
 * <p>
 * Named tags are written as kind byte, name, payload. List elements are
 * written as payload only, since the list header already declares their kind.
 * </p>
 * <p>
 * The writer refuses trees that a {@link TagReader} with the same settings
 * would reject: nesting deeper than {@link NbtisSettings#maxDepth()} fails with
 * {@link NbtError#NESTING_TOO_DEEP}, and arrays or lists longer than
 * {@link NbtisSettings#maxArrayLength()} fail with {@link NbtError#MALFORMED_LENGTH}.
 * Output already written before the failure is left in the sink.
 * </p>
 */
public final class TagWriter {

    private final TagOutput out;
    private final NbtisSettings settings;

    public TagWriter(TagOutput out) {
        this(out, NbtisSettings.defaults());
    }

    public TagWriter(TagOutput out, NbtisSettings settings) {
        this.out = out;
        this.settings = settings;
    }

    /**
     * Writes a document root. A root without a name is written with the empty name.
     */
    public void writeRoot(CompoundTag root) throws IOException {
        String name = root.getName();
        writeNamed(name == null ? "" : name, root);
    }

    /**
     * Writes the kind byte, {@code name} and the payload of {@code tag}.
     */
    public void writeNamed(String name, Tag tag) throws IOException {
        writeNamed(name, tag, 0);
    }

    /**
     * Writes only the value of {@code tag}, with no kind byte and no name.
     */
    public void writePayload(Tag tag) throws IOException {
        writePayload(tag, 0);
    }

    private void writeNamed(String name, Tag tag, int depth) throws IOException {
        out.writeByte(tag.type().id());
        out.writeString(name);
        writePayload(tag, depth);
    }

    /**
     * @param depth number of enclosing lists and compounds
     */
    private void writePayload(Tag tag, int depth) throws IOException {
        switch (tag.type()) {
            case BYTE -> out.writeByte(((ByteTag) tag).getValue());
            case SHORT -> out.writeShort(((ShortTag) tag).getValue());
            case INT -> out.writeInt(((IntTag) tag).getValue());
            case LONG -> out.writeLong(((LongTag) tag).getValue());
            case FLOAT -> out.writeFloat(((FloatTag) tag).getValue());
            case DOUBLE -> out.writeDouble(((DoubleTag) tag).getValue());
            case BYTE_ARRAY -> {
                byte[] bytes = ((ByteArrayTag) tag).getValue();
                writeLength(tag.type(), bytes.length);
                out.writeBytes(bytes);
            }
            case STRING -> out.writeString(((StringTag) tag).getValue());
            case LIST -> writeList((ListTag) tag, depth + 1);
            case COMPOUND -> writeCompound((CompoundTag) tag, depth + 1);
            case INT_ARRAY -> {
                int[] ints = ((IntArrayTag) tag).getValue();
                writeLength(tag.type(), ints.length);
                out.writeIntArray(ints);
            }
            case LONG_ARRAY -> {
                long[] longs = ((LongArrayTag) tag).getValue();
                writeLength(tag.type(), longs.length);
                out.writeLongArray(longs);
            }
            case END -> throw new IllegalArgumentException("TAG_End has no payload");
        }
    }

    private void writeList(ListTag list, int depth) throws IOException {
        checkDepth(depth);
        out.writeByte(list.getElementType().id());
        writeLength(TagType.LIST, list.size());
        for (Tag element : list) {
            writePayload(element, depth);
        }
    }

    private void writeCompound(CompoundTag compound, int depth) throws IOException {
        checkDepth(depth);
        for (Map.Entry<String, Tag> entry : compound.entries().entrySet()) {
            writeNamed(entry.getKey(), entry.getValue(), depth);
        }
        out.writeByte(TagType.END.id());
    }

    private void writeLength(TagType owner, int length) throws IOException {
        if (length > settings.maxArrayLength()) {
            throw new NbtException(NbtError.MALFORMED_LENGTH,
                    String.format("%s has %d elements, limit is %d",
                            owner.displayName(), length, settings.maxArrayLength()),
                    out.written());
        }
        out.writeInt(length);
    }

    private void checkDepth(int depth) throws NbtException {
        if (depth > settings.maxDepth()) {
            throw new NbtException(NbtError.NESTING_TOO_DEEP,
                    "Nesting exceeds " + settings.maxDepth() + " levels", out.written());
        }
    }
}
