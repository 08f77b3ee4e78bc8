package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

/**
 * Renders tag trees as indented text for debugging.
 * <p>
 * Output looks like:
 * <pre>
 * TAG_Compound(''): 2 entries
 * {
 *   TAG_String('name'): 'Steve'
 *   TAG_List('pos'): 3 entries
 *   {
 *     TAG_Double(None): 1.5
 *     ...
 *   }
 * }
 * </pre>
 * Unnamed tags (list elements) print {@code None} as their name.
 * </p>
 */
public final class TagPrinter {
    public static final String DEFAULT_INDENT = "  ";

    private TagPrinter() {
        throw new AssertionError("TagPrinter is a utility class and should not be instantiated");
    }

    public static String pretty(Tag tag) {
        return pretty(tag, DEFAULT_INDENT);
    }

    /**
     * Renders {@code tag} and all of its descendants.
     *
     * @param tag        the root of the subtree to print
     * @param indentUnit the text repeated once per nesting level
     */
    public static String pretty(Tag tag, String indentUnit) {
        StringBuilder out = new StringBuilder();
        append(out, tag, 0, indentUnit);
        return out.toString();
    }

    /** Single-line summary of a tag, without its children. */
    static String describe(Tag tag) {
        StringBuilder out = new StringBuilder();
        header(out, tag);
        return out.toString();
    }

    private static void append(StringBuilder out, Tag tag, int depth, String indentUnit) {
        String indent = indentUnit.repeat(depth);
        out.append(indent);
        header(out, tag);

        Iterable<Tag> children = switch (tag.type()) {
            case LIST -> (ListTag) tag;
            case COMPOUND -> ((CompoundTag) tag).values();
            default -> null;
        };
        if (children == null) {
            return;
        }

        out.append('\n').append(indent).append('{');
        for (Tag child : children) {
            out.append('\n');
            append(out, child, depth + 1, indentUnit);
        }
        out.append('\n').append(indent).append('}');
    }

    private static void header(StringBuilder out, Tag tag) {
        out.append(tag.type().displayName()).append('(').append(quote(tag.getName())).append("): ");

        switch (tag.type()) {
            case BYTE -> out.append(((ByteTag) tag).getValue());
            case SHORT -> out.append(((ShortTag) tag).getValue());
            case INT -> out.append(((IntTag) tag).getValue());
            case LONG -> out.append(((LongTag) tag).getValue());
            case FLOAT -> out.append(((FloatTag) tag).getValue());
            case DOUBLE -> out.append(((DoubleTag) tag).getValue());
            case STRING -> out.append(quote(((StringTag) tag).getValue()));
            case BYTE_ARRAY -> out.append('[').append(((ByteArrayTag) tag).length()).append(" bytes]");
            case INT_ARRAY -> out.append('[').append(((IntArrayTag) tag).length()).append(" integers]");
            case LONG_ARRAY -> out.append('[').append(((LongArrayTag) tag).length()).append(" longs]");
            case LIST -> out.append(((ListTag) tag).size()).append(" entries");
            case COMPOUND -> out.append(((CompoundTag) tag).size()).append(" entries");
            case END -> throw new IllegalStateException("TAG_End has no printable form");
        }
    }

    private static String quote(@Nullable String text) {
        if (text == null) {
            return "None";
        }
        return "'" + text.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
