package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

/**
 * The closed set of tag kinds and their wire identifiers.
 * <p>
 * {@link #END} only ever appears on the wire as the compound terminator or as
 * the element kind of an empty list; it is never the kind of a standalone tag.
 * </p>
 */
public enum TagType {
    END(0, "TAG_End"),
    BYTE(1, "TAG_Byte"),
    SHORT(2, "TAG_Short"),
    INT(3, "TAG_Int"),
    LONG(4, "TAG_Long"),
    FLOAT(5, "TAG_Float"),
    DOUBLE(6, "TAG_Double"),
    BYTE_ARRAY(7, "TAG_Byte_Array"),
    STRING(8, "TAG_String"),
    LIST(9, "TAG_List"),
    COMPOUND(10, "TAG_Compound"),
    INT_ARRAY(11, "TAG_Int_Array"),
    LONG_ARRAY(12, "TAG_Long_Array");

    private static final TagType[] BY_ID = new TagType[13];

    static {
        for (TagType type : values()) {
            BY_ID[type.id] = type;
        }
    }

    private final int id;
    private final String displayName;

    TagType(int id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    /** The wire discriminator of this kind. */
    public int id() {
        return id;
    }

    /** The conventional {@code TAG_*} name used by the pretty printer. */
    public String displayName() {
        return displayName;
    }

    /**
     * Looks up a kind by its wire identifier.
     *
     * @param id the identifier read from the stream
     * @return the kind, or {@code null} if the identifier is not known
     */
    public static @Nullable TagType byId(int id) {
        return (id >= 0 && id < BY_ID.length) ? BY_ID[id] : null;
    }
}
