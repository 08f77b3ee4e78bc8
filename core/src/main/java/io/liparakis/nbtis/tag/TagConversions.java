package io.liparakis.nbtis.tag;

import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Explicit conversions from raw Java values to tags.
 * <p>
 * Integral targets accept any {@link Number} whose value is a whole number
 * within range; floating targets accept any finite-range {@link Number}. A
 * value that cannot be represented exactly in range is rejected rather than
 * wrapped.
 * </p>
 */
public final class TagConversions {

    private TagConversions() {
        throw new AssertionError("TagConversions is a utility class and should not be instantiated");
    }

    /**
     * Converts {@code value} to a tag of kind {@code type}.
     * A tag that already has the requested kind is returned as is.
     *
     * @throws TagTypeMismatchException if the value cannot be represented as {@code type}
     */
    public static Tag convert(TagType type, Object value) {
        if (value instanceof Tag tag) {
            if (tag.type() != type) {
                throw new TagTypeMismatchException(type, tag.type());
            }
            return tag;
        }

        return switch (type) {
            case BYTE -> new ByteTag((byte) integral(type, value, Byte.MIN_VALUE, Byte.MAX_VALUE));
            case SHORT -> new ShortTag((short) integral(type, value, Short.MIN_VALUE, Short.MAX_VALUE));
            case INT -> new IntTag((int) integral(type, value, Integer.MIN_VALUE, Integer.MAX_VALUE));
            case LONG -> new LongTag(integral(type, value, Long.MIN_VALUE, Long.MAX_VALUE));
            case FLOAT -> new FloatTag(toFloat(value));
            case DOUBLE -> new DoubleTag(toDouble(type, value));
            case STRING -> {
                if (value instanceof CharSequence text) {
                    yield new StringTag(text.toString());
                }
                throw mismatch(type, value);
            }
            case BYTE_ARRAY -> {
                if (value instanceof byte[] bytes) {
                    yield new ByteArrayTag(bytes);
                }
                throw mismatch(type, value);
            }
            case INT_ARRAY -> {
                if (value instanceof int[] ints) {
                    yield new IntArrayTag(ints);
                }
                throw mismatch(type, value);
            }
            case LONG_ARRAY -> {
                if (value instanceof long[] longs) {
                    yield new LongArrayTag(longs);
                }
                throw mismatch(type, value);
            }
            case COMPOUND -> {
                if (value instanceof Map<?, ?> map) {
                    yield toCompound(map);
                }
                throw mismatch(type, value);
            }
            case LIST, END -> throw mismatch(type, value);
        };
    }

    /**
     * Picks the tag kind that naturally holds {@code value}: boxed primitives
     * map to their same-width kind, {@link CharSequence} to a string, primitive
     * arrays to array kinds and string-keyed maps to compounds.
     *
     * @throws TagTypeMismatchException if no kind fits the value
     */
    public static Tag infer(Object value) {
        if (value instanceof Tag tag) {
            return tag;
        }
        if (value instanceof Byte b) {
            return new ByteTag(b);
        }
        if (value instanceof Boolean flag) {
            return new ByteTag(flag ? (byte) 1 : (byte) 0);
        }
        if (value instanceof Short s) {
            return new ShortTag(s);
        }
        if (value instanceof Integer i) {
            return new IntTag(i);
        }
        if (value instanceof Long l) {
            return new LongTag(l);
        }
        if (value instanceof Float f) {
            return new FloatTag(f);
        }
        if (value instanceof Double d) {
            return new DoubleTag(d);
        }
        if (value instanceof CharSequence text) {
            return new StringTag(text.toString());
        }
        if (value instanceof byte[] bytes) {
            return new ByteArrayTag(bytes);
        }
        if (value instanceof int[] ints) {
            return new IntArrayTag(ints);
        }
        if (value instanceof long[] longs) {
            return new LongArrayTag(longs);
        }
        if (value instanceof Map<?, ?> map) {
            return toCompound(map);
        }
        throw new TagTypeMismatchException(TagType.END, null,
                "Cannot infer a tag kind for " + describe(value));
    }

    private static CompoundTag toCompound(Map<?, ?> map) {
        CompoundTag compound = new CompoundTag();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new TagTypeMismatchException(TagType.COMPOUND, null,
                        "Compound keys must be strings, got " + describe(entry.getKey()));
            }
            compound.put(key, infer(entry.getValue()));
        }
        return compound;
    }

    private static long integral(TagType type, Object value, long min, long max) {
        long result;
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            result = ((Number) value).longValue();
        } else if (value instanceof Boolean flag) {
            result = flag ? 1 : 0;
        } else if (value instanceof Float || value instanceof Double) {
            double d = ((Number) value).doubleValue();
            // The range is [min, -min); -min is exact as a double where max may not be.
            if (d != Math.rint(d) || d < min || d >= -(double) min) {
                throw new TagTypeMismatchException(type, null,
                        d + " is not a whole number within " + type.displayName() + " range");
            }
            result = (long) d;
        } else {
            throw mismatch(type, value);
        }

        if (result < min || result > max) {
            throw new TagTypeMismatchException(type, null,
                    result + " does not fit in " + type.displayName() + " [" + min + ", " + max + "]");
        }
        return result;
    }

    private static float toFloat(Object value) {
        double d = toDouble(TagType.FLOAT, value);
        if (Double.isFinite(d) && Math.abs(d) > Float.MAX_VALUE) {
            throw new TagTypeMismatchException(TagType.FLOAT, null,
                    d + " does not fit in " + TagType.FLOAT.displayName());
        }
        return (float) d;
    }

    private static double toDouble(TagType type, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw mismatch(type, value);
    }

    private static TagTypeMismatchException mismatch(TagType type, @Nullable Object value) {
        return new TagTypeMismatchException(type, null,
                "Cannot convert " + describe(value) + " to " + type.displayName());
    }

    private static String describe(@Nullable Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
