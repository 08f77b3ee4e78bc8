package io.liparakis.nbtis.file;

import io.liparakis.nbtis.NbtisSettings;
import io.liparakis.nbtis.spi.HeaderSniffer;
import org.jetbrains.annotations.Nullable;

import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Framing choices for loading and saving an {@link NbtFile}.
 *
 * @param compression      outer compression; {@code null} means detect on load and reuse on save
 * @param byteOrder        byte order of the tag stream; {@code null} means big-endian on load and
 *                         the loaded order on save
 * @param headerSniffer    vendor header detection used on load
 * @param dropVendorHeader on save, omit a vendor header that was present on load
 * @param settings         decode limits and compression level
 */
public record NbtOptions(@Nullable Compression compression,
                         @Nullable ByteOrder byteOrder,
                         HeaderSniffer headerSniffer,
                         boolean dropVendorHeader,
                         NbtisSettings settings) {

    public NbtOptions {
        Objects.requireNonNull(headerSniffer, "headerSniffer");
        Objects.requireNonNull(settings, "settings");
    }

    public static NbtOptions defaults() {
        return new NbtOptions(null, null, HeaderSniffer.DEFAULT, false, NbtisSettings.defaults());
    }

    /** Uncompressed little-endian framing, as used by Bedrock edition files. */
    public static NbtOptions littleEndian() {
        return defaults().withCompression(Compression.NONE).withByteOrder(ByteOrder.LITTLE_ENDIAN);
    }

    public NbtOptions withCompression(@Nullable Compression compression) {
        return new NbtOptions(compression, byteOrder, headerSniffer, dropVendorHeader, settings);
    }

    public NbtOptions withByteOrder(@Nullable ByteOrder byteOrder) {
        return new NbtOptions(compression, byteOrder, headerSniffer, dropVendorHeader, settings);
    }

    public NbtOptions withHeaderSniffer(HeaderSniffer headerSniffer) {
        return new NbtOptions(compression, byteOrder, headerSniffer, dropVendorHeader, settings);
    }

    public NbtOptions withoutVendorHeader() {
        return new NbtOptions(compression, byteOrder, headerSniffer, true, settings);
    }

    public NbtOptions withSettings(NbtisSettings settings) {
        return new NbtOptions(compression, byteOrder, headerSniffer, dropVendorHeader, settings);
    }
}
