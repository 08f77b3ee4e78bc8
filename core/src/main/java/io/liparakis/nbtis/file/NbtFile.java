package io.liparakis.nbtis.file;

import io.liparakis.nbtis.io.NbtError;
import io.liparakis.nbtis.io.NbtException;
import io.liparakis.nbtis.io.TagInput;
import io.liparakis.nbtis.io.TagOutput;
import io.liparakis.nbtis.io.TagReader;
import io.liparakis.nbtis.io.TagWriter;
import io.liparakis.nbtis.tag.CompoundTag;
import io.liparakis.nbtis.tag.Tag;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A tag document: the root compound together with the framing it was read
 * with.
 * <p>
 * The document is itself the root compound; its entries are the root's
 * children. The framing (compression, byte order and vendor header) is
 * remembered on load so that {@link #save(OutputStream)} reproduces it.
 * </p>
 */
public final class NbtFile extends CompoundTag {

    private Compression compression;
    private ByteOrder byteOrder;
    private @Nullable VendorHeader vendorHeader;

    /**
     * Creates an empty document with the empty root name, gzip compression and
     * big-endian byte order.
     */
    public NbtFile() {
        this("");
    }

    public NbtFile(String name) {
        this(name, Compression.GZIP, ByteOrder.BIG_ENDIAN, null);
    }

    public NbtFile(String name, Compression compression, ByteOrder byteOrder, @Nullable VendorHeader vendorHeader) {
        super(Objects.requireNonNull(name, "name"));
        this.compression = Objects.requireNonNull(compression, "compression");
        this.byteOrder = Objects.requireNonNull(byteOrder, "byteOrder");
        this.vendorHeader = vendorHeader;
    }

    // ==================== Loading ====================

    public static NbtFile load(Path file) throws IOException {
        return load(file, NbtOptions.defaults());
    }

    public static NbtFile load(Path file, NbtOptions options) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, options);
        }
    }

    public static NbtFile load(InputStream in) throws IOException {
        return load(in, NbtOptions.defaults());
    }

    /**
     * Reads a document.
     * <p>
     * The outer compression is removed first (detected unless the options fix
     * it), then the vendor header sniffer inspects the uncompressed prefix,
     * then the root compound is decoded in the requested byte order. A
     * compressed stream is read to its end so that its checksum is verified.
     * The stream is not closed.
     * </p>
     *
     * @throws NbtException if the content is malformed
     * @throws IOException  if the stream cannot be read
     */
    public static NbtFile load(InputStream in, NbtOptions options) throws IOException {
        BufferedInputStream source = new BufferedInputStream(in);

        Compression compression = options.compression();
        if (compression == null) {
            compression = Compression.detect(peek(source, 2));
        }

        BufferedInputStream plain = new BufferedInputStream(DecompressedInput.open(compression, source));
        VendorHeader header = options.headerSniffer().sniff(peek(plain, VendorHeader.SNIFF_LENGTH));
        if (header != null) {
            int skipped = plain.readNBytes(header.kind().size()).length;
            if (skipped != header.kind().size()) {
                throw new NbtException(NbtError.UNEXPECTED_END_OF_INPUT,
                        header.kind() + " header is truncated", skipped);
            }
        }

        ByteOrder order = options.byteOrder() != null ? options.byteOrder() : ByteOrder.BIG_ENDIAN;
        CompoundTag root = new TagReader(new TagInput(plain, order), options.settings()).readRoot();
        if (compression != Compression.NONE) {
            DecompressedInput.drain(plain);
        }

        NbtFile file = new NbtFile(Objects.requireNonNull(root.getName()), compression, order, header);
        List<Tag> children = new ArrayList<>(root.values());
        root.clear();
        for (Tag child : children) {
            file.put(Objects.requireNonNull(child.getName()), child);
        }
        return file;
    }

    /**
     * Decodes a document held in memory, such as a chunk payload extracted
     * from a region file.
     */
    public static NbtFile fromBytes(byte[] data, NbtOptions options) throws IOException {
        return load(new ByteArrayInputStream(data), options);
    }

    private static byte[] peek(BufferedInputStream in, int length) throws IOException {
        in.mark(length);
        byte[] prefix = in.readNBytes(length);
        in.reset();
        return prefix;
    }

    // ==================== Saving ====================

    public void save(Path file) throws IOException {
        save(file, NbtOptions.defaults());
    }

    public void save(Path file, NbtOptions options) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            save(out, options);
        }
    }

    public void save(OutputStream out) throws IOException {
        save(out, NbtOptions.defaults());
    }

    /**
     * Writes the document. Options left unset fall back to this document's
     * framing. A vendor header is re-emitted with the new payload length
     * unless {@link NbtOptions#dropVendorHeader()} is set. The stream is not
     * closed.
     */
    public void save(OutputStream out, NbtOptions options) throws IOException {
        out.write(toBytes(options));
        out.flush();
    }

    /**
     * Encodes the document, including its framing, into a byte array.
     */
    public byte[] toBytes(NbtOptions options) throws IOException {
        Compression targetCompression = options.compression() != null ? options.compression() : compression;
        ByteOrder targetOrder = options.byteOrder() != null ? options.byteOrder() : byteOrder;
        VendorHeader header = options.dropVendorHeader() ? null : vendorHeader;

        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        new TagWriter(new TagOutput(payload, targetOrder), options.settings()).writeRoot(this);

        ByteArrayOutputStream framed = new ByteArrayOutputStream(payload.size() + VendorHeader.SNIFF_LENGTH);
        if (header != null) {
            header.withPayloadLength(payload.size()).writeTo(framed);
        }
        payload.writeTo(framed);

        return targetCompression.compress(framed.toByteArray(), options.settings().compressionLevel());
    }

    // ==================== Framing ====================

    public Compression getCompression() {
        return compression;
    }

    public void setCompression(Compression compression) {
        this.compression = Objects.requireNonNull(compression, "compression");
    }

    public ByteOrder getByteOrder() {
        return byteOrder;
    }

    public void setByteOrder(ByteOrder byteOrder) {
        this.byteOrder = Objects.requireNonNull(byteOrder, "byteOrder");
    }

    /** The vendor header found on load, or {@code null} for standard framing. */
    public @Nullable VendorHeader getVendorHeader() {
        return vendorHeader;
    }

    public void setVendorHeader(@Nullable VendorHeader vendorHeader) {
        this.vendorHeader = vendorHeader;
    }

    @Override
    public NbtFile copy() {
        NbtFile copy = new NbtFile(Objects.requireNonNull(getName()), compression, byteOrder, vendorHeader);
        copyEntriesInto(copy);
        return copy;
    }
}
