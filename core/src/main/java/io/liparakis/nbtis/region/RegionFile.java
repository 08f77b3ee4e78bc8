package io.liparakis.nbtis.region;

import io.liparakis.nbtis.Nbtis;
import io.liparakis.nbtis.NbtisSettings;
import io.liparakis.nbtis.file.Compression;
import io.liparakis.nbtis.file.NbtFile;
import io.liparakis.nbtis.file.NbtOptions;
import io.liparakis.nbtis.io.NbtError;
import io.liparakis.nbtis.io.NbtException;
import io.liparakis.nbtis.io.TagOutput;
import io.liparakis.nbtis.io.TagWriter;
import io.liparakis.nbtis.spi.HeaderSniffer;
import io.liparakis.nbtis.tag.CompoundTag;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.jetbrains.annotations.Nullable;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;

/**
 * Region container holding up to 32x32 independently compressed chunk documents.
 * <p>
 * The file starts with two 4 KiB tables of big-endian integers. The location
 * table packs a sector offset (upper 24 bits) and sector count (low 8 bits)
 * per chunk; the timestamp table holds the last modification time in epoch
 * seconds. Each chunk blob starts on a sector boundary with a 4-byte length
 * and a 1-byte {@link CompressionScheme}, followed by {@code length - 1}
 * bytes of compressed data.
 * </p>
 * <p>
 * All chunk reads are positional, so distinct chunks may be read from
 * several threads at once. Writes are serialized on this instance.
 * </p>
 */
public final class RegionFile implements AutoCloseable {

    private final Path path;
    private final boolean readOnly;
    private final NbtisSettings settings;
    private final NbtOptions chunkOptions;
    private volatile FileChannel channel;

    private final int[] locations = new int[RegionConstants.CHUNKS_PER_REGION];
    private final int[] timestamps = new int[RegionConstants.CHUNKS_PER_REGION];

    /**
     * Thread-local zlib state so that parallel chunk reads do not contend.
     */
    private final ThreadLocal<CompressionContext> compressionContext;

    /**
     * Every context handed out by {@link #compressionContext}, on any thread, so close can end them.
     */
    private final Queue<CompressionContext> openContexts = new ConcurrentLinkedQueue<>();

    private boolean dirty;
    private boolean fragmented;

    private RegionFile(Path path, boolean readOnly, NbtisSettings settings) throws IOException {
        this.path = path;
        this.readOnly = readOnly;
        this.settings = settings;
        this.chunkOptions = NbtOptions.defaults()
                .withCompression(Compression.NONE)
                .withByteOrder(ByteOrder.BIG_ENDIAN)
                .withHeaderSniffer(HeaderSniffer.NONE)
                .withSettings(settings);
        this.compressionContext = ThreadLocal.withInitial(() -> {
            CompressionContext context = new CompressionContext(settings.compressionLevel());
            openContexts.add(context);
            return context;
        });
        this.channel = openChannel();

        try {
            long size = channel.size();
            if (size == 0 && !readOnly) {
                initializeNewRegion();
            } else if (size < RegionConstants.HEADER_SIZE) {
                throw new NbtException(NbtError.UNEXPECTED_END_OF_INPUT,
                        "Region " + path.getFileName() + " is " + size + " bytes, shorter than its header", size);
            } else {
                loadHeader();
            }
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    // ==================== Opening ====================

    /**
     * Opens a region for reading and writing, creating an empty one if the file does not exist.
     */
    public static RegionFile open(Path path) throws IOException {
        return open(path, NbtisSettings.defaults());
    }

    public static RegionFile open(Path path, NbtisSettings settings) throws IOException {
        return new RegionFile(path, false, settings);
    }

    public static RegionFile openReadOnly(Path path) throws IOException {
        return openReadOnly(path, NbtisSettings.defaults());
    }

    public static RegionFile openReadOnly(Path path, NbtisSettings settings) throws IOException {
        return new RegionFile(path, true, settings);
    }

    private FileChannel openChannel() throws IOException {
        if (readOnly) {
            return FileChannel.open(path, StandardOpenOption.READ);
        }
        return FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE, StandardOpenOption.CREATE);
    }

    private void initializeNewRegion() throws IOException {
        writeFully(channel, ByteBuffer.allocate(RegionConstants.HEADER_SIZE), 0);
    }

    private void loadHeader() throws IOException {
        ByteBuffer header = ByteBuffer.allocate(RegionConstants.HEADER_SIZE);
        readFully(channel, header, 0);
        header.flip();

        header.asIntBuffer().get(locations);
        header.position(RegionConstants.SECTOR_SIZE);
        header.asIntBuffer().get(timestamps);
    }

    // ==================== Index-only scan ====================

    /**
     * Lists the occupied slots of a region file by reading only its location table.
     *
     * @return slot indices (0-1023) with a non-zero location, ascending
     */
    public static IntList occupiedSlots(Path path) throws IOException {
        ByteBuffer table = ByteBuffer.allocate(RegionConstants.SECTOR_SIZE);
        try (FileChannel source = FileChannel.open(path, StandardOpenOption.READ)) {
            readFully(source, table, 0);
        }
        table.flip();

        IntList slots = new IntArrayList();
        for (int i = 0; i < RegionConstants.CHUNKS_PER_REGION; i++) {
            if (table.getInt() != 0) {
                slots.add(i);
            }
        }
        return slots;
    }

    /**
     * Lists the absolute coordinates of every chunk present in a region file
     * without decoding any of them. The region coordinates come from the file
     * name, which must follow the {@code r.<x>.<z>.mca} convention.
     *
     * @throws IllegalArgumentException if the file name carries no region coordinates
     */
    public static List<ChunkPos> usedChunks(Path path) throws IOException {
        RegionKey key = RegionKey.fromFileName(path.getFileName().toString());
        if (key == null) {
            throw new IllegalArgumentException("Not a region file name: " + path.getFileName());
        }

        IntList slots = occupiedSlots(path);
        List<ChunkPos> chunks = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            int index = slots.getInt(i);
            chunks.add(key.chunk(index & (RegionConstants.REGION_SIZE - 1), index >> RegionConstants.REGION_SHIFT));
        }
        return chunks;
    }

    // ==================== Header queries ====================

    public Path path() {
        return path;
    }

    /**
     * Occupied slots in index order.
     */
    public List<ChunkEntry> entries() {
        List<ChunkEntry> entries = new ArrayList<>();
        for (int i = 0; i < RegionConstants.CHUNKS_PER_REGION; i++) {
            int location = locations[i];
            if (location != 0) {
                entries.add(ChunkEntry.of(i, location, timestamps[i]));
            }
        }
        return entries;
    }

    /**
     * @return the slot, or {@code null} if the location table has no entry for it
     */
    public @Nullable ChunkEntry entry(int localX, int localZ) {
        int index = getChunkIndex(localX, localZ);
        int location = locations[index];
        return location == 0 ? null : ChunkEntry.of(index, location, timestamps[index]);
    }

    public boolean hasChunk(int localX, int localZ) {
        return locations[getChunkIndex(localX, localZ)] != 0;
    }

    /** Last modification time of a chunk in epoch seconds, 0 if never written. */
    public int getTimestamp(int localX, int localZ) {
        return timestamps[getChunkIndex(localX, localZ)];
    }

    /**
     * Whether sectors have been abandoned by rewrites or deletions since the
     * file was opened or last compacted.
     */
    public synchronized boolean isFragmented() {
        return fragmented;
    }

    // ==================== Reading ====================

    /**
     * Loads one chunk.
     *
     * @return the chunk document, or {@code null} if the slot is empty or its blob is marked erased
     * @throws NbtException if the blob or the document inside it is malformed
     * @throws IOException  if the file cannot be read or the blob fails to decompress
     */
    public @Nullable NbtFile read(int localX, int localZ) throws IOException {
        ChunkEntry entry = entry(localX, localZ);
        return entry == null ? null : read(entry);
    }

    /**
     * Loads the chunk stored at a slot returned by {@link #entries()}.
     */
    public @Nullable NbtFile read(ChunkEntry entry) throws IOException {
        FileChannel source = channel;
        long offset = entry.byteOffset();

        ByteBuffer header = ByteBuffer.allocate(RegionConstants.CHUNK_HEADER_SIZE);
        readFully(source, header, offset);
        int length = header.getInt(0);
        int schemeId = header.get(4) & 0xFF;

        int available = entry.byteLength() - Integer.BYTES;
        if (length < 1 || length > available) {
            throw new NbtException(NbtError.MALFORMED_LENGTH,
                    String.format("%s declares blob length %d (allowed 1..%d)", entry, length, available),
                    offset);
        }

        CompressionScheme scheme = CompressionScheme.byId(schemeId, offset + Integer.BYTES);
        if (scheme == CompressionScheme.ERASED) {
            return null;
        }

        ByteBuffer blob = ByteBuffer.allocate(length - 1);
        readFully(source, blob, offset + RegionConstants.CHUNK_HEADER_SIZE);

        return NbtFile.fromBytes(decompress(scheme, blob.array()), chunkOptions);
    }

    /**
     * Loads every chunk, one after another.
     * <p>
     * A chunk that fails to load is passed to {@code handler}; the scan goes on
     * with the next slot unless the handler throws.
     * </p>
     *
     * @return chunk documents keyed by slot index, in index order
     */
    public Int2ObjectMap<NbtFile> readAll(ChunkFailureHandler handler) throws IOException {
        Int2ObjectMap<NbtFile> chunks = new Int2ObjectLinkedOpenHashMap<>();
        for (ChunkEntry entry : entries()) {
            try {
                NbtFile chunk = read(entry);
                if (chunk != null) {
                    chunks.put(entry.index(), chunk);
                }
            } catch (IOException e) {
                handler.onFailure(entry, e);
            }
        }
        return chunks;
    }

    /**
     * Loads every chunk, decoding on {@code executor}.
     * <p>
     * Results are assembled in slot order regardless of completion order, and
     * failures reach {@code handler} in slot order too. If the handler throws,
     * chunks that have not started yet are cancelled.
     * </p>
     */
    public Int2ObjectMap<NbtFile> readAll(ExecutorService executor, ChunkFailureHandler handler) throws IOException {
        List<ChunkEntry> entries = entries();
        List<CompletableFuture<NbtFile>> pending = new ArrayList<>(entries.size());
        for (ChunkEntry entry : entries) {
            pending.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return read(entry);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }, executor));
        }

        Int2ObjectMap<NbtFile> chunks = new Int2ObjectLinkedOpenHashMap<>();
        try {
            for (int i = 0; i < entries.size(); i++) {
                ChunkEntry entry = entries.get(i);
                try {
                    NbtFile chunk = pending.get(i).join();
                    if (chunk != null) {
                        chunks.put(entry.index(), chunk);
                    }
                } catch (CompletionException e) {
                    handler.onFailure(entry, unwrap(e));
                }
            }
        } catch (IOException | RuntimeException e) {
            pending.forEach(future -> future.cancel(false));
            throw e;
        }
        return chunks;
    }

    private static IOException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof UncheckedIOException unchecked) {
            return unchecked.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IOException(cause);
    }

    private byte[] decompress(CompressionScheme scheme, byte[] data) throws IOException {
        return switch (scheme) {
            case GZIP -> {
                try (InputStream in = Compression.GZIP.decompress(new ByteArrayInputStream(data))) {
                    yield in.readAllBytes();
                }
            }
            case ZLIB -> compressionContext.get().decompress(data);
            case UNCOMPRESSED -> data;
            case ERASED -> throw new IllegalArgumentException("Erased chunks carry no data");
        };
    }

    // ==================== Writing ====================

    /**
     * Stores a chunk with zlib compression.
     */
    public void write(int localX, int localZ, CompoundTag chunk) throws IOException {
        write(localX, localZ, chunk, CompressionScheme.ZLIB);
    }

    /**
     * Stores a chunk, replacing any previous one at the same coordinates.
     * <p>
     * The blob goes back into the sectors it occupied before if it still fits
     * there; otherwise it is appended at the end of the file.
     * </p>
     *
     * @throws NbtException with {@link NbtError#MALFORMED_LENGTH} if the blob needs more than 255 sectors
     */
    public synchronized void write(int localX, int localZ, CompoundTag chunk, CompressionScheme scheme)
            throws IOException {
        ensureWritable();
        if (scheme == CompressionScheme.ERASED) {
            throw new IllegalArgumentException("Use delete() to erase a chunk");
        }
        int index = getChunkIndex(localX, localZ);

        byte[] data = compress(scheme, encode(chunk));
        int totalLength = RegionConstants.CHUNK_HEADER_SIZE + data.length;
        int sectorsNeeded = (totalLength + RegionConstants.SECTOR_SIZE - 1) / RegionConstants.SECTOR_SIZE;
        if (sectorsNeeded > RegionConstants.MAX_SECTORS_PER_CHUNK) {
            throw new NbtException(NbtError.MALFORMED_LENGTH, String.format(
                    "Chunk [%d, %d] needs %d sectors, limit is %d",
                    localX, localZ, sectorsNeeded, RegionConstants.MAX_SECTORS_PER_CHUNK));
        }

        int sectorOffset = calculateWriteOffset(index, sectorsNeeded);

        ByteBuffer buffer = ByteBuffer.allocate(sectorsNeeded * RegionConstants.SECTOR_SIZE);
        buffer.putInt(data.length + 1);
        buffer.put((byte) scheme.id());
        buffer.put(data);
        buffer.clear();
        writeFully(channel, buffer, (long) sectorOffset * RegionConstants.SECTOR_SIZE);

        updateHeader(index, (sectorOffset << 8) | sectorsNeeded, currentEpochSeconds());
        dirty = true;
    }

    /**
     * Removes a chunk from the location table. Its sectors stay in the file
     * until the next {@link #compact()}.
     *
     * @return whether a chunk was present
     */
    public synchronized boolean delete(int localX, int localZ) throws IOException {
        ensureWritable();
        int index = getChunkIndex(localX, localZ);
        if (locations[index] == 0) {
            return false;
        }
        updateHeader(index, 0, 0);
        fragmented = true;
        dirty = true;
        return true;
    }

    private byte[] encode(CompoundTag chunk) throws IOException {
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        new TagWriter(new TagOutput(raw, ByteOrder.BIG_ENDIAN), settings).writeRoot(chunk);
        return raw.toByteArray();
    }

    private byte[] compress(CompressionScheme scheme, byte[] raw) throws IOException {
        return switch (scheme) {
            case GZIP -> Compression.GZIP.compress(raw, settings.compressionLevel());
            case ZLIB -> compressionContext.get().compress(raw);
            case UNCOMPRESSED -> raw;
            case ERASED -> throw new IllegalArgumentException("Erased chunks carry no data");
        };
    }

    /**
     * Picks the first sector for a blob. Reuses the chunk's current run if it
     * is large enough, otherwise appends after the last sector of the file.
     */
    private int calculateWriteOffset(int index, int sectorsNeeded) throws IOException {
        int location = locations[index];
        int currentOffset = location >>> 8;
        int currentCount = location & 0xFF;

        if (location != 0 && sectorsNeeded <= currentCount) {
            if (sectorsNeeded < currentCount) {
                fragmented = true;
            }
            return currentOffset;
        }
        if (location != 0) {
            fragmented = true;
        }

        long fileSectors = (channel.size() + RegionConstants.SECTOR_SIZE - 1) / RegionConstants.SECTOR_SIZE;
        long offset = Math.max(RegionConstants.HEADER_SECTORS, fileSectors);
        if (offset > RegionConstants.MAX_SECTOR_OFFSET) {
            throw new NbtException(NbtError.MALFORMED_LENGTH,
                    "Region " + path.getFileName() + " has no addressable sectors left");
        }
        return (int) offset;
    }

    /**
     * Updates both header entries of a chunk in memory and on disk.
     */
    private void updateHeader(int index, int location, int timestamp) throws IOException {
        locations[index] = location;
        timestamps[index] = timestamp;

        long entryOffset = (long) index * Integer.BYTES;
        writeFully(channel, ByteBuffer.allocate(Integer.BYTES).putInt(0, location), entryOffset);
        writeFully(channel, ByteBuffer.allocate(Integer.BYTES).putInt(0, timestamp),
                RegionConstants.SECTOR_SIZE + entryOffset);
    }

    private static int currentEpochSeconds() {
        return (int) (System.currentTimeMillis() / 1000L);
    }

    // ==================== Maintenance ====================

    /**
     * Forces pending writes to disk.
     */
    public synchronized void flush() throws IOException {
        if (dirty && channel.isOpen()) {
            channel.force(false);
            dirty = false;
        }
    }

    /**
     * Rewrites the file with every chunk packed contiguously after the header,
     * dropping abandoned sectors. Timestamps are kept.
     */
    public synchronized void compact() throws IOException {
        ensureWritable();
        flush();
        Path tempPath = path.resolveSibling(path.getFileName() + ".tmp");

        int[] newLocations = new int[RegionConstants.CHUNKS_PER_REGION];
        try (FileChannel dest = FileChannel.open(tempPath, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {

            int currentSector = RegionConstants.HEADER_SECTORS;
            for (int i = 0; i < RegionConstants.CHUNKS_PER_REGION; i++) {
                int location = locations[i];
                if (location == 0) {
                    continue;
                }
                int count = location & 0xFF;
                ByteBuffer sectors = ByteBuffer.allocate(count * RegionConstants.SECTOR_SIZE);
                readFully(channel, sectors, (long) (location >>> 8) * RegionConstants.SECTOR_SIZE);
                sectors.flip();
                writeFully(dest, sectors, (long) currentSector * RegionConstants.SECTOR_SIZE);

                newLocations[i] = (currentSector << 8) | count;
                currentSector += count;
            }

            ByteBuffer header = ByteBuffer.allocate(RegionConstants.HEADER_SIZE);
            header.asIntBuffer().put(newLocations).put(timestamps);
            writeFully(dest, header, 0);
            dest.force(true);
        } catch (IOException e) {
            Files.deleteIfExists(tempPath);
            throw e;
        }

        channel.close();
        try {
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            channel = openChannel();
        }
        System.arraycopy(newLocations, 0, locations, 0, newLocations.length);
        fragmented = false;
        Nbtis.LOGGER.debug("Compacted region {}", path.getFileName());
    }

    /**
     * Flushes and closes the file, releasing the zlib state of every thread
     * that read or wrote through it. No other thread may still be using the
     * region.
     */
    @Override
    public synchronized void close() throws IOException {
        try {
            flush();
        } finally {
            channel.close();
            compressionContext.remove();
            CompressionContext context;
            while ((context = openContexts.poll()) != null) {
                context.end();
            }
        }
    }

    /**
     * Number of compression contexts not yet released.
     */
    int openContextCount() {
        return openContexts.size();
    }

    // ==================== Helpers ====================

    private void ensureWritable() {
        if (readOnly) {
            throw new IllegalStateException("Region " + path.getFileName() + " is open read-only");
        }
    }

    /**
     * Gets the index of a chunk within the header tables (0-1023).
     */
    private static int getChunkIndex(int localX, int localZ) {
        if (localX < 0 || localX >= RegionConstants.REGION_SIZE
                || localZ < 0 || localZ >= RegionConstants.REGION_SIZE) {
            throw new IllegalArgumentException(
                    "Local chunk coordinates out of range: [" + localX + ", " + localZ + "]");
        }
        return localX + localZ * RegionConstants.REGION_SIZE;
    }

    private static void readFully(FileChannel source, ByteBuffer buffer, long position) throws IOException {
        long start = position;
        while (buffer.hasRemaining()) {
            int read = source.read(buffer, position);
            if (read < 0) {
                throw new NbtException(NbtError.UNEXPECTED_END_OF_INPUT,
                        String.format("Needed %d bytes at offset %d but the file ended",
                                buffer.limit(), start),
                        position);
            }
            position += read;
        }
    }

    private static void writeFully(FileChannel dest, ByteBuffer buffer, long position) throws IOException {
        while (buffer.hasRemaining()) {
            position += dest.write(buffer, position);
        }
    }
}
