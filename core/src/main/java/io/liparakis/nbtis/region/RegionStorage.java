package io.liparakis.nbtis.region;

import io.liparakis.nbtis.Nbtis;
import io.liparakis.nbtis.NbtisSettings;
import io.liparakis.nbtis.file.NbtFile;
import io.liparakis.nbtis.tag.CompoundTag;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Directory of region files addressed by absolute chunk coordinates.
 * Features:
 * - One {@code r.<x>.<z>.mca} file per 32x32 chunks
 * - LRU caching of open region files
 * - Region files are created on first write only
 */
public final class RegionStorage implements AutoCloseable {

    /**
     * The directory holding the region files.
     */
    private final Path storageDir;
    private final NbtisSettings settings;

    /**
     * LRU cache of open region files, oldest first.
     */
    private final Object2ObjectLinkedOpenHashMap<RegionKey, RegionFile> regionCache;

    /**
     * Lock for managing access to the region cache.
     */
    private final ReadWriteLock cacheLock = new ReentrantReadWriteLock();

    public RegionStorage(Path storageDir) {
        this(storageDir, NbtisSettings.defaults());
    }

    public RegionStorage(Path storageDir, NbtisSettings settings) {
        this.storageDir = storageDir;
        this.settings = settings;
        this.regionCache = new Object2ObjectLinkedOpenHashMap<>(settings.maxCachedRegions());
    }

    public Path directory() {
        return storageDir;
    }

    /**
     * Loads a chunk.
     *
     * @return the chunk document, or {@code null} if it is not stored
     * @throws IOException if the region or the chunk is unreadable
     */
    public @Nullable NbtFile load(ChunkPos pos) throws IOException {
        RegionFile regionFile = getRegionFile(pos.region(), false);
        if (regionFile == null) {
            return null;
        }
        return regionFile.read(pos.localX(), pos.localZ());
    }

    /**
     * Stores a chunk with zlib compression, creating its region file if needed.
     */
    public void save(ChunkPos pos, CompoundTag chunk) throws IOException {
        save(pos, chunk, CompressionScheme.ZLIB);
    }

    public void save(ChunkPos pos, CompoundTag chunk, CompressionScheme scheme) throws IOException {
        RegionFile regionFile = getRegionFile(pos.region(), true);
        regionFile.write(pos.localX(), pos.localZ(), chunk, scheme);
    }

    /**
     * Removes a chunk.
     *
     * @return whether the chunk was stored
     */
    public boolean delete(ChunkPos pos) throws IOException {
        RegionFile regionFile = getRegionFile(pos.region(), false);
        return regionFile != null && regionFile.delete(pos.localX(), pos.localZ());
    }

    /**
     * Lists every stored chunk by scanning the location table of each region
     * file in the directory. No chunk is decoded.
     */
    public List<ChunkPos> usedChunks() throws IOException {
        flushAll();

        List<ChunkPos> chunks = new ArrayList<>();
        if (!Files.isDirectory(storageDir)) {
            return chunks;
        }
        try (DirectoryStream<Path> regions = Files.newDirectoryStream(storageDir,
                "r.*.*." + RegionConstants.FILE_EXTENSION)) {
            for (Path region : regions) {
                if (RegionKey.fromFileName(region.getFileName().toString()) != null) {
                    chunks.addAll(RegionFile.usedChunks(region));
                }
            }
        }
        return chunks;
    }

    /**
     * Flushes every open region file.
     */
    public void flushAll() throws IOException {
        cacheLock.readLock().lock();
        try {
            for (RegionFile regionFile : regionCache.values()) {
                regionFile.flush();
            }
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    /**
     * Compacts fragmented region files and closes all of them.
     */
    @Override
    public void close() throws IOException {
        cacheLock.writeLock().lock();
        try {
            IOException failure = null;
            for (RegionFile regionFile : regionCache.values()) {
                try {
                    if (regionFile.isFragmented()) {
                        compact(regionFile);
                    }
                    regionFile.close();
                } catch (IOException e) {
                    Nbtis.LOGGER.warn("Failed to close region {}", regionFile.path().getFileName(), e);
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            regionCache.clear();
            if (failure != null) {
                throw failure;
            }
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    private static void compact(RegionFile regionFile) {
        try {
            regionFile.compact();
        } catch (IOException e) {
            // The file stays usable, only the abandoned sectors are kept.
            Nbtis.LOGGER.error("Failed to compact region {}", regionFile.path().getFileName(), e);
        }
    }

    /**
     * Gets or opens a region file, using LRU caching.
     *
     * @param create whether to create the file if it does not exist yet
     * @return the region file, or {@code null} if it does not exist and {@code create} is false
     */
    private @Nullable RegionFile getRegionFile(RegionKey key, boolean create) throws IOException {
        cacheLock.readLock().lock();
        try {
            RegionFile existing = regionCache.get(key);
            if (existing != null) {
                return existing;
            }
        } finally {
            cacheLock.readLock().unlock();
        }

        cacheLock.writeLock().lock();
        try {
            // Double check lock pattern
            RegionFile existing = regionCache.get(key);
            if (existing != null) {
                return existing;
            }

            Path regionPath = storageDir.resolve(key.fileName());
            if (!create && !Files.exists(regionPath)) {
                return null;
            }
            if (create) {
                Files.createDirectories(storageDir);
            }

            if (regionCache.size() >= settings.maxCachedRegions()) {
                evictOldestRegion();
            }

            RegionFile newFile = RegionFile.open(regionPath, settings);
            regionCache.put(key, newFile);
            Nbtis.LOGGER.debug("Opened region {}", key);
            return newFile;
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    /**
     * Closes the region file that was opened first.
     */
    private void evictOldestRegion() {
        RegionFile oldest = regionCache.removeFirst();
        if (oldest == null) {
            return;
        }
        try {
            oldest.close();
            Nbtis.LOGGER.debug("Evicted region {}", oldest.path().getFileName());
        } catch (IOException e) {
            Nbtis.LOGGER.warn("Failed to close evicted region {}", oldest.path().getFileName(), e);
        }
    }

    /**
     * Number of region files currently open.
     */
    int openRegionCount() {
        cacheLock.readLock().lock();
        try {
            return regionCache.size();
        } finally {
            cacheLock.readLock().unlock();
        }
    }
}
