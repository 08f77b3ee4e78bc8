package io.liparakis.nbtis.region;

import io.liparakis.nbtis.NbtisSettings;
import io.liparakis.nbtis.tag.CompoundTag;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.Deflater;

import static org.assertj.core.api.Assertions.assertThat;

class RegionStorageTest {

    @TempDir
    Path tempDir;

    private RegionStorage storage;

    @BeforeEach
    void setUp() {
        storage = new RegionStorage(tempDir.resolve("region"));
    }

    @AfterEach
    void tearDown() throws IOException {
        storage.close();
    }

    // ========== Basic Save/Load Tests ==========

    @Test
    void savesAndLoadsChunk() throws IOException {
        ChunkPos pos = new ChunkPos(-1, 40);

        storage.save(pos, chunk(pos));

        assertThat(storage.load(pos)).isEqualTo(chunk(pos));
        assertThat(Files.exists(storage.directory().resolve("r.-1.1.mca"))).isTrue();
    }

    @Test
    void loadingFromMissingRegion_returnsNullWithoutCreatingFiles() throws IOException {
        assertThat(storage.load(new ChunkPos(100, 100))).isNull();
        assertThat(Files.exists(storage.directory())).isFalse();
    }

    @Test
    void loadingMissingChunkInExistingRegion_returnsNull() throws IOException {
        storage.save(new ChunkPos(0, 0), chunk(new ChunkPos(0, 0)));

        assertThat(storage.load(new ChunkPos(1, 0))).isNull();
    }

    @Test
    void savesWithRequestedScheme() throws IOException {
        ChunkPos pos = new ChunkPos(3, 3);

        storage.save(pos, chunk(pos), CompressionScheme.GZIP);

        assertThat(storage.load(pos)).isEqualTo(chunk(pos));
    }

    @Test
    void delete_removesChunk() throws IOException {
        ChunkPos pos = new ChunkPos(5, -5);
        storage.save(pos, chunk(pos));

        assertThat(storage.delete(pos)).isTrue();
        assertThat(storage.load(pos)).isNull();
        assertThat(storage.delete(pos)).isFalse();
        assertThat(storage.delete(new ChunkPos(1000, 1000))).isFalse();
    }

    // ========== Scan Tests ==========

    @Test
    void usedChunks_listsEveryRegion() throws IOException {
        List<ChunkPos> saved = List.of(
                new ChunkPos(0, 0), new ChunkPos(31, 0), new ChunkPos(32, 0),
                new ChunkPos(-1, -1), new ChunkPos(-33, 64));
        for (ChunkPos pos : saved) {
            storage.save(pos, chunk(pos));
        }

        assertThat(storage.usedChunks()).containsExactlyInAnyOrderElementsOf(saved);
    }

    @Test
    void usedChunks_ignoresUnrelatedFiles() throws IOException {
        storage.save(new ChunkPos(2, 2), chunk(new ChunkPos(2, 2)));
        Files.writeString(storage.directory().resolve("r.a.b.mca"), "junk");
        Files.writeString(storage.directory().resolve("notes.txt"), "junk");

        assertThat(storage.usedChunks()).containsExactly(new ChunkPos(2, 2));
    }

    @Test
    void usedChunks_missingDirectory_isEmpty() throws IOException {
        assertThat(storage.usedChunks()).isEmpty();
    }

    // ========== Cache Tests ==========

    @Test
    void cache_evictsOldestRegionWhenFull() throws IOException {
        storage.close();
        storage = new RegionStorage(tempDir.resolve("region"), new NbtisSettings(
                NbtisSettings.DEFAULT_MAX_DEPTH, NbtisSettings.DEFAULT_MAX_ARRAY_LENGTH,
                Deflater.DEFAULT_COMPRESSION, 2));
        List<ChunkPos> positions = List.of(new ChunkPos(0, 0), new ChunkPos(40, 0), new ChunkPos(80, 0));

        for (ChunkPos pos : positions) {
            storage.save(pos, chunk(pos));
        }

        assertThat(storage.openRegionCount()).isEqualTo(2);
        for (ChunkPos pos : positions) {
            assertThat(storage.load(pos)).isEqualTo(chunk(pos));
        }
        assertThat(storage.openRegionCount()).isEqualTo(2);
    }

    @Test
    void close_compactsFragmentedRegions() throws IOException {
        storage.save(new ChunkPos(0, 0), chunk(new ChunkPos(0, 0)));
        storage.save(new ChunkPos(1, 0), chunk(new ChunkPos(1, 0)));
        storage.delete(new ChunkPos(0, 0));
        Path regionFile = storage.directory().resolve("r.0.0.mca");

        storage.close();

        assertThat(Files.size(regionFile)).isEqualTo(3L * RegionConstants.SECTOR_SIZE);
        try (RegionFile region = RegionFile.openReadOnly(regionFile)) {
            assertThat(region.read(1, 0)).isEqualTo(chunk(new ChunkPos(1, 0)));
        }
        try (Stream<Path> files = Files.list(storage.directory())) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("r.0.0.mca");
        }
    }

    @Test
    void storage_isUsableAfterClose() throws IOException {
        ChunkPos pos = new ChunkPos(9, 9);
        storage.save(pos, chunk(pos));
        storage.close();

        assertThat(storage.load(pos)).isEqualTo(chunk(pos));
    }

    private static CompoundTag chunk(ChunkPos pos) {
        CompoundTag root = new CompoundTag("");
        root.putInt("xPos", pos.x());
        root.putInt("zPos", pos.z());
        root.putString("Status", "full");
        return root;
    }
}
