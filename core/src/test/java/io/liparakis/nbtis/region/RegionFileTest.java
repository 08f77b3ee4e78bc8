package io.liparakis.nbtis.region;

import io.liparakis.nbtis.file.NbtFile;
import io.liparakis.nbtis.io.NbtError;
import io.liparakis.nbtis.io.NbtException;
import io.liparakis.nbtis.tag.CompoundTag;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.zip.ZipException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;

/**
 * Tests for {@link RegionFile} covering the sector layout, scan paths and
 * per-chunk failure isolation.
 */
@ExtendWith(MockitoExtension.class)
class RegionFileTest {

    private static final int SECTOR = RegionConstants.SECTOR_SIZE;

    @TempDir
    Path tempDir;

    @Mock
    ChunkFailureHandler handler;

    // ========== Creation Tests ==========

    @Test
    void open_newFile_writesEmptyHeader() throws IOException {
        Path path = tempDir.resolve("r.0.0.mca");

        try (RegionFile region = RegionFile.open(path)) {
            assertThat(region.entries()).isEmpty();
            assertThat(region.hasChunk(0, 0)).isFalse();
            assertThat(region.read(0, 0)).isNull();
        }

        assertThat(Files.size(path)).isEqualTo(RegionConstants.HEADER_SIZE);
    }

    @Test
    void open_fileShorterThanHeader_throwsUnexpectedEnd() throws IOException {
        Path path = tempDir.resolve("r.0.0.mca");
        Files.write(path, new byte[100]);

        NbtException e = catchThrowableOfType(() -> RegionFile.open(path), NbtException.class);

        assertThat(e.getError()).isEqualTo(NbtError.UNEXPECTED_END_OF_INPUT);
    }

    @Test
    void openReadOnly_missingFile_throws() {
        assertThatThrownBy(() -> RegionFile.openReadOnly(tempDir.resolve("r.9.9.mca")))
                .isInstanceOf(NoSuchFileException.class);
    }

    // ========== Read/Write Tests ==========

    @Test
    void write_firstChunk_occupiesSectorAfterHeader() throws IOException {
        Path path = tempDir.resolve("r.0.0.mca");

        try (RegionFile region = RegionFile.open(path)) {
            region.write(1, 0, chunk(1, 0));

            ChunkEntry entry = region.entry(1, 0);
            assertThat(entry).isNotNull();
            assertThat(entry.index()).isEqualTo(1);
            assertThat(entry.sectorOffset()).isEqualTo(RegionConstants.HEADER_SECTORS);
            assertThat(entry.sectorCount()).isEqualTo(1);
        }

        assertThat(Files.size(path)).isEqualTo(3L * SECTOR);
        ByteBuffer file = ByteBuffer.wrap(Files.readAllBytes(path));
        assertThat(file.getInt(4)).isEqualTo((2 << 8) | 1);
        assertThat(file.get(2 * SECTOR + 4)).isEqualTo((byte) CompressionScheme.ZLIB.id());
    }

    @ParameterizedTest
    @EnumSource(value = CompressionScheme.class, names = {"GZIP", "ZLIB", "UNCOMPRESSED"})
    void writeThenRead_eachScheme_roundTrips(CompressionScheme scheme) throws IOException {
        Path path = tempDir.resolve("r.0.0.mca");
        CompoundTag chunk = chunk(3, 4);

        try (RegionFile region = RegionFile.open(path)) {
            region.write(3, 4, chunk, scheme);

            ChunkEntry entry = region.entry(3, 4);
            assertThat(schemeByteAt(path, entry)).isEqualTo(scheme.id());
            assertThat(region.read(3, 4)).isEqualTo(chunk);
        }
    }

    @Test
    void write_erasedScheme_isRejected() throws IOException {
        try (RegionFile region = RegionFile.open(tempDir.resolve("r.0.0.mca"))) {
            assertThatThrownBy(() -> region.write(0, 0, chunk(0, 0), CompressionScheme.ERASED))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void write_recordsTimestampInEpochSeconds() throws IOException {
        try (RegionFile region = RegionFile.open(tempDir.resolve("r.0.0.mca"))) {
            long before = System.currentTimeMillis() / 1000L;
            region.write(7, 7, chunk(7, 7));
            long after = System.currentTimeMillis() / 1000L;

            assertThat((long) region.getTimestamp(7, 7)).isBetween(before, after);
            assertThat(region.getTimestamp(0, 0)).isZero();
        }
    }

    @Test
    void reopen_preservesChunksAndTimestamps() throws IOException {
        Path path = tempDir.resolve("r.0.0.mca");
        int timestamp;
        try (RegionFile region = RegionFile.open(path)) {
            region.write(31, 31, chunk(31, 31));
            timestamp = region.getTimestamp(31, 31);
        }

        try (RegionFile region = RegionFile.openReadOnly(path)) {
            assertThat(region.read(31, 31)).isEqualTo(chunk(31, 31));
            assertThat(region.getTimestamp(31, 31)).isEqualTo(timestamp);
        }
    }

    @Test
    void localCoordinatesOutOfRange_throw() throws IOException {
        try (RegionFile region = RegionFile.open(tempDir.resolve("r.0.0.mca"))) {
            assertThatThrownBy(() -> region.read(32, 0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> region.hasChunk(0, -1)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ========== Sector Allocation Tests ==========

    @Test
    void rewrite_thatFits_reusesSectors() throws IOException {
        try (RegionFile region = RegionFile.open(tempDir.resolve("r.0.0.mca"))) {
            region.write(0, 0, chunk(0, 0));
            region.write(1, 0, chunk(1, 0));

            CompoundTag updated = chunk(0, 0);
            updated.putString("status", "full");
            region.write(0, 0, updated);

            assertThat(region.entry(0, 0).sectorOffset()).isEqualTo(2);
            assertThat(region.entry(1, 0).sectorOffset()).isEqualTo(3);
            assertThat(region.isFragmented()).isFalse();
            assertThat(region.read(0, 0)).isEqualTo(updated);
        }
    }

    @Test
    void rewrite_thatOutgrowsSectors_isAppended() throws IOException {
        Path path = tempDir.resolve("r.0.0.mca");
        try (RegionFile region = RegionFile.open(path)) {
            region.write(0, 0, chunk(0, 0));
            region.write(1, 0, chunk(1, 0));

            CompoundTag big = largeChunk(6000);
            region.write(0, 0, big, CompressionScheme.UNCOMPRESSED);

            ChunkEntry entry = region.entry(0, 0);
            assertThat(entry.sectorOffset()).isEqualTo(4);
            assertThat(entry.sectorCount()).isEqualTo(2);
            assertThat(region.isFragmented()).isTrue();
            assertThat(region.read(0, 0)).isEqualTo(big);
            assertThat(region.read(1, 0)).isEqualTo(chunk(1, 0));
        }
        assertThat(Files.size(path)).isEqualTo(6L * SECTOR);
    }

    @Test
    void write_moreThan255Sectors_throwsMalformedLength() throws IOException {
        try (RegionFile region = RegionFile.open(tempDir.resolve("r.0.0.mca"))) {
            CompoundTag huge = largeChunk(RegionConstants.MAX_SECTORS_PER_CHUNK * SECTOR);

            NbtException e = catchThrowableOfType(
                    () -> region.write(0, 0, huge, CompressionScheme.UNCOMPRESSED), NbtException.class);

            assertThat(e.getError()).isEqualTo(NbtError.MALFORMED_LENGTH);
            assertThat(region.hasChunk(0, 0)).isFalse();
        }
    }

    @Test
    void compact_removesAbandonedSectors() throws IOException {
        Path path = tempDir.resolve("r.0.0.mca");
        try (RegionFile region = RegionFile.open(path)) {
            region.write(0, 0, chunk(0, 0));
            region.write(1, 0, chunk(1, 0));
            region.write(2, 0, chunk(2, 0));
            region.delete(1, 0);
            int timestamp = region.getTimestamp(2, 0);

            region.compact();

            assertThat(region.isFragmented()).isFalse();
            assertThat(region.entry(2, 0).sectorOffset()).isEqualTo(3);
            assertThat(region.getTimestamp(2, 0)).isEqualTo(timestamp);
            assertThat(region.read(0, 0)).isEqualTo(chunk(0, 0));
            assertThat(region.read(2, 0)).isEqualTo(chunk(2, 0));
        }
        assertThat(Files.size(path)).isEqualTo(4L * SECTOR);
        assertThat(Files.exists(tempDir.resolve("r.0.0.mca.tmp"))).isFalse();
    }

    @Test
    void delete_clearsSlot() throws IOException {
        try (RegionFile region = RegionFile.open(tempDir.resolve("r.0.0.mca"))) {
            region.write(4, 2, chunk(4, 2));

            assertThat(region.delete(4, 2)).isTrue();
            assertThat(region.hasChunk(4, 2)).isFalse();
            assertThat(region.getTimestamp(4, 2)).isZero();
            assertThat(region.read(4, 2)).isNull();
            assertThat(region.isFragmented()).isTrue();
            assertThat(region.delete(4, 2)).isFalse();
        }
    }

    @Test
    void readOnly_rejectsModification() throws IOException {
        Path path = tempDir.resolve("r.0.0.mca");
        RegionFile.open(path).close();

        try (RegionFile region = RegionFile.openReadOnly(path)) {
            assertThatThrownBy(() -> region.write(0, 0, chunk(0, 0)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("read-only");
            assertThatThrownBy(region::compact).isInstanceOf(IllegalStateException.class);
        }
    }

    // ========== Scan Tests ==========

    @Test
    void usedChunks_matchesFullLoad() throws IOException {
        Path path = tempDir.resolve("r.1.-1.mca");
        try (RegionFile region = RegionFile.open(path)) {
            region.write(0, 0, chunk(0, 0));
            region.write(5, 3, chunk(5, 3));
            region.write(31, 31, chunk(31, 31));
        }

        List<ChunkPos> scanned = RegionFile.usedChunks(path);

        assertThat(scanned).containsExactly(new ChunkPos(32, -32), new ChunkPos(37, -29), new ChunkPos(63, -1));
        assertThat((List<Integer>) RegionFile.occupiedSlots(path)).containsExactly(0, 101, 1023);

        RegionKey key = new RegionKey(1, -1);
        try (RegionFile region = RegionFile.openReadOnly(path)) {
            Int2ObjectMap<NbtFile> loaded = region.readAll(ChunkFailureHandler.RETHROW);
            assertThat(loaded.keySet().intStream()
                    .mapToObj(i -> key.chunk(i % 32, i / 32)))
                    .containsExactlyElementsOf(scanned);
        }
    }

    @Test
    void usedChunks_unconventionalFileName_throws() throws IOException {
        Path path = tempDir.resolve("chunks.bin");
        RegionFile.open(path).close();

        assertThatThrownBy(() -> RegionFile.usedChunks(path))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("chunks.bin");
    }

    @Test
    void readAll_corruptChunk_isReportedAndSkipped() throws IOException {
        Path path = regionWithThreeChunks();
        overwrite(path, entryOf(path, 1, 0).byteOffset() + 4, (byte) 9);

        try (RegionFile region = RegionFile.openReadOnly(path)) {
            Int2ObjectMap<NbtFile> loaded = region.readAll(handler);

            assertThat(loaded.keySet()).containsExactly(0, 2);
            assertThat(loaded.get(2)).isEqualTo(chunk(2, 0));
        }
        verify(handler).onFailure(argThat(entry -> entry.index() == 1), isA(NbtException.class));
        verifyNoMoreInteractions(handler);
    }

    @Test
    void read_unknownScheme_throwsUnsupportedCompressionScheme() throws IOException {
        Path path = regionWithThreeChunks();
        overwrite(path, entryOf(path, 1, 0).byteOffset() + 4, (byte) 9);

        try (RegionFile region = RegionFile.openReadOnly(path)) {
            NbtException e = catchThrowableOfType(() -> region.read(1, 0), NbtException.class);

            assertThat(e.getError()).isEqualTo(NbtError.UNSUPPORTED_COMPRESSION_SCHEME);
            assertThat(e.getOffset()).isEqualTo(3L * SECTOR + 4);
        }
    }

    @Test
    void readAll_corruptCompressedData_isReported() throws IOException {
        Path path = regionWithThreeChunks();
        long offset = entryOf(path, 2, 0).byteOffset() + RegionConstants.CHUNK_HEADER_SIZE;
        overwrite(path, offset, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF);

        try (RegionFile region = RegionFile.openReadOnly(path)) {
            assertThat(region.readAll(handler).keySet()).containsExactly(0, 1);
        }
        verify(handler).onFailure(argThat(entry -> entry.index() == 2), isA(ZipException.class));
    }

    @Test
    void readAll_rethrowHandler_abortsScan() throws IOException {
        Path path = regionWithThreeChunks();
        overwrite(path, entryOf(path, 0, 0).byteOffset() + 4, (byte) 9);

        try (RegionFile region = RegionFile.openReadOnly(path)) {
            assertThatThrownBy(() -> region.readAll(ChunkFailureHandler.RETHROW))
                    .isInstanceOf(NbtException.class)
                    .hasMessageContaining("Unknown chunk compression scheme 9");
        }
    }

    @Test
    void readAll_logAndContinueHandler_skipsChunk() throws IOException {
        Path path = regionWithThreeChunks();
        overwrite(path, entryOf(path, 0, 0).byteOffset() + 4, (byte) 9);

        try (RegionFile region = RegionFile.openReadOnly(path)) {
            assertThat(region.readAll(ChunkFailureHandler.LOG_AND_CONTINUE).keySet()).containsExactly(1, 2);
        }
    }

    @Test
    void read_erasedScheme_isAbsentButStillListed() throws IOException {
        Path path = regionWithThreeChunks();
        overwrite(path, entryOf(path, 1, 0).byteOffset() + 4, (byte) 0);

        try (RegionFile region = RegionFile.openReadOnly(path)) {
            assertThat(region.hasChunk(1, 0)).isTrue();
            assertThat(region.read(1, 0)).isNull();
            assertThat(region.readAll(handler).keySet()).containsExactly(0, 2);
        }
        verifyNoInteractions(handler);
    }

    @Test
    void read_blobLongerThanItsSectors_throwsMalformedLength() throws IOException {
        Path path = regionWithThreeChunks();
        overwrite(path, entryOf(path, 0, 0).byteOffset(), (byte) 0x00, (byte) 0x00, (byte) 0x20, (byte) 0x00);

        try (RegionFile region = RegionFile.openReadOnly(path)) {
            NbtException e = catchThrowableOfType(() -> region.read(0, 0), NbtException.class);

            assertThat(e.getError()).isEqualTo(NbtError.MALFORMED_LENGTH);
            assertThat(e).hasMessageContaining("8192");
        }
    }

    @Test
    void read_truncatedFile_throwsUnexpectedEnd() throws IOException {
        Path path = regionWithThreeChunks();
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
            channel.truncate(4L * SECTOR + 8);
        }

        try (RegionFile region = RegionFile.openReadOnly(path)) {
            NbtException e = catchThrowableOfType(() -> region.read(2, 0), NbtException.class);

            assertThat(e.getError()).isEqualTo(NbtError.UNEXPECTED_END_OF_INPUT);
            assertThat(region.read(0, 0)).isEqualTo(chunk(0, 0));
        }
    }

    @Test
    void readAll_parallel_matchesSequential() throws IOException {
        Path path = tempDir.resolve("r.0.0.mca");
        try (RegionFile region = RegionFile.open(path)) {
            for (int i = 0; i < 64; i++) {
                region.write(i % 32, i / 32, chunk(i % 32, i / 32));
            }
        }
        overwrite(path, entryOf(path, 10, 0).byteOffset() + 4, (byte) 9);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try (RegionFile region = RegionFile.openReadOnly(path)) {
            Int2ObjectMap<NbtFile> sequential = region.readAll(ChunkFailureHandler.LOG_AND_CONTINUE);
            Int2ObjectMap<NbtFile> parallel = region.readAll(executor, handler);

            assertThat(parallel).isEqualTo(sequential);
            assertThat(parallel.keySet()).hasSize(63).doesNotContain(10);
            assertThat((List<Integer>) new IntArrayList(parallel.keySet())).isSorted();
        } finally {
            executor.shutdownNow();
        }
        verify(handler).onFailure(argThat(entry -> entry.index() == 10), isA(NbtException.class));
        verifyNoMoreInteractions(handler);
    }

    @Test
    void readAll_parallel_handlerFailureAbortsScan() throws IOException {
        Path path = regionWithThreeChunks();
        overwrite(path, entryOf(path, 1, 0).byteOffset() + 4, (byte) 9);
        IOException abort = new IOException("stop");
        doThrow(abort).when(handler).onFailure(argThat(entry -> entry.index() == 1), isA(NbtException.class));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (RegionFile region = RegionFile.openReadOnly(path)) {
            assertThatThrownBy(() -> region.readAll(executor, handler)).isSameAs(abort);
        } finally {
            executor.shutdownNow();
        }
    }

    // ========== Resource Tests ==========

    @Test
    void close_releasesCompressionContextsOfEveryThread() throws IOException {
        Path path = tempDir.resolve("r.0.0.mca");
        ExecutorService executor = Executors.newFixedThreadPool(3);
        RegionFile region = RegionFile.open(path);
        try {
            for (int i = 0; i < 12; i++) {
                region.write(i, 0, chunk(i, 0));
            }
            region.readAll(executor, ChunkFailureHandler.RETHROW);

            assertThat(region.openContextCount()).isGreaterThanOrEqualTo(1);
        } finally {
            region.close();
            executor.shutdownNow();
        }

        assertThat(region.openContextCount()).isZero();
    }

    // ========== Helpers ==========

    private Path regionWithThreeChunks() throws IOException {
        Path path = tempDir.resolve("r.0.0.mca");
        try (RegionFile region = RegionFile.open(path)) {
            region.write(0, 0, chunk(0, 0));
            region.write(1, 0, chunk(1, 0));
            region.write(2, 0, chunk(2, 0));
        }
        return path;
    }

    private static ChunkEntry entryOf(Path path, int localX, int localZ) throws IOException {
        try (RegionFile region = RegionFile.openReadOnly(path)) {
            ChunkEntry entry = region.entry(localX, localZ);
            assertThat(entry).isNotNull();
            return entry;
        }
    }

    private static int schemeByteAt(Path path, ChunkEntry entry) throws IOException {
        return Files.readAllBytes(path)[(int) entry.byteOffset() + 4] & 0xFF;
    }

    private static void overwrite(Path path, long offset, byte... bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
            channel.write(ByteBuffer.wrap(bytes), offset);
        }
    }

    private static CompoundTag chunk(int x, int z) {
        CompoundTag root = new CompoundTag("");
        CompoundTag level = new CompoundTag();
        level.putInt("xPos", x);
        level.putInt("zPos", z);
        level.putLong("LastUpdate", 1234L);
        level.putIntArray("HeightMap", new int[]{x, z, x + z});
        root.put("Level", level);
        return root;
    }

    private static CompoundTag largeChunk(int payloadBytes) {
        byte[] noise = new byte[payloadBytes];
        new Random(42).nextBytes(noise);
        CompoundTag root = new CompoundTag("");
        root.putByteArray("Blocks", noise);
        return root;
    }
}
