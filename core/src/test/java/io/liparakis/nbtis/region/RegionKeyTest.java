package io.liparakis.nbtis.region;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class RegionKeyTest {

    @Test
    void fileName_followsConvention() {
        assertThat(new RegionKey(-1, 2).fileName()).isEqualTo("r.-1.2.mca");
        assertThat(new RegionKey(-1, 2)).hasToString("r.-1.2");
    }

    @Test
    void fromFileName_parsesCoordinates() {
        assertThat(RegionKey.fromFileName("r.-3.17.mca")).isEqualTo(new RegionKey(-3, 17));
        assertThat(RegionKey.fromFileName("r.0.0.mcr")).isEqualTo(new RegionKey(0, 0));
    }

    @ParameterizedTest
    @ValueSource(strings = {"region.mca", "r.1.mca", "r.a.b.mca", "r.1.2.dat", "r.1.2.mca.tmp",
            "r.99999999999.0.mca"})
    void fromFileName_unconventionalName_isNull(String name) {
        assertThat(RegionKey.fromFileName(name)).isNull();
    }

    @Test
    void chunk_convertsLocalToAbsolute() {
        RegionKey key = new RegionKey(1, -1);

        assertThat(key.chunk(0, 0)).isEqualTo(new ChunkPos(32, -32));
        assertThat(key.chunk(31, 31)).isEqualTo(new ChunkPos(63, -1));
    }
}
