package io.liparakis.nbtis.region;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkFailureHandlerTest {

    private static final ChunkEntry ENTRY = ChunkEntry.of(33, (2 << 8) | 1, 0);

    @Test
    void rethrow_propagatesSameException() {
        IOException error = new IOException("broken");

        assertThatThrownBy(() -> ChunkFailureHandler.RETHROW.onFailure(ENTRY, error)).isSameAs(error);
    }

    @Test
    void logAndContinue_doesNotThrow() {
        assertThatCode(() -> ChunkFailureHandler.LOG_AND_CONTINUE.onFailure(ENTRY, new IOException("broken")))
                .doesNotThrowAnyException();
    }
}
