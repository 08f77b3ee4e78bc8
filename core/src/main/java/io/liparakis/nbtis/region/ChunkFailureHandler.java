package io.liparakis.nbtis.region;

import io.liparakis.nbtis.Nbtis;

import java.io.IOException;

/**
 * Decides what happens when one chunk of a region cannot be loaded while the
 * rest of the region is being read.
 */
@FunctionalInterface
public interface ChunkFailureHandler {

    /** Logs the failure and continues with the next chunk. */
    ChunkFailureHandler LOG_AND_CONTINUE = (entry, error) ->
            Nbtis.LOGGER.warn("Skipping unreadable {}: {}", entry, error.getMessage());

    /** Aborts the whole read with the chunk's error. */
    ChunkFailureHandler RETHROW = (entry, error) -> {
        throw error;
    };

    /**
     * @param entry the slot that failed
     * @param error the cause
     * @throws IOException to abort the remaining chunks
     */
    void onFailure(ChunkEntry entry, IOException error) throws IOException;
}
