package io.jobgtm.workflow;

import java.time.Duration;

/**
 * @param chunkSize             items per child execution
 * @param maxParallelChunks     children running at the same time (one wave)
 * @param maxConcurrentPerChunk items processed at the same time inside a child (one slice)
 * @param sliceDelay            pause after each slice, {@link Duration#ZERO} for none
 */
public record CoordinatorOptions(int chunkSize, int maxParallelChunks, int maxConcurrentPerChunk,
                                 Duration sliceDelay) {

    public CoordinatorOptions {
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1");
        if (maxParallelChunks < 1) throw new IllegalArgumentException("maxParallelChunks must be >= 1");
        if (maxConcurrentPerChunk < 1) throw new IllegalArgumentException("maxConcurrentPerChunk must be >= 1");
        sliceDelay = sliceDelay == null || sliceDelay.isNegative() ? Duration.ZERO : sliceDelay;
    }
}
