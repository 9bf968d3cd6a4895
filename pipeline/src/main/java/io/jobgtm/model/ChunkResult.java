package io.jobgtm.model;

/**
 * Chunk-level summary returned by a child execution. The parent never sees item detail.
 */
public record ChunkResult(int chunkIndex, String executionId, int total, int success, int failed,
                          Status status, String error) {

    public enum Status {
        COMPLETED,
        COMPLETED_WITH_ERRORS,
        FAILED
    }

    public static ChunkResult of(Chunk chunk, String executionId, int total, int success, int failed) {
        Status status = failed == 0 ? Status.COMPLETED : Status.COMPLETED_WITH_ERRORS;
        return new ChunkResult(chunk.chunkIndex(), executionId, total, success, failed, status, null);
    }

    /**
     * A child that died as a whole: every item of the chunk counts as failed.
     */
    public static ChunkResult failed(Chunk chunk, String executionId, Throwable error) {
        String msg = error == null ? "error" : String.valueOf(error.getMessage());
        return new ChunkResult(chunk.chunkIndex(), executionId, chunk.limit(), 0, chunk.limit(), Status.FAILED, msg);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
