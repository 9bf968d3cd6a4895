package io.jobgtm.model;

import java.util.Comparator;
import java.util.List;

/**
 * Coordinator result. Built once from the chunk results and never mutated.
 */
public record AggregatedResult(String executionId,
                               String workflowType,
                               int total,
                               int successCount,
                               int failedCount,
                               int chunksCompleted,
                               int chunksFailed,
                               Status status,
                               List<ChunkResult> perChunkResults) {

    public enum Status {
        COMPLETED("completed"),
        COMPLETED_WITH_ERRORS("completed_with_errors");

        private final String wire;

        Status(String wire) {
            this.wire = wire;
        }

        public String wire() {
            return wire;
        }
    }

    public AggregatedResult {
        perChunkResults = List.copyOf(perChunkResults);
    }

    public static AggregatedResult aggregate(String executionId, String workflowType, int total,
                                             List<ChunkResult> results) {
        List<ChunkResult> sorted = results.stream()
                .sorted(Comparator.comparingInt(ChunkResult::chunkIndex))
                .toList();
        int success = 0;
        int failed = 0;
        int completed = 0;
        int chunkFailures = 0;
        for (ChunkResult r : sorted) {
            success += r.success();
            failed += r.failed();
            if (r.isFailed()) chunkFailures++;
            else completed++;
        }
        Status status = failed == 0 && chunkFailures == 0 ? Status.COMPLETED : Status.COMPLETED_WITH_ERRORS;
        return new AggregatedResult(executionId, workflowType, total, success, failed,
                completed, chunkFailures, status, sorted);
    }

    public static AggregatedResult empty(String executionId, String workflowType) {
        return new AggregatedResult(executionId, workflowType, 0, 0, 0, 0, 0, Status.COMPLETED, List.of());
    }
}
