package io.jobgtm.workflow;

import java.time.OffsetDateTime;

public record ExecutionRecord(String executionId, String parentId, String workflowType, ExecutionStatus status,
                              String input, String result, String error,
                              OffsetDateTime startedAt, OffsetDateTime completedAt) {
}
