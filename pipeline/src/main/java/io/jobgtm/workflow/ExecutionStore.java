package io.jobgtm.workflow;

import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Durable record of workflow executions.
 */
public interface ExecutionStore {

    Uni<Void> initialize();

    /**
     * Records a new running execution.
     *
     * @throws DuplicateExecutionException (as a failure) if the id was used before
     */
    Uni<Void> start(String executionId, String parentId, String workflowType, String input);

    Uni<Void> complete(String executionId, String result);

    Uni<Void> fail(String executionId, String error);

    /**
     * @return the record, or {@code null} if unknown
     */
    Uni<ExecutionRecord> describe(String executionId);

    /**
     * Top-level executions of {@code workflowType} that are still running.
     */
    Uni<List<ExecutionRecord>> findRunning(String workflowType);

    /**
     * Marks every running execution as interrupted.
     *
     * @return number of executions marked
     */
    Uni<Integer> markInterrupted();
}
