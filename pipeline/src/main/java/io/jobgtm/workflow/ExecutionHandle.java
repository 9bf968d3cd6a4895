package io.jobgtm.workflow;

import io.smallrye.mutiny.Uni;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Reference to a started execution. The result is only observable through {@link #result()};
 * progress shows up in the logs.
 */
public final class ExecutionHandle<R> {

    private final String executionId;
    private final ExecutionStore store;
    private final CompletableFuture<R> outcome;

    ExecutionHandle(String executionId, ExecutionStore store, CompletableFuture<R> outcome) {
        this.executionId = executionId;
        this.store = store;
        this.outcome = outcome;
    }

    public String executionId() {
        return executionId;
    }

    /**
     * Status as recorded by the store, {@code null} if the execution never got recorded.
     */
    public Uni<ExecutionStatus> describe() {
        return store.describe(executionId)
                .onItem().transform(rec -> rec == null ? null : rec.status());
    }

    public Uni<R> result() {
        return Uni.createFrom().completionStage(outcome)
                .onFailure(CompletionException.class).transform(e -> e.getCause() == null ? e : e.getCause());
    }

    public boolean isDone() {
        return outcome.isDone();
    }
}
