package io.jobgtm.workflow;

import io.jobgtm.support.JsonCodec;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Starts workflow bodies as recorded executions.
 *
 * <p>Each execution is written as {@code running} before its body runs and marked
 * {@code completed} with the JSON result or {@code failed} with the error afterwards. An id can
 * only be used once. Execution starts immediately; the returned handle exposes the outcome.</p>
 */
@ApplicationScoped
public class DurableExecutor {

    private static final Logger LOG = Logger.getLogger(DurableExecutor.class);

    final ExecutionStore store;
    final JsonCodec json;

    public DurableExecutor(ExecutionStore store, JsonCodec json) {
        this.store = store;
        this.json = json;
    }

    public <I, R> ExecutionHandle<R> start(String executionId, String workflowType, I input,
                                           Function<I, Uni<R>> body) {
        return launch(executionId, null, workflowType, input, body);
    }

    /**
     * Starts a child of {@code parentId} with id {@code {parentId}-chunk-{index}}.
     */
    public <I, R> ExecutionHandle<R> startChild(String parentId, int index, String workflowType, I input,
                                                Function<I, Uni<R>> body) {
        return launch(ExecutionIds.child(parentId, index), parentId, workflowType, input, body);
    }

    private <I, R> ExecutionHandle<R> launch(String executionId, String parentId, String workflowType, I input,
                                             Function<I, Uni<R>> body) {
        CompletableFuture<R> outcome = store.start(executionId, parentId, workflowType, json.write(input))
                .invoke(() -> LOG.debugf("Execution %s (%s) started", executionId, workflowType))
                .chain(() -> Uni.createFrom().<R>deferred(() -> body.apply(input))
                        .call(result -> store.complete(executionId, json.write(result))
                                .onFailure().invoke(e -> LOG.errorf(e, "Could not record completion of %s", executionId))
                                .onFailure().recoverWithNull())
                        .onFailure().call(err -> store.fail(executionId, errMessage(err))
                                .onFailure().invoke(e -> LOG.errorf(e, "Could not record failure of %s", executionId))
                                .onFailure().recoverWithNull()))
                .subscribeAsCompletionStage();
        return new ExecutionHandle<>(executionId, store, outcome);
    }

    private static String errMessage(Throwable t) {
        String m = t.getMessage();
        return m == null ? t.getClass().getSimpleName() : m;
    }
}
