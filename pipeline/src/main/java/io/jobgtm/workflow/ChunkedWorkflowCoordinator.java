package io.jobgtm.workflow;

import io.jobgtm.model.AggregatedResult;
import io.jobgtm.model.Chunk;
import io.jobgtm.model.ChunkResult;
import io.jobgtm.model.WorkItem;
import io.jobgtm.retry.ActivityRetryEnvelope;
import io.jobgtm.retry.RetryPolicy;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fans a large item set out to child executions and aggregates their summaries.
 *
 * <p>The work is planned once into contiguous chunks, see {@link ChunkWork#plan}. Chunks run as
 * child executions in waves of {@code maxParallelChunks}; a wave finishes before the next one
 * starts. A child pages its items and processes them in slices of
 * {@code maxConcurrentPerChunk}, waiting for the whole slice before starting the next. A child that fails as a whole is reported as a failed chunk;
 * it is not retried and does not stop the other chunks.</p>
 */
@ApplicationScoped
public class ChunkedWorkflowCoordinator {

    private static final Logger LOG = Logger.getLogger(ChunkedWorkflowCoordinator.class);

    final DurableExecutor executor;
    final ActivityRetryEnvelope envelope;

    RetryPolicy countPolicy = RetryPolicy.exponential(3, Duration.ofSeconds(1), Duration.ofSeconds(10), Duration.ofSeconds(30));
    RetryPolicy fetchPolicy = RetryPolicy.exponential(3, Duration.ofSeconds(1), Duration.ofSeconds(10), Duration.ofSeconds(60));

    public ChunkedWorkflowCoordinator(DurableExecutor executor, ActivityRetryEnvelope envelope) {
        this.executor = executor;
        this.envelope = envelope;
    }

    public Uni<AggregatedResult> run(String executionId, ChunkWork work, CoordinatorOptions options) {
        String type = work.workflowType();
        transition(executionId, null, CoordinatorState.INIT);
        return envelope.run("count:" + type, countPolicy, () -> work.plan(options.chunkSize()))
                .onItem().transformToUni(plan -> {
                    transition(executionId, CoordinatorState.INIT, CoordinatorState.CHUNK_INFO_FETCHED);
                    LOG.infof("[%s] %d item(s) in %d chunk(s) of %d, %d chunk(s) in parallel",
                            executionId, plan.totalCount(), plan.chunkCount(), plan.chunkSize(),
                            options.maxParallelChunks());
                    if (plan.isEmpty()) {
                        transition(executionId, CoordinatorState.CHUNK_INFO_FETCHED, CoordinatorState.DONE);
                        return Uni.createFrom().item(AggregatedResult.empty(executionId, type));
                    }
                    transition(executionId, CoordinatorState.CHUNK_INFO_FETCHED, CoordinatorState.CHUNKS_DISPATCHING);
                    List<List<Chunk>> waves = plan.waves(options.maxParallelChunks());
                    return Multi.createFrom().range(0, waves.size())
                            .onItem().transformToUniAndConcatenate(w -> dispatchWave(executionId, work, waves, w, options))
                            .collect().asList()
                            .onItem().transform(perWave -> {
                                transition(executionId, CoordinatorState.CHUNKS_DISPATCHING, CoordinatorState.CHUNKS_AGGREGATING);
                                List<ChunkResult> results = new ArrayList<>(plan.chunkCount());
                                perWave.forEach(results::addAll);
                                AggregatedResult agg = AggregatedResult.aggregate(executionId, type, plan.totalCount(), results);
                                transition(executionId, CoordinatorState.CHUNKS_AGGREGATING,
                                        terminalState(agg));
                                LOG.infof("[%s] finished %s: %d ok, %d failed, %d/%d chunk(s) completed",
                                        executionId, agg.status().wire(), agg.successCount(), agg.failedCount(),
                                        agg.chunksCompleted(), plan.chunkCount());
                                return agg;
                            });
                });
    }

    private Uni<List<ChunkResult>> dispatchWave(String parentId, ChunkWork work, List<List<Chunk>> waves, int w,
                                                CoordinatorOptions options) {
        List<Chunk> wave = waves.get(w);
        LOG.infof("[%s] wave %d/%d: chunk(s) %d..%d", parentId, w + 1, waves.size(),
                wave.get(0).chunkIndex(), wave.get(wave.size() - 1).chunkIndex());
        List<Uni<ChunkResult>> children = new ArrayList<>(wave.size());
        for (Chunk chunk : wave) {
            children.add(runChild(parentId, work, chunk, options));
        }
        return Uni.join().all(children).andFailFast();
    }

    private Uni<ChunkResult> runChild(String parentId, ChunkWork work, Chunk chunk, CoordinatorOptions options) {
        String childId = ExecutionIds.child(parentId, chunk.chunkIndex());
        ExecutionHandle<ChunkResult> handle = executor.startChild(parentId, chunk.chunkIndex(),
                work.workflowType() + "-chunk", chunk, c -> processChunk(childId, work, c, options));
        return handle.result()
                .onFailure().recoverWithItem(err -> {
                    LOG.errorf("[%s] chunk %d failed: %s", childId, chunk.chunkIndex(), err.getMessage());
                    return ChunkResult.failed(chunk, childId, err);
                });
    }

    Uni<ChunkResult> processChunk(String childId, ChunkWork work, Chunk chunk, CoordinatorOptions options) {
        if (chunk.byIdRange()) {
            LOG.infof("[%s] fetching up to %d item(s) with ids %d..%d", childId, chunk.limit(),
                    chunk.firstId(), chunk.lastId());
        } else {
            LOG.infof("[%s] fetching %d item(s) at offset %d", childId, chunk.limit(), chunk.offset());
        }
        return envelope.run("fetch-page:" + work.workflowType(), fetchPolicy, () -> work.fetchPage(chunk))
                .onItem().transformToUni(items -> Multi.createFrom().iterable(items)
                        .group().intoLists().of(options.maxConcurrentPerChunk())
                        .onItem().transformToUniAndConcatenate(slice -> processSlice(childId, work, slice)
                                .call(() -> pause(options.sliceDelay())))
                        .collect().asList()
                        .onItem().transform(sliceSuccesses -> {
                            int success = sliceSuccesses.stream().mapToInt(Integer::intValue).sum();
                            ChunkResult result = ChunkResult.of(chunk, childId, items.size(), success, items.size() - success);
                            LOG.infof("[%s] chunk %d done: %d/%d ok", childId, chunk.chunkIndex(), success, items.size());
                            return result;
                        }));
    }

    private Uni<Integer> processSlice(String childId, ChunkWork work, List<WorkItem> slice) {
        List<Uni<Boolean>> calls = new ArrayList<>(slice.size());
        for (WorkItem item : slice) {
            calls.add(Uni.createFrom().<Boolean>deferred(() -> work.processItem(item))
                    .onFailure().invoke(e -> LOG.warnf("[%s] item %d failed: %s", childId, item.id(), e.getMessage()))
                    .onFailure().recoverWithItem(Boolean.FALSE));
        }
        return Uni.join().all(calls).andFailFast()
                .onItem().transform(oks -> (int) oks.stream().filter(Boolean.TRUE::equals).count());
    }

    private static Uni<Void> pause(Duration d) {
        if (d.isZero()) return Uni.createFrom().voidItem();
        return Uni.createFrom().voidItem().onItem().delayIt().by(d);
    }

    /**
     * {@code PARTIALLY_FAILED} as soon as anything failed, a whole chunk or a single item.
     */
    static CoordinatorState terminalState(AggregatedResult agg) {
        return agg.failedCount() > 0 || agg.chunksFailed() > 0
                ? CoordinatorState.PARTIALLY_FAILED
                : CoordinatorState.DONE;
    }

    private static void transition(String executionId, CoordinatorState from, CoordinatorState to) {
        if (from == null) {
            LOG.infof("[%s] state -> %s", executionId, to);
        } else {
            LOG.infof("[%s] state %s -> %s", executionId, from, to);
        }
    }
}
