package io.jobgtm.batch;

import io.smallrye.mutiny.Uni;

import java.util.List;

@FunctionalInterface
public interface BatchProcessor<T> {

    /**
     * Handles one batch. The accumulator waits for the returned {@link Uni} before forming the
     * next batch.
     */
    Uni<Void> process(List<T> batch);
}
