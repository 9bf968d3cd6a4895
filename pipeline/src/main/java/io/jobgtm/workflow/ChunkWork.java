package io.jobgtm.workflow;

import io.jobgtm.model.Chunk;
import io.jobgtm.model.ChunkPlan;
import io.jobgtm.model.WorkItem;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * The per-workflow parts of a chunked run: what to count, how to page and what to do with one
 * item.
 */
public interface ChunkWork {

    String workflowType();

    Uni<Long> countItems();

    /**
     * Splits the run into chunks. By position over {@link #countItems()} unless overridden.
     */
    default Uni<ChunkPlan> plan(int chunkSize) {
        return countItems().onItem().transform(total -> ChunkPlan.of(Math.toIntExact(total), chunkSize));
    }

    Uni<List<WorkItem>> fetchPage(Chunk chunk);

    /**
     * @return {@code true} if the item succeeded; a failure or {@code false} counts it as failed
     */
    Uni<Boolean> processItem(WorkItem item);
}
