package io.jobgtm.workflow;

import io.jobgtm.model.Chunk;
import io.jobgtm.model.ChunkPlan;
import io.jobgtm.model.ScrapedItem;
import io.jobgtm.model.WorkItem;
import io.jobgtm.queue.QueueTopology;
import io.jobgtm.queue.StagePublisher;
import io.jobgtm.store.GoldenJobRepository;
import io.jobgtm.support.JsonCodec;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

/**
 * Re-publishes golden rows whose enrichment is still pending, for backfill and replay.
 */
@ApplicationScoped
public class EnrichmentWorkflow implements ChunkWork {

    public static final String TYPE = "enrichment";

    final GoldenJobRepository golden;
    final StagePublisher publisher;
    final JsonCodec json;

    public EnrichmentWorkflow(GoldenJobRepository golden, StagePublisher publisher, JsonCodec json) {
        this.golden = golden;
        this.publisher = publisher;
        this.json = json;
    }

    @Override
    public String workflowType() {
        return TYPE;
    }

    @Override
    public Uni<Long> countItems() {
        return golden.countPendingEnrichment();
    }

    /**
     * Chunks are pinned to id ranges: enriched rows leave the pending set while the run is still
     * paging it, so positions would shift under later chunks.
     */
    @Override
    public Uni<ChunkPlan> plan(int chunkSize) {
        return golden.pendingEnrichmentIds().onItem().transform(ids -> ChunkPlan.ofIds(ids, chunkSize));
    }

    @Override
    public Uni<List<WorkItem>> fetchPage(Chunk chunk) {
        if (!chunk.byIdRange()) {
            return Uni.createFrom().failure(new IllegalArgumentException(
                    "Enrichment chunk " + chunk.chunkIndex() + " has no id range"));
        }
        return golden.fetchPendingEnrichment(chunk.firstId(), chunk.lastId(), chunk.limit());
    }

    @Override
    public Uni<Boolean> processItem(WorkItem item) {
        ScrapedItem job = json.convert(item.payload(), ScrapedItem.class);
        return publisher.publish(QueueTopology.RAW_JOBS_FOR_PROCESSING, job)
                .replaceWith(Boolean.TRUE);
    }
}
