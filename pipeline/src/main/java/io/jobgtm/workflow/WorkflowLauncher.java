package io.jobgtm.workflow;

import io.jobgtm.model.AggregatedResult;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.function.BiFunction;

/**
 * Entry point for starting workflows. At most one top-level execution per workflow type runs at
 * a time.
 */
@ApplicationScoped
public class WorkflowLauncher {

    private static final Logger LOG = Logger.getLogger(WorkflowLauncher.class);

    final DurableExecutor executor;
    final ExecutionStore store;
    final ChunkedWorkflowCoordinator coordinator;
    final DetailScrapeWorkflow detailScrape;
    final EnrichmentWorkflow enrichment;
    final ScrapeWorkflow scrape;

    public WorkflowLauncher(DurableExecutor executor, ExecutionStore store, ChunkedWorkflowCoordinator coordinator,
                            DetailScrapeWorkflow detailScrape, EnrichmentWorkflow enrichment, ScrapeWorkflow scrape) {
        this.executor = executor;
        this.store = store;
        this.coordinator = coordinator;
        this.detailScrape = detailScrape;
        this.enrichment = enrichment;
        this.scrape = scrape;
    }

    @ConfigProperty(name = "pipeline.detail-scrape.chunk-size", defaultValue = "100")
    int detailChunkSize;

    @ConfigProperty(name = "pipeline.detail-scrape.max-parallel-chunks", defaultValue = "5")
    int detailParallelChunks;

    @ConfigProperty(name = "pipeline.detail-scrape.max-concurrent-per-chunk", defaultValue = "10")
    int detailConcurrentPerChunk;

    @ConfigProperty(name = "pipeline.detail-scrape.slice-delay", defaultValue = "PT1S")
    Duration detailSliceDelay;

    @ConfigProperty(name = "pipeline.enrichment-backfill.chunk-size", defaultValue = "500")
    int backfillChunkSize;

    @ConfigProperty(name = "pipeline.enrichment-backfill.max-parallel-chunks", defaultValue = "3")
    int backfillParallelChunks;

    @ConfigProperty(name = "pipeline.enrichment-backfill.max-concurrent-per-chunk", defaultValue = "50")
    int backfillConcurrentPerChunk;

    @ConfigProperty(name = "pipeline.scrape.max-pages", defaultValue = "500")
    int maxPages;

    public Uni<ExecutionHandle<AggregatedResult>> launchDetailScrape() {
        CoordinatorOptions options = new CoordinatorOptions(detailChunkSize, detailParallelChunks,
                detailConcurrentPerChunk, detailSliceDelay);
        return launch(DetailScrapeWorkflow.TYPE, options, (id, opts) -> coordinator.run(id, detailScrape, opts));
    }

    public Uni<ExecutionHandle<AggregatedResult>> launchEnrichmentBackfill() {
        CoordinatorOptions options = new CoordinatorOptions(backfillChunkSize, backfillParallelChunks,
                backfillConcurrentPerChunk, Duration.ZERO);
        return launch(EnrichmentWorkflow.TYPE, options, (id, opts) -> coordinator.run(id, enrichment, opts));
    }

    /**
     * @param scraperName a single scraper, or {@code null} for all of them
     */
    public Uni<ExecutionHandle<ScrapeSummary>> launchScrape(String scraperName) {
        return launch(ScrapeWorkflow.TYPE, new ScrapeRequest(scraperName, maxPages), scrape::run);
    }

    <I, R> Uni<ExecutionHandle<R>> launch(String type, I input, BiFunction<String, I, Uni<R>> body) {
        return store.findRunning(type).onItem().transform(running -> {
            if (!running.isEmpty()) {
                throw new DuplicateExecutionException(
                        "A " + type + " workflow is already running: " + running.get(0).executionId());
            }
            String id = ExecutionIds.coordinator(type);
            ExecutionHandle<R> handle = executor.start(id, type, input, in -> body.apply(id, in));
            LOG.infof("Started %s workflow %s", type, id);
            return handle;
        });
    }
}
