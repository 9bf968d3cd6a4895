package io.jobgtm.workflow;

import io.jobgtm.client.DetailScrape;
import io.jobgtm.client.ScraperGateway;
import io.jobgtm.model.Chunk;
import io.jobgtm.model.ScrapedItem;
import io.jobgtm.model.WorkItem;
import io.jobgtm.queue.QueueTopology;
import io.jobgtm.queue.StagePublisher;
import io.jobgtm.retry.ActivityRetryEnvelope;
import io.jobgtm.retry.RetryPolicy;
import io.jobgtm.store.DetailScrapeRecord;
import io.jobgtm.store.GoldenJobRepository;
import io.jobgtm.store.JobListingRepository;
import io.jobgtm.support.JsonCodec;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scrapes the detail page of every raw listing into the golden table and hands successful
 * items to the enrichment stage.
 */
@ApplicationScoped
public class DetailScrapeWorkflow implements ChunkWork {

    private static final Logger LOG = Logger.getLogger(DetailScrapeWorkflow.class);

    public static final String TYPE = "detail-scrape";

    final JobListingRepository listings;
    final GoldenJobRepository golden;
    final ScraperGateway scraper;
    final StagePublisher publisher;
    final ActivityRetryEnvelope envelope;
    final JsonCodec json;

    RetryPolicy scrapePolicy = RetryPolicy.exponential(2, Duration.ofSeconds(2), Duration.ofSeconds(10), Duration.ofSeconds(120));
    RetryPolicy savePolicy = RetryPolicy.exponential(3, Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofSeconds(30));

    public DetailScrapeWorkflow(JobListingRepository listings, GoldenJobRepository golden, ScraperGateway scraper,
                                StagePublisher publisher, ActivityRetryEnvelope envelope, JsonCodec json) {
        this.listings = listings;
        this.golden = golden;
        this.scraper = scraper;
        this.publisher = publisher;
        this.envelope = envelope;
        this.json = json;
    }

    @ConfigProperty(name = "pipeline.detail-scrape.publish-to-enrichment", defaultValue = "true")
    boolean publishToEnrichment;

    @Override
    public String workflowType() {
        return TYPE;
    }

    @Override
    public Uni<Long> countItems() {
        return listings.count();
    }

    @Override
    public Uni<List<WorkItem>> fetchPage(Chunk chunk) {
        return listings.fetchPage(chunk.offset(), chunk.limit());
    }

    @Override
    public Uni<Boolean> processItem(WorkItem item) {
        ScrapedItem source = json.convert(item.payload(), ScrapedItem.class);
        String url = source.postingUrl();
        if (url == null || url.isBlank()) {
            LOG.warnf("Listing %d has no posting URL; skipped", item.id());
            return Uni.createFrom().item(Boolean.FALSE);
        }
        long started = System.nanoTime();
        return envelope.run("scrape-detail", scrapePolicy, () -> scraper.scrapeDetail(url))
                .onFailure().recoverWithItem(err -> DetailScrape.failed(err.getMessage()))
                .onItem().transformToUni(detail -> {
                    long durationMs = (System.nanoTime() - started) / 1_000_000;
                    DetailScrapeRecord rec = new DetailScrapeRecord(source, detail.success(), detail.error(),
                            detail.jobDescriptionFull(), detail.fullPageText(), durationMs);
                    if (detail.success()) {
                        LOG.infof("Scraped details for %s in %dms (%d chars)", url, durationMs,
                                detail.jobDescriptionFull() == null ? 0 : detail.jobDescriptionFull().length());
                    } else {
                        LOG.warnf("Detail scrape failed for %s: %s", url, detail.error());
                    }
                    return envelope.run("save-golden", savePolicy, () -> golden.saveDetailScraped(rec))
                            .onItem().transformToUni(goldenId -> detail.success()
                                    ? forward(goldenId, source, detail).replaceWith(Boolean.TRUE)
                                    : Uni.createFrom().item(Boolean.FALSE));
                });
    }

    private Uni<Void> forward(Long goldenId, ScrapedItem source, DetailScrape detail) {
        if (!publishToEnrichment) return Uni.createFrom().voidItem();
        Map<String, Object> fields = new HashMap<>(json.toMap(source));
        fields.put("id", goldenId);
        if (detail.jobDescriptionFull() != null) fields.put("job_description_full", detail.jobDescriptionFull());
        fields.put("detail_scraped_at", OffsetDateTime.now(ZoneOffset.UTC).toString());
        return publisher.publish(QueueTopology.RAW_JOBS_FOR_PROCESSING, json.convert(fields, ScrapedItem.class));
    }
}
