package io.jobgtm.workflow;

import io.jobgtm.client.DetailScrape;
import io.jobgtm.client.ScraperGateway;
import io.jobgtm.model.AggregatedResult;
import io.jobgtm.model.RawItem;
import io.jobgtm.model.SampleItems;
import io.jobgtm.model.ScrapedItem;
import io.jobgtm.queue.InMemoryMessageBroker;
import io.jobgtm.queue.QueueMessage;
import io.jobgtm.queue.QueueTopology;
import io.jobgtm.queue.StagePublisher;
import io.jobgtm.retry.ActivityRetryEnvelope;
import io.jobgtm.retry.RetryPolicy;
import io.jobgtm.store.InMemoryGoldenJobRepository;
import io.jobgtm.store.InMemoryJobListingRepository;
import io.jobgtm.support.JsonCodec;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class DetailScrapeWorkflowTest {

    private static final Duration WAIT = Duration.ofSeconds(20);
    private static final RetryPolicy FAST = RetryPolicy.fixed(2, Duration.ZERO, Duration.ofSeconds(5));

    private final JsonCodec json = new JsonCodec();
    private final InMemoryJobListingRepository listings = new InMemoryJobListingRepository();
    private final InMemoryGoldenJobRepository golden = new InMemoryGoldenJobRepository();
    private final InMemoryMessageBroker broker = new InMemoryMessageBroker();
    private ChunkedWorkflowCoordinator coordinator;
    private DetailScrapeWorkflow workflow;

    @BeforeEach
    void setUp() {
        ActivityRetryEnvelope envelope = new ActivityRetryEnvelope();
        QueueTopology.PIPELINE.forEach(t -> broker.declare(t).await().indefinitely());
        workflow = new DetailScrapeWorkflow(listings, golden, new StubScraper(), new StagePublisher(broker, json, envelope, FAST),
                envelope, json);
        workflow.scrapePolicy = FAST;
        workflow.savePolicy = FAST;
        workflow.publishToEnrichment = true;
        coordinator = new ChunkedWorkflowCoordinator(new DurableExecutor(new InMemoryExecutionStore(), json), envelope);
        coordinator.countPolicy = FAST;
        coordinator.fetchPolicy = FAST;
    }

    @Test
    void successfulScrapesAreSavedAndForwardedToEnrichment() {
        listings.add(SampleItems.card("Acme", "Backend Engineer", "New York, NY", "Full-time", "https://jobs.example.com/ok"));
        listings.add(SampleItems.card("Globex", "Data Scientist", "Remote", "Contract", "https://jobs.example.com/broken"));
        listings.add(SampleItems.card("Initech", "SRE", "Berlin", "Full-time", "https://jobs.example.com/down"));

        AggregatedResult result = coordinator.run("detail-scrape-t", workflow, new CoordinatorOptions(2, 2, 2, Duration.ZERO))
                .await().atMost(WAIT);

        assertEquals(3, result.total());
        assertEquals(1, result.successCount());
        assertEquals(2, result.failedCount());
        assertEquals(0, result.chunksFailed());

        assertEquals(3, golden.size());
        Map<String, Object> ok = golden.rowByUrl("https://jobs.example.com/ok");
        assertEquals("completed", ok.get("detail_scrape_status"));
        assertEquals("pending", ok.get("enrichment_status"));
        assertEquals("Full description of https://jobs.example.com/ok", ok.get("job_description_full"));
        Map<String, Object> broken = golden.rowByUrl("https://jobs.example.com/broken");
        assertEquals("failed", broken.get("detail_scrape_status"));
        assertNull(broken.get("enrichment_status"));
        assertEquals("failed", golden.rowByUrl("https://jobs.example.com/down").get("detail_scrape_status"));

        List<QueueMessage> forwarded = broker.peek(QueueTopology.RAW_JOBS_FOR_PROCESSING.queue());
        assertEquals(1, forwarded.size());
        ScrapedItem item = json.read(forwarded.get(0).body(), ScrapedItem.class);
        assertEquals(ok.get("id"), item.id());
        assertEquals(1L, item.sourceJobId());
        assertEquals("https://jobs.example.com/ok", item.postingUrl());
        assertEquals("Full description of https://jobs.example.com/ok", item.jobDescriptionFull());
    }

    @Test
    void forwardingCanBeSwitchedOff() {
        workflow.publishToEnrichment = false;
        listings.add(SampleItems.card("Acme", "Backend Engineer", "New York, NY", "Full-time", "https://jobs.example.com/ok"));

        AggregatedResult result = coordinator.run("detail-scrape-u", workflow, new CoordinatorOptions(10, 1, 5, Duration.ZERO))
                .await().atMost(WAIT);

        assertEquals(1, result.successCount());
        assertEquals(0, broker.depthNow(QueueTopology.RAW_JOBS_FOR_PROCESSING.queue()));
    }

    /**
     * URLs ending in "broken" load but cannot be read; URLs ending in "down" fail in transport.
     */
    static final class StubScraper implements ScraperGateway {

        @Override
        public Uni<List<String>> availableScrapers() {
            return Uni.createFrom().item(List.of());
        }

        @Override
        public Uni<List<RawItem>> scrapePage(String scraper, int page) {
            return Uni.createFrom().item(List.of());
        }

        @Override
        public Uni<DetailScrape> scrapeDetail(String url) {
            if (url.endsWith("down")) {
                return Uni.createFrom().failure(new IllegalStateException("connection refused"));
            }
            if (url.endsWith("broken")) {
                return Uni.createFrom().item(DetailScrape.failed("no description found"));
            }
            return Uni.createFrom().item(new DetailScrape(true, null, "Full description of " + url, "page text"));
        }
    }
}
