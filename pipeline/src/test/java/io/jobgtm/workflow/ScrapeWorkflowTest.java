package io.jobgtm.workflow;

import io.jobgtm.client.DetailScrape;
import io.jobgtm.client.ScraperGateway;
import io.jobgtm.model.RawItem;
import io.jobgtm.model.SampleItems;
import io.jobgtm.queue.InMemoryMessageBroker;
import io.jobgtm.queue.QueueTopology;
import io.jobgtm.queue.StagePublisher;
import io.jobgtm.retry.ActivityRetryEnvelope;
import io.jobgtm.retry.RetryPolicy;
import io.jobgtm.support.JsonCodec;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScrapeWorkflowTest {

    private static final Duration WAIT = Duration.ofSeconds(10);
    private static final RetryPolicy ONCE = RetryPolicy.fixed(1, Duration.ZERO, Duration.ofSeconds(5));

    private final InMemoryMessageBroker broker = new InMemoryMessageBroker();
    private ScrapeWorkflow workflow;

    @BeforeEach
    void setUp() {
        ActivityRetryEnvelope envelope = new ActivityRetryEnvelope();
        broker.declare(QueueTopology.SCRAPED_JOBS).await().indefinitely();
        workflow = new ScrapeWorkflow(new PagedScraper(),
                new StagePublisher(broker, new JsonCodec(), envelope, ONCE), envelope);
        workflow.listPolicy = ONCE;
        workflow.pagePolicy = ONCE;
    }

    @Test
    void scrapesEveryScraperUntilItRunsOutOfPages() {
        ScrapeSummary summary = workflow.run("scrape-t", new ScrapeRequest(null, 10)).await().atMost(WAIT);

        Map<String, ScrapeSummary.ScraperRun> runs = summary.scrapers().stream()
                .collect(Collectors.toMap(ScrapeSummary.ScraperRun::scraper, Function.identity()));
        assertEquals(2, summary.totalScrapers());
        assertEquals(8, summary.totalPublished());

        assertEquals("completed", runs.get("remoteok").status());
        assertEquals(2, runs.get("remoteok").pagesScraped());
        assertEquals(6, runs.get("remoteok").jobsPublished());

        assertEquals("partial", runs.get("wellfound").status());
        assertEquals(1, runs.get("wellfound").pagesScraped());
        assertEquals(2, runs.get("wellfound").jobsPublished());
        assertTrue(runs.get("wellfound").lastError().contains("HTTP 503"), runs.get("wellfound").lastError());

        assertEquals(8, broker.depthNow(QueueTopology.SCRAPED_JOBS.queue()));
    }

    @Test
    void namedScraperHonoursPageLimit() {
        ScrapeSummary summary = workflow.run("scrape-u", new ScrapeRequest("remoteok", 1)).await().atMost(WAIT);

        assertEquals(1, summary.totalScrapers());
        assertEquals(3, summary.totalPublished());
        assertEquals(1, summary.scrapers().get(0).pagesScraped());
    }

    /**
     * remoteok: two pages of three cards. wellfound: one page of two cards, then a server error.
     */
    static final class PagedScraper implements ScraperGateway {

        @Override
        public Uni<List<String>> availableScrapers() {
            return Uni.createFrom().item(List.of("remoteok", "wellfound"));
        }

        @Override
        public Uni<List<RawItem>> scrapePage(String scraper, int page) {
            if (scraper.equals("wellfound") && page == 2) {
                return Uni.createFrom().failure(new IllegalStateException("HTTP 503"));
            }
            int count = scraper.equals("remoteok") ? (page <= 2 ? 3 : 0) : (page == 1 ? 2 : 0);
            List<RawItem> cards = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                cards.add(SampleItems.card("Co" + i, "Role", "Remote", "Full-time",
                        "https://jobs.example.com/" + scraper + "/" + page + "/" + i));
            }
            return Uni.createFrom().item(cards);
        }

        @Override
        public Uni<DetailScrape> scrapeDetail(String url) {
            return Uni.createFrom().item(DetailScrape.failed("not used"));
        }
    }
}
