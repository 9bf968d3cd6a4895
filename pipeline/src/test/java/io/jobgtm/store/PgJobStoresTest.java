package io.jobgtm.store;

import io.jobgtm.model.SampleItems;
import io.jobgtm.model.WorkItem;
import io.quarkus.test.junit.QuarkusTest;
import io.vertx.mutiny.sqlclient.Pool;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Both job repositories against a dev-services PostgreSQL with the production constraints.
 */
@QuarkusTest
@Testcontainers(disabledWithoutDocker = true)
class PgJobStoresTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @Inject
    Pool pg;

    @Inject
    PgJobListingRepository listings;

    @Inject
    PgGoldenJobRepository golden;

    @BeforeEach
    void setUp() {
        PgTestSchema.recreateJobTables(pg);
    }

    @Test
    void placeholderLocationAndTypeStillHitTheNaturalKey() {
        assertEquals(InsertOutcome.INSERTED, insert("Acme", "Eng", null, null, null));
        assertEquals(InsertOutcome.DUPLICATE, insert("Acme", "Eng", "N/A", "unknown", null));
        assertEquals(InsertOutcome.DUPLICATE, insert("Acme", "Eng", " ", "none", null));

        assertEquals(1L, listings.count().await().atMost(WAIT));
        WorkItem stored = listings.fetchPage(0, 10).await().atMost(WAIT).get(0);
        assertEquals("N/A", stored.payload().get("job_location"));
        assertEquals("N/A", stored.payload().get("employment_type"));
    }

    @Test
    void samePostingUrlIsADuplicateWhateverTheDetails() {
        assertEquals(InsertOutcome.INSERTED, insert("Acme", "Eng", "NY", "FT", "https://jobs.example.com/1"));
        assertEquals(InsertOutcome.DUPLICATE, insert("Globex", "Ops", "Remote", "Contract", "https://jobs.example.com/1"));
    }

    @Test
    void cardsWithoutUrlOnlyCollideOnTheirDetails() {
        assertEquals(InsertOutcome.INSERTED, insert("Acme", "Eng", "NY", "FT", null));
        assertEquals(InsertOutcome.INSERTED, insert("Globex", "Eng", "NY", "FT", ""));

        assertEquals(2L, listings.count().await().atMost(WAIT));
    }

    @Test
    void detailScrapeUpsertsByUrlAndQueuesEnrichment() {
        String url = "https://jobs.example.com/acme";
        long first = save(url, true, "First description");
        long second = save(url, true, "Second description");

        assertEquals(first, second);
        assertEquals(List.of(first), golden.pendingEnrichmentIds().await().atMost(WAIT));
        assertEquals(1L, golden.countPendingEnrichment().await().atMost(WAIT));
        List<WorkItem> page = golden.fetchPendingEnrichment(first, first, 10).await().atMost(WAIT);
        assertEquals(1, page.size());
        assertEquals("Second description", page.get(0).payload().get("job_description_full"));
        assertEquals(11L, page.get(0).payload().get("source_job_id"));
    }

    @Test
    void failedDetailScrapeIsNotPendingEnrichment() {
        save("https://jobs.example.com/down", false, null);

        assertTrue(golden.pendingEnrichmentIds().await().atMost(WAIT).isEmpty());
    }

    @Test
    void enrichmentFindsRowByIdThenByUrlAndBumpsVersion() {
        String url = "https://jobs.example.com/enrich";
        long id = save(url, true, "Description");

        UpdateOutcome byId = golden.applyEnrichment(id, null, Map.of(
                GoldenColumn.ENRICHMENT_STATUS, "completed",
                GoldenColumn.SKILLS_EXTRACTED, List.of("java", "sql"),
                GoldenColumn.SENIORITY_CONFIDENCE_SCORE, 0.85,
                GoldenColumn.IS_REMOTE, Boolean.TRUE)).await().atMost(WAIT);
        UpdateOutcome byUrl = golden.applyEnrichment(999_999L, url, Map.of(GoldenColumn.SCAM_SCORE, 3))
                .await().atMost(WAIT);
        UpdateOutcome missing = golden.applyEnrichment(null, "https://jobs.example.com/none",
                Map.of(GoldenColumn.SCAM_SCORE, 3)).await().atMost(WAIT);

        assertEquals(new UpdateOutcome(id, 1), byId);
        assertEquals(new UpdateOutcome(id, 2), byUrl);
        assertFalse(missing.found());
        assertTrue(golden.pendingEnrichmentIds().await().atMost(WAIT).isEmpty());
    }

    private InsertOutcome insert(String company, String role, String location, String type, String url) {
        return listings.insert(SampleItems.card(company, role, location, type, url)).await().atMost(WAIT);
    }

    private long save(String url, boolean success, String description) {
        DetailScrapeRecord record = new DetailScrapeRecord(SampleItems.scraped(null, url), success,
                success ? null : "HTTP 503", description, description, 1_200L);
        return golden.saveDetailScraped(record).await().atMost(WAIT);
    }
}
