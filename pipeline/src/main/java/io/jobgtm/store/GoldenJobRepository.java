package io.jobgtm.store;

import io.jobgtm.model.WorkItem;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.Map;

/**
 * Golden table ({@code job_listings_golden}): one row per posting URL, filled by the detail
 * scrape and then updated in place by enrichment.
 */
public interface GoldenJobRepository {

    /**
     * Rows whose detail scrape completed and whose enrichment is pending or never started.
     */
    Uni<Long> countPendingEnrichment();

    /**
     * Ids of the rows {@link #countPendingEnrichment()} counts, ascending.
     */
    Uni<List<Long>> pendingEnrichmentIds();

    /**
     * Rows with an id in {@code [firstId, lastId]} that are still pending, ordered by id. Rows
     * enriched since the ids were listed are left out, the rest of the range is unaffected.
     */
    Uni<List<WorkItem>> fetchPendingEnrichment(long firstId, long lastId, int limit);

    /**
     * Upserts by posting URL.
     *
     * @return golden id of the written row
     */
    Uni<Long> saveDetailScraped(DetailScrapeRecord record);

    /**
     * Writes the given enrichment columns and bumps {@code enrichment_version}. Looks the row up by
     * {@code id} first and by {@code postingUrl} when the id is absent or matches nothing.
     */
    Uni<UpdateOutcome> applyEnrichment(Long id, String postingUrl, Map<GoldenColumn, Object> columns);
}
