package io.jobgtm.store;

import io.jobgtm.model.RawItem;
import io.jobgtm.model.WorkItem;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Raw listings table ({@code job_listings}), one row per scraped card.
 */
public interface JobListingRepository {

    Uni<Long> count();

    /**
     * Rows ordered by id. Payload keys use the snake_case names of
     * {@link io.jobgtm.model.ScrapedItem}; absent values are left out.
     */
    Uni<List<WorkItem>> fetchPage(int offset, int limit);

    /**
     * Inserts unless a row with the same natural key or posting URL exists.
     */
    Uni<InsertOutcome> insert(RawItem item);
}
