package io.jobgtm.store;

import io.jobgtm.model.ScrapedItem;

/**
 * Outcome of scraping one listing's detail page, ready to be written to the golden table.
 *
 * @param source raw listing fields ({@code sourceJobId} set, golden {@code id} unset)
 */
public record DetailScrapeRecord(ScrapedItem source, boolean success, String error,
                                 String jobDescriptionFull, String fullPageText, long durationMs) {
}
