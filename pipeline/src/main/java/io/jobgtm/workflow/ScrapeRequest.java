package io.jobgtm.workflow;

/**
 * @param scraper  one scraper to run, or {@code null} for every scraper the service offers
 * @param maxPages last page scraped per scraper
 */
public record ScrapeRequest(String scraper, int maxPages) {

    public ScrapeRequest {
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
    }
}
