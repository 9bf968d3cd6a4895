package io.jobgtm.workflow;

import java.util.List;

public record ScrapeSummary(String executionId, int totalScrapers, int totalPublished, List<ScraperRun> scrapers) {

    public ScrapeSummary {
        scrapers = List.copyOf(scrapers);
    }

    /**
     * @param status {@code completed}, or {@code partial} when a page failed
     */
    public record ScraperRun(String scraper, String status, int pagesScraped, int jobsPublished, String lastError) {

        static ScraperRun begin(String scraper) {
            return new ScraperRun(scraper, "completed", 0, 0, null);
        }

        ScraperRun withPage(int published) {
            return new ScraperRun(scraper, status, pagesScraped + 1, jobsPublished + published, lastError);
        }

        ScraperRun partial(String error) {
            return new ScraperRun(scraper, "partial", pagesScraped, jobsPublished, error);
        }
    }
}
