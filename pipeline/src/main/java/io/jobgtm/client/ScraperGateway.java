package io.jobgtm.client;

import io.jobgtm.model.RawItem;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Listing and detail scraping. Transport failures surface as failures; a page the scraper
 * loaded but could not read is a {@link DetailScrape} with {@code success = false}.
 */
public interface ScraperGateway {

    Uni<List<String>> availableScrapers();

    /**
     * Cards of one listing page, each tagged with {@code scraper} as its source. An empty list
     * means there are no more pages.
     */
    Uni<List<RawItem>> scrapePage(String scraper, int page);

    Uni<DetailScrape> scrapeDetail(String url);
}
