package io.jobgtm.client;

/**
 * What the scraper could read from one posting's detail page.
 */
public record DetailScrape(boolean success, String error, String jobDescriptionFull, String fullPageText) {

    public static DetailScrape failed(String error) {
        return new DetailScrape(false, error, null, null);
    }
}
