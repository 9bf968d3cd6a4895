package io.jobgtm.mock;

import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.resteasy.reactive.RestResponse;

import java.util.List;
import java.util.Map;

/**
 * Stands in for the scraper service: listing scrapers, paginated card scrapes and detail
 * scrapes.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class MockScraperResource {

    @Inject
    MockBehaviour behaviour;

    @ConfigProperty(name = "mock.scraper.names", defaultValue = "remoteok,wellfound,ycombinator")
    List<String> scrapers;

    @ConfigProperty(name = "mock.scraper.pages", defaultValue = "3")
    int pages;

    @ConfigProperty(name = "mock.scraper.page-size", defaultValue = "10")
    int pageSize;

    public record ScrapersResponse(List<String> scrapers) {
    }

    public record ScrapeRequest(String scraper, Map<String, Object> params) {
    }

    public record ScrapeResponse(boolean success, String scraper, List<Map<String, Object>> result) {
    }

    public record DetailRequest(String url) {
    }

    public record DetailResult(String jobDescriptionFull, String fullPageText, String scrapedUrl,
                               boolean scrapeSuccess, String scrapeError, long scrapeDurationMs) {
    }

    public record DetailResponse(boolean success, String scraper, DetailResult result) {
    }

    @GET
    @Path("/scrapers")
    public Uni<RestResponse<ScrapersResponse>> scrapers() {
        return behaviour.respond("scrapers", () -> new ScrapersResponse(scrapers));
    }

    @POST
    @Path("/scrape")
    public Uni<RestResponse<ScrapeResponse>> scrape(ScrapeRequest req) {
        String scraper = req == null || req.scraper() == null ? "unknown" : req.scraper();
        int page = pageOf(req);
        return behaviour.respond("scrape", () -> new ScrapeResponse(true, scraper,
                page < 1 || page > pages ? List.of() : MockJobCards.page(scraper, page, pageSize)));
    }

    @POST
    @Path("/scrape-detail")
    public Uni<RestResponse<DetailResponse>> scrapeDetail(DetailRequest req) {
        String url = req == null ? null : req.url();
        return behaviour.respond("scrape-detail", () -> {
            if (url == null || url.isBlank()) {
                return new DetailResponse(false, "detail",
                        new DetailResult(null, null, url, false, "url is required", 0));
            }
            String description = "Full description for " + url + ". You will design, build and run "
                    + "distributed services. Requirements: Java, PostgreSQL, Kubernetes. Benefits: equity, "
                    + "remote-friendly, health insurance.";
            return new DetailResponse(true, "detail",
                    new DetailResult(description, description + "\nApply now.", url, true, null, 42));
        });
    }

    private static int pageOf(ScrapeRequest req) {
        if (req == null || req.params() == null) return 1;
        Object page = req.params().get("page");
        if (page instanceof Number n) return n.intValue();
        if (page instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return 1;
            }
        }
        return 1;
    }
}
