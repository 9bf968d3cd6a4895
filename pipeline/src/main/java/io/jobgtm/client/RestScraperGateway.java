package io.jobgtm.client;

import io.jobgtm.model.RawItem;
import io.jobgtm.retry.NonRetryableException;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;

@ApplicationScoped
public class RestScraperGateway implements ScraperGateway {

    private static final Logger LOG = Logger.getLogger(RestScraperGateway.class);

    final ScraperApiClient api;

    public RestScraperGateway(@RestClient ScraperApiClient api) {
        this.api = api;
    }

    @Override
    public Uni<List<String>> availableScrapers() {
        return api.scrapers()
                .onItem().transform(resp -> resp == null || resp.scrapers() == null ? List.<String>of() : resp.scrapers())
                .invoke(list -> LOG.infof("Found %d available scraper(s): %s", list.size(), list))
                .onFailure().transform(RestScraperGateway::classify);
    }

    @Override
    public Uni<List<RawItem>> scrapePage(String scraper, int page) {
        return api.scrape(new ScraperApiClient.ScrapeReq(scraper, Map.of("page", page)))
                .onItem().transform(resp -> {
                    if (resp == null || resp.result() == null) return List.<RawItem>of();
                    return resp.result().stream()
                            .filter(Objects::nonNull)
                            .map(card -> card.withScraperSource(scraper))
                            .toList();
                })
                .invoke(list -> LOG.infof("Scraped %d job(s) from %s, page %d", list.size(), scraper, page))
                .onFailure().transform(RestScraperGateway::classify);
    }

    @Override
    public Uni<DetailScrape> scrapeDetail(String url) {
        return api.scrapeDetail(new ScraperApiClient.DetailReq(url))
                .onItem().transform(resp -> {
                    ScraperApiClient.DetailResult r = resp == null ? null : resp.result();
                    if (r == null) return DetailScrape.failed("Scraper returned no result");
                    boolean ok = Boolean.TRUE.equals(r.scrapeSuccess());
                    return new DetailScrape(ok, ok ? null : Objects.requireNonNullElse(r.scrapeError(), "scrape failed"),
                            r.jobDescriptionFull(), r.fullPageText());
                })
                .onFailure().transform(RestScraperGateway::classify);
    }

    /**
     * A 4xx from the scraper (unknown scraper, undetectable URL) does not get better on retry.
     */
    static Throwable classify(Throwable err) {
        if (err instanceof WebApplicationException wae && wae.getResponse() != null) {
            int status = wae.getResponse().getStatus();
            if (status >= 400 && status < 500 && status != 408 && status != 429) {
                return new NonRetryableException("Scraper returned status " + status, err);
            }
        }
        return err;
    }
}
