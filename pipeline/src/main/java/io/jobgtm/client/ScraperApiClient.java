package io.jobgtm.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.jobgtm.model.RawItem;
import io.smallrye.mutiny.Uni;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;
import java.util.Map;

@Path("/")
@RegisterRestClient(configKey = "scraper-api")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public interface ScraperApiClient {

    @GET
    @Path("/scrapers")
    Uni<ScrapersResp> scrapers();

    @POST
    @Path("/scrape")
    Uni<ScrapeResp> scrape(ScrapeReq req);

    @POST
    @Path("/scrape-detail")
    Uni<DetailResp> scrapeDetail(DetailReq req);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScrapersResp(List<String> scrapers) { }

    record ScrapeReq(String scraper, Map<String, Object> params) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScrapeResp(Boolean success, String scraper, List<RawItem> result) { }

    record DetailReq(String url) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DetailResp(Boolean success, String scraper, DetailResult result) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DetailResult(String jobDescriptionFull, String fullPageText, String scrapedUrl,
                        Boolean scrapeSuccess, String scrapeError, Long scrapeDurationMs) { }
}
