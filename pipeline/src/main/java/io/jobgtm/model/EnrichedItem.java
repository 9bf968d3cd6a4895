package io.jobgtm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.Map;

/**
 * Detail-scraped item merged with its AI enrichment, published to {@code enriched_jobs}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnrichedItem(
        @JsonProperty("job") ScrapedItem job,
        @JsonProperty("ai_enrichment") Enrichment aiEnrichment,
        @JsonProperty("enriched_at") String enrichedAt,
        @JsonProperty("enrichment_status") String enrichmentStatus,
        @JsonProperty("processing_duration_ms") Long processingDurationMs) implements StagePayload {

    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_PARTIAL = "partial";

    public Long goldenId() {
        return job == null ? null : job.id();
    }

    public String postingUrl() {
        return job == null ? null : job.postingUrl();
    }

    @Override
    public String idempotencyKey() {
        return job == null ? "unknown" : job.idempotencyKey();
    }

    @Override
    public Map<String, Object> headers() {
        Map<String, Object> h = job == null ? new HashMap<>() : job.headers();
        h.put("enrichment_status", enrichmentStatus == null ? STATUS_COMPLETED : enrichmentStatus);
        return h;
    }
}
