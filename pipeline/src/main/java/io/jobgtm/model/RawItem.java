package io.jobgtm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.Map;

/**
 * A job card as returned by a listing scraper, published to {@code scraped_jobs}.
 * Field names follow the scraper's camelCase output.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawItem(
        @JsonProperty("companyTitle") String companyTitle,
        @JsonProperty("jobRole") String jobRole,
        @JsonProperty("jobLocation") String jobLocation,
        @JsonProperty("employmentType") String employmentType,
        @JsonProperty("salaryRange") String salaryRange,
        @JsonProperty("minSalary") Double minSalary,
        @JsonProperty("maxSalary") Double maxSalary,
        @JsonProperty("requiredExperience") String requiredExperience,
        @JsonProperty("seniorityLevel") String seniorityLevel,
        @JsonProperty("jobDescription") String jobDescription,
        @JsonProperty("datePosted") String datePosted,
        @JsonProperty("postingUrl") String postingUrl,
        @JsonProperty("hiringTeam") String hiringTeam,
        @JsonProperty("aboutCompany") String aboutCompany,
        @JsonProperty("scraper_source") String scraperSource) implements StagePayload {

    public RawItem withScraperSource(String source) {
        return new RawItem(companyTitle, jobRole, jobLocation, employmentType, salaryRange, minSalary,
                maxSalary, requiredExperience, seniorityLevel, jobDescription, datePosted, postingUrl,
                hiringTeam, aboutCompany, source);
    }

    /**
     * Natural key as scraped, used for message idempotency. The values actually stored are
     * normalised first, see {@code PgJobListingRepository.naturalKey}.
     */
    public String naturalKey() {
        return String.join("|", String.valueOf(companyTitle), String.valueOf(jobRole),
                String.valueOf(jobLocation), String.valueOf(employmentType));
    }

    @Override
    public String idempotencyKey() {
        return postingUrl != null ? postingUrl : naturalKey();
    }

    @Override
    public Map<String, Object> headers() {
        Map<String, Object> h = new HashMap<>();
        h.put("scraper", scraperSource == null ? "unknown" : scraperSource);
        h.put("posting_url", postingUrl == null ? "" : postingUrl);
        return h;
    }
}
