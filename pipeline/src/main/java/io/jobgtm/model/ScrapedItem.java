package io.jobgtm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.Map;

/**
 * A golden row after detail scraping, published to {@code raw_jobs_for_processing} for AI
 * enrichment. {@code id} is the golden id, {@code sourceJobId} the raw listing id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScrapedItem(
        @JsonProperty("id") Long id,
        @JsonProperty("source_job_id") Long sourceJobId,
        @JsonProperty("posting_url") String postingUrl,
        @JsonProperty("company_title") String companyTitle,
        @JsonProperty("job_role") String jobRole,
        @JsonProperty("job_location") String jobLocation,
        @JsonProperty("employment_type") String employmentType,
        @JsonProperty("salary_range") String salaryRange,
        @JsonProperty("min_salary") Double minSalary,
        @JsonProperty("max_salary") Double maxSalary,
        @JsonProperty("required_experience") String requiredExperience,
        @JsonProperty("seniority_level") String seniorityLevel,
        @JsonProperty("job_description_full") String jobDescriptionFull,
        @JsonProperty("about_company") String aboutCompany,
        @JsonProperty("hiring_team") String hiringTeam,
        @JsonProperty("date_posted") String datePosted,
        @JsonProperty("scraper_source") String scraperSource,
        @JsonProperty("scraped_at") String scrapedAt,
        @JsonProperty("detail_scraped_at") String detailScrapedAt) implements StagePayload {

    @Override
    public String idempotencyKey() {
        if (postingUrl != null) return postingUrl;
        return id == null ? "unknown" : "golden:" + id;
    }

    @Override
    public Map<String, Object> headers() {
        Map<String, Object> h = new HashMap<>();
        if (id != null) h.put("golden_id", id);
        if (sourceJobId != null) h.put("source_job_id", sourceJobId);
        h.put("posting_url", postingUrl == null ? "" : postingUrl);
        h.put("scraper_source", scraperSource == null ? "unknown" : scraperSource);
        return h;
    }
}
