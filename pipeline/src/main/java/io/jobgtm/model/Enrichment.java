package io.jobgtm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured output of the enrichment model. Every section is optional; a response the parser
 * could not read is represented by {@link #failed(String, String)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Enrichment(
        @JsonProperty("currency_normalization") CurrencyNormalization currencyNormalization,
        @JsonProperty("seniority_level") SeniorityLevel seniorityLevel,
        @JsonProperty("work_arrangement") WorkArrangement workArrangement,
        @JsonProperty("scam_detection") ScamDetection scamDetection,
        @JsonProperty("skills_extraction") SkillsExtraction skillsExtraction,
        @JsonProperty("tech_stack") TechStack techStack,
        @JsonProperty("location_normalization") LocationNormalization locationNormalization,
        @JsonProperty("company_insights") CompanyInsights companyInsights,
        @JsonProperty("benefits") Benefits benefits,
        @JsonProperty("role_classification") RoleClassification roleClassification,
        @JsonProperty("_metadata") Metadata metadata,
        @JsonProperty("error") String error,
        @JsonProperty("raw_response") String rawResponse) {

    public static Enrichment failed(String error, String rawResponse) {
        return new Enrichment(null, null, null, null, null, null, null, null, null, null, null,
                error, rawResponse);
    }

    public Enrichment withMetadata(Metadata meta) {
        return new Enrichment(currencyNormalization, seniorityLevel, workArrangement, scamDetection,
                skillsExtraction, techStack, locationNormalization, companyInsights, benefits,
                roleClassification, meta, error, rawResponse);
    }

    public boolean hasError() {
        return error != null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CurrencyNormalization(
            @JsonProperty("detected_currency") String detectedCurrency,
            @JsonProperty("min_salary_usd") Double minSalaryUsd,
            @JsonProperty("max_salary_usd") Double maxSalaryUsd,
            @JsonProperty("conversion_rate") Double conversionRate,
            @JsonProperty("confidence") Double confidence) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SeniorityLevel(
            @JsonProperty("normalized") String normalized,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("reasoning") String reasoning) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WorkArrangement(
            @JsonProperty("normalized") String normalized,
            @JsonProperty("details") String details) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScamDetection(
            @JsonProperty("score") Integer score,
            @JsonProperty("indicators") List<String> indicators) {
    }

    /**
     * Skills are plain names or objects ({@code skill}, {@code normalized}, {@code category},
     * {@code experience}) depending on the model's mood; both are kept as-is.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SkillsExtraction(@JsonProperty("skills") List<Object> skills) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TechStack(
            @JsonProperty("technologies") List<String> technologies,
            @JsonProperty("frameworks") List<String> frameworks,
            @JsonProperty("tools") List<String> tools) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LocationNormalization(
            @JsonProperty("city") String city,
            @JsonProperty("state") String state,
            @JsonProperty("country") String country,
            @JsonProperty("timezone") String timezone,
            @JsonProperty("is_remote") Boolean isRemote) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CompanyInsights(
            @JsonProperty("industry") String industry,
            @JsonProperty("company_size") String companySize,
            @JsonProperty("notable_info") String notableInfo) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Benefits(
            @JsonProperty("has_stock_options") Boolean hasStockOptions,
            @JsonProperty("stock_details") String stockDetails,
            @JsonProperty("other_benefits") List<String> otherBenefits) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RoleClassification(
            @JsonProperty("primary_role") String primaryRole,
            @JsonProperty("role_category") String roleCategory,
            @JsonProperty("is_management") Boolean isManagement) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(
            @JsonProperty("processing_duration_ms") Long processingDurationMs,
            @JsonProperty("model") String model,
            @JsonProperty("timestamp") String timestamp) {
    }
}
