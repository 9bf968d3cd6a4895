package io.jobgtm.store;

import io.jobgtm.model.EnrichedItem;
import io.jobgtm.model.Enrichment;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps an {@link EnrichedItem} onto the golden columns it is allowed to change.
 *
 * <p>Only sections the model actually returned contribute columns, so a partial enrichment
 * leaves earlier values of absent sections alone. Processing metadata is always written.</p>
 */
public final class EnrichmentColumns {

    private EnrichmentColumns() {
    }

    public static Map<GoldenColumn, Object> from(EnrichedItem item) {
        return from(item, OffsetDateTime.now(ZoneOffset.UTC));
    }

    static Map<GoldenColumn, Object> from(EnrichedItem item, OffsetDateTime now) {
        Map<GoldenColumn, Object> cols = new EnumMap<>(GoldenColumn.class);
        Enrichment ai = item.aiEnrichment();
        if (ai != null) {
            location(ai.locationNormalization(), cols);
            currency(ai.currencyNormalization(), cols, now);
            if (ai.seniorityLevel() != null) {
                text(cols, GoldenColumn.SENIORITY_LEVEL_NORMALIZED, ai.seniorityLevel().normalized());
                cols.put(GoldenColumn.SENIORITY_CONFIDENCE_SCORE, FieldRules.clamp(ai.seniorityLevel().confidence(), 0.0, 1.0));
            }
            if (ai.workArrangement() != null) {
                text(cols, GoldenColumn.WORK_ARRANGEMENT_RAW, ai.workArrangement().details());
                text(cols, GoldenColumn.WORK_ARRANGEMENT_NORMALIZED, ai.workArrangement().normalized());
            }
            if (ai.scamDetection() != null) {
                cols.put(GoldenColumn.SCAM_SCORE, ai.scamDetection().score());
                cols.put(GoldenColumn.SCAM_INDICATORS, list(ai.scamDetection().indicators()));
            }
            if (ai.skillsExtraction() != null) {
                cols.put(GoldenColumn.SKILLS_EXTRACTED, list(ai.skillsExtraction().skills()));
            }
            if (ai.techStack() != null) {
                cols.put(GoldenColumn.TECH_STACK_NORMALIZED, list(ai.techStack().technologies()));
            }
            if (ai.companyInsights() != null) {
                text(cols, GoldenColumn.COMPANY_RESEARCH, ai.companyInsights().notableInfo());
                text(cols, GoldenColumn.COMPANY_INDUSTRY, ai.companyInsights().industry());
                text(cols, GoldenColumn.COMPANY_SIZE, ai.companyInsights().companySize());
            }
            if (ai.benefits() != null) {
                cols.put(GoldenColumn.HAS_STOCK_OPTIONS, ai.benefits().hasStockOptions());
                text(cols, GoldenColumn.STOCK_OPTIONS_DETAILS, ai.benefits().stockDetails());
                cols.put(GoldenColumn.OTHER_BENEFITS, list(ai.benefits().otherBenefits()));
            }
            if (ai.roleClassification() != null) {
                text(cols, GoldenColumn.PRIMARY_ROLE, ai.roleClassification().primaryRole());
                text(cols, GoldenColumn.ROLE_CATEGORY, ai.roleClassification().roleCategory());
                cols.put(GoldenColumn.IS_MANAGEMENT, ai.roleClassification().isManagement());
            }
            if (ai.metadata() != null && ai.metadata().model() != null) {
                text(cols, GoldenColumn.OLLAMA_MODEL_VERSION, ai.metadata().model());
            }
            if (ai.hasError()) {
                cols.put(GoldenColumn.ENRICHMENT_ERRORS, Map.of("error", ai.error()));
            }
        }
        cols.put(GoldenColumn.ENRICHED_AT, timestamp(item.enrichedAt(), now));
        if (item.processingDurationMs() != null) {
            cols.put(GoldenColumn.PROCESSING_DURATION_MS,
                    (int) Math.min(Integer.MAX_VALUE, Math.max(0L, item.processingDurationMs())));
        }
        text(cols, GoldenColumn.ENRICHMENT_STATUS,
                item.enrichmentStatus() == null ? EnrichedItem.STATUS_COMPLETED : item.enrichmentStatus());
        return cols;
    }

    private static void location(Enrichment.LocationNormalization loc, Map<GoldenColumn, Object> cols) {
        if (loc == null) return;
        String city = FieldRules.text(loc.city());
        String country = FieldRules.text(loc.country());
        if (city != null || country != null) {
            String joined = city == null ? country : country == null ? city : city + ", " + country;
            text(cols, GoldenColumn.JOB_LOCATION_NORMALIZED, joined);
        }
        text(cols, GoldenColumn.LOCATION_CITY, loc.city());
        text(cols, GoldenColumn.LOCATION_STATE, loc.state());
        text(cols, GoldenColumn.LOCATION_COUNTRY, loc.country());
        text(cols, GoldenColumn.LOCATION_TIMEZONE, loc.timezone());
        if (loc.isRemote() != null) {
            cols.put(GoldenColumn.IS_REMOTE, loc.isRemote());
        }
    }

    private static void currency(Enrichment.CurrencyNormalization cur, Map<GoldenColumn, Object> cols,
                                 OffsetDateTime now) {
        if (cur == null) return;
        text(cols, GoldenColumn.CURRENCY_RAW, cur.detectedCurrency());
        cols.put(GoldenColumn.MIN_SALARY_USD, FieldRules.decimal(cur.minSalaryUsd(), 10, 2));
        cols.put(GoldenColumn.MAX_SALARY_USD, FieldRules.decimal(cur.maxSalaryUsd(), 10, 2));
        Double rate = FieldRules.decimal(cur.conversionRate(), 10, 6);
        cols.put(GoldenColumn.CURRENCY_CONVERSION_RATE, rate);
        if (rate != null && rate != 0.0) {
            cols.put(GoldenColumn.CURRENCY_CONVERSION_DATE, now);
        }
    }

    private static void text(Map<GoldenColumn, Object> cols, GoldenColumn col, String value) {
        cols.put(col, FieldRules.nullable(value, col.maxLength()));
    }

    private static List<?> list(List<?> values) {
        return values == null ? null : Collections.unmodifiableList(values);
    }

    private static OffsetDateTime timestamp(String iso, OffsetDateTime fallback) {
        if (iso == null || iso.isBlank()) return fallback;
        try {
            return OffsetDateTime.parse(iso);
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }
}
