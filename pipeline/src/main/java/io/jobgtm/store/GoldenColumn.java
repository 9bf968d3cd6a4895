package io.jobgtm.store;

/**
 * Columns of {@code job_listings_golden} that an enrichment may write. Anything outside this list
 * (source fields, detail-scrape fields, identifiers) is never touched by an enrichment update.
 */
public enum GoldenColumn {

    JOB_LOCATION_NORMALIZED("job_location_normalized", Kind.TEXT, 255),
    LOCATION_CITY("location_city", Kind.TEXT, 100),
    LOCATION_STATE("location_state", Kind.TEXT, 100),
    LOCATION_COUNTRY("location_country", Kind.TEXT, 100),
    LOCATION_TIMEZONE("location_timezone", Kind.TEXT, 50),
    IS_REMOTE("is_remote", Kind.BOOLEAN, 0),

    CURRENCY_RAW("currency_raw", Kind.TEXT, 10),
    MIN_SALARY_USD("min_salary_usd", Kind.NUMBER, 0),
    MAX_SALARY_USD("max_salary_usd", Kind.NUMBER, 0),
    CURRENCY_CONVERSION_RATE("currency_conversion_rate", Kind.NUMBER, 0),
    CURRENCY_CONVERSION_DATE("currency_conversion_date", Kind.TIMESTAMP, 0),

    SENIORITY_LEVEL_NORMALIZED("seniority_level_normalized", Kind.TEXT, 50),
    SENIORITY_CONFIDENCE_SCORE("seniority_confidence_score", Kind.NUMBER, 0),

    WORK_ARRANGEMENT_RAW("work_arrangement_raw", Kind.TEXT, 100),
    WORK_ARRANGEMENT_NORMALIZED("work_arrangement_normalized", Kind.TEXT, 50),

    SCAM_SCORE("scam_score", Kind.INTEGER, 0),
    SCAM_INDICATORS("scam_indicators", Kind.JSON, 0),

    SKILLS_EXTRACTED("skills_extracted", Kind.JSON, 0),
    TECH_STACK_NORMALIZED("tech_stack_normalized", Kind.JSON, 0),

    COMPANY_RESEARCH("company_research", Kind.TEXT, 0),
    COMPANY_INDUSTRY("company_industry", Kind.TEXT, 100),
    COMPANY_SIZE("company_size", Kind.TEXT, 100),

    HAS_STOCK_OPTIONS("has_stock_options", Kind.BOOLEAN, 0),
    STOCK_OPTIONS_DETAILS("stock_options_details", Kind.TEXT, 0),
    OTHER_BENEFITS("other_benefits", Kind.JSON, 0),

    PRIMARY_ROLE("primary_role", Kind.TEXT, 100),
    ROLE_CATEGORY("role_category", Kind.TEXT, 100),
    IS_MANAGEMENT("is_management", Kind.BOOLEAN, 0),

    ENRICHED_AT("enriched_at", Kind.TIMESTAMP, 0),
    OLLAMA_MODEL_VERSION("ollama_model_version", Kind.TEXT, 50),
    PROCESSING_DURATION_MS("processing_duration_ms", Kind.INTEGER, 0),
    ENRICHMENT_STATUS("enrichment_status", Kind.TEXT, 50),
    ENRICHMENT_ERRORS("enrichment_errors", Kind.JSON, 0);

    public enum Kind {
        TEXT,
        NUMBER,
        INTEGER,
        BOOLEAN,
        TIMESTAMP,
        JSON
    }

    private final String column;
    private final Kind kind;
    private final int maxLength;

    GoldenColumn(String column, Kind kind, int maxLength) {
        this.column = column;
        this.kind = kind;
        this.maxLength = maxLength;
    }

    public String column() {
        return column;
    }

    public Kind kind() {
        return kind;
    }

    public int maxLength() {
        return maxLength;
    }
}
