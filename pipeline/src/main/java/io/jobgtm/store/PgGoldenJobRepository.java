package io.jobgtm.store;

import io.jobgtm.model.ScrapedItem;
import io.jobgtm.model.StageStatus;
import io.jobgtm.model.WorkItem;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.sqlclient.Pool;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.Tuple;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@ApplicationScoped
public class PgGoldenJobRepository implements GoldenJobRepository {

    private static final String PENDING_ENRICHMENT = """
            detail_scrape_status = 'completed'
              AND (enrichment_status IS NULL OR enrichment_status = 'pending')
            """;

    final Pool pg;

    public PgGoldenJobRepository(Pool pg) {
        this.pg = pg;
    }

    @Override
    public Uni<Long> countPendingEnrichment() {
        return pg.query("SELECT count(*) AS total FROM job_listings_golden WHERE " + PENDING_ENRICHMENT).execute()
                .onItem().transform(rows -> rows.iterator().next().getLong("total"));
    }

    @Override
    public Uni<List<Long>> pendingEnrichmentIds() {
        return pg.query("SELECT id FROM job_listings_golden WHERE " + PENDING_ENRICHMENT + " ORDER BY id").execute()
                .onItem().transform(rows -> {
                    List<Long> ids = new ArrayList<>(rows.rowCount());
                    for (Row r : rows) {
                        ids.add(r.getLong("id"));
                    }
                    return ids;
                });
    }

    @Override
    public Uni<List<WorkItem>> fetchPendingEnrichment(long firstId, long lastId, int limit) {
        String sql = """
                SELECT id, source_job_id, posting_url, company_title, job_role, job_location_raw,
                       employment_type_raw, salary_range_raw,
                       min_salary_raw::float8 AS min_salary_raw, max_salary_raw::float8 AS max_salary_raw,
                       required_experience, seniority_level_raw, job_description_full, about_company_raw,
                       hiring_team_raw, date_posted, scraper_source, scraped_at, detail_scraped_at,
                       enrichment_status
                FROM job_listings_golden
                WHERE id BETWEEN $1 AND $2
                  AND %s
                ORDER BY id
                LIMIT $3
                """.formatted(PENDING_ENRICHMENT);
        return pg.preparedQuery(sql).execute(Tuple.of(firstId, lastId, limit))
                .onItem().transform(rows -> {
                    List<WorkItem> list = new ArrayList<>(rows.rowCount());
                    for (Row r : rows) {
                        StageStatus status = StageStatus.fromWire(r.getString("enrichment_status"));
                        list.add(new WorkItem(r.getLong("id"), payloadOf(r),
                                status == null ? StageStatus.PENDING : status));
                    }
                    return list;
                });
    }

    @Override
    public Uni<Long> saveDetailScraped(DetailScrapeRecord rec) {
        String sql = """
                INSERT INTO job_listings_golden (
                    source_job_id, posting_url, company_title, job_role, job_location_raw,
                    employment_type_raw, salary_range_raw, min_salary_raw, max_salary_raw,
                    required_experience, seniority_level_raw, job_description_full, full_page_text,
                    about_company_raw, hiring_team_raw, date_posted, scraper_source, scraped_at,
                    detail_scraped_at, detail_scrape_status, detail_scrape_duration_ms,
                    detail_scrape_errors, enrichment_status, enrichment_version)
                VALUES ($1, $2, $3, $4, $5, $6, $7, $8::float8, $9::float8, $10, $11, $12, $13, $14, $15,
                        $16, $17, $18, now(), $19::text, $20::int4, $21::jsonb,
                        CASE WHEN $19::text = 'completed' THEN 'pending' END, 0)
                ON CONFLICT (posting_url) DO UPDATE
                  SET job_description_full      = EXCLUDED.job_description_full,
                      full_page_text            = EXCLUDED.full_page_text,
                      about_company_raw         = COALESCE(job_listings_golden.about_company_raw, EXCLUDED.about_company_raw),
                      hiring_team_raw           = COALESCE(job_listings_golden.hiring_team_raw, EXCLUDED.hiring_team_raw),
                      detail_scraped_at         = EXCLUDED.detail_scraped_at,
                      detail_scrape_status      = EXCLUDED.detail_scrape_status,
                      detail_scrape_duration_ms = EXCLUDED.detail_scrape_duration_ms,
                      detail_scrape_errors      = EXCLUDED.detail_scrape_errors,
                      enrichment_status         = CASE
                          WHEN EXCLUDED.detail_scrape_status = 'completed'
                               AND job_listings_golden.enrichment_status IS NULL THEN 'pending'
                          ELSE job_listings_golden.enrichment_status END,
                      updated_at                = now()
                RETURNING id
                """;
        ScrapedItem s = rec.source();
        String status = rec.success() ? StageStatus.COMPLETED.wire() : StageStatus.FAILED.wire();
        Tuple params = Tuple.tuple()
                .addValue(s.sourceJobId())
                .addValue(s.postingUrl())
                .addValue(FieldRules.nullable(s.companyTitle(), 255))
                .addValue(FieldRules.nullable(s.jobRole(), 255))
                .addValue(FieldRules.nullable(s.jobLocation(), 255))
                .addValue(FieldRules.nullable(s.employmentType(), 100))
                .addValue(FieldRules.nullable(s.salaryRange(), 255))
                .addValue(FieldRules.decimal(s.minSalary(), 10, 2))
                .addValue(FieldRules.decimal(s.maxSalary(), 10, 2))
                .addValue(FieldRules.nullable(s.requiredExperience(), 255))
                .addValue(FieldRules.nullable(s.seniorityLevel(), 100))
                .addValue(FieldRules.text(rec.jobDescriptionFull()))
                .addValue(FieldRules.text(rec.fullPageText()))
                .addValue(FieldRules.text(s.aboutCompany()))
                .addValue(FieldRules.text(s.hiringTeam()))
                .addValue(FieldRules.nullable(s.datePosted(), 100))
                .addValue(FieldRules.nullable(s.scraperSource(), 100))
                .addValue(parseTimestamp(s.scrapedAt()))
                .addValue(status)
                .addValue((int) Math.min(Integer.MAX_VALUE, Math.max(0L, rec.durationMs())))
                .addValue(rec.success() || rec.error() == null ? null : new JsonObject().put("error", rec.error()));
        return pg.preparedQuery(sql).execute(params)
                .onItem().transform(rows -> rows.iterator().next().getLong("id"));
    }

    @Override
    public Uni<UpdateOutcome> applyEnrichment(Long id, String postingUrl, Map<GoldenColumn, Object> columns) {
        Uni<UpdateOutcome> byId = id == null
                ? Uni.createFrom().item(UpdateOutcome.notFound())
                : update("id = $1", id, columns);
        return byId.onItem().transformToUni(outcome -> {
            if (outcome.found() || postingUrl == null || postingUrl.isBlank()) {
                return Uni.createFrom().item(outcome);
            }
            return update("posting_url = $1", postingUrl, columns);
        });
    }

    private Uni<UpdateOutcome> update(String filter, Object key, Map<GoldenColumn, Object> columns) {
        StringBuilder set = new StringBuilder();
        Tuple params = Tuple.tuple().addValue(key);
        int i = 1;
        for (Map.Entry<GoldenColumn, Object> e : columns.entrySet()) {
            GoldenColumn col = e.getKey();
            set.append(col.column()).append(" = $").append(++i).append(cast(col.kind())).append(", ");
            params.addValue(bind(col.kind(), e.getValue()));
        }
        String sql = "UPDATE job_listings_golden SET " + set
                + "enrichment_version = COALESCE(enrichment_version, 0) + 1, updated_at = now() WHERE "
                + filter + " RETURNING id, enrichment_version";
        return pg.preparedQuery(sql).execute(params)
                .onItem().transform(rows -> {
                    if (rows.rowCount() == 0) return UpdateOutcome.notFound();
                    Row r = rows.iterator().next();
                    return new UpdateOutcome(r.getLong("id"), r.getInteger("enrichment_version"));
                });
    }

    private static String cast(GoldenColumn.Kind kind) {
        return switch (kind) {
            case TEXT -> "::text";
            case NUMBER -> "::float8";
            case INTEGER -> "::int4";
            case BOOLEAN -> "::bool";
            case TIMESTAMP -> "::timestamptz";
            case JSON -> "::jsonb";
        };
    }

    @SuppressWarnings("unchecked")
    private static Object bind(GoldenColumn.Kind kind, Object value) {
        if (value == null || kind != GoldenColumn.Kind.JSON) return value;
        if (value instanceof List<?> l) return new JsonArray(new ArrayList<>(l));
        if (value instanceof Map<?, ?> m) return new JsonObject(new HashMap<>((Map<String, Object>) m));
        return value;
    }

    private static OffsetDateTime parseTimestamp(String iso) {
        if (iso == null || iso.isBlank()) return null;
        try {
            return OffsetDateTime.parse(iso);
        } catch (java.time.format.DateTimeParseException e) {
            return null;
        }
    }

    private static Map<String, Object> payloadOf(Row r) {
        Map<String, Object> p = new HashMap<>();
        PgJobListingRepository.put(p, "id", r.getLong("id"));
        PgJobListingRepository.put(p, "source_job_id", r.getLong("source_job_id"));
        PgJobListingRepository.put(p, "posting_url", r.getString("posting_url"));
        PgJobListingRepository.put(p, "company_title", r.getString("company_title"));
        PgJobListingRepository.put(p, "job_role", r.getString("job_role"));
        PgJobListingRepository.put(p, "job_location", r.getString("job_location_raw"));
        PgJobListingRepository.put(p, "employment_type", r.getString("employment_type_raw"));
        PgJobListingRepository.put(p, "salary_range", r.getString("salary_range_raw"));
        PgJobListingRepository.put(p, "min_salary", r.getDouble("min_salary_raw"));
        PgJobListingRepository.put(p, "max_salary", r.getDouble("max_salary_raw"));
        PgJobListingRepository.put(p, "required_experience", r.getString("required_experience"));
        PgJobListingRepository.put(p, "seniority_level", r.getString("seniority_level_raw"));
        PgJobListingRepository.put(p, "job_description_full", r.getString("job_description_full"));
        PgJobListingRepository.put(p, "about_company", r.getString("about_company_raw"));
        PgJobListingRepository.put(p, "hiring_team", r.getString("hiring_team_raw"));
        PgJobListingRepository.put(p, "date_posted", r.getString("date_posted"));
        PgJobListingRepository.put(p, "scraper_source", r.getString("scraper_source"));
        OffsetDateTime scrapedAt = r.getOffsetDateTime("scraped_at");
        PgJobListingRepository.put(p, "scraped_at", scrapedAt == null ? null : scrapedAt.toString());
        OffsetDateTime detailAt = r.getOffsetDateTime("detail_scraped_at");
        PgJobListingRepository.put(p, "detail_scraped_at", detailAt == null ? null : detailAt.toString());
        return p;
    }
}
