package io.jobgtm.store;

import io.jobgtm.model.RawItem;
import io.jobgtm.model.StageStatus;
import io.jobgtm.model.WorkItem;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.Pool;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.Tuple;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@ApplicationScoped
public class PgJobListingRepository implements JobListingRepository {

    private static final Logger LOG = Logger.getLogger(PgJobListingRepository.class);

    final Pool pg;

    public PgJobListingRepository(Pool pg) {
        this.pg = pg;
    }

    @Override
    public Uni<Long> count() {
        return pg.query("SELECT count(*) AS total FROM job_listings").execute()
                .onItem().transform(rows -> rows.iterator().next().getLong("total"));
    }

    @Override
    public Uni<List<WorkItem>> fetchPage(int offset, int limit) {
        String sql = """
                SELECT id, company_title, job_role, job_location, employment_type, salary_range,
                       min_salary::float8 AS min_salary, max_salary::float8 AS max_salary,
                       required_experience, seniority_level, job_description, date_posted, posting_url,
                       hiring_team, about_company, scraper_source, scraped_at
                FROM job_listings
                ORDER BY id
                OFFSET $1
                LIMIT $2
                """;
        return pg.preparedQuery(sql).execute(Tuple.of(offset, limit))
                .onItem().transform(rows -> {
                    List<WorkItem> list = new ArrayList<>(rows.rowCount());
                    for (Row r : rows) {
                        list.add(new WorkItem(r.getLong("id"), payloadOf(r), StageStatus.COMPLETED));
                    }
                    return list;
                });
    }

    @Override
    public Uni<InsertOutcome> insert(RawItem item) {
        String sql = """
                INSERT INTO job_listings (company_title, job_role, job_location, employment_type,
                                          salary_range, min_salary, max_salary, required_experience,
                                          seniority_level, job_description, date_posted, posting_url,
                                          hiring_team, about_company, scraper_source, scraped_at)
                VALUES ($1, $2, $3, $4, $5, $6::float8, $7::float8, $8, $9, $10, $11, $12, $13, $14, $15, now())
                ON CONFLICT DO NOTHING
                RETURNING id
                """;
        List<String> key = naturalKey(item);
        Tuple params = Tuple.tuple()
                .addValue(key.get(0))
                .addValue(key.get(1))
                .addValue(key.get(2))
                .addValue(key.get(3))
                .addValue(FieldRules.nullable(item.salaryRange(), 255))
                .addValue(FieldRules.decimal(item.minSalary(), 10, 2))
                .addValue(FieldRules.decimal(item.maxSalary(), 10, 2))
                .addValue(FieldRules.nullable(item.requiredExperience(), 255))
                .addValue(FieldRules.nullable(item.seniorityLevel(), 100))
                .addValue(FieldRules.text(item.jobDescription()))
                .addValue(FieldRules.nullable(item.datePosted(), 100))
                .addValue(FieldRules.text(item.postingUrl()))
                .addValue(FieldRules.text(item.hiringTeam()))
                .addValue(FieldRules.text(item.aboutCompany()))
                .addValue(FieldRules.required(item.scraperSource(), 100));
        return pg.preparedQuery(sql).execute(params)
                .onItem().transform(rows -> {
                    if (rows.rowCount() == 0) {
                        LOG.debugf("Duplicate listing skipped: %s", item.idempotencyKey());
                        return InsertOutcome.DUPLICATE;
                    }
                    return InsertOutcome.INSERTED;
                });
    }

    /**
     * Values bound to the columns of {@code uq_job_listing_details}. None of them is ever
     * {@code null}: Postgres treats nulls as distinct, so a card without a location or type
     * would otherwise be inserted again on every scrape. Placeholders collapse to
     * {@link FieldRules#NOT_AVAILABLE}.
     */
    public static List<String> naturalKey(RawItem item) {
        return List.of(
                FieldRules.required(item.companyTitle(), 255),
                FieldRules.required(item.jobRole(), 255),
                FieldRules.required(item.jobLocation(), 255),
                FieldRules.required(item.employmentType(), 100));
    }

    private static Map<String, Object> payloadOf(Row r) {
        Map<String, Object> p = new HashMap<>();
        put(p, "source_job_id", r.getLong("id"));
        put(p, "company_title", r.getString("company_title"));
        put(p, "job_role", r.getString("job_role"));
        put(p, "job_location", r.getString("job_location"));
        put(p, "employment_type", r.getString("employment_type"));
        put(p, "salary_range", r.getString("salary_range"));
        put(p, "min_salary", r.getDouble("min_salary"));
        put(p, "max_salary", r.getDouble("max_salary"));
        put(p, "required_experience", r.getString("required_experience"));
        put(p, "seniority_level", r.getString("seniority_level"));
        put(p, "job_description", r.getString("job_description"));
        put(p, "date_posted", r.getString("date_posted"));
        put(p, "posting_url", r.getString("posting_url"));
        put(p, "hiring_team", r.getString("hiring_team"));
        put(p, "about_company", r.getString("about_company"));
        put(p, "scraper_source", r.getString("scraper_source"));
        OffsetDateTime scrapedAt = r.getOffsetDateTime("scraped_at");
        put(p, "scraped_at", scrapedAt == null ? null : scrapedAt.toString());
        return p;
    }

    static void put(Map<String, Object> p, String key, Object value) {
        if (value != null) p.put(key, value);
    }
}
