package io.jobgtm.store;

import io.jobgtm.model.RawItem;
import io.jobgtm.model.StageStatus;
import io.jobgtm.model.WorkItem;
import io.smallrye.mutiny.Uni;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@code job_listings} in memory, with both unique constraints enforced on the values the Postgres
 * repository binds.
 */
public class InMemoryJobListingRepository implements JobListingRepository {

    private final TreeMap<Long, RawItem> rows = new TreeMap<>();
    private long nextId = 1;

    @Override
    public synchronized Uni<Long> count() {
        return Uni.createFrom().item((long) rows.size());
    }

    @Override
    public synchronized Uni<List<WorkItem>> fetchPage(int offset, int limit) {
        List<WorkItem> page = new ArrayList<>();
        rows.entrySet().stream().skip(offset).limit(limit).forEach(e -> {
            Map<String, Object> payload = new HashMap<>();
            PgJobListingRepository.put(payload, "source_job_id", e.getKey());
            PgJobListingRepository.put(payload, "posting_url", e.getValue().postingUrl());
            PgJobListingRepository.put(payload, "company_title", e.getValue().companyTitle());
            PgJobListingRepository.put(payload, "job_role", e.getValue().jobRole());
            page.add(new WorkItem(e.getKey(), payload, StageStatus.PENDING));
        });
        return Uni.createFrom().item(page);
    }

    @Override
    public synchronized Uni<InsertOutcome> insert(RawItem item) {
        List<String> key = PgJobListingRepository.naturalKey(item);
        String url = FieldRules.text(item.postingUrl());
        boolean clash = rows.values().stream().anyMatch(r -> PgJobListingRepository.naturalKey(r).equals(key)
                || (url != null && url.equals(FieldRules.text(r.postingUrl()))));
        if (clash) {
            return Uni.createFrom().item(InsertOutcome.DUPLICATE);
        }
        rows.put(nextId++, item);
        return Uni.createFrom().item(InsertOutcome.INSERTED);
    }

    public synchronized int size() {
        return rows.size();
    }

    public synchronized void add(RawItem item) {
        rows.put(nextId++, item);
    }
}
