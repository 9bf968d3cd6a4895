package io.jobgtm.store;

import io.jobgtm.model.StageStatus;
import io.jobgtm.model.WorkItem;
import io.smallrye.mutiny.Uni;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * {@code job_listings_golden} in memory; rows are plain column maps.
 */
public class InMemoryGoldenJobRepository implements GoldenJobRepository {

    private final TreeMap<Long, Map<String, Object>> rows = new TreeMap<>();
    private long nextId = 1;

    @Override
    public synchronized Uni<Long> countPendingEnrichment() {
        return Uni.createFrom().item(pending().count());
    }

    @Override
    public synchronized Uni<List<Long>> pendingEnrichmentIds() {
        return Uni.createFrom().item(pending().map(Map.Entry::getKey).toList());
    }

    @Override
    public synchronized Uni<List<WorkItem>> fetchPendingEnrichment(long firstId, long lastId, int limit) {
        return Uni.createFrom().item(pending()
                .filter(e -> e.getKey() >= firstId && e.getKey() <= lastId)
                .limit(limit)
                .map(e -> new WorkItem(e.getKey(), withoutNulls(e.getValue()), StageStatus.COMPLETED))
                .toList());
    }

    @Override
    public synchronized Uni<Long> saveDetailScraped(DetailScrapeRecord record) {
        Map<String, Object> row = rows.values().stream()
                .filter(r -> record.source().postingUrl().equals(r.get("posting_url")))
                .findFirst().orElse(null);
        long id;
        if (row == null) {
            id = nextId++;
            row = new HashMap<>();
            row.put("id", id);
            row.put("posting_url", record.source().postingUrl());
            row.put("company_title", record.source().companyTitle());
            row.put("job_role", record.source().jobRole());
            row.put("source_job_id", record.source().sourceJobId());
            row.put("enrichment_version", 0);
            rows.put(id, row);
        } else {
            id = (Long) row.get("id");
        }
        row.put("detail_scrape_status", record.success() ? "completed" : "failed");
        row.put("detail_scrape_error", record.error());
        if (record.success()) {
            row.put("job_description_full", record.jobDescriptionFull());
            row.put("enrichment_status", "pending");
        }
        return Uni.createFrom().item(id);
    }

    @Override
    public synchronized Uni<UpdateOutcome> applyEnrichment(Long id, String postingUrl, Map<GoldenColumn, Object> columns) {
        Map<String, Object> row = id == null ? null : rows.get(id);
        if (row == null && postingUrl != null) {
            row = rows.values().stream().filter(r -> postingUrl.equals(r.get("posting_url"))).findFirst().orElse(null);
        }
        if (row == null) {
            return Uni.createFrom().item(UpdateOutcome.notFound());
        }
        for (Map.Entry<GoldenColumn, Object> e : columns.entrySet()) {
            row.put(e.getKey().column(), e.getValue());
        }
        int version = ((Integer) row.getOrDefault("enrichment_version", 0)) + 1;
        row.put("enrichment_version", version);
        return Uni.createFrom().item(new UpdateOutcome((Long) row.get("id"), version));
    }

    public synchronized long put(Map<String, Object> columns) {
        long id = columns.containsKey("id") ? ((Number) columns.get("id")).longValue() : nextId;
        nextId = Math.max(nextId, id + 1);
        Map<String, Object> row = new HashMap<>(columns);
        row.put("id", id);
        row.putIfAbsent("enrichment_version", 0);
        rows.put(id, row);
        return id;
    }

    public synchronized Map<String, Object> row(long id) {
        return rows.get(id);
    }

    public synchronized Map<String, Object> rowByUrl(String postingUrl) {
        return rows.values().stream().filter(r -> postingUrl.equals(r.get("posting_url"))).findFirst().orElse(null);
    }

    public synchronized int size() {
        return rows.size();
    }

    private Stream<Map.Entry<Long, Map<String, Object>>> pending() {
        return rows.entrySet().stream()
                .filter(e -> "completed".equals(e.getValue().get("detail_scrape_status")))
                .filter(e -> e.getValue().get("enrichment_status") == null
                        || "pending".equals(e.getValue().get("enrichment_status")));
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> row) {
        Map<String, Object> copy = new HashMap<>();
        row.forEach((k, v) -> {
            if (v != null) copy.put(k, v);
        });
        return copy;
    }
}
