package io.jobgtm.workflow;

import io.jobgtm.support.JsonCodec;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DurableExecutorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final InMemoryExecutionStore store = new InMemoryExecutionStore();
    private final DurableExecutor executor = new DurableExecutor(store, new JsonCodec());

    @Test
    void completedExecutionRecordsItsResult() {
        ExecutionHandle<Map<String, Integer>> handle = executor.start("enrichment-1", "enrichment", Map.of("n", 2),
                in -> Uni.createFrom().item(Map.of("doubled", in.get("n") * 2)));

        assertEquals(Map.of("doubled", 4), handle.result().await().atMost(WAIT));
        assertEquals(ExecutionStatus.COMPLETED, handle.describe().await().atMost(WAIT));
        ExecutionRecord rec = store.get("enrichment-1");
        assertEquals("{\"n\":2}", rec.input());
        assertEquals("{\"doubled\":4}", rec.result());
        assertNull(rec.parentId());
    }

    @Test
    void failedExecutionRecordsTheError() {
        ExecutionHandle<String> handle = executor.start("scrape-1", "scrape", "all",
                in -> Uni.createFrom().failure(new IllegalStateException("scraper service down")));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> handle.result().await().atMost(WAIT));
        assertEquals("scraper service down", e.getMessage());
        assertEquals(ExecutionStatus.FAILED, store.get("scrape-1").status());
        assertEquals("scraper service down", store.get("scrape-1").error());
    }

    @Test
    void executionIdCannotBeReused() {
        AtomicInteger runs = new AtomicInteger();
        executor.start("scrape-2", "scrape", "all", in -> Uni.createFrom().item(runs.incrementAndGet()))
                .result().await().atMost(WAIT);

        ExecutionHandle<Integer> again = executor.start("scrape-2", "scrape", "all",
                in -> Uni.createFrom().item(runs.incrementAndGet()));

        assertThrows(DuplicateExecutionException.class, () -> again.result().await().atMost(WAIT));
        assertEquals(1, runs.get());
        assertEquals(ExecutionStatus.COMPLETED, store.get("scrape-2").status());
    }

    @Test
    void childExecutionIsLinkedToItsParent() {
        ExecutionHandle<String> child = executor.startChild("detail-scrape-9", 4, "detail-scrape-chunk", "c",
                in -> Uni.createFrom().item("ok"));

        child.result().await().atMost(WAIT);
        assertEquals("detail-scrape-9-chunk-4", child.executionId());
        assertEquals("detail-scrape-9", store.get("detail-scrape-9-chunk-4").parentId());
    }
}
