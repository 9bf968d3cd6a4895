package io.jobgtm.workflow;

import io.jobgtm.support.JsonCodec;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowLauncherTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private InMemoryExecutionStore store;
    private WorkflowLauncher launcher;

    @BeforeEach
    void setUp() {
        store = new InMemoryExecutionStore();
        launcher = new WorkflowLauncher(new DurableExecutor(store, new JsonCodec()), store, null, null, null, null);
    }

    @Test
    void launchesUnderAFreshCoordinatorId() {
        ExecutionHandle<String> handle = launcher.launch("enrichment", "backfill",
                (id, in) -> Uni.createFrom().item(id + "/" + in)).await().atMost(WAIT);

        assertTrue(handle.executionId().matches("enrichment-\\d{14}-[a-z0-9]{6}"), handle.executionId());
        assertEquals(handle.executionId() + "/backfill", handle.result().await().atMost(WAIT));
    }

    @Test
    void refusesSecondRunOfSameTypeWhileFirstIsRunning() {
        launcher.launch("detail-scrape", "x", (id, in) -> Uni.createFrom().<String>nothing()).await().atMost(WAIT);

        assertThrows(DuplicateExecutionException.class, () -> launcher.launch("detail-scrape", "x",
                (id, in) -> Uni.createFrom().item("second")).await().atMost(WAIT));
    }

    @Test
    void otherTypesAndChildrenDoNotBlockALaunch() {
        launcher.launch("scrape", "x", (id, in) -> Uni.createFrom().<String>nothing()).await().atMost(WAIT);
        store.start("enrichment-20260101000000-aaaaaa-chunk-0", "enrichment-20260101000000-aaaaaa", "enrichment", "{}")
                .await().atMost(WAIT);

        ExecutionHandle<String> handle = launcher.launch("enrichment", "x",
                (id, in) -> Uni.createFrom().item("ran")).await().atMost(WAIT);

        assertEquals("ran", handle.result().await().atMost(WAIT));
    }
}
