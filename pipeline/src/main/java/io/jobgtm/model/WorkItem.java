package io.jobgtm.model;

import java.util.Map;

/**
 * One unit of pipeline work (a job listing) at some stage.
 *
 * <p>{@code id} is the row id of the stage table the item was read from; the golden row links
 * back to the raw row through {@code source_job_id}.</p>
 */
public record WorkItem(long id, Map<String, Object> payload, StageStatus stageStatus) {

    public WorkItem {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    /**
     * Stage N+1 may only leave "not started" once stage N is completed.
     */
    public static boolean mayStartNextStage(StageStatus previous) {
        return previous == StageStatus.COMPLETED;
    }
}
