package io.jobgtm.workflow;

public enum CoordinatorState {
    INIT,
    CHUNK_INFO_FETCHED,
    CHUNKS_DISPATCHING,
    CHUNKS_AGGREGATING,
    DONE,
    PARTIALLY_FAILED
}
