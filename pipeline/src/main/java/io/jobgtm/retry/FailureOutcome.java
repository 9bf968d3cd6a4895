package io.jobgtm.retry;

public enum FailureOutcome {
    REQUEUED,
    DEAD_LETTERED
}
