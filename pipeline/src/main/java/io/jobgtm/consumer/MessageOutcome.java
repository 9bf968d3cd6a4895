package io.jobgtm.consumer;

import io.jobgtm.retry.FailureOutcome;

/**
 * How a single message of a batch was settled.
 */
public enum MessageOutcome {
    PROCESSED,
    DUPLICATE,
    NOT_FOUND,
    REQUEUED,
    DEAD_LETTERED,
    /** Neither acked nor moved; the lease will expire and the broker redelivers. */
    UNSETTLED;

    static MessageOutcome of(FailureOutcome outcome) {
        return outcome == FailureOutcome.REQUEUED ? REQUEUED : DEAD_LETTERED;
    }
}
