package io.jobgtm.workflow;

import io.jobgtm.retry.NonRetryableException;

public class DuplicateExecutionException extends NonRetryableException {

    public DuplicateExecutionException(String message) {
        super(message);
    }
}
