package io.jobgtm.retry;

import java.time.Duration;

public class ActivityTimeoutException extends RuntimeException {

    public ActivityTimeoutException(String activity, Duration timeout) {
        super("Activity " + activity + " timed out after " + timeout.toMillis() + "ms");
    }
}
