package io.jobgtm.retry;

/**
 * Failure that can never succeed on another attempt (bad input, violated contract).
 * The retry envelope and the dead-letter policy skip their retries for it.
 */
public class NonRetryableException extends RuntimeException {

    public NonRetryableException(String message) {
        super(message);
    }

    public NonRetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
