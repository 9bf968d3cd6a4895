package io.jobgtm.retry;

/**
 * Raised by {@link ActivityRetryEnvelope} once every attempt of an activity has failed.
 */
public class ActivityFailedException extends RuntimeException {

    private final String activity;
    private final int attempts;

    public ActivityFailedException(String activity, int attempts, Throwable cause) {
        super("Activity " + activity + " failed after " + attempts + " attempt(s): "
                + (cause == null ? "error" : cause.getMessage()), cause);
        this.activity = activity;
        this.attempts = attempts;
    }

    public String getActivity() {
        return activity;
    }

    public int getAttempts() {
        return attempts;
    }
}
