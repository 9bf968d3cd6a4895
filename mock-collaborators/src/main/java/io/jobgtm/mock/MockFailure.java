package io.jobgtm.mock;

/**
 * Injected failure of a mocked endpoint, rendered by {@link MockFailureMapper}.
 */
public class MockFailure extends RuntimeException {
    private final int status;
    private final String endpoint;
    private final String title;
    private final long delayMs;

    public MockFailure(int status, String endpoint, String title, long delayMs) {
        super(endpoint + " -> " + status + " " + title);
        this.status = status;
        this.endpoint = endpoint;
        this.title = title;
        this.delayMs = delayMs;
    }

    public int getStatus() {
        return status;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getTitle() {
        return title;
    }

    public long getDelayMs() {
        return delayMs;
    }
}
