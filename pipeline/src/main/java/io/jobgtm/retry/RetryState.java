package io.jobgtm.retry;

import java.util.HashMap;
import java.util.Map;

/**
 * Retry accounting derived from the {@value #HEADER} message header.
 */
public record RetryState(int retryCount) {

    public static final String HEADER = "x-retry-count";
    public static final String LAST_ERROR_HEADER = "x-last-error";

    public static RetryState from(Map<String, Object> headers) {
        if (headers == null) return new RetryState(0);
        Object raw = headers.get(HEADER);
        if (raw instanceof Number n) return new RetryState(Math.max(0, n.intValue()));
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return new RetryState(Math.max(0, Integer.parseInt(s.trim())));
            } catch (NumberFormatException ignored) {
                return new RetryState(0);
            }
        }
        return new RetryState(0);
    }

    public RetryState next() {
        return new RetryState(retryCount + 1);
    }

    /**
     * Copy of {@code headers} carrying this retry count and the last error text.
     */
    public Map<String, Object> applyTo(Map<String, Object> headers, String lastError) {
        Map<String, Object> copy = headers == null ? new HashMap<>() : new HashMap<>(headers);
        copy.put(HEADER, retryCount);
        if (lastError != null) copy.put(LAST_ERROR_HEADER, lastError);
        return copy;
    }
}
