package io.jobgtm.retry;

import io.jobgtm.queue.MessageBroker;
import io.jobgtm.queue.QueueMessage;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Decides between requeue and dead-letter for a message whose processing failed.
 *
 * <p>The retry count travels in the message headers ({@link RetryState}). Below
 * {@code maxRetries} the message is republished with the counter incremented; at the limit it
 * is rejected without requeue so the broker routes it to the queue's dead-letter queue.
 * {@link NonRetryableException}s skip the retry budget.</p>
 */
public class DeadLetterPolicy {

    private static final Logger LOG = Logger.getLogger(DeadLetterPolicy.class);

    final MessageBroker broker;
    final int maxRetries;

    public DeadLetterPolicy(MessageBroker broker, int maxRetries) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.broker = broker;
        this.maxRetries = maxRetries;
    }

    public Uni<FailureOutcome> handleFailure(QueueMessage message, Throwable error) {
        RetryState state = RetryState.from(message.headers());
        String reason = errMessage(error);
        if (!(error instanceof NonRetryableException) && state.retryCount() < maxRetries) {
            RetryState next = state.next();
            LOG.warnf("Requeuing %s from %s (retry %d/%d): %s",
                    idempotencyKey(message), message.queue(), next.retryCount(), maxRetries, reason);
            return broker.requeue(message, next.applyTo(message.headers(), reason))
                    .replaceWith(FailureOutcome.REQUEUED);
        }
        LOG.errorf("Dead-lettering %s from %s after %d retries: %s",
                idempotencyKey(message), message.queue(), state.retryCount(), reason);
        return broker.reject(message, reason)
                .replaceWith(FailureOutcome.DEAD_LETTERED);
    }

    /**
     * Messages that cannot be parsed are never retried.
     */
    public Uni<FailureOutcome> rejectMalformed(QueueMessage message, Throwable error) {
        String reason = errMessage(error);
        LOG.errorf("Rejecting malformed message %s from %s: %s",
                idempotencyKey(message), message.queue(), reason);
        return broker.reject(message, reason)
                .replaceWith(FailureOutcome.DEAD_LETTERED);
    }

    public int maxRetries() {
        return maxRetries;
    }

    static String idempotencyKey(QueueMessage message) {
        Object url = message.headers().get("posting_url");
        if (url instanceof String s && !s.isBlank()) return s;
        Object goldenId = message.headers().get("golden_id");
        if (goldenId != null) return "golden_id=" + goldenId;
        Object sourceId = message.headers().get("source_job_id");
        if (sourceId != null) return "source_job_id=" + sourceId;
        return "delivery-tag=" + message.deliveryTag();
    }

    private static String errMessage(Throwable t) {
        String m = t == null ? "error" : t.getMessage();
        if (m == null) m = t.getClass().getSimpleName();
        return m.length() > 500 ? m.substring(0, 500) : m;
    }
}
