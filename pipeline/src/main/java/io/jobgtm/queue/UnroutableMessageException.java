package io.jobgtm.queue;

import io.jobgtm.retry.NonRetryableException;

/**
 * No queue is bound to the exchange and routing key a message was published with.
 */
public class UnroutableMessageException extends NonRetryableException {

    public UnroutableMessageException(String exchange, String routingKey) {
        super("No binding for exchange=" + exchange + " routingKey=" + routingKey);
    }
}
