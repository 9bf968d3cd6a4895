package io.jobgtm.queue;

import java.util.Map;

/**
 * A leased delivery. {@code deliveryTag} identifies the stored message for ack, requeue and
 * reject; {@code deliveryCount} counts broker deliveries including lease expiries.
 */
public record QueueMessage(long deliveryTag, String queue, String body, Map<String, Object> headers,
                           int deliveryCount) {

    public QueueMessage {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
