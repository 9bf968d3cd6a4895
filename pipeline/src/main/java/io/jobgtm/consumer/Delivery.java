package io.jobgtm.consumer;

import io.jobgtm.model.StagePayload;
import io.jobgtm.queue.QueueMessage;

/**
 * A leased message together with its parsed body.
 */
public record Delivery<T extends StagePayload>(QueueMessage message, T payload) {
}
