package io.jobgtm.queue;

import io.smallrye.mutiny.Uni;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Durable message queue with per-queue dead-lettering.
 *
 * <p>Delivery is at-least-once: a fetched message stays leased until it is acked, requeued or
 * rejected; an expired lease makes it visible again.</p>
 */
public interface MessageBroker {

    /**
     * Creates the broker's own storage if missing.
     */
    Uni<Void> initialize();

    /**
     * Declares the exchange, queue, dead-letter exchange, dead-letter queue and both bindings.
     * Idempotent.
     */
    Uni<Void> declare(QueueTopology topology);

    /**
     * @return number of queues the message was routed to
     * @throws UnroutableMessageException (as a failure) if nothing is bound
     */
    Uni<Integer> publish(String exchange, String routingKey, String body, Map<String, Object> headers);

    /**
     * Leases up to {@code max} visible messages, oldest first.
     */
    Uni<List<QueueMessage>> fetch(String queue, int max, Duration lease);

    /**
     * Pushes the lease of each message out to {@code lease} from now, as long as it is still held
     * by the same delivery. Settled and redelivered messages are left alone.
     *
     * @return number of leases extended
     */
    Uni<Integer> extendLease(List<QueueMessage> messages, Duration lease);

    Uni<Void> ack(QueueMessage message);

    /**
     * Republishes the body to the same queue with {@code headers} and settles the original,
     * atomically.
     */
    Uni<Void> requeue(QueueMessage message, Map<String, Object> headers);

    /**
     * Settles the message without requeue; it moves to the dead-letter queue when the queue has
     * one.
     *
     * @return {@code true} if the message was dead-lettered, {@code false} if it was dropped
     */
    Uni<Boolean> reject(QueueMessage message, String reason);

    Uni<Long> depth(String queue);
}
