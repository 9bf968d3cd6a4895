package io.jobgtm.consumer;

import java.time.Duration;

/**
 * @param batchSize    flush threshold of the accumulator
 * @param batchTimeout flush interval for partial batches
 * @param maxRetries   requeues before a message is dead-lettered
 * @param prefetch     maximum unsettled messages held by the consumer
 * @param lease        how long a fetched message stays invisible to other consumers
 * @param idle         poll interval when the queue is empty or prefetch is exhausted
 */
public record ConsumerSettings(int batchSize, Duration batchTimeout, int maxRetries, int prefetch,
                               Duration lease, Duration idle) {
}
