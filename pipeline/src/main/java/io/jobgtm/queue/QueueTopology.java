package io.jobgtm.queue;

import java.util.List;

/**
 * Durable queue with its direct exchange and dead-letter pair. The routing key is the queue
 * name on both the main and the dead-letter exchange.
 */
public record QueueTopology(String queue, String exchange, String deadLetterExchange, String deadLetterQueue) {

    public static final QueueTopology SCRAPED_JOBS = forQueue("scraped_jobs");
    public static final QueueTopology RAW_JOBS_FOR_PROCESSING = forQueue("raw_jobs_for_processing");
    public static final QueueTopology ENRICHED_JOBS = forQueue("enriched_jobs");

    public static final List<QueueTopology> PIPELINE = List.of(SCRAPED_JOBS, RAW_JOBS_FOR_PROCESSING, ENRICHED_JOBS);

    public static QueueTopology forQueue(String queue) {
        return new QueueTopology(queue, queue + "_exchange", queue + "_dlx", queue + "_dlq");
    }

    public String routingKey() {
        return queue;
    }
}
