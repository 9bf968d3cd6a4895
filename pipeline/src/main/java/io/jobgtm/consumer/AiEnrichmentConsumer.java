package io.jobgtm.consumer;

import io.jobgtm.client.EnrichmentClient;
import io.jobgtm.model.EnrichedItem;
import io.jobgtm.model.ScrapedItem;
import io.jobgtm.queue.MessageBroker;
import io.jobgtm.queue.QueueTopology;
import io.jobgtm.queue.StagePublisher;
import io.jobgtm.retry.ActivityRetryEnvelope;
import io.jobgtm.retry.RetryPolicy;
import io.jobgtm.support.JsonCodec;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Enriches detail-scraped items from {@code raw_jobs_for_processing} with the model and
 * forwards them to {@code enriched_jobs}.
 *
 * <p>All messages of a batch run at once; the number of model calls in flight is capped by
 * {@code pipeline.enrichment.rate-limit} across batches. The message is acked only after the
 * enriched item was published.</p>
 */
@ApplicationScoped
public class AiEnrichmentConsumer extends StageConsumer<ScrapedItem> {

    private static final Logger LOG = Logger.getLogger(AiEnrichmentConsumer.class);

    final EnrichmentClient enrichment;
    final StagePublisher publisher;
    final ActivityRetryEnvelope envelope;

    private volatile AsyncSemaphore modelSlots;

    RetryPolicy enrichPolicy = RetryPolicy.fixed(2, Duration.ofSeconds(2), Duration.ofMinutes(5));

    public AiEnrichmentConsumer(MessageBroker broker, JsonCodec json, EnrichmentClient enrichment,
                                StagePublisher publisher, ActivityRetryEnvelope envelope) {
        super(broker, json, QueueTopology.RAW_JOBS_FOR_PROCESSING, ScrapedItem.class);
        this.enrichment = enrichment;
        this.publisher = publisher;
        this.envelope = envelope;
    }

    @ConfigProperty(name = "pipeline.enrichment.batch-size", defaultValue = "10")
    int batchSize;

    @ConfigProperty(name = "pipeline.enrichment.batch-timeout", defaultValue = "PT30S")
    Duration batchTimeout;

    @ConfigProperty(name = "pipeline.enrichment.max-retries", defaultValue = "3")
    int maxRetries;

    @ConfigProperty(name = "pipeline.enrichment.prefetch", defaultValue = "20")
    int prefetch;

    @ConfigProperty(name = "pipeline.enrichment.rate-limit", defaultValue = "3")
    int rateLimit;

    @ConfigProperty(name = "pipeline.consumer.lease", defaultValue = "PT5M")
    Duration lease;

    @ConfigProperty(name = "pipeline.consumer.idle", defaultValue = "PT1S")
    Duration idle;

    @Override
    protected ConsumerSettings settings() {
        return new ConsumerSettings(batchSize, batchTimeout, maxRetries, prefetch, lease, idle);
    }

    @Override
    protected int batchConcurrency() {
        return Math.max(1, batchSize);
    }

    @Override
    protected Uni<MessageOutcome> handle(Delivery<ScrapedItem> delivery) {
        ScrapedItem job = delivery.payload();
        long started = System.nanoTime();
        return slots().withPermit(() -> envelope.run("enrich", enrichPolicy, () -> enrichment.enrich(job)))
                .onItem().transform(ai -> new EnrichedItem(job, ai,
                        OffsetDateTime.now(ZoneOffset.UTC).toString(),
                        ai.hasError() ? EnrichedItem.STATUS_PARTIAL : EnrichedItem.STATUS_COMPLETED,
                        (System.nanoTime() - started) / 1_000_000))
                .call(enriched -> publisher.publish(QueueTopology.ENRICHED_JOBS, enriched))
                .invoke(enriched -> LOG.infof("Enriched %s (%s) in %dms", job.idempotencyKey(),
                        enriched.enrichmentStatus(), enriched.processingDurationMs()))
                .replaceWith(MessageOutcome.PROCESSED);
    }

    AsyncSemaphore slots() {
        AsyncSemaphore s = modelSlots;
        if (s == null) {
            synchronized (this) {
                if (modelSlots == null) {
                    modelSlots = new AsyncSemaphore(Math.max(1, rateLimit));
                }
                s = modelSlots;
            }
        }
        return s;
    }
}
