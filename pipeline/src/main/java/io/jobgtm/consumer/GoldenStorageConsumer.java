package io.jobgtm.consumer;

import io.jobgtm.model.EnrichedItem;
import io.jobgtm.queue.MessageBroker;
import io.jobgtm.queue.QueueTopology;
import io.jobgtm.retry.ActivityRetryEnvelope;
import io.jobgtm.retry.RetryPolicy;
import io.jobgtm.store.EnrichmentColumns;
import io.jobgtm.store.GoldenJobRepository;
import io.jobgtm.support.JsonCodec;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Writes enrichment results from {@code enriched_jobs} onto the existing golden rows.
 * Source and detail-scrape columns are never touched.
 */
@ApplicationScoped
public class GoldenStorageConsumer extends StageConsumer<EnrichedItem> {

    private static final Logger LOG = Logger.getLogger(GoldenStorageConsumer.class);

    final GoldenJobRepository golden;
    final ActivityRetryEnvelope envelope;

    RetryPolicy updatePolicy = RetryPolicy.exponential(3, Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofSeconds(30));

    public GoldenStorageConsumer(MessageBroker broker, JsonCodec json, GoldenJobRepository golden,
                                 ActivityRetryEnvelope envelope) {
        super(broker, json, QueueTopology.ENRICHED_JOBS, EnrichedItem.class);
        this.golden = golden;
        this.envelope = envelope;
    }

    @ConfigProperty(name = "pipeline.golden.batch-size", defaultValue = "50")
    int batchSize;

    @ConfigProperty(name = "pipeline.golden.batch-timeout", defaultValue = "PT10S")
    Duration batchTimeout;

    @ConfigProperty(name = "pipeline.golden.max-retries", defaultValue = "3")
    int maxRetries;

    @ConfigProperty(name = "pipeline.golden.prefetch", defaultValue = "100")
    int prefetch;

    @ConfigProperty(name = "pipeline.consumer.lease", defaultValue = "PT5M")
    Duration lease;

    @ConfigProperty(name = "pipeline.consumer.idle", defaultValue = "PT1S")
    Duration idle;

    @Override
    protected ConsumerSettings settings() {
        return new ConsumerSettings(batchSize, batchTimeout, maxRetries, prefetch, lease, idle);
    }

    @Override
    protected Uni<MessageOutcome> handle(Delivery<EnrichedItem> delivery) {
        EnrichedItem item = delivery.payload();
        return envelope.run("apply-enrichment", updatePolicy,
                        () -> golden.applyEnrichment(item.goldenId(), item.postingUrl(), EnrichmentColumns.from(item)))
                .onItem().transform(outcome -> {
                    if (!outcome.found()) {
                        LOG.warnf("Job not found in golden table: %s (id=%s)", item.postingUrl(), item.goldenId());
                        return MessageOutcome.NOT_FOUND;
                    }
                    LOG.debugf("Updated golden %d to enrichment version %d", outcome.id(), outcome.version());
                    return MessageOutcome.PROCESSED;
                });
    }
}
