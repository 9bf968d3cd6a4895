package io.jobgtm.consumer;

import io.jobgtm.model.RawItem;
import io.jobgtm.queue.MessageBroker;
import io.jobgtm.queue.QueueTopology;
import io.jobgtm.retry.ActivityRetryEnvelope;
import io.jobgtm.retry.RetryPolicy;
import io.jobgtm.store.InsertOutcome;
import io.jobgtm.store.JobListingRepository;
import io.jobgtm.support.JsonCodec;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Stores scraped cards from {@code scraped_jobs} into {@code job_listings}. Re-delivered or
 * re-scraped cards hit the unique constraints and are acked as duplicates.
 */
@ApplicationScoped
public class RawIngestionConsumer extends StageConsumer<RawItem> {

    private static final Logger LOG = Logger.getLogger(RawIngestionConsumer.class);

    final JobListingRepository listings;
    final ActivityRetryEnvelope envelope;

    RetryPolicy insertPolicy = RetryPolicy.exponential(3, Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofSeconds(30));

    public RawIngestionConsumer(MessageBroker broker, JsonCodec json, JobListingRepository listings,
                                ActivityRetryEnvelope envelope) {
        super(broker, json, QueueTopology.SCRAPED_JOBS, RawItem.class);
        this.listings = listings;
        this.envelope = envelope;
    }

    @ConfigProperty(name = "pipeline.raw-ingestion.batch-size", defaultValue = "50")
    int batchSize;

    @ConfigProperty(name = "pipeline.raw-ingestion.batch-timeout", defaultValue = "PT5S")
    Duration batchTimeout;

    @ConfigProperty(name = "pipeline.raw-ingestion.max-retries", defaultValue = "3")
    int maxRetries;

    @ConfigProperty(name = "pipeline.raw-ingestion.prefetch", defaultValue = "100")
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
    protected Uni<MessageOutcome> handle(Delivery<RawItem> delivery) {
        RawItem item = delivery.payload();
        return envelope.run("insert-listing", insertPolicy, () -> listings.insert(item))
                .onItem().transform(outcome -> {
                    if (outcome == InsertOutcome.DUPLICATE) {
                        LOG.debugf("Duplicate listing %s acked", item.idempotencyKey());
                        return MessageOutcome.DUPLICATE;
                    }
                    return MessageOutcome.PROCESSED;
                });
    }
}
