package io.jobgtm.consumer;

import io.jobgtm.client.EnrichmentClient;
import io.jobgtm.model.EnrichedItem;
import io.jobgtm.model.Enrichment;
import io.jobgtm.model.SampleItems;
import io.jobgtm.model.ScrapedItem;
import io.jobgtm.queue.InMemoryMessageBroker;
import io.jobgtm.queue.QueueMessage;
import io.jobgtm.queue.QueueTopology;
import io.jobgtm.queue.StagePublisher;
import io.jobgtm.retry.ActivityRetryEnvelope;
import io.jobgtm.retry.RetryPolicy;
import io.jobgtm.retry.RetryState;
import io.jobgtm.support.JsonCodec;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AiEnrichmentConsumerTest {

    private static final QueueTopology IN = QueueTopology.RAW_JOBS_FOR_PROCESSING;
    private static final QueueTopology OUT = QueueTopology.ENRICHED_JOBS;
    private static final Duration LEASE = Duration.ofMinutes(5);
    private static final RetryPolicy ONCE = RetryPolicy.fixed(1, Duration.ZERO, Duration.ofSeconds(5));

    private final JsonCodec json = new JsonCodec();
    private final InMemoryMessageBroker broker = new InMemoryMessageBroker();
    private final StubModel model = new StubModel();
    private AiEnrichmentConsumer consumer;

    @BeforeEach
    void setUp() {
        QueueTopology.PIPELINE.forEach(t -> broker.declare(t).await().indefinitely());
        ActivityRetryEnvelope envelope = new ActivityRetryEnvelope();
        consumer = new AiEnrichmentConsumer(broker, json, model, new StagePublisher(broker, json, envelope, ONCE), envelope);
        consumer.enrichPolicy = ONCE;
        consumer.batchSize = 10;
        consumer.batchTimeout = Duration.ofSeconds(1);
        consumer.maxRetries = 3;
        consumer.prefetch = 20;
        consumer.rateLimit = 2;
        consumer.lease = LEASE;
        consumer.idle = Duration.ofMillis(20);
    }

    @Test
    void enrichedItemsArePublishedAndUnreadableAnswersMarkedPartial() {
        publish(SampleItems.scraped(1L, "https://jobs.example.com/ok"));
        publish(SampleItems.scraped(2L, "https://jobs.example.com/garbage"));
        publish(SampleItems.scraped(3L, "https://jobs.example.com/down"));

        consumer.processBatch(deliveries()).await().atMost(Duration.ofSeconds(10));

        Map<Long, EnrichedItem> out = broker.peek(OUT.queue()).stream()
                .map(m -> json.read(m.body(), EnrichedItem.class))
                .collect(Collectors.toMap(EnrichedItem::goldenId, Function.identity()));
        assertEquals(2, out.size());
        assertEquals(EnrichedItem.STATUS_COMPLETED, out.get(1L).enrichmentStatus());
        assertEquals("Senior", out.get(1L).aiEnrichment().seniorityLevel().normalized());
        assertEquals("https://jobs.example.com/ok", out.get(1L).postingUrl());
        assertEquals(EnrichedItem.STATUS_PARTIAL, out.get(2L).enrichmentStatus());
        assertEquals("Failed to parse model response", out.get(2L).aiEnrichment().error());

        List<QueueMessage> retried = broker.peek(IN.queue());
        assertEquals(1, retried.size());
        assertEquals(1, RetryState.from(retried.get(0).headers()).retryCount());
        assertTrue(retried.get(0).body().contains("/down"));
    }

    @Test
    void modelCallsAreCappedByRateLimit() {
        model.delay = Duration.ofMillis(40);
        for (long i = 1; i <= 6; i++) {
            publish(SampleItems.scraped(i, "https://jobs.example.com/ok-" + i));
        }

        consumer.processBatch(deliveries()).await().atMost(Duration.ofSeconds(10));

        assertEquals(6, broker.depthNow(OUT.queue()));
        assertTrue(model.peak.get() <= 2, "peak model calls " + model.peak.get());
        assertEquals(0, consumer.slots().inUse());
    }

    private void publish(ScrapedItem item) {
        broker.publish(IN.exchange(), IN.routingKey(), json.write(item), item.headers()).await().indefinitely();
    }

    private List<Delivery<ScrapedItem>> deliveries() {
        return broker.fetch(IN.queue(), 100, LEASE).await().indefinitely().stream()
                .map(m -> new Delivery<>(m, json.read(m.body(), ScrapedItem.class)))
                .toList();
    }

    static final class StubModel implements EnrichmentClient {

        final AtomicInteger running = new AtomicInteger();
        final AtomicInteger peak = new AtomicInteger();
        Duration delay = Duration.ZERO;

        @Override
        public Uni<Enrichment> enrich(ScrapedItem item) {
            String url = item.postingUrl();
            if (url.endsWith("/down")) {
                return Uni.createFrom().failure(new IllegalStateException("ollama unreachable"));
            }
            Enrichment result = url.endsWith("/garbage")
                    ? Enrichment.failed("Failed to parse model response", "I cannot help with that")
                    : new Enrichment(null, new Enrichment.SeniorityLevel("Senior", 0.8, "5+ years"),
                    null, null, null, null, null, null, null, null, null, null, null);
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            Uni<Enrichment> uni = Uni.createFrom().item(result);
            if (!delay.isZero()) {
                uni = uni.onItem().delayIt().by(delay);
            }
            return uni.onTermination().invoke(() -> running.decrementAndGet());
        }

        @Override
        public Uni<Boolean> healthy() {
            return Uni.createFrom().item(true);
        }
    }
}
