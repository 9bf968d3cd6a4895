package io.jobgtm.retry;

import io.jobgtm.model.SampleItems;
import io.jobgtm.queue.InMemoryMessageBroker;
import io.jobgtm.queue.QueueMessage;
import io.jobgtm.queue.QueueTopology;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DeadLetterPolicyTest {

    private static final QueueTopology TOPOLOGY = QueueTopology.RAW_JOBS_FOR_PROCESSING;

    private InMemoryMessageBroker broker;
    private DeadLetterPolicy policy;

    @BeforeEach
    void setUp() {
        broker = new InMemoryMessageBroker();
        broker.declare(TOPOLOGY).await().indefinitely();
        policy = new DeadLetterPolicy(broker, 3);
    }

    @Test
    void requeuesUpToMaxRetriesThenDeadLetters() {
        broker.publish(TOPOLOGY.exchange(), TOPOLOGY.routingKey(), "{\"id\":1}",
                Map.of("posting_url", "https://jobs.example.com/1")).await().indefinitely();

        for (int failure = 1; failure <= 3; failure++) {
            QueueMessage m = fetchOne(TOPOLOGY.queue());
            assertEquals(failure - 1, RetryState.from(m.headers()).retryCount());
            assertEquals(FailureOutcome.REQUEUED,
                    policy.handleFailure(m, new IllegalStateException("model down")).await().indefinitely());
        }

        QueueMessage last = fetchOne(TOPOLOGY.queue());
        assertEquals(3, RetryState.from(last.headers()).retryCount());
        assertEquals(FailureOutcome.DEAD_LETTERED,
                policy.handleFailure(last, new IllegalStateException("model down")).await().indefinitely());

        assertEquals(0, broker.depthNow(TOPOLOGY.queue()));
        List<QueueMessage> dlq = broker.peek(TOPOLOGY.deadLetterQueue());
        assertEquals(1, dlq.size());
        assertEquals("{\"id\":1}", dlq.get(0).body());
        assertEquals(TOPOLOGY.queue(), dlq.get(0).headers().get("x-original-queue"));
        assertEquals("model down", dlq.get(0).headers().get(RetryState.LAST_ERROR_HEADER));
    }

    @Test
    void nonRetryableErrorsSkipTheRetryBudget() {
        broker.publish(TOPOLOGY.exchange(), TOPOLOGY.routingKey(), "{}", Map.of()).await().indefinitely();

        FailureOutcome outcome = policy.handleFailure(fetchOne(TOPOLOGY.queue()),
                new NonRetryableException("missing id")).await().indefinitely();

        assertEquals(FailureOutcome.DEAD_LETTERED, outcome);
        assertEquals(1, broker.depthNow(TOPOLOGY.deadLetterQueue()));
    }

    @Test
    void zeroRetriesDeadLettersOnFirstFailure() {
        DeadLetterPolicy strict = new DeadLetterPolicy(broker, 0);
        broker.publish(TOPOLOGY.exchange(), TOPOLOGY.routingKey(), "{}", Map.of()).await().indefinitely();

        assertEquals(FailureOutcome.DEAD_LETTERED,
                strict.handleFailure(fetchOne(TOPOLOGY.queue()), new RuntimeException("x")).await().indefinitely());
    }

    @Test
    void retryCountIsReadFromStringHeaders() {
        assertEquals(2, RetryState.from(Map.of(RetryState.HEADER, "2")).retryCount());
        assertEquals(0, RetryState.from(Map.of(RetryState.HEADER, "two")).retryCount());
        assertEquals(0, RetryState.from(null).retryCount());
    }

    @Test
    void idempotencyKeyPrefersPostingUrl() {
        QueueMessage withUrl = new QueueMessage(9, "q", "{}", Map.of("posting_url", "https://x/1", "source_job_id", 4), 1);
        QueueMessage withId = new QueueMessage(9, "q", "{}", Map.of("source_job_id", 4), 1);
        QueueMessage bare = new QueueMessage(9, "q", "{}", Map.of(), 1);

        assertEquals("https://x/1", DeadLetterPolicy.idempotencyKey(withUrl));
        assertEquals("source_job_id=4", DeadLetterPolicy.idempotencyKey(withId));
        assertEquals("delivery-tag=9", DeadLetterPolicy.idempotencyKey(bare));
    }

    @Test
    void goldenAndSourceIdsTravelInSeparateHeaders() {
        Map<String, Object> headers = SampleItems.scraped(5L, null).headers();

        assertEquals(5L, headers.get("golden_id"));
        assertEquals(11L, headers.get("source_job_id"));
        assertEquals("golden_id=5", DeadLetterPolicy.idempotencyKey(new QueueMessage(9, "q", "{}", headers, 1)));
    }

    private QueueMessage fetchOne(String queue) {
        List<QueueMessage> batch = broker.fetch(queue, 1, Duration.ofMinutes(5)).await().indefinitely();
        assertEquals(1, batch.size());
        return batch.get(0);
    }
}
