package io.jobgtm.queue;

import io.jobgtm.model.StagePayload;
import io.jobgtm.retry.ActivityRetryEnvelope;
import io.jobgtm.retry.RetryPolicy;
import io.jobgtm.support.JsonCodec;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;

/**
 * Publishes a typed stage payload onto the exchange of its target queue.
 */
@ApplicationScoped
public class StagePublisher {

    static final RetryPolicy DEFAULT_POLICY =
            RetryPolicy.exponential(3, Duration.ofSeconds(1), Duration.ofSeconds(10), Duration.ofSeconds(30));

    final MessageBroker broker;
    final JsonCodec json;
    final ActivityRetryEnvelope envelope;
    final RetryPolicy policy;

    @Inject
    public StagePublisher(MessageBroker broker, JsonCodec json, ActivityRetryEnvelope envelope) {
        this(broker, json, envelope, DEFAULT_POLICY);
    }

    public StagePublisher(MessageBroker broker, JsonCodec json, ActivityRetryEnvelope envelope, RetryPolicy policy) {
        this.broker = broker;
        this.json = json;
        this.envelope = envelope;
        this.policy = policy;
    }

    public Uni<Void> publish(QueueTopology target, StagePayload payload) {
        String body = json.write(payload);
        return envelope.run("publish:" + target.queue(), policy,
                        () -> broker.publish(target.exchange(), target.routingKey(), body, payload.headers()))
                .replaceWithVoid();
    }
}
