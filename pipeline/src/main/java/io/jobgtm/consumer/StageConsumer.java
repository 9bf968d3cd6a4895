package io.jobgtm.consumer;

import io.jobgtm.batch.BatchAccumulator;
import io.jobgtm.model.StagePayload;
import io.jobgtm.queue.MessageBroker;
import io.jobgtm.queue.QueueMessage;
import io.jobgtm.queue.QueueTopology;
import io.jobgtm.retry.DeadLetterPolicy;
import io.jobgtm.support.CancellationToken;
import io.jobgtm.support.JsonCodec;
import io.jobgtm.support.MalformedPayloadException;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared shape of the three stage consumers.
 *
 * <p>A poll subscription leases messages from the stage queue while fewer than
 * {@code prefetch} are unsettled, parses each body into {@code T} and offers it to a
 * {@link BatchAccumulator}. Unparsable bodies are dead-lettered right away. Each message of a
 * batch is settled on its own: acked after {@link #handle(Delivery)} succeeds, otherwise passed
 * to the {@link DeadLetterPolicy}. One message failing never affects its siblings.</p>
 *
 * <p>While a message is unsettled its lease is renewed every third of the lease, so a slow
 * batch is not redelivered to another consumer halfway through.</p>
 */
public abstract class StageConsumer<T extends StagePayload> {

    private static final Logger LOG = Logger.getLogger(StageConsumer.class);
    private static final Duration MIN_HEARTBEAT = Duration.ofMillis(10);

    protected final MessageBroker broker;
    protected final JsonCodec json;
    private final QueueTopology topology;
    private final Class<T> type;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<Long, QueueMessage> unsettled = new ConcurrentHashMap<>();
    private volatile BatchAccumulator<Delivery<T>> accumulator;
    private volatile DeadLetterPolicy policy;
    private volatile Cancellable poller;
    private volatile Cancellable heartbeat;

    protected StageConsumer(MessageBroker broker, JsonCodec json, QueueTopology topology, Class<T> type) {
        this.broker = broker;
        this.json = json;
        this.topology = topology;
        this.type = type;
    }

    /**
     * Current tunables; read once per {@link #start(CancellationToken)}.
     */
    protected abstract ConsumerSettings settings();

    /**
     * Business handling of one message. Success acks the message; failure goes to the
     * dead-letter policy.
     */
    protected abstract Uni<MessageOutcome> handle(Delivery<T> delivery);

    /**
     * Messages of one batch handled at the same time. Sequential by default.
     */
    protected int batchConcurrency() {
        return 1;
    }

    public String name() {
        return getClass().getSimpleName();
    }

    public QueueTopology topology() {
        return topology;
    }

    public void start(CancellationToken token) {
        if (!running.compareAndSet(false, true)) {
            LOG.warnf("%s already running; start() ignored.", name());
            return;
        }
        ConsumerSettings s = settings();
        accumulator = new BatchAccumulator<>(topology.queue(), s.batchSize(), s.batchTimeout(), this::processBatch);
        accumulator.start();
        poller = Multi.createBy().repeating()
                .uni(() -> pollOnce(s))
                .indefinitely()
                .subscribe().with(
                        v -> {
                        },
                        err -> LOG.errorf(err, "%s poller crashed", name()));
        heartbeat = Multi.createFrom().ticks().every(heartbeatInterval(s.lease()))
                .onOverflow().drop()
                .onItem().transformToUniAndConcatenate(tick -> renewLeases(s.lease()))
                .subscribe().with(
                        v -> {
                        },
                        err -> LOG.errorf(err, "%s lease heartbeat crashed", name()));
        token.onCancel(this::stop);
        LOG.infof("%s consuming %s (batch=%d, timeout=%dms, maxRetries=%d, prefetch=%d)",
                name(), topology.queue(), s.batchSize(), s.batchTimeout().toMillis(), s.maxRetries(), s.prefetch());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) return;
        Cancellable p = poller;
        if (p != null) p.cancel();
        BatchAccumulator<Delivery<T>> acc = accumulator;
        if (acc != null) acc.stop();
        Cancellable h = heartbeat;
        if (h != null) h.cancel();
        LOG.infof("%s stopped (%d unsettled message(s) left to lease expiry)", name(), unsettled.size());
    }

    public boolean isRunning() {
        return running.get();
    }

    Uni<Void> pollOnce(ConsumerSettings s) {
        int capacity = s.prefetch() - unsettled.size();
        if (!running.get() || capacity <= 0) {
            return idle(s.idle());
        }
        return broker.fetch(topology.queue(), capacity, s.lease())
                .onFailure().invoke(e -> LOG.errorf("%s fetch from %s failed: %s", name(), topology.queue(), e.getMessage()))
                .onFailure().recoverWithItem(List.of())
                .onItem().transformToUni(list -> {
                    if (list.isEmpty()) {
                        return idle(s.idle());
                    }
                    return Multi.createFrom().iterable(list)
                            .onItem().transformToUniAndConcatenate(this::onMessage)
                            .collect().asList()
                            .replaceWithVoid();
                });
    }

    /**
     * Parses and buffers one delivery. Malformed bodies are rejected without retry.
     */
    Uni<Void> onMessage(QueueMessage message) {
        T payload;
        try {
            payload = json.read(message.body(), type);
        } catch (MalformedPayloadException e) {
            return deadLetterPolicy().rejectMalformed(message, e)
                    .onFailure().invoke(err -> LOG.errorf(err, "%s could not reject malformed message %d",
                            name(), message.deliveryTag()))
                    .onFailure().recoverWithNull()
                    .replaceWithVoid();
        }
        unsettled.put(message.deliveryTag(), message);
        accumulator.offer(new Delivery<>(message, payload));
        return Uni.createFrom().voidItem();
    }

    public Uni<Void> processBatch(List<Delivery<T>> batch) {
        long started = System.nanoTime();
        LOG.infof("[%s] Processing batch of %d message(s)", name(), batch.size());
        return Multi.createFrom().iterable(batch)
                .onItem().transformToUni(this::settle).merge(Math.max(1, batchConcurrency()))
                .collect().asList()
                .invoke(outcomes -> {
                    Map<MessageOutcome, Integer> counts = new EnumMap<>(MessageOutcome.class);
                    outcomes.forEach(o -> counts.merge(o, 1, Integer::sum));
                    LOG.infof("[%s] Batch completed in %dms: %s", name(),
                            (System.nanoTime() - started) / 1_000_000, counts);
                })
                .replaceWithVoid();
    }

    private Uni<MessageOutcome> settle(Delivery<T> d) {
        return Uni.createFrom().<MessageOutcome>deferred(() -> handle(d))
                .onItem().transformToUni(outcome -> broker.ack(d.message()).replaceWith(outcome))
                .onFailure().recoverWithUni(err -> deadLetterPolicy().handleFailure(d.message(), err)
                        .onItem().transform(MessageOutcome::of))
                .onFailure().invoke(err -> LOG.errorf(err, "[%s] could not settle %s", name(),
                        d.payload().idempotencyKey()))
                .onFailure().recoverWithItem(MessageOutcome.UNSETTLED)
                .onTermination().invoke(() -> unsettled.remove(d.message().deliveryTag()));
    }

    /**
     * Extends the lease of every message fetched but not yet settled. A failed renewal is logged
     * and retried on the next tick.
     */
    Uni<Void> renewLeases(Duration lease) {
        List<QueueMessage> held = List.copyOf(unsettled.values());
        if (held.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        return broker.extendLease(held, lease)
                .invoke(extended -> LOG.debugf("%s renewed %d/%d lease(s)", name(), extended, held.size()))
                .onFailure().invoke(e -> LOG.warnf("%s lease renewal on %s failed: %s", name(), topology.queue(),
                        e.getMessage()))
                .onFailure().recoverWithNull()
                .replaceWithVoid();
    }

    static Duration heartbeatInterval(Duration lease) {
        Duration third = lease.dividedBy(3);
        return third.compareTo(MIN_HEARTBEAT) < 0 ? MIN_HEARTBEAT : third;
    }

    protected DeadLetterPolicy deadLetterPolicy() {
        DeadLetterPolicy p = policy;
        if (p == null) {
            synchronized (this) {
                if (policy == null) {
                    policy = new DeadLetterPolicy(broker, settings().maxRetries());
                }
                p = policy;
            }
        }
        return p;
    }

    private static Uni<Void> idle(Duration d) {
        return Uni.createFrom().voidItem().onItem().delayIt().by(d);
    }
}
