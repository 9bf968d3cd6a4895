package io.jobgtm.batch;

import io.smallrye.mutiny.TimeoutException;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Groups items offered from any thread into batches flushed either when {@code maxBatchSize}
 * items are buffered or when {@code batchTimeout} elapses with a partial batch.
 *
 * <p>A single loop thread hands each batch to the {@link BatchProcessor} and waits for it to
 * finish, so at most one batch is in flight per accumulator. Items offered meanwhile keep
 * buffering. {@link #stop()} ends the loop and flushes what is left.</p>
 */
public final class BatchAccumulator<T> {

    private static final Logger LOG = Logger.getLogger(BatchAccumulator.class);

    private final String name;
    private final int maxBatchSize;
    private final Duration batchTimeout;
    private final BatchProcessor<T> processor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition ready = lock.newCondition();
    private List<T> buffer = new ArrayList<>();
    private boolean full;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong batches = new AtomicLong();
    private ExecutorService loop;

    Duration shutdownGrace = Duration.ofSeconds(30);

    public BatchAccumulator(String name, int maxBatchSize, Duration batchTimeout, BatchProcessor<T> processor) {
        if (maxBatchSize < 1) throw new IllegalArgumentException("maxBatchSize must be >= 1");
        if (batchTimeout == null || batchTimeout.isNegative() || batchTimeout.isZero()) {
            throw new IllegalArgumentException("batchTimeout must be positive");
        }
        this.name = name;
        this.maxBatchSize = maxBatchSize;
        this.batchTimeout = batchTimeout;
        this.processor = Objects.requireNonNull(processor, "processor");
    }

    public void offer(T item) {
        Objects.requireNonNull(item, "item");
        lock.lock();
        try {
            buffer.add(item);
            if (buffer.size() >= maxBatchSize) {
                full = true;
                ready.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            LOG.warnf("[%s] accumulator already running; start() ignored.", name);
            return;
        }
        loop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "batch-" + name);
            t.setDaemon(true);
            return t;
        });
        loop.execute(this::runLoop);
        LOG.infof("[%s] accumulator started (maxBatchSize=%d, timeout=%dms)", name, maxBatchSize, batchTimeout.toMillis());
    }

    /**
     * Stops the loop, waits for the in-flight batch, then processes the remaining items on the
     * calling thread. Each wait is bounded by the shutdown grace period; items of a final batch
     * that does not finish in time are left unsettled.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) return;
        lock.lock();
        try {
            ready.signalAll();
        } finally {
            lock.unlock();
        }
        loop.shutdown();
        try {
            if (!loop.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warnf("[%s] batch still running after %dms, interrupting", name, shutdownGrace.toMillis());
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loop.shutdownNow();
        }

        List<T> rest;
        lock.lock();
        try {
            rest = buffer;
            buffer = new ArrayList<>();
            full = false;
        } finally {
            lock.unlock();
        }
        if (!rest.isEmpty()) {
            LOG.infof("[%s] flushing %d buffered item(s) on stop", name, rest.size());
            for (int from = 0; from < rest.size(); from += maxBatchSize) {
                flush(rest.subList(from, Math.min(rest.size(), from + maxBatchSize)));
            }
        }
        LOG.infof("[%s] accumulator stopped after %d batch(es)", name, batches.get());
    }

    public int pending() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public long batchesProcessed() {
        return batches.get();
    }

    private void runLoop() {
        while (running.get()) {
            List<T> batch;
            try {
                batch = awaitBatch();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (!batch.isEmpty()) {
                process(batch);
            }
        }
    }

    private List<T> awaitBatch() throws InterruptedException {
        lock.lock();
        try {
            long remaining = batchTimeout.toNanos();
            while (!full && running.get() && remaining > 0) {
                remaining = ready.awaitNanos(remaining);
            }
            if (!running.get()) {
                // left for the final flush in stop()
                return List.of();
            }
            return drain();
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private List<T> drain() {
        if (buffer.isEmpty()) {
            full = false;
            return List.of();
        }
        List<T> batch;
        if (buffer.size() <= maxBatchSize) {
            batch = buffer;
            buffer = new ArrayList<>();
        } else {
            batch = new ArrayList<>(buffer.subList(0, maxBatchSize));
            buffer = new ArrayList<>(buffer.subList(maxBatchSize, buffer.size()));
        }
        full = buffer.size() >= maxBatchSize;
        return batch;
    }

    private void flush(List<T> batch) {
        try {
            processor.process(batch).await().atMost(shutdownGrace);
            batches.incrementAndGet();
        } catch (TimeoutException e) {
            LOG.warnf("[%s] final batch of %d item(s) did not finish within %dms", name, batch.size(),
                    shutdownGrace.toMillis());
        } catch (RuntimeException e) {
            LOG.errorf(e, "[%s] final batch of %d item(s) failed", name, batch.size());
        }
    }

    private void process(List<T> batch) {
        try {
            processor.process(batch).await().indefinitely();
            batches.incrementAndGet();
        } catch (RuntimeException e) {
            LOG.errorf(e, "[%s] batch of %d item(s) failed", name, batch.size());
        }
    }
}
