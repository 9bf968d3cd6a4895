package io.jobgtm.consumer;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.UniEmitter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Counting semaphore for {@link Uni} pipelines: waiting for a permit never blocks a thread.
 *
 * <p>A waiter is settled exactly once, either by a grant or by its subscriber cancelling. A
 * permit granted to a waiter that was cancelled before the grant reached it is released again.</p>
 */
public final class AsyncSemaphore {

    private static final class Waiter {
        final AtomicBoolean settled = new AtomicBoolean();
        volatile UniEmitter<? super Void> emitter;
    }

    private final int permits;
    private int available;
    private final Deque<Waiter> waiters = new ArrayDeque<>();

    public AsyncSemaphore(int permits) {
        if (permits < 1) throw new IllegalArgumentException("permits must be >= 1");
        this.permits = permits;
        this.available = permits;
    }

    /**
     * Runs {@code work} once a permit is free and releases the permit when it terminates.
     */
    public <T> Uni<T> withPermit(Supplier<Uni<T>> work) {
        return acquire().onItem().transformToUni(v ->
                Uni.createFrom().<T>deferred(() -> work.get())
                        .onTermination().invoke(this::release));
    }

    public synchronized int inUse() {
        return permits - available;
    }

    synchronized int waiting() {
        return waiters.size();
    }

    private Uni<Void> acquire() {
        return Uni.createFrom().deferred(() -> {
            Waiter w = new Waiter();
            return Uni.createFrom().<Void>emitter(em -> {
                        w.emitter = em;
                        boolean granted;
                        synchronized (this) {
                            if (available > 0) {
                                available--;
                                granted = true;
                            } else {
                                waiters.addLast(w);
                                granted = false;
                            }
                        }
                        if (granted && w.settled.compareAndSet(false, true)) {
                            em.complete(null);
                        } else if (granted) {
                            release();
                        }
                    })
                    .onCancellation().invoke(() -> abandon(w));
        });
    }

    private void abandon(Waiter w) {
        if (w.settled.compareAndSet(false, true)) {
            synchronized (this) {
                waiters.remove(w);
            }
        } else {
            // granted, but the subscriber was gone before the grant reached it
            release();
        }
    }

    private void release() {
        Waiter next;
        synchronized (this) {
            do {
                next = waiters.pollFirst();
            } while (next != null && !next.settled.compareAndSet(false, true));
            if (next == null) {
                available++;
                return;
            }
        }
        next.emitter.complete(null);
    }
}
