package io.jobgtm.support;

import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shutdown signal handed to long-running loops. Cancelling runs the registered callbacks once,
 * in registration order; callbacks registered after cancellation run immediately.
 */
public final class CancellationToken {

    private static final Logger LOG = Logger.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runQuietly(callback);
        }
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        for (Runnable r : callbacks) {
            if (callbacks.remove(r)) runQuietly(r);
        }
    }

    private void runQuietly(Runnable r) {
        try {
            r.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation callback failed", e);
        }
    }
}
