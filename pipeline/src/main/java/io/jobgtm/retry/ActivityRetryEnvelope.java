package io.jobgtm.retry;

import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs an external call (DB query, HTTP call, queue publish) under a {@link RetryPolicy}.
 *
 * <p>Each attempt subscribes a fresh {@link Uni} from the supplier. An attempt that does not
 * produce an item within {@link RetryPolicy#timeout()} fails with
 * {@link ActivityTimeoutException} and consumes one attempt. {@link NonRetryableException}s are
 * surfaced immediately. When attempts run out the caller gets an {@link ActivityFailedException}
 * wrapping the last cause.</p>
 */
@ApplicationScoped
public class ActivityRetryEnvelope {

    private static final Logger LOG = Logger.getLogger(ActivityRetryEnvelope.class);

    public <T> Uni<T> run(String activity, RetryPolicy policy, Supplier<Uni<T>> call) {
        return attempt(activity, policy, call, 1);
    }

    private <T> Uni<T> attempt(String activity, RetryPolicy policy, Supplier<Uni<T>> call, int n) {
        Uni<T> once = Uni.createFrom().<T>deferred(() -> call.get());
        if (isPositive(policy.timeout())) {
            once = once.ifNoItem().after(policy.timeout())
                    .failWith(() -> new ActivityTimeoutException(activity, policy.timeout()));
        }
        return once.onFailure().recoverWithUni(err -> {
            if (err instanceof NonRetryableException) {
                return Uni.createFrom().failure(err);
            }
            if (n >= policy.maxAttempts()) {
                LOG.warnf("Activity %s exhausted %d attempt(s): %s", activity, n, err.getMessage());
                return Uni.createFrom().failure(new ActivityFailedException(activity, n, err));
            }
            Duration wait = policy.backoffBefore(n + 1);
            LOG.debugf("Activity %s attempt %d/%d failed (%s), retrying in %dms",
                    activity, n, policy.maxAttempts(), err.getMessage(), wait.toMillis());
            Uni<Void> pause = isPositive(wait)
                    ? Uni.createFrom().voidItem().onItem().delayIt().by(wait)
                    : Uni.createFrom().voidItem();
            return pause.chain(() -> attempt(activity, policy, call, n + 1));
        });
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }
}
