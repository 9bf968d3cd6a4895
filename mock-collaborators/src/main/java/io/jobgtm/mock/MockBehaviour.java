package io.jobgtm.mock;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.unchecked.Unchecked;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestResponse;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Random latency and random failures shared by all mocked endpoints.
 */
@ApplicationScoped
public class MockBehaviour {

    private static final Logger LOG = Logger.getLogger(MockBehaviour.class);

    static final String DELAY_HEADER = "X-Mock-Delay";

    @ConfigProperty(name = "mock.max-delay-ms", defaultValue = "300")
    long maxDelayMs;

    @ConfigProperty(name = "mock.error-rate", defaultValue = "0.08")
    double errorRate;

    @ConfigProperty(name = "mock.client-error-share", defaultValue = "0.5")
    double clientErrShare;

    @SuppressWarnings("java:S2245")
    public <T> Uni<RestResponse<T>> respond(String endpoint, Supplier<T> body) {
        long delay = ThreadLocalRandom.current().nextLong(0, Math.max(1, maxDelayMs + 1));
        boolean shouldError = ThreadLocalRandom.current().nextDouble() < errorRate;

        return Uni.createFrom().voidItem()
                .onItem().delayIt().by(Duration.ofMillis(delay))
                .onItem().transform(Unchecked.function(v -> {
                    if (shouldError) {
                        boolean clientErr = ThreadLocalRandom.current().nextDouble() < clientErrShare;
                        int status = clientErr ? 400 : 503;
                        LOG.debugf("Injecting %d on %s after %dms", (Object) status, endpoint, delay);
                        throw new MockFailure(status, endpoint,
                                clientErr ? "Bad Request" : "Service Unavailable", delay);
                    }
                    return RestResponse.ResponseBuilder.ok(body.get())
                            .header(DELAY_HEADER, Long.toString(delay))
                            .build();
                }));
    }
}
