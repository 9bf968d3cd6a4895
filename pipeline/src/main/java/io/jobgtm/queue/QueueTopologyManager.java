package io.jobgtm.queue;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;

/**
 * Declares every pipeline queue with its dead-letter pair before any consumer starts.
 *
 * <p>The broker may come up after this service; setup retries with exponential backoff and
 * fails startup only when the attempts are used up.</p>
 */
@ApplicationScoped
public class QueueTopologyManager {

    private static final Logger LOG = Logger.getLogger(QueueTopologyManager.class);

    final MessageBroker broker;

    public QueueTopologyManager(MessageBroker broker) {
        this.broker = broker;
    }

    @ConfigProperty(name = "pipeline.broker.connect-attempts", defaultValue = "30")
    int connectAttempts;

    @ConfigProperty(name = "pipeline.broker.connect-initial-backoff", defaultValue = "PT1S")
    Duration initialBackoff;

    @ConfigProperty(name = "pipeline.broker.connect-max-backoff", defaultValue = "PT30S")
    Duration maxBackoff;

    public Uni<Void> setup() {
        return setup(QueueTopology.PIPELINE);
    }

    public Uni<Void> setup(List<QueueTopology> topologies) {
        return broker.initialize()
                .chain(() -> Multi.createFrom().iterable(topologies)
                        .onItem().transformToUniAndConcatenate(broker::declare)
                        .collect().last())
                .onFailure().invoke(e -> LOG.warnf("Queue setup failed, retrying: %s", e.getMessage()))
                .onFailure().retry().withBackOff(initialBackoff, maxBackoff).atMost(connectAttempts)
                .invoke(() -> LOG.infof("Queue topology ready: %d queue(s) with dead-letter routing", topologies.size()))
                .replaceWithVoid();
    }
}
