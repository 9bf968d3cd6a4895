package io.jobgtm;

import io.jobgtm.client.EnrichmentClient;
import io.jobgtm.consumer.AiEnrichmentConsumer;
import io.jobgtm.consumer.GoldenStorageConsumer;
import io.jobgtm.consumer.RawIngestionConsumer;
import io.jobgtm.consumer.StageConsumer;
import io.jobgtm.queue.QueueTopologyManager;
import io.jobgtm.support.CancellationToken;
import io.jobgtm.workflow.ExecutionStore;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

@ApplicationScoped
public class MainStartup {

    private static final Logger LOG = Logger.getLogger(MainStartup.class);

    final QueueTopologyManager topology;
    final ExecutionStore executions;
    final EnrichmentClient enrichment;
    final RawIngestionConsumer rawIngestion;
    final AiEnrichmentConsumer aiEnrichment;
    final GoldenStorageConsumer goldenStorage;

    private final CancellationToken shutdown = new CancellationToken();

    public MainStartup(QueueTopologyManager topology, ExecutionStore executions, EnrichmentClient enrichment,
                       RawIngestionConsumer rawIngestion, AiEnrichmentConsumer aiEnrichment,
                       GoldenStorageConsumer goldenStorage) {
        this.topology = topology;
        this.executions = executions;
        this.enrichment = enrichment;
        this.rawIngestion = rawIngestion;
        this.aiEnrichment = aiEnrichment;
        this.goldenStorage = goldenStorage;
    }

    @ConfigProperty(name = "pipeline.startup.enabled", defaultValue = "true")
    boolean enabled;

    @ConfigProperty(name = "pipeline.consumers.raw-ingestion.enabled", defaultValue = "true")
    boolean rawIngestionEnabled;

    @ConfigProperty(name = "pipeline.consumers.ai-enrichment.enabled", defaultValue = "true")
    boolean aiEnrichmentEnabled;

    @ConfigProperty(name = "pipeline.consumers.golden-storage.enabled", defaultValue = "true")
    boolean goldenStorageEnabled;

    void onStart(@Observes StartupEvent ev) {
        if (!enabled) {
            LOG.info("Pipeline startup disabled; no topology setup, no consumers.");
            return;
        }
        LOG.info("Preparing broker topology and execution store...");
        topology.setup().await().indefinitely();
        executions.initialize()
                .chain(executions::markInterrupted)
                .invoke(n -> {
                    if (n > 0) LOG.warnf("Marked %d execution(s) left running by a previous process as interrupted", n);
                })
                .await().indefinitely();

        List<StageConsumer<?>> started = new ArrayList<>();
        if (rawIngestionEnabled) started.add(rawIngestion);
        if (aiEnrichmentEnabled) started.add(aiEnrichment);
        if (goldenStorageEnabled) started.add(goldenStorage);
        started.forEach(c -> c.start(shutdown));
        LOG.infof("Started %d consumer(s)", started.size());

        if (aiEnrichmentEnabled) {
            enrichment.healthy().subscribe().with(
                    ok -> {
                        if (ok) LOG.info("Ollama reachable");
                        else LOG.warn("Ollama not reachable; enrichment calls will fail until it is up");
                    },
                    err -> LOG.warnf("Ollama health check failed: %s", err.getMessage()));
        }
    }

    void onStop(@Observes ShutdownEvent ev) {
        LOG.info("Stopping consumers...");
        shutdown.cancel();
    }
}
