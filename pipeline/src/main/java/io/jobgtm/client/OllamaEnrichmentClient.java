package io.jobgtm.client;

import io.jobgtm.model.Enrichment;
import io.jobgtm.model.ScrapedItem;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

@ApplicationScoped
public class OllamaEnrichmentClient implements EnrichmentClient {

    private static final Logger LOG = Logger.getLogger(OllamaEnrichmentClient.class);

    final OllamaApiClient api;
    final EnrichmentResponseParser parser;

    public OllamaEnrichmentClient(@RestClient OllamaApiClient api, EnrichmentResponseParser parser) {
        this.api = api;
        this.parser = parser;
    }

    @ConfigProperty(name = "pipeline.enrichment.model", defaultValue = "llama3.2:3b")
    String model;

    @ConfigProperty(name = "pipeline.enrichment.temperature", defaultValue = "0.3")
    double temperature;

    @ConfigProperty(name = "pipeline.enrichment.max-tokens", defaultValue = "2048")
    int maxTokens;

    @Override
    public Uni<Enrichment> enrich(ScrapedItem item) {
        long started = System.nanoTime();
        String prompt = EnrichmentPrompt.build(item);
        LOG.debugf("Built prompt for %s, length: %d chars", item.idempotencyKey(), prompt.length());
        OllamaApiClient.GenerateReq req = new OllamaApiClient.GenerateReq(model, prompt, false,
                Map.of("temperature", temperature, "num_predict", maxTokens));
        return api.generate(req)
                .onItem().transform(resp -> {
                    Enrichment parsed = parser.parse(resp == null ? null : resp.response());
                    long durationMs = (System.nanoTime() - started) / 1_000_000;
                    if (parsed.hasError()) {
                        LOG.warnf("Enrichment returned error for %s: %s", item.idempotencyKey(), parsed.error());
                    } else {
                        LOG.infof("Enriched %s in %dms", item.idempotencyKey(), durationMs);
                    }
                    return parsed.withMetadata(new Enrichment.Metadata(durationMs, model,
                            OffsetDateTime.now(ZoneOffset.UTC).toString()));
                });
    }

    @Override
    public Uni<Boolean> healthy() {
        return api.tags()
                .replaceWith(Boolean.TRUE)
                .onFailure().invoke(e -> LOG.errorf("Ollama health check failed: %s", e.getMessage()))
                .onFailure().recoverWithItem(Boolean.FALSE);
    }
}
