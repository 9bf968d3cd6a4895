package io.jobgtm.client;

import io.jobgtm.model.Enrichment;
import io.jobgtm.model.SampleItems;
import io.jobgtm.support.JsonCodec;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OllamaEnrichmentClientTest {

    @Test
    void sendsPromptAndStampsMetadata() {
        FakeOllama api = new FakeOllama("{\"seniority_level\": {\"normalized\": \"Mid\"}}");
        OllamaEnrichmentClient client = client(api);

        Enrichment e = client.enrich(SampleItems.scraped(7L, "https://jobs.example.com/7")).await().indefinitely();

        assertEquals("Mid", e.seniorityLevel().normalized());
        assertEquals("llama3.2:3b", e.metadata().model());
        OllamaApiClient.GenerateReq sent = api.requests.get(0);
        assertFalse(sent.stream());
        assertEquals(0.3, sent.options().get("temperature"));
        assertEquals(2048, sent.options().get("num_predict"));
        assertTrue(sent.prompt().contains("Company: Acme"));
        assertTrue(sent.prompt().contains("Role: Backend Engineer"));
    }

    @Test
    void unreadableAnswerIsReturnedAsError() {
        Enrichment e = client(new FakeOllama("not json at all")).enrich(SampleItems.scraped(7L, "u"))
                .await().indefinitely();

        assertTrue(e.hasError());
        assertEquals("llama3.2:3b", e.metadata().model());
    }

    @Test
    void healthReflectsTagsCall() {
        assertTrue(client(new FakeOllama("{}")).healthy().await().indefinitely());

        FakeOllama down = new FakeOllama("{}");
        down.tagsFailure = new IllegalStateException("connection refused");
        assertFalse(client(down).healthy().await().indefinitely());
    }

    private static OllamaEnrichmentClient client(OllamaApiClient api) {
        OllamaEnrichmentClient client = new OllamaEnrichmentClient(api, new EnrichmentResponseParser(new JsonCodec()));
        client.model = "llama3.2:3b";
        client.temperature = 0.3;
        client.maxTokens = 2048;
        return client;
    }

    static final class FakeOllama implements OllamaApiClient {

        final List<GenerateReq> requests = new ArrayList<>();
        final String answer;
        RuntimeException tagsFailure;

        FakeOllama(String answer) {
            this.answer = answer;
        }

        @Override
        public Uni<GenerateResp> generate(GenerateReq req) {
            requests.add(req);
            return Uni.createFrom().item(new GenerateResp(req.model(), answer, true, 1_000L, 10, 20));
        }

        @Override
        public Uni<TagsResp> tags() {
            if (tagsFailure != null) return Uni.createFrom().failure(tagsFailure);
            return Uni.createFrom().item(new TagsResp(List.of()));
        }
    }
}
