package io.jobgtm.mock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.resteasy.reactive.RestResponse;

import java.io.UncheckedIOException;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Stands in for the Ollama API. {@code /api/generate} answers with a canned enrichment
 * document; a share of answers is wrapped in a markdown fence or is not JSON at all, like a
 * small model occasionally does.
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class MockOllamaResource {

    @Inject
    MockBehaviour behaviour;

    @Inject
    ObjectMapper mapper;

    @ConfigProperty(name = "mock.ollama.garbage-rate", defaultValue = "0.05")
    double garbageRate;

    @ConfigProperty(name = "mock.ollama.fence-rate", defaultValue = "0.2")
    double fenceRate;

    public record GenerateRequest(String model, String prompt, Boolean stream, Map<String, Object> options) {
    }

    public record GenerateResponse(String model, String created_at, String response, boolean done,
                                   long total_duration, int prompt_eval_count, int eval_count) {
    }

    public record TagsResponse(List<Map<String, Object>> models) {
    }

    @POST
    @Path("/generate")
    @SuppressWarnings("java:S2245")
    public Uni<RestResponse<GenerateResponse>> generate(GenerateRequest req) {
        String model = req == null || req.model() == null ? "llama3.2:3b" : req.model();
        int promptLength = req == null || req.prompt() == null ? 0 : req.prompt().length();
        double roll = ThreadLocalRandom.current().nextDouble();
        return behaviour.respond("generate", () -> {
            String text;
            if (roll < garbageRate) {
                text = "I am sorry, I cannot analyse this listing.";
            } else if (roll < garbageRate + fenceRate) {
                text = "```json\n" + enrichmentJson() + "\n```";
            } else {
                text = enrichmentJson();
            }
            return new GenerateResponse(model, OffsetDateTime.now().toString(), text, true,
                    1_500_000_000L, promptLength / 4, text.length() / 4);
        });
    }

    @GET
    @Path("/tags")
    public Uni<RestResponse<TagsResponse>> tags() {
        return behaviour.respond("tags", () -> new TagsResponse(List.of(
                Map.of("name", "llama3.2:3b", "size", 2_019_393_189L))));
    }

    private String enrichmentJson() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("currency_normalization", Map.of("detected_currency", "USD", "min_salary_usd", 120000,
                "max_salary_usd", 160000, "conversion_rate", 1.0, "confidence", 0.9));
        doc.put("seniority_level", Map.of("normalized", "Senior", "confidence", 0.8,
                "reasoning", "5+ years required"));
        doc.put("work_arrangement", Map.of("normalized", "Hybrid", "confidence", 0.7,
                "details", "Two office days"));
        doc.put("scam_detection", Map.of("score", 5, "indicators", List.of(), "is_likely_scam", false));
        doc.put("skills_extraction", Map.of("skills", List.of(
                Map.of("skill", "Java", "normalized", "Java", "category", "Backend", "experience", "5+ years"),
                Map.of("skill", "Postgres", "normalized", "PostgreSQL", "category", "Database"))));
        doc.put("tech_stack", Map.of("technologies", List.of("Java", "PostgreSQL"),
                "frameworks", List.of("Quarkus"), "tools", List.of("Docker", "Kubernetes")));
        doc.put("location_normalization", Map.of("city", "New York", "state", "NY", "country", "USA",
                "timezone", "America/New_York", "is_remote", false));
        doc.put("company_insights", Map.of("industry", "Software", "company_size", "201-500",
                "notable_info", "Series C"));
        doc.put("benefits", Map.of("has_stock_options", true, "stock_details", "RSUs",
                "other_benefits", List.of("Health insurance")));
        doc.put("role_classification", Map.of("primary_role", "Software Engineer",
                "role_category", "Engineering", "is_management", false));
        try {
            return mapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
