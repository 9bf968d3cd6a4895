package io.jobgtm.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobgtm.model.Enrichment;
import io.jobgtm.support.JsonCodec;
import io.jobgtm.support.MalformedPayloadException;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Reads the model's text answer into an {@link Enrichment}. Code fences and chatter around the
 * JSON object are tolerated; anything else yields {@link Enrichment#failed(String, String)}.
 */
@ApplicationScoped
public class EnrichmentResponseParser {

    private static final Logger LOG = Logger.getLogger(EnrichmentResponseParser.class);

    static final List<String> EXPECTED_SECTIONS = List.of(
            "currency_normalization", "seniority_level", "work_arrangement", "scam_detection",
            "skills_extraction", "tech_stack", "location_normalization", "company_insights",
            "benefits", "role_classification");

    final JsonCodec json;

    public EnrichmentResponseParser(JsonCodec json) {
        this.json = json;
    }

    public Enrichment parse(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return Enrichment.failed("Empty response from model", null);
        }
        String text = stripFences(responseText.strip());
        JsonNode tree;
        try {
            tree = json.tree(text);
        } catch (MalformedPayloadException e) {
            LOG.errorf("Failed to parse model response: %s", e.getMessage());
            return Enrichment.failed("Failed to parse model response", head(text));
        }
        if (tree == null || !tree.isObject()) {
            return Enrichment.failed("Model response is not a JSON object", head(text));
        }
        List<String> missing = EXPECTED_SECTIONS.stream().filter(k -> !tree.has(k)).toList();
        if (!missing.isEmpty()) {
            LOG.warnf("Model response missing keys: %s", missing);
        }
        try {
            return json.convert(tree, Enrichment.class);
        } catch (MalformedPayloadException e) {
            LOG.errorf("Model response has unexpected shape: %s", e.getMessage());
            return Enrichment.failed("Failed to parse model response", head(text));
        }
    }

    static String stripFences(String text) {
        String t = text;
        if (t.startsWith("```")) {
            int firstNewline = t.indexOf('\n');
            t = firstNewline < 0 ? "" : t.substring(firstNewline + 1);
            String trimmed = t.stripTrailing();
            if (trimmed.endsWith("```")) {
                t = trimmed.substring(0, trimmed.length() - 3);
            }
            t = t.strip();
        }
        if (!t.startsWith("{")) {
            int open = t.indexOf('{');
            int close = t.lastIndexOf('}');
            if (open >= 0 && close > open) {
                t = t.substring(open, close + 1);
            }
        }
        return t;
    }

    private static String head(String text) {
        return text.length() > 500 ? text.substring(0, 500) : text;
    }
}
