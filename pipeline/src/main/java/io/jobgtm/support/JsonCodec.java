package io.jobgtm.support;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;

/**
 * Shared Jackson setup for message bodies, execution records and collaborator payloads.
 */
@ApplicationScoped
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {
    };

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL);

    public String write(Object value) {
        try {
            return om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("serialize failed for " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * @throws MalformedPayloadException if {@code json} is blank or does not bind to {@code type}
     */
    public <T> T read(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            throw new MalformedPayloadException("empty payload for " + type.getSimpleName(), null);
        }
        try {
            T value = om.readValue(json, type);
            if (value == null) {
                throw new MalformedPayloadException("null payload for " + type.getSimpleName(), null);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("invalid " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    public <T> T convert(Object value, Class<T> type) {
        try {
            return om.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("cannot convert to " + type.getSimpleName(), e);
        }
    }

    public Map<String, Object> toMap(Object value) {
        return om.convertValue(value, MAP);
    }

    public JsonNode tree(String json) {
        try {
            return om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("invalid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
