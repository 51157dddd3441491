package com.agentledger.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static JSON parsing for the agent's own artifacts (diary lines, prompt-log blocks).
 *
 * <p>The agent is a Python process: keys are snake_case, unknown keys are common as
 * the agent evolves, and {@code json.dumps} emits {@code NaN}/{@code Infinity} for
 * missing indicators. The shared mapper is configured for all three.
 *
 * <p>Exchange payloads do not go through here; they are camelCase and bound by the
 * Spring-managed mapper behind {@code RestClient}.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    private JsonHelper() {}

    /**
     * Parses one JSON document, returning empty instead of throwing when the text is
     * blank or not valid for {@code type}. Callers count the miss.
     */
    public static <T> Optional<T> tryParse(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(OBJECT_MAPPER.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.debug("Skipping unparseable {} JSON: {}", type.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
