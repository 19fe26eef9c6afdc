package com.marketloop.reflection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketloop.config.ReasoningProperties;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for the advisory reasoning service (Messages API).
 *
 * <p>Advisory only: every failure, including a disabled client, a timeout or an
 * unparseable reply, comes back as {@link Optional#empty()} and is never thrown.
 */
@Component
public class ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(ReasoningClient.class);

    static final String MESSAGES_PATH = "/v1/messages";

    private final RestTemplate restTemplate;
    private final ReasoningProperties reasoningProperties;
    private final ObjectMapper objectMapper;

    public ReasoningClient(
            @Qualifier("reasoningRestTemplate") RestTemplate restTemplate,
            ReasoningProperties reasoningProperties,
            ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.reasoningProperties = reasoningProperties;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return reasoningProperties.isActive();
    }

    /** Sends one user prompt and returns the concatenated text of the reply. */
    public Optional<String> complete(String system, String prompt, int maxTokens) {
        if (!isEnabled()) {
            return Optional.empty();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-api-key", reasoningProperties.getApiKey());
        headers.set("anthropic-version", reasoningProperties.getApiVersion());

        Map<String, Object> body = Map.of(
                "model", reasoningProperties.getModel(),
                "max_tokens", Math.min(maxTokens, reasoningProperties.getMaxTokens()),
                "system", system,
                "messages", List.of(Map.of("role", "user", "content", prompt)));

        try {
            JsonNode response = restTemplate.postForObject(MESSAGES_PATH, new HttpEntity<>(body, headers), JsonNode.class);
            return extractText(response);
        } catch (RestClientException e) {
            log.warn("Reasoning service call failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Like {@link #complete} but parses the reply as JSON, tolerating markdown fences. */
    public Optional<JsonNode> completeJson(String system, String prompt, int maxTokens) {
        return complete(system, prompt, maxTokens).flatMap(this::parseJson);
    }

    /** One tiny request at startup. Logs the outcome; never throws. */
    public boolean probe() {
        if (!isEnabled()) {
            log.info("Reasoning service disabled: reflections and recommendations use deterministic fallbacks");
            return false;
        }
        boolean ok = complete("Reply with the single word OK.", "ping", 5).isPresent();
        if (ok) {
            log.info("Reasoning service reachable at {} (model {})", reasoningProperties.getBaseUrl(),
                    reasoningProperties.getModel());
        } else {
            log.warn("Reasoning service probe failed; advisory calls will fall back until it recovers");
        }
        return ok;
    }

    Optional<JsonNode> parseJson(String raw) {
        String cleaned = stripFences(raw);
        try {
            return Optional.ofNullable(objectMapper.readTree(cleaned));
        } catch (JsonProcessingException e) {
            log.warn("Reasoning reply is not valid JSON: {} (first 200 chars: {})", e.getOriginalMessage(),
                    cleaned.substring(0, Math.min(200, cleaned.length())));
            return Optional.empty();
        }
    }

    /** Removes a surrounding ``` or ```json fence, if any. */
    static String stripFences(String raw) {
        String text = raw.trim();
        if (!text.startsWith("```")) {
            return text;
        }
        String[] parts = text.split("```");
        String inner = parts.length > 1 ? parts[1] : text;
        if (inner.startsWith("json")) {
            inner = inner.substring(4);
        }
        return inner.trim();
    }

    private static Optional<String> extractText(JsonNode response) {
        if (response == null || !response.path("content").isArray()) {
            return Optional.empty();
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        return text.length() > 0 ? Optional.of(text.toString()) : Optional.empty();
    }
}
