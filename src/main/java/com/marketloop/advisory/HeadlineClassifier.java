package com.marketloop.advisory;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketloop.domain.enums.Side;
import com.marketloop.reflection.ReasoningClient;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Asks the reasoning service whether a headline moves any market category and in
 * which direction.
 *
 * <p>The reply is validated field by field. A missing reply, a missing field or a
 * field of the wrong type yields no classification, so a malformed answer can never
 * become a signal.
 */
@Component
public class HeadlineClassifier {

    private static final Logger log = LoggerFactory.getLogger(HeadlineClassifier.class);

    static final String SYSTEM_PROMPT = "You are a prediction market trading assistant. "
            + "Classify news headlines for their impact on prediction markets. Return JSON only.";

    static final int MAX_TOKENS = 300;
    static final int MAX_SUMMARY_CHARS = 500;

    private final ReasoningClient reasoningClient;

    public HeadlineClassifier(ReasoningClient reasoningClient) {
        this.reasoningClient = reasoningClient;
    }

    public boolean isEnabled() {
        return reasoningClient.isEnabled();
    }

    public Optional<HeadlineClassification> classify(Headline headline) {
        Optional<JsonNode> reply = reasoningClient.completeJson(SYSTEM_PROMPT, buildPrompt(headline), MAX_TOKENS);
        if (reply.isEmpty()) {
            log.debug("No classification for '{}'", headline.getTitle());
            return Optional.empty();
        }
        return parse(headline, reply.get());
    }

    String buildPrompt(Headline headline) {
        String summary = headline.getSummary() != null ? headline.getSummary() : "";
        if (summary.length() > MAX_SUMMARY_CHARS) {
            summary = summary.substring(0, MAX_SUMMARY_CHARS);
        }
        return String.format(
                "Headline: %s%nSummary: %s%n%n"
                        + "Return JSON: {\"relevant\": bool, "
                        + "\"affected_categories\": [\"market categories such as politics, economics, crypto, sports\"], "
                        + "\"direction\": \"yes_up\" or \"no_up\" or \"neutral\", "
                        + "\"confidence\": 0.0-1.0, "
                        + "\"reasoning\": \"one sentence\"}",
                headline.getTitle(), summary);
    }

    Optional<HeadlineClassification> parse(Headline headline, JsonNode reply) {
        if (!reply.isObject()) {
            return reject(headline, "reply is not an object");
        }
        JsonNode relevant = reply.get("relevant");
        if (relevant == null || !relevant.isBoolean()) {
            return reject(headline, "relevant is not a boolean");
        }

        JsonNode categories = reply.get("affected_categories");
        if (categories == null || !categories.isArray()) {
            return reject(headline, "affected_categories is not a list");
        }
        List<String> affected = new ArrayList<>();
        for (JsonNode category : categories) {
            if (!category.isTextual()) {
                return reject(headline, "affected_categories holds a non-text entry");
            }
            String name = category.asText().trim().toLowerCase(Locale.ROOT);
            if (!name.isEmpty()) {
                affected.add(name);
            }
        }

        JsonNode directionNode = reply.get("direction");
        if (directionNode == null || !directionNode.isTextual()) {
            return reject(headline, "direction is not text");
        }
        Side direction;
        switch (directionNode.asText()) {
            case "yes_up":
                direction = Side.YES;
                break;
            case "no_up":
                direction = Side.NO;
                break;
            case "neutral":
                direction = null;
                break;
            default:
                return reject(headline, "unknown direction " + directionNode.asText());
        }

        JsonNode confidenceNode = reply.get("confidence");
        if (confidenceNode == null || !confidenceNode.isNumber()) {
            return reject(headline, "confidence is not a number");
        }
        BigDecimal confidence = confidenceNode.decimalValue();
        if (confidence.signum() < 0 || confidence.compareTo(BigDecimal.ONE) > 0) {
            return reject(headline, "confidence " + confidence + " outside [0,1]");
        }

        return Optional.of(HeadlineClassification.builder()
                .headline(headline)
                .relevant(relevant.booleanValue())
                .affectedCategories(List.copyOf(affected))
                .direction(direction)
                .confidence(confidence)
                .reasoning(reply.path("reasoning").asText(""))
                .build());
    }

    private static Optional<HeadlineClassification> reject(Headline headline, String problem) {
        log.warn("Discarding classification for '{}': {}", headline.getTitle(), problem);
        return Optional.empty();
    }
}
