package app.focustrack.service.decision;

import app.focustrack.domain.decision.DecisionVerdict;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Parses a model reply into a verdict. Accepts a JSON object anywhere in the
 * text; otherwise infers the decision from keywords.
 */
public final class VerdictParser {
    private static final Logger log = LoggerFactory.getLogger(VerdictParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final double KEYWORD_FOUND_CONFIDENCE = 0.7;
    static final double KEYWORD_MISSING_CONFIDENCE = 0.3;
    static final String TEXT_REASONING = "Parsed from plain text response";

    public DecisionVerdict parse(String text) {
        String reply = text == null ? "" : text.trim();

        int open = reply.indexOf('{');
        int close = reply.lastIndexOf('}');
        if (open >= 0 && close > open) {
            try {
                JsonNode json = MAPPER.readTree(reply.substring(open, close + 1));
                if (json != null && json.isObject()) {
                    return fromJson(json, reply);
                }
            } catch (JsonProcessingException e) {
                log.warn("[DECISION] Model reply is not valid JSON, using keyword heuristic: {}", e.getOriginalMessage());
            }
        }

        return fromText(reply);
    }

    private DecisionVerdict fromJson(JsonNode json, String reply) {
        String message = json.path("message").asText("");
        String reasoning = json.path("reasoning").asText("");
        return DecisionVerdict.focus(
            json.path("should_notify").asBoolean(false),
            message.isBlank() ? reply : message,
            json.path("confidence").asDouble(0.5),
            reasoning.isBlank() ? "No reasoning provided" : reasoning);
    }

    private DecisionVerdict fromText(String reply) {
        String lower = reply.toLowerCase(Locale.ROOT);
        boolean notify = lower.contains("yes") || lower.contains("notify");
        return DecisionVerdict.focus(
            notify,
            reply,
            notify ? KEYWORD_FOUND_CONFIDENCE : KEYWORD_MISSING_CONFIDENCE,
            TEXT_REASONING);
    }
}
