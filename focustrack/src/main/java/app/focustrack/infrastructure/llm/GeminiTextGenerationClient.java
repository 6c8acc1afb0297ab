package app.focustrack.infrastructure.llm;

import app.focustrack.service.decision.TextGenerationClient;
import app.focustrack.service.decision.TextGenerationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Google Gemini client for the Generative Language {@code generateContent} REST endpoint.
 */
public final class GeminiTextGenerationClient implements TextGenerationClient {
    private static final Logger log = LoggerFactory.getLogger(GeminiTextGenerationClient.class);

    public static final String NAME = "Gemini";
    private static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String apiKey;
    private final String model;
    private final String baseUrl;
    private final Duration requestTimeout;

    public GeminiTextGenerationClient(String apiKey, String model, Duration requestTimeout) {
        this(apiKey, model, requestTimeout, DEFAULT_BASE_URL, HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build());
    }

    GeminiTextGenerationClient(String apiKey, String model, Duration requestTimeout,
                               String baseUrl, HttpClient httpClient) {
        this.apiKey = apiKey;
        this.model = model;
        this.requestTimeout = requestTimeout;
        this.baseUrl = baseUrl;
        this.httpClient = httpClient;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String generate(String prompt) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/models/" + model + ":generateContent?key="
                + URLEncoder.encode(apiKey, StandardCharsets.UTF_8)))
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(requestBody(prompt), StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new TextGenerationException(NAME, -1, "request timed out after " + requestTimeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new TextGenerationException(NAME, -1, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TextGenerationException(NAME, -1, "interrupted", e);
        }

        if (response.statusCode() != 200) {
            log.error("[GEMINI] HTTP {} from generateContent", response.statusCode());
            throw new TextGenerationException(NAME, response.statusCode(), errorMessage(response.body()));
        }

        return extractText(response.body());
    }

    String requestBody(String prompt) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("contents")
            .addObject()
            .putArray("parts")
            .addObject()
            .put("text", prompt);
        return body.toString();
    }

    String extractText(String responseBody) {
        JsonNode json;
        try {
            json = objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new TextGenerationException(NAME, 200, "unparseable response: " + e.getMessage(), e);
        }

        JsonNode parts = json.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            String blockReason = json.path("promptFeedback").path("blockReason").asText("");
            throw new TextGenerationException(NAME, 200,
                blockReason.isEmpty() ? "response has no candidates" : "prompt blocked: " + blockReason);
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }

    private String errorMessage(String body) {
        try {
            JsonNode json = objectMapper.readTree(body);
            String message = json.path("error").path("message").asText("");
            if (!message.isEmpty()) {
                return message;
            }
        } catch (IOException e) {
            log.debug("[GEMINI] Error body is not JSON");
        }
        return body == null || body.length() <= 200 ? String.valueOf(body) : body.substring(0, 200);
    }
}
