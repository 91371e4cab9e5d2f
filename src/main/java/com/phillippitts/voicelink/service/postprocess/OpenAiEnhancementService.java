package com.phillippitts.voicelink.service.postprocess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.voicelink.config.properties.EnhancementProperties;
import com.phillippitts.voicelink.exception.EnhancementException;
import com.phillippitts.voicelink.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Enhancement through an OpenAI-compatible {@code /v1/chat/completions} endpoint.
 */
@Component
public final class OpenAiEnhancementService implements EnhancementService {

    private static final Logger LOG = LogManager.getLogger(OpenAiEnhancementService.class);
    private static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private final EnhancementProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public OpenAiEnhancementService(EnhancementProperties properties, ObjectMapper objectMapper) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.timeoutSeconds()))
                .build();
    }

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    @Override
    public String enhance(String text) {
        if (!isConfigured()) {
            throw new EnhancementException("Enhancement is not configured");
        }
        if (text == null || text.isBlank()) {
            return text == null ? "" : text;
        }
        long start = System.nanoTime();
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(stripSlash(properties.baseUrl()) + COMPLETIONS_PATH))
                    .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody(text)));
            if (!properties.apiKey().isBlank()) {
                builder.header("Authorization", "Bearer " + properties.apiKey());
            }
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new EnhancementException("Enhancement API returned status " + response.statusCode());
            }
            String enhanced = extractContent(response.body());
            LOG.debug("Enhanced transcript in {} ms (chars {} -> {})",
                    TimeUtils.elapsedMillis(start), text.length(), enhanced.length());
            return enhanced;
        } catch (IOException e) {
            throw new EnhancementException("Enhancement request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EnhancementException("Enhancement interrupted", e);
        }
    }

    String requestBody(String text) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", properties.model());
        root.put("temperature", 0.3);
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", properties.prompt());
        messages.addObject().put("role", "user").put("content", text);
        return objectMapper.writeValueAsString(root);
    }

    String extractContent(String body) throws IOException {
        JsonNode content = objectMapper.readTree(body).path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new EnhancementException("Enhancement response contained no text");
        }
        return content.asText().trim();
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
