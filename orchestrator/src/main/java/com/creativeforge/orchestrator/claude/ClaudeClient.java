package com.creativeforge.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Single-turn only: the caption writer sends one user message with a system
 * prompt and reads back the first text block.
 */
@Component
public class ClaudeClient {

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /**
     * A single message in a conversation.
     * role must be "user" or "assistant".
     */
    public record Message(String role, String content) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record MessagesRequest(
            String model,
            @JsonProperty("max_tokens") int maxTokens,
            String system,
            List<Message> messages) {}

    /**
     * The subset of the API response we care about.
     * Unknown fields are skipped so new API fields never break parsing.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Extracts the text of the first text block. */
        public String firstText() {
            if (content == null) {
                throw new IllegalStateException("No content in response");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 512;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       baseUrl;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                        ObjectMapper objectMapper) {
        this.apiKey  = apiKey;
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send a conversation to Claude and return the assistant's text reply.
     *
     * @param model    e.g. "claude-sonnet-4-6"
     * @param messages the conversation so far
     * @param system   system prompt, or null
     * @throws ClaudeApiException     on a non-200 reply
     * @throws UncheckedIOException   on a transport failure
     * @throws IllegalStateException  if the reply carries no text
     */
    public String complete(String model, List<Message> messages, String system) {
        String requestBody;
        try {
            requestBody = json.writeValueAsString(new MessagesRequest(model, MAX_TOKENS, system, messages));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise Claude request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/messages"))
                .timeout(Duration.ofSeconds(60))
                .header("content-type",      "application/json")
                .header("x-api-key",         apiKey)
                .header("anthropic-version", API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UncheckedIOException("Claude API call failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UncheckedIOException("Claude API call interrupted", new IOException(e));
        }

        if (response.statusCode() != 200) {
            throw new ClaudeApiException(response.statusCode(), response.body());
        }

        try {
            return json.readValue(response.body(), MessagesResponse.class).firstText();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unparseable Claude response", e);
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends RuntimeException {
        private final int statusCode;
        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }
        public int statusCode() { return statusCode; }
    }
}
