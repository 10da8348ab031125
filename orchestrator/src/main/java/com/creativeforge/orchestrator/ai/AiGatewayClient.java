package com.creativeforge.orchestrator.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the managed AI gateway (vision, image generation, moderation).
 *
 * Uses java.net.http.HttpClient so every header and byte on the wire is
 * explicit. Blocking I/O is fine here: stage executors call it from the
 * bounded call pool, never from a request thread.
 *
 * Error classification:
 *   408 / 429 / 5xx, I/O errors, unparseable or empty bodies → TRANSIENT
 *   any other non-2xx                               → PERMANENT
 */
@Component
public class AiGatewayClient implements ImageAnalysisCapability,
                                        BackgroundGenerationCapability,
                                        ContentSafetyCapability {

    private static final Logger log = LoggerFactory.getLogger(AiGatewayClient.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BackgroundsResponse(@JsonProperty("asset_refs") List<String> assetRefs) {}

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;

    public AiGatewayClient(
            @Value("${creativeforge.ai-gateway.base-url}") String baseUrl,
            @Value("${creativeforge.ai-gateway.request-timeout:120s}") Duration requestTimeout,
            ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Capabilities
    // ------------------------------------------------------------------

    @Override
    public AnalysisReport analyze(String sourceAssetRef) {
        log.debug("Analysing asset '{}'", sourceAssetRef);
        String body = toJson(Map.of("asset_ref", sourceAssetRef));
        return read(post("/v1/vision/analyze", body, "analyze"), AnalysisReport.class, "analyze");
    }

    @Override
    public List<String> generate(String prompt, int count) {
        log.debug("Requesting {} background variations", count);
        String body = toJson(Map.of("prompt", prompt, "count", count));
        BackgroundsResponse resp = read(post("/v1/images/backgrounds", body, "generateBackgrounds"),
                BackgroundsResponse.class, "generateBackgrounds");
        return resp.assetRefs() == null ? List.of() : resp.assetRefs();
    }

    @Override
    public SafetyAssessment moderateImages(List<String> assetRefs) {
        String body = toJson(Map.of("kind", "image", "asset_refs", assetRefs));
        return read(post("/v1/moderation", body, "moderateImages"), SafetyAssessment.class, "moderateImages");
    }

    @Override
    public SafetyAssessment moderateText(String text, String languageCode) {
        String body = toJson(Map.of("kind", "text", "text", text, "language", languageCode));
        return read(post("/v1/moderation", body, "moderateText"), SafetyAssessment.class, "moderateText");
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** POST a JSON body; returns the response body of a 2xx reply. */
    private String post(String path, String jsonBody, String opName) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw CapabilityException.transientFailure(opName + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CapabilityException.transientFailure(opName + " interrupted", e);
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw CapabilityException.forStatus(resp.statusCode(),
                    opName + " failed - HTTP " + resp.statusCode() + ": " + resp.body());
        }
        return resp.body();
    }

    private <T> T read(String body, Class<T> type, String opName) {
        T value;
        try {
            value = json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw CapabilityException.transientFailure("Failed to parse " + opName + " response", e);
        }
        if (value == null) {
            throw CapabilityException.transientFailure("Empty " + opName + " response", null);
        }
        return value;
    }

    /** Serialize obj to JSON; a failure here is a programming error, not a service failure. */
    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }
}
