package com.vidnyan.sigmaeval.adapter.out.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.sigmaeval.application.port.out.CapabilityException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for an OpenAI-compatible endpoint (Groq, LM Studio, Ollama, ...).
 * Supports chat completions and embeddings. Failures surface as {@link CapabilityException}.
 */
@Slf4j
public class LlmClient {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public LlmClient(String baseUrl, String apiKey, Duration timeout, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .build();
    }

    /**
     * Send a system and user prompt and return the assistant message content.
     */
    public String chat(String model, String systemPrompt, String userPrompt) {
        log.debug("LLM request - model: {}", model);

        Map<String, Object> requestBody = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userPrompt)),
                "temperature", 0.1,
                "max_tokens", 2048);

        JsonNode root = post("/chat/completions", requestBody);
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new CapabilityException("LLM response has no choices");
        }
        String content = choices.get(0).path("message").path("content").asText();
        log.debug("LLM response received: {} chars", content.length());
        return content;
    }

    /**
     * Embed one text and return its vector.
     */
    public float[] embed(String model, String text) {
        JsonNode root = post("/embeddings", Map.of("model", model, "input", text));
        JsonNode vector = root.path("data").path(0).path("embedding");
        if (!vector.isArray() || vector.isEmpty()) {
            throw new CapabilityException("Embedding response has no vector");
        }
        float[] embedding = new float[vector.size()];
        for (int i = 0; i < vector.size(); i++) {
            embedding[i] = (float) vector.get(i).asDouble();
        }
        return embedding;
    }

    private JsonNode post(String path, Map<String, Object> requestBody) {
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(requestBody)))
                    .timeout(timeout);
            if (apiKey != null && !apiKey.isEmpty()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }

            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.error("LLM API error: {} - {}", response.statusCode(), response.body());
                throw new CapabilityException("LLM API error: " + response.statusCode());
            }
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new CapabilityException("LLM call to " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityException("LLM call to " + path + " interrupted", e);
        }
    }
}
