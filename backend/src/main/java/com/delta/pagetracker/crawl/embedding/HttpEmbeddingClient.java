package com.delta.pagetracker.crawl.embedding;

import com.delta.pagetracker.crawl.http.PoliteHttpClient;
import com.delta.pagetracker.crawl.model.HttpFetchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.Map;

public class HttpEmbeddingClient implements EmbeddingClient {
    // Longer inputs are cut before sending.
    static final int MAX_INPUT_CHARS = 32_000;

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final Duration timeout;

    public HttpEmbeddingClient(PoliteHttpClient httpClient, ObjectMapper objectMapper, String endpoint, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    @Override
    public float[] embed(String text) {
        String input = text == null ? "" : text;
        if (input.length() > MAX_INPUT_CHARS) {
            input = input.substring(0, MAX_INPUT_CHARS);
        }
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("input", input));
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Unable to encode embedding request", e);
        }
        HttpFetchResult result = httpClient.postJson(endpoint, body, "application/json", timeout);
        if (!result.isSuccessful() || result.body() == null) {
            String detail = result.errorCode() != null
                ? result.errorCode() + ": " + result.errorMessage()
                : "HTTP " + result.statusCode();
            throw new EmbeddingException("Embedding request failed (" + detail + ")");
        }
        return parseVector(result.body());
    }

    float[] parseVector(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Embedding response is not valid JSON", e);
        }
        JsonNode vector = root.path("embedding");
        if (!vector.isArray()) {
            vector = root.path("data").path(0).path("embedding");
        }
        if (!vector.isArray()) {
            throw new EmbeddingException("Embedding response carries no vector");
        }
        float[] out = new float[vector.size()];
        for (int i = 0; i < vector.size(); i++) {
            out[i] = (float) vector.get(i).asDouble();
        }
        return out;
    }
}
