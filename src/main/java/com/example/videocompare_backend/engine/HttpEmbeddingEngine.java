package com.example.videocompare_backend.engine;

import com.example.videocompare_backend.config.EmbeddingProperties;
import com.example.videocompare_backend.engine.Interfaces.EmbeddingEngine;
import com.example.videocompare_backend.exception.EmbeddingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible {@code /v1/embeddings} client. The whole batch goes out in one request.
 */
@Service
public class HttpEmbeddingEngine implements EmbeddingEngine {

    private final WebClient client;
    private final String model;
    private final Duration timeout;

    public HttpEmbeddingEngine(@Qualifier("embeddingWebClient") WebClient client, EmbeddingProperties props) {
        this.client = client;
        this.model = props.getModel();
        this.timeout = Duration.ofSeconds(props.getTimeoutSeconds());
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = client.post()
                    .uri("/v1/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("model", model, "input", texts))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(err -> new EmbeddingException("Embedding error %s: %s".formatted(resp.statusCode(), err))))
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (EmbeddingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
        }
        return parse(root, texts.size());
    }

    private static List<float[]> parse(JsonNode root, int expected) {
        JsonNode data = root == null ? null : root.path("data");
        if (data == null || !data.isArray() || data.size() != expected) {
            throw new EmbeddingException("Embedding response has " + (data == null || !data.isArray() ? 0 : data.size())
                    + " vectors, expected " + expected);
        }
        float[][] ordered = new float[expected][];
        int position = 0;
        for (JsonNode item : data) {
            int index = item.has("index") ? item.get("index").asInt() : position;
            if (index < 0 || index >= expected || ordered[index] != null) {
                throw new EmbeddingException("Embedding response has invalid index " + index);
            }
            JsonNode vector = item.path("embedding");
            float[] values = new float[vector.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = (float) vector.get(i).asDouble();
            }
            ordered[index] = values;
            position++;
        }
        int dim = ordered[0].length;
        if (dim == 0 || Arrays.stream(ordered).anyMatch(v -> v.length != dim)) {
            throw new EmbeddingException("Embedding vectors have inconsistent dimensionality");
        }
        return new ArrayList<>(Arrays.asList(ordered));
    }
}
