package com.example.videocompare_backend.engine;

import com.example.videocompare_backend.config.SummarizerProperties;
import com.example.videocompare_backend.engine.Interfaces.SummarizationEngine;
import com.example.videocompare_backend.exception.SummarizationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls a Hugging Face style summarization endpoint:
 * {@code POST /models/<model id>} with {@code {inputs, parameters:{max_length, min_length, do_sample}}},
 * answered by {@code [{"summary_text": "..."}]}.
 */
@Service
public class HttpSummarizationEngine implements SummarizationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpSummarizationEngine.class);

    private final WebClient client;
    private final String model;
    private final Duration timeout;

    public HttpSummarizationEngine(@Qualifier("summarizerWebClient") WebClient client, SummarizerProperties props) {
        this.client = client;
        this.model = props.getModel();
        this.timeout = Duration.ofSeconds(props.getTimeoutSeconds());
    }

    @Override
    public String summarize(String text, int maxLength, int minLength) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("max_length", maxLength);
        parameters.put("min_length", minLength);
        parameters.put("do_sample", false);
        Map<String, Object> body = Map.of("inputs", text, "parameters", parameters);

        long start = System.currentTimeMillis();
        JsonNode root;
        try {
            root = client.post()
                    .uri("/models/" + model)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(err -> new SummarizationException("Summarizer error %s: %s".formatted(resp.statusCode(), err))))
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (SummarizationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SummarizationException("Summarizer request failed: " + e.getMessage(), e);
        }

        String summary = extractSummary(root);
        LOGGER.debug("Summarizer model={} inputChars={} max={} min={} took={}ms",
                model, text.length(), maxLength, minLength, System.currentTimeMillis() - start);
        return summary;
    }

    private static String extractSummary(JsonNode root) {
        if (root == null) {
            throw new SummarizationException("Empty response from summarizer");
        }
        JsonNode first = root.isArray() ? root.path(0) : root;
        JsonNode summary = first.path("summary_text");
        if (!summary.isTextual()) {
            throw new SummarizationException("Summarizer response missing summary_text: " + root);
        }
        return summary.asText().strip();
    }
}
