package com.example.videocompare_backend.engine;

import com.example.videocompare_backend.config.EmbeddingProperties;
import com.example.videocompare_backend.exception.EmbeddingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HttpEmbeddingEngineTest {

    @Test
    void sendsWholeBatchAndOrdersVectorsByIndex() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AtomicReference<String> body = new AtomicReference<>();
        ExchangeFunction exchange = request -> {
            calls.incrementAndGet();
            body.set(HttpSummarizationEngineTest.bodyOf(request));
            return Mono.just(json(HttpStatus.OK, """
                    {"data":[
                      {"index":1,"embedding":[0.0,1.0]},
                      {"index":0,"embedding":[1.0,0.0]}
                    ]}
                    """));
        };

        List<float[]> vectors = engine(exchange).embed(List.of("topic", "summary"));

        assertThat(calls.get()).isEqualTo(1);
        assertThat(vectors.get(0)).containsExactly(1.0f, 0.0f);
        assertThat(vectors.get(1)).containsExactly(0.0f, 1.0f);
        JsonNode sent = new ObjectMapper().readTree(body.get());
        assertThat(sent.path("model").asText()).isEqualTo("sentence-transformers/all-MiniLM-L6-v2");
        assertThat(sent.path("input")).hasSize(2);
    }

    @Test
    void emptyBatchMakesNoCall() {
        AtomicInteger calls = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            calls.incrementAndGet();
            return Mono.just(json(HttpStatus.OK, "{\"data\":[]}"));
        };

        assertThat(engine(exchange).embed(List.of())).isEmpty();
        assertThat(calls.get()).isZero();
    }

    @Test
    void vectorCountMismatchIsRejected() {
        ExchangeFunction exchange = request -> Mono.just(json(HttpStatus.OK, "{\"data\":[{\"index\":0,\"embedding\":[1.0]}]}"));

        assertThrows(EmbeddingException.class, () -> engine(exchange).embed(List.of("a", "b")));
    }

    @Test
    void inconsistentDimensionsAreRejected() {
        ExchangeFunction exchange = request -> Mono.just(json(HttpStatus.OK,
                "{\"data\":[{\"index\":0,\"embedding\":[1.0,2.0]},{\"index\":1,\"embedding\":[1.0]}]}"));

        assertThrows(EmbeddingException.class, () -> engine(exchange).embed(List.of("a", "b")));
    }

    @Test
    void errorStatusBecomesEmbeddingException() {
        ExchangeFunction exchange = request -> Mono.just(json(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"oom\"}"));

        EmbeddingException ex = assertThrows(EmbeddingException.class, () -> engine(exchange).embed(List.of("a")));

        assertThat(ex.getMessage()).contains("oom");
    }

    private HttpEmbeddingEngine engine(ExchangeFunction exchange) {
        WebClient client = WebClient.builder()
                .baseUrl("http://embeddings.test")
                .exchangeFunction(exchange)
                .build();
        return new HttpEmbeddingEngine(client, new EmbeddingProperties());
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
