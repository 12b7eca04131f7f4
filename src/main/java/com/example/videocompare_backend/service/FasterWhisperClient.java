package com.example.videocompare_backend.service;

import com.example.videocompare_backend.config.FwProperties;
import com.example.videocompare_backend.dto.FwTranscriptionResponse;
import com.example.videocompare_backend.exception.TranscriptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Duration;

@Component
public class FasterWhisperClient {

    private final WebClient client;
    private final String model; // alleen voor het form-veld
    private static final Logger log = LoggerFactory.getLogger(FasterWhisperClient.class);
    private final Duration timeout;

    public FasterWhisperClient(@Qualifier("fwWebClient") WebClient client, FwProperties props) {
        this.client = client;
        this.model = props.getModel();
        this.timeout = Duration.ofSeconds(props.getTimeoutSeconds());
    }

    public FwTranscriptionResponse transcribeFile(Path file) {
        var mb = new LinkedMultiValueMap<String, Object>();
        mb.add("file", new FileSystemResource(file));
        if (model != null && !model.isBlank()) {
            mb.add("model", model);
        }
        mb.add("response_format", "json");

        long start = System.currentTimeMillis();
        try {
            return client.post()
                    .uri("/v1/audio/transcriptions")
                    .body(BodyInserters.fromMultipartData(mb))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(body -> new TranscriptionException("FasterWhisper error " + resp.statusCode() + ": " + body)))
                    .bodyToMono(FwTranscriptionResponse.class)
                    .timeout(timeout)
                    .doOnSuccess(r -> log.debug("FW {} processed in {} ms",
                            file.getFileName(), System.currentTimeMillis() - start))
                    .block();
        } catch (TranscriptionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TranscriptionException("FasterWhisper request failed for " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
