package com.example.videocompare_backend.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One {@link WebClient} per inference collaborator. Each is built once at startup and shared
 * by every concurrent pipeline item.
 */
@Configuration
@EnableConfigurationProperties({FwProperties.class, SummarizerProperties.class, EmbeddingProperties.class})
public class InferenceClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(InferenceClientConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 15_000;
    private static final int MAX_IN_MEMORY_BYTES = 32 * 1024 * 1024;

    @Bean("fwWebClient")
    public WebClient fwWebClient(FwProperties props) {
        return build("faster-whisper", props.getBaseUrl(), null, Duration.ofSeconds(props.getTimeoutSeconds()));
    }

    @Bean("summarizerWebClient")
    public WebClient summarizerWebClient(SummarizerProperties props) {
        return build("summarizer", props.getBaseUrl(), props.getApiKey(), Duration.ofSeconds(props.getTimeoutSeconds()));
    }

    @Bean("embeddingWebClient")
    public WebClient embeddingWebClient(EmbeddingProperties props) {
        return build("embedding", props.getBaseUrl(), props.getApiKey(), Duration.ofSeconds(props.getTimeoutSeconds()));
    }

    private WebClient build(String name, String baseUrl, String apiKey, Duration timeout) {
        long toSec = Math.max(1, timeout.getSeconds());

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();

        HttpClient http = HttpClient.create()
                .responseTimeout(timeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(toSec, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(toSec, TimeUnit.SECONDS))
                );

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies)
                .defaultHeader("Accept", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + apiKey.trim());
        }

        LOGGER.info("Configuring {} WebClient baseUrl={} connect={}ms response={}s", name, baseUrl, CONNECT_TIMEOUT_MILLIS, toSec);
        return builder.build();
    }
}
