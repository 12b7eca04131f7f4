package com.example.videocompare_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Summarization server connection plus the token budget used for map-reduce chunking.
 */
@ConfigurationProperties(prefix = "summarizer")
public class SummarizerProperties {

    private String baseUrl = "http://127.0.0.1:8081";
    private String model = "facebook/bart-large-cnn";
    private String apiKey;
    private long timeoutSeconds = 300;

    /** Largest input, in tokens, one summarization call accepts. */
    private int inputTokenBudget = 900;
    /** Window size, in tokens, for the map stage. */
    private int chunkTokens = 900;
    private int mapMaxLength = 130;
    private int mapMinLength = 30;
    private int maxLength = 180;
    private int minLength = 60;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getInputTokenBudget() {
        return inputTokenBudget;
    }

    public void setInputTokenBudget(int inputTokenBudget) {
        this.inputTokenBudget = inputTokenBudget;
    }

    public int getChunkTokens() {
        return chunkTokens;
    }

    public void setChunkTokens(int chunkTokens) {
        this.chunkTokens = chunkTokens;
    }

    public int getMapMaxLength() {
        return mapMaxLength;
    }

    public void setMapMaxLength(int mapMaxLength) {
        this.mapMaxLength = mapMaxLength;
    }

    public int getMapMinLength() {
        return mapMinLength;
    }

    public void setMapMinLength(int mapMinLength) {
        this.mapMinLength = mapMinLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public void setMaxLength(int maxLength) {
        this.maxLength = maxLength;
    }

    public int getMinLength() {
        return minLength;
    }

    public void setMinLength(int minLength) {
        this.minLength = minLength;
    }
}
