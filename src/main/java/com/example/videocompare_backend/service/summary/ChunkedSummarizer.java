package com.example.videocompare_backend.service.summary;

import com.example.videocompare_backend.config.SummarizerProperties;
import com.example.videocompare_backend.engine.Interfaces.SummarizationEngine;
import com.example.videocompare_backend.model.LengthBounds;
import com.example.videocompare_backend.model.Transcript;
import com.example.videocompare_backend.util.TokenUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Token-budgeted summarization. Transcripts within the budget go to the engine in one call;
 * longer ones are split into windows, summarized per window (map) and the joined partials
 * summarized once more with the caller's bounds (reduce).
 */
@Service
public class ChunkedSummarizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedSummarizer.class);

    public static final String EMPTY_SUMMARY = "No content to summarize.";

    static final int SHORT_INPUT_TOKENS = 30;
    static final int SHORT_MAX_LENGTH = 60;
    static final int SHORT_MIN_LENGTH = 10;

    private final SummarizationEngine engine;
    private final LengthBoundRetry retry;
    private final int inputTokenBudget;
    private final int chunkTokens;
    private final LengthBounds mapBounds;
    private final LengthBounds defaultBounds;

    public ChunkedSummarizer(SummarizationEngine engine, SummarizerProperties props) {
        this(engine, LengthBoundRetry.halving(), props);
    }

    ChunkedSummarizer(SummarizationEngine engine, LengthBoundRetry retry, SummarizerProperties props) {
        if (props.getInputTokenBudget() < 1 || props.getChunkTokens() < 1) {
            throw new IllegalArgumentException("summarizer token budget and chunk size must be positive");
        }
        this.engine = engine;
        this.retry = retry;
        this.inputTokenBudget = props.getInputTokenBudget();
        this.chunkTokens = Math.min(props.getChunkTokens(), props.getInputTokenBudget());
        this.mapBounds = new LengthBounds(props.getMapMaxLength(), props.getMapMinLength());
        this.defaultBounds = new LengthBounds(props.getMaxLength(), props.getMinLength());
    }

    public String summarize(Transcript transcript) {
        return summarize(transcript, defaultBounds);
    }

    public String summarize(Transcript transcript, LengthBounds requested) {
        if (transcript == null || transcript.isBlank()) {
            return EMPTY_SUMMARY;
        }
        List<String> tokens = TokenUtil.tokenize(transcript.text());
        if (tokens.size() <= inputTokenBudget) {
            return call(transcript.text(), boundsForInput(tokens.size(), requested));
        }

        List<List<String>> windows = TokenUtil.windows(tokens, chunkTokens);
        LOGGER.info("SUMMARIZE map-reduce tokens={} windows={} budget={}", tokens.size(), windows.size(), inputTokenBudget);
        List<String> partials = new ArrayList<>(windows.size());
        for (List<String> window : windows) {
            partials.add(call(TokenUtil.join(window), boundsForInput(window.size(), mapBounds)));
        }

        List<String> joined = TokenUtil.tokenize(String.join(" ", partials));
        List<String> reduceInput = TokenUtil.truncate(joined, inputTokenBudget);
        if (reduceInput.size() < joined.size()) {
            LOGGER.debug("SUMMARIZE truncated partials from={} to={}", joined.size(), reduceInput.size());
        }
        if (reduceInput.isEmpty()) {
            return EMPTY_SUMMARY;
        }
        return call(TokenUtil.join(reduceInput), boundsForInput(reduceInput.size(), requested));
    }

    /**
     * Shrinks bounds for inputs too short to support them; never raises the requested bounds.
     */
    static LengthBounds boundsForInput(int inputTokens, LengthBounds requested) {
        if (inputTokens < SHORT_INPUT_TOKENS) {
            return requested.capped(SHORT_MAX_LENGTH, SHORT_MIN_LENGTH);
        }
        if (inputTokens < requested.maxLength()) {
            return requested.capped(Math.max(SHORT_MAX_LENGTH, inputTokens), Math.max(SHORT_MIN_LENGTH, inputTokens / 4));
        }
        return requested;
    }

    private String call(String text, LengthBounds bounds) {
        return retry.execute(bounds, b -> engine.summarize(text, b.maxLength(), b.minLength()));
    }
}
