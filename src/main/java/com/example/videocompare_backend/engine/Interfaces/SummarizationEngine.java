package com.example.videocompare_backend.engine.Interfaces;

import com.example.videocompare_backend.exception.SummarizationException;

public interface SummarizationEngine {

    /**
     * Abstractive summary of {@code text} within the given output bounds (model tokens).
     *
     * @throws SummarizationException on any model or transport failure
     */
    String summarize(String text, int maxLength, int minLength);
}
