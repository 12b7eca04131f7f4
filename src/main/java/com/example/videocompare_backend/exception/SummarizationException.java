package com.example.videocompare_backend.exception;

/**
 * Thrown when the summarization service fails to produce a summary.
 */
public class SummarizationException extends VideoCompareException {

    public SummarizationException(String message) {
        super(message);
    }

    public SummarizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
