package com.example.videocompare_backend.exception;

import com.example.videocompare_backend.model.SkipEntry;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Thrown when no source in a batch survived. Carries the per-source reasons so the caller
 * can see why each one was dropped.
 */
public class AggregateFailureException extends VideoCompareException {

    private final HttpStatus status;
    private final List<SkipEntry> skipped;

    public AggregateFailureException(HttpStatus status, String message, List<SkipEntry> skipped) {
        super(message);
        this.status = status;
        this.skipped = List.copyOf(skipped);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public List<SkipEntry> getSkipped() {
        return skipped;
    }
}
