package com.example.videocompare_backend.exception;

/**
 * Base exception for all application-specific errors.
 * Domain exceptions extend this class so the web layer can handle them in one place.
 */
public class VideoCompareException extends RuntimeException {

    public VideoCompareException(String message) {
        super(message);
    }

    public VideoCompareException(String message, Throwable cause) {
        super(message, cause);
    }
}
