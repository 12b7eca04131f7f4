package com.example.videocompare_backend.exception;

/**
 * Thrown when a media file cannot be decoded or transcribed, e.g. it has no audio track.
 */
public class TranscriptionException extends VideoCompareException {

    public TranscriptionException(String message) {
        super(message);
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
