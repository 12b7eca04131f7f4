package com.example.videocompare_backend.exception;

/**
 * Thrown when a comparison request is malformed (missing filename, empty URL list).
 */
public class InputException extends VideoCompareException {

    public InputException(String message) {
        super(message);
    }
}
