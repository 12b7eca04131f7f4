package com.example.videocompare_backend.exception;

public class EmbeddingException extends VideoCompareException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
