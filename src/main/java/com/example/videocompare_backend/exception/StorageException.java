package com.example.videocompare_backend.exception;

public class StorageException extends VideoCompareException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
