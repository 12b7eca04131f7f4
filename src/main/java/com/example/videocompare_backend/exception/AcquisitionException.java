package com.example.videocompare_backend.exception;

/**
 * Thrown when one source cannot be saved, downloaded or copied into the scratch area.
 */
public class AcquisitionException extends VideoCompareException {

    public AcquisitionException(String message) {
        super(message);
    }

    public AcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
