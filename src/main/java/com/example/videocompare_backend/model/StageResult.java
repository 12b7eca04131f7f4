package com.example.videocompare_backend.model;

/**
 * Outcome of one pipeline stage for one item. Failures travel as values so a stage never
 * throws across a concurrency boundary.
 */
public sealed interface StageResult<T> permits StageResult.Success, StageResult.Failure {

    static <T> StageResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> StageResult<T> failure(String tag, String message) {
        return new Failure<>(tag, message);
    }

    boolean isSuccess();

    record Success<T>(T value) implements StageResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * @param tag     error class, e.g. {@code TranscriptionError}
     * @param message human-readable reason
     */
    record Failure<T>(String tag, String message) implements StageResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        public <U> Failure<U> retype() {
            return new Failure<>(tag, message);
        }

        public String describe() {
            return message == null || message.isBlank() ? tag : tag + ": " + message;
        }
    }
}
