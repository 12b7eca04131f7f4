package com.example.videocompare_backend.model;

/**
 * Output length bounds, in model tokens, for one summarization call.
 */
public record LengthBounds(int maxLength, int minLength) {

    public static final int MAX_LENGTH_FLOOR = 20;
    public static final int MIN_LENGTH_FLOOR = 5;

    public LengthBounds {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        if (minLength < 0) {
            throw new IllegalArgumentException("minLength must not be negative: " + minLength);
        }
        minLength = Math.min(minLength, maxLength);
    }

    /**
     * Caps both bounds; never raises them.
     */
    public LengthBounds capped(int maxCap, int minCap) {
        return new LengthBounds(Math.min(maxLength, maxCap), Math.min(minLength, minCap));
    }

    /**
     * Halves both bounds, floored at {@link #MAX_LENGTH_FLOOR}/{@link #MIN_LENGTH_FLOOR}
     * but never above the current values.
     */
    public LengthBounds halved() {
        int max = Math.min(maxLength, Math.max(MAX_LENGTH_FLOOR, maxLength / 2));
        int min = Math.min(minLength, Math.max(MIN_LENGTH_FLOOR, minLength / 2));
        return new LengthBounds(max, min);
    }
}
