package com.example.videocompare_backend.service.summary;

import com.example.videocompare_backend.exception.SummarizationException;
import com.example.videocompare_backend.model.LengthBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Bounded retry for summarization calls: after a {@link SummarizationException} the call is
 * repeated with transformed length bounds, at most {@code maxExtraAttempts} times (0 or 1).
 */
public final class LengthBoundRetry {
    private static final Logger LOGGER = LoggerFactory.getLogger(LengthBoundRetry.class);

    private final int maxExtraAttempts;
    private final UnaryOperator<LengthBounds> transform;

    public LengthBoundRetry(int maxExtraAttempts, UnaryOperator<LengthBounds> transform) {
        if (maxExtraAttempts < 0 || maxExtraAttempts > 1) {
            throw new IllegalArgumentException("maxExtraAttempts must be 0 or 1: " + maxExtraAttempts);
        }
        this.maxExtraAttempts = maxExtraAttempts;
        this.transform = transform;
    }

    public static LengthBoundRetry halving() {
        return new LengthBoundRetry(1, LengthBounds::halved);
    }

    public <T> T execute(LengthBounds bounds, Function<LengthBounds, T> call) {
        LengthBounds current = bounds;
        int attempt = 0;
        while (true) {
            try {
                return call.apply(current);
            } catch (SummarizationException e) {
                if (attempt >= maxExtraAttempts) {
                    throw e;
                }
                attempt++;
                LengthBounds next = transform.apply(current);
                LOGGER.warn("SUMMARIZE retry attempt={} bounds={}->{} reason={}", attempt, current, next, e.getMessage());
                current = next;
            }
        }
    }
}
