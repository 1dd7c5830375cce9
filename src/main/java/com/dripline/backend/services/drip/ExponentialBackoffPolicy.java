package com.dripline.backend.services.drip;

import com.dripline.backend.config.DripEngineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * {@code baseDelay * 2^(attempt - 1)}, capped at {@code maxDelay}.
 */
@Component
public class ExponentialBackoffPolicy implements BackoffPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;

    @Autowired
    public ExponentialBackoffPolicy(DripEngineProperties properties) {
        this(properties.backoff().baseDelay(), properties.backoff().maxDelay());
    }

    public ExponentialBackoffPolicy(Duration baseDelay, Duration maxDelay) {
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    @Override
    public Duration delayForAttempt(int attempt) {
        if (attempt <= 1) {
            return baseDelay;
        }
        // Past 2^30 the cap has long since applied
        int shift = Math.min(attempt - 1, 30);
        long baseMillis = baseDelay.toMillis();
        long maxMillis = maxDelay.toMillis();
        if (baseMillis > maxMillis >> shift) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(baseMillis << shift, maxMillis));
    }
}
