package com.dripline.backend.services.drip;

import java.time.Duration;

/**
 * Delay before a message that failed with a retryable error is attempted again.
 */
public interface BackoffPolicy {

    /**
     * @param attempt the attempt number that just failed, starting at 1
     */
    Duration delayForAttempt(int attempt);
}
