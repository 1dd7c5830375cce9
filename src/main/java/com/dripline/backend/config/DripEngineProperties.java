package com.dripline.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "drip")
public record DripEngineProperties(
        @DefaultValue Processor processor,
        @DefaultValue Backoff backoff,
        @DefaultValue Webhook webhook
) {

    /**
     * @param batchSize   max due messages claimed per channel per run
     * @param maxRetries  retryable failures tolerated before a message fails terminally
     * @param sendTimeout upper bound on a single provider call
     * @param batchDelay  pause between channel batches, zero for none
     */
    public record Processor(
            @DefaultValue("50") int batchSize,
            @DefaultValue("3") int maxRetries,
            @DefaultValue("30s") Duration sendTimeout,
            @DefaultValue("0s") Duration batchDelay
    ) {
    }

    public record Backoff(
            @DefaultValue("1m") Duration baseDelay,
            @DefaultValue("1h") Duration maxDelay
    ) {
    }

    /**
     * @param emailVerificationKey base64 public key of SendGrid's signed event webhook
     * @param publicBaseUrl        externally reachable base URL, used for Twilio signatures and status callbacks
     */
    public record Webhook(
            @DefaultValue("true") boolean validateSignature,
            @DefaultValue("") String emailVerificationKey,
            @DefaultValue("") String publicBaseUrl
    ) {
    }
}
