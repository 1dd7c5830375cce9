package com.dripline.backend.services.channel;

/**
 * Outcome of one provider send call.
 *
 * @param success           whether the provider accepted the message
 * @param providerMessageId provider-assigned id, set on success
 * @param retryable         whether a failed send may succeed on a later attempt
 * @param error             provider or transport error, set on failure
 */
public record SendResult(boolean success, String providerMessageId, boolean retryable, String error) {

    public static SendResult success(String providerMessageId) {
        return new SendResult(true, providerMessageId, false, null);
    }

    public static SendResult failure(boolean retryable, String error) {
        return new SendResult(false, null, retryable, error);
    }

    public static SendResult retryableFailure(String error) {
        return failure(true, error);
    }

    public static SendResult permanentFailure(String error) {
        return failure(false, error);
    }
}
