package com.dripline.backend.util;

/**
 * Local drip message ids as attached to provider requests ("drip-42"). Providers echo them back
 * on delivery callbacks: SendGrid as a custom arg, Twilio as a query parameter of the status
 * callback URL.
 */
public final class CorrelationIds {

    public static final String PARAMETER = "drip_message_id";

    private static final String PREFIX = "drip-";

    private CorrelationIds() {
    }

    public static String forMessage(Long messageId) {
        return PREFIX + messageId;
    }

    /**
     * @return the drip message id, or null when the value is missing or not one of ours
     */
    public static Long parseMessageId(String correlationId) {
        if (correlationId == null || !correlationId.startsWith(PREFIX)) {
            return null;
        }
        try {
            return Long.valueOf(correlationId.substring(PREFIX.length()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
