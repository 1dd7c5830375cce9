package com.dripline.backend.services.webhook;

import com.dripline.backend.enums.Channel;

import java.util.List;

/**
 * Provider-specific half of webhook reconciliation: authenticity check and payload parsing.
 */
public interface ProviderWebhookHandler {

    Channel channel();

    /**
     * @return whether the callback really came from the provider
     */
    boolean verify(ProviderWebhook webhook);

    /**
     * @throws com.dripline.backend.exceptions.InvalidWebhookPayloadException if the payload cannot be read
     */
    List<DeliveryEvent> parse(ProviderWebhook webhook);
}
