package com.dripline.backend.services.webhook;

import com.dripline.backend.enums.Channel;
import com.dripline.backend.enums.DeliveryEventType;

import java.time.OffsetDateTime;

/**
 * One provider delivery callback, normalized.
 *
 * @param providerMessageId the provider's id for the message, may be null when the callback only carries ours
 * @param dripMessageId     our message id as echoed back by the provider, may be null
 * @param rawType           the provider's own event or status name
 * @param occurredAt        when the provider says it happened, falling back to receipt time
 * @param error             provider error detail for failure events, may be null
 */
public record DeliveryEvent(Channel channel,
                            String providerMessageId,
                            Long dripMessageId,
                            DeliveryEventType type,
                            String rawType,
                            OffsetDateTime occurredAt,
                            String error) {

    public DeliveryEvent(Channel channel, String providerMessageId, DeliveryEventType type,
                         String rawType, OffsetDateTime occurredAt, String error) {
        this(channel, providerMessageId, null, type, rawType, occurredAt, error);
    }
}
