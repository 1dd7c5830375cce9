package com.dripline.backend.enums;

/**
 * Normalized provider callback types.
 */
public enum DeliveryEventType {
    SENT(MessageStatus.SENT),
    DELIVERED(MessageStatus.DELIVERED),
    OPENED(MessageStatus.OPENED),
    CLICKED(MessageStatus.CLICKED),
    FAILED(MessageStatus.FAILED),
    BOUNCED(MessageStatus.BOUNCED),
    // deferred, spam reports, unsubscribes and anything else with no lifecycle meaning
    IGNORED(null);

    private final MessageStatus targetStatus;

    DeliveryEventType(MessageStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    public MessageStatus getTargetStatus() {
        return targetStatus;
    }

    public boolean isEngagement() {
        return this == DELIVERED || this == OPENED || this == CLICKED;
    }
}
