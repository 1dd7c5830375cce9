package com.dripline.backend.enums;

import java.util.EnumSet;
import java.util.Set;

public enum MessageStatus {
    PENDING("Pending"),
    QUEUED("Queued"),
    SENT("Sent"),
    DELIVERED("Delivered"),
    OPENED("Opened"),
    CLICKED("Clicked"),
    FAILED("Failed"),
    BOUNCED("Bounced");

    private final String displayName;

    MessageStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isPending() {
        return this == PENDING;
    }

    public boolean isTerminalFailure() {
        return this == FAILED || this == BOUNCED;
    }

    /**
     * Statuses from which a provider callback may move a message into this one.
     * Lifecycle only moves forward: SENT -> DELIVERED -> OPENED -> CLICKED, or SENT -> FAILED/BOUNCED.
     * QUEUED is included because a callback can beat the processor recording the provider's response.
     */
    public Set<MessageStatus> reconcilableFrom() {
        return switch (this) {
            case DELIVERED -> EnumSet.of(QUEUED, SENT);
            case OPENED -> EnumSet.of(QUEUED, SENT, DELIVERED);
            case CLICKED -> EnumSet.of(QUEUED, SENT, DELIVERED, OPENED);
            case FAILED, BOUNCED -> EnumSet.of(QUEUED, SENT);
            default -> EnumSet.noneOf(MessageStatus.class);
        };
    }

    /**
     * Statuses only a provider callback sets, i.e. ones that prove the provider accepted the message.
     */
    public static Set<MessageStatus> callbackStatuses() {
        return EnumSet.of(DELIVERED, OPENED, CLICKED, FAILED, BOUNCED);
    }
}
