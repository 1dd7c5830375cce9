package com.dripline.backend.enums;

public enum Channel {
    SMS("SMS"),
    EMAIL("Email");

    private final String displayName;

    Channel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isSms() {
        return this == SMS;
    }

    public boolean isEmail() {
        return this == EMAIL;
    }

    /**
     * Status a message of this channel ends in when it can no longer be delivered.
     */
    public MessageStatus terminalFailureStatus() {
        return this == SMS ? MessageStatus.FAILED : MessageStatus.BOUNCED;
    }
}
