package com.dripline.backend.enums;

public enum TriggerType {
    LEAD_CAPTURED("Lead captured"),
    MANUAL("Manual");

    private final String displayName;

    TriggerType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
