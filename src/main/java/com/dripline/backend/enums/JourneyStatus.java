package com.dripline.backend.enums;

public enum JourneyStatus {
    ACTIVE("Active"),
    COMPLETED("Completed"),
    PAUSED("Paused"),
    FAILED("Failed");

    private final String displayName;

    JourneyStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isActive() {
        return this == ACTIVE;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}
