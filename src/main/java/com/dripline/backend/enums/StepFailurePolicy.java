package com.dripline.backend.enums;

/**
 * What happens to a journey when one of its steps fails terminally.
 */
public enum StepFailurePolicy {
    FAIL_JOURNEY("Fail journey"),
    SKIP_STEP("Skip step");

    private final String displayName;

    StepFailurePolicy(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
