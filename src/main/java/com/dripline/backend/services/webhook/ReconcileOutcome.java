package com.dripline.backend.services.webhook;

public enum ReconcileOutcome {
    /** Message moved forward. */
    APPLIED,
    /** Message already at or past the event's status, or the event is a send confirmation. */
    IGNORED_STALE,
    /** No message carries the provider message id. */
    UNKNOWN_MESSAGE,
    /** Event type with no lifecycle meaning. */
    UNSUPPORTED
}
