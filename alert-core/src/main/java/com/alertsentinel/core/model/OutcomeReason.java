package com.alertsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a submitted event was or was not delivered.
 *
 * @since 1.0.0
 */
public enum OutcomeReason {

    MAINTENANCE_WINDOW("maintenance_window"),
    DUPLICATE("duplicate"),
    RATE_LIMIT("rate_limit"),
    BELOW_SEVERITY_THRESHOLD("below_severity_threshold"),
    QUEUED_IN_BATCH("queued_in_batch"),
    BATCH_FLUSHED("batch_flushed");

    private final String wireName;

    OutcomeReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @return {@code true} for the reasons that drop the event
     */
    public boolean isSuppression() {
        return this != QUEUED_IN_BATCH && this != BATCH_FLUSHED;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
