package com.alertsentinel.core.batch;

/**
 * Lifecycle of the pending batch: {@code EMPTY → OPEN → FLUSHING → EMPTY}.
 *
 * <p>
 * {@code FLUSHING} is only observable from inside
 * {@link BatchAggregator#drain()}; callers see the batch return to
 * {@code EMPTY} before delivery starts.
 * </p>
 */
public enum BatchState {
    EMPTY,
    OPEN,
    FLUSHING
}
