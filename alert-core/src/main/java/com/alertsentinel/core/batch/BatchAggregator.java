package com.alertsentinel.core.batch;

import com.alertsentinel.core.model.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Accumulates admitted events into one time-bounded batch.
 *
 * <h3>State machine</h3>
 * <ul>
 * <li>{@code EMPTY}: no events, no open timestamp.</li>
 * <li>First {@link #add} opens the batch and stamps {@code openedAt}; later
 * adds append without touching it.</li>
 * <li>{@link #isDue(Instant)} turns true once {@code now - openedAt} reaches
 * the batch window.</li>
 * <li>{@link #drain()} snapshots and clears the batch in one step and returns
 * it to {@code EMPTY}.</li>
 * </ul>
 *
 * <p>
 * There is no timer: a due batch is only noticed by the next call.
 * </p>
 *
 * @since 1.0.0
 */
public class BatchAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(BatchAggregator.class);

    private final Duration window;

    private final List<AnomalyEvent> pending = new ArrayList<>();
    private Instant openedAt;
    private BatchState state = BatchState.EMPTY;

    /**
     * @param window how long a batch may stay open; must not be negative
     */
    public BatchAggregator(Duration window) {
        this.window = Objects.requireNonNull(window, "Batch window must not be null");
        if (window.isNegative()) {
            throw new IllegalArgumentException("Batch window must not be negative, got: " + window);
        }
    }

    /**
     * @param event admitted event
     * @param now   admission time; opens the batch if it is empty
     */
    public void add(AnomalyEvent event, Instant now) {
        Objects.requireNonNull(event, "Event must not be null");
        if (state == BatchState.EMPTY) {
            openedAt = Objects.requireNonNull(now, "now must not be null");
            state = BatchState.OPEN;
            LOG.debug("Batch opened at {}", openedAt);
        }
        pending.add(event);
    }

    /**
     * @param now evaluation instant
     * @return {@code true} if the batch is open and its window has elapsed
     */
    public boolean isDue(Instant now) {
        if (state != BatchState.OPEN) {
            return false;
        }
        return Duration.between(openedAt, now).compareTo(window) >= 0;
    }

    /**
     * Take every pending event and reset to {@code EMPTY}.
     *
     * @return the drained events in insertion order; empty if nothing was
     *         pending
     */
    public List<AnomalyEvent> drain() {
        if (state == BatchState.EMPTY) {
            return Collections.emptyList();
        }
        state = BatchState.FLUSHING;
        List<AnomalyEvent> snapshot = List.copyOf(pending);
        pending.clear();
        openedAt = null;
        state = BatchState.EMPTY;
        LOG.debug("Batch drained with {} event(s)", snapshot.size());
        return snapshot;
    }

    /**
     * @return the event that opened the current batch, if any
     */
    public Optional<AnomalyEvent> firstEvent() {
        return pending.isEmpty() ? Optional.empty() : Optional.of(pending.get(0));
    }

    /**
     * @return when the current batch was opened, or empty if none is open
     */
    public Optional<Instant> openedAt() {
        return Optional.ofNullable(openedAt);
    }

    public BatchState state() {
        return state;
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
