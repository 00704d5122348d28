package com.alertsentinel.core.gate;

import com.alertsentinel.core.model.OutcomeReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Caps outbound sends at {@code maxAlertsPerHour} over a trailing hour.
 *
 * <p>
 * Checking never records anything: timestamps are appended through
 * {@link #recordSend(Instant)} when a batch is flushed, so the limit counts
 * deliveries rather than admissions. One flush counts once, however many
 * events it carries.
 * </p>
 *
 * @since 1.0.0
 */
public class RateLimitGate implements SuppressionGate {

    private static final Logger LOG = LoggerFactory.getLogger(RateLimitGate.class);

    /** Trailing window over which sends are counted. */
    public static final Duration WINDOW = Duration.ofHours(1);

    private final int maxAlertsPerHour;

    /** Send timestamps, oldest first. */
    private final Deque<Instant> sendTimes = new ArrayDeque<>();

    /**
     * @param maxAlertsPerHour maximum flushes per trailing hour; must be
     *                         &gt;= 1
     */
    public RateLimitGate(int maxAlertsPerHour) {
        if (maxAlertsPerHour < 1) {
            throw new IllegalArgumentException(
                    "maxAlertsPerHour must be >= 1, got: " + maxAlertsPerHour);
        }
        this.maxAlertsPerHour = maxAlertsPerHour;
    }

    @Override
    public boolean suppresses(GateContext context) {
        return isLimited(context.getNow());
    }

    @Override
    public OutcomeReason reason() {
        return OutcomeReason.RATE_LIMIT;
    }

    /**
     * Prune to the trailing hour, then compare against the cap.
     *
     * @param now evaluation instant
     * @return {@code true} if the cap has been reached
     */
    public boolean isLimited(Instant now) {
        prune(now);
        boolean limited = sendTimes.size() >= maxAlertsPerHour;
        if (limited) {
            LOG.debug("Rate limit reached: {} send(s) in the last hour (max {})",
                    sendTimes.size(), maxAlertsPerHour);
        }
        return limited;
    }

    /**
     * @param now time of the flush
     */
    public void recordSend(Instant now) {
        sendTimes.addLast(now);
    }

    /**
     * Count sends in the trailing hour without pruning.
     */
    public int countLastHour(Instant now) {
        int count = 0;
        for (Instant t : sendTimes) {
            if (withinWindow(t, now)) {
                count++;
            }
        }
        return count;
    }

    public List<Instant> snapshot() {
        return List.copyOf(sendTimes);
    }

    /**
     * Replace the send history with persisted timestamps.
     */
    public void restore(Collection<Instant> timestamps) {
        sendTimes.clear();
        List<Instant> sorted = new ArrayList<>();
        for (Instant t : timestamps) {
            if (t != null) {
                sorted.add(t);
            }
        }
        sorted.sort(null);
        sendTimes.addAll(sorted);
    }

    public int getMaxAlertsPerHour() {
        return maxAlertsPerHour;
    }

    private void prune(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        while (!sendTimes.isEmpty() && !withinWindow(sendTimes.peekFirst(), now)) {
            sendTimes.pollFirst();
        }
    }

    private static boolean withinWindow(Instant t, Instant now) {
        return Duration.between(t, now).compareTo(WINDOW) < 0;
    }
}
