package com.alertsentinel.core.state;

import com.alertsentinel.core.model.OutcomeReason;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Monotonic pipeline counters.
 *
 * <p>
 * Persisted under their {@link Counter#key()} names and merged additively
 * when a snapshot is restored.
 * </p>
 */
public class AlertCounters {

    /**
     * Every counter the pipeline keeps.
     */
    public enum Counter {
        TOTAL_RECEIVED("total_received"),
        TOTAL_SENT("total_sent"),
        SUPPRESSED_DUPLICATE("suppressed_duplicate"),
        SUPPRESSED_MAINTENANCE("suppressed_maintenance"),
        SUPPRESSED_RATE_LIMIT("suppressed_rate_limit"),
        SUPPRESSED_SEVERITY("suppressed_severity"),
        BATCHED("batched");

        private final String key;

        Counter(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        /**
         * @param reason a suppression reason
         * @return the counter that tracks it
         * @throws IllegalArgumentException if {@code reason} is not a
         *                                  suppression
         */
        public static Counter forSuppression(OutcomeReason reason) {
            return switch (reason) {
                case DUPLICATE -> SUPPRESSED_DUPLICATE;
                case MAINTENANCE_WINDOW -> SUPPRESSED_MAINTENANCE;
                case RATE_LIMIT -> SUPPRESSED_RATE_LIMIT;
                case BELOW_SEVERITY_THRESHOLD -> SUPPRESSED_SEVERITY;
                default -> throw new IllegalArgumentException("Not a suppression reason: " + reason);
            };
        }
    }

    private final Map<Counter, Long> values = new EnumMap<>(Counter.class);

    public AlertCounters() {
        for (Counter c : Counter.values()) {
            values.put(c, 0L);
        }
    }

    public void increment(Counter counter) {
        values.merge(counter, 1L, Long::sum);
    }

    public long get(Counter counter) {
        return values.get(counter);
    }

    /**
     * @return sum of the four suppression counters
     */
    public long totalSuppressed() {
        return get(Counter.SUPPRESSED_DUPLICATE)
                + get(Counter.SUPPRESSED_MAINTENANCE)
                + get(Counter.SUPPRESSED_RATE_LIMIT)
                + get(Counter.SUPPRESSED_SEVERITY);
    }

    /**
     * Add persisted values onto the current ones. Unknown keys and negative
     * values are ignored.
     *
     * @param persisted counter key → value
     */
    public void mergeFrom(Map<String, ? extends Number> persisted) {
        for (Counter c : Counter.values()) {
            Number n = persisted.get(c.key());
            if (n != null && n.longValue() > 0) {
                values.merge(c, n.longValue(), Long::sum);
            }
        }
    }

    /**
     * @return counter key → value, in declaration order
     */
    public Map<String, Long> asMap() {
        Map<String, Long> out = new LinkedHashMap<>();
        values.forEach((c, v) -> out.put(c.key(), v));
        return Collections.unmodifiableMap(out);
    }

    @Override
    public String toString() {
        return "AlertCounters" + asMap();
    }
}
