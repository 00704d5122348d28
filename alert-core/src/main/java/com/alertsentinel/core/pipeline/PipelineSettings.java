package com.alertsentinel.core.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of an {@link AlertPipeline}.
 *
 * <p>
 * Use the {@link Builder}; {@link Builder#build()} validates the values.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineSettings {

    public static final Duration DEFAULT_BATCH_WINDOW = Duration.ofSeconds(60);
    public static final Duration DEFAULT_DEDUP_WINDOW = Duration.ofSeconds(300);
    public static final int DEFAULT_MAX_ALERTS_PER_HOUR = 20;

    private final Duration batchWindow;
    private final Duration dedupWindow;
    private final int maxAlertsPerHour;

    private PipelineSettings(Builder b) {
        this.batchWindow = b.batchWindow;
        this.dedupWindow = b.dedupWindow;
        this.maxAlertsPerHour = b.maxAlertsPerHour;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return settings with every default
     */
    public static PipelineSettings defaults() {
        return builder().build();
    }

    public Duration getBatchWindow() {
        return batchWindow;
    }

    public Duration getDedupWindow() {
        return dedupWindow;
    }

    public int getMaxAlertsPerHour() {
        return maxAlertsPerHour;
    }

    @Override
    public String toString() {
        return "PipelineSettings{" +
                "batchWindow=" + batchWindow +
                ", dedupWindow=" + dedupWindow +
                ", maxAlertsPerHour=" + maxAlertsPerHour +
                '}';
    }

    /**
     * Fluent builder for {@link PipelineSettings}.
     */
    public static class Builder {
        private Duration batchWindow = DEFAULT_BATCH_WINDOW;
        private Duration dedupWindow = DEFAULT_DEDUP_WINDOW;
        private int maxAlertsPerHour = DEFAULT_MAX_ALERTS_PER_HOUR;

        public Builder batchWindow(Duration v) {
            this.batchWindow = v;
            return this;
        }

        public Builder dedupWindow(Duration v) {
            this.dedupWindow = v;
            return this;
        }

        public Builder maxAlertsPerHour(int v) {
            this.maxAlertsPerHour = v;
            return this;
        }

        /**
         * @return validated settings
         * @throws IllegalArgumentException if a window is negative or the
         *                                  hourly cap is below 1
         */
        public PipelineSettings build() {
            Objects.requireNonNull(batchWindow, "batchWindow required");
            Objects.requireNonNull(dedupWindow, "dedupWindow required");
            if (batchWindow.isNegative()) {
                throw new IllegalArgumentException("batchWindow must not be negative, got: " + batchWindow);
            }
            if (dedupWindow.isNegative()) {
                throw new IllegalArgumentException("dedupWindow must not be negative, got: " + dedupWindow);
            }
            if (maxAlertsPerHour < 1) {
                throw new IllegalArgumentException("maxAlertsPerHour must be >= 1, got: " + maxAlertsPerHour);
            }
            return new PipelineSettings(this);
        }
    }
}
