package com.alertsentinel.core.pipeline;

import com.alertsentinel.core.state.AlertCounters;
import com.alertsentinel.core.state.AlertCounters.Counter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Locale;

/**
 * Point-in-time operational summary of an {@link AlertPipeline}.
 *
 * <p>
 * Serialises to JSON with snake_case keys. {@code suppression_rate} is
 * {@code total_suppressed / max(total_received, 1)}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({
        "total_received", "total_sent",
        "suppressed_duplicate", "suppressed_maintenance", "suppressed_rate_limit", "suppressed_severity",
        "batched", "total_suppressed", "suppression_rate",
        "pending_in_batch", "active_maintenance_windows", "registered_rules", "alerts_last_hour"
})
public final class PipelineStats {

    private final long totalReceived;
    private final long totalSent;
    private final long suppressedDuplicate;
    private final long suppressedMaintenance;
    private final long suppressedRateLimit;
    private final long suppressedSeverity;
    private final long batched;
    private final long totalSuppressed;
    private final double suppressionRate;
    private final int pendingInBatch;
    private final int activeMaintenanceWindows;
    private final int registeredRules;
    private final int alertsLastHour;

    private PipelineStats(AlertCounters counters, int pendingInBatch, int activeMaintenanceWindows,
            int registeredRules, int alertsLastHour) {
        this.totalReceived = counters.get(Counter.TOTAL_RECEIVED);
        this.totalSent = counters.get(Counter.TOTAL_SENT);
        this.suppressedDuplicate = counters.get(Counter.SUPPRESSED_DUPLICATE);
        this.suppressedMaintenance = counters.get(Counter.SUPPRESSED_MAINTENANCE);
        this.suppressedRateLimit = counters.get(Counter.SUPPRESSED_RATE_LIMIT);
        this.suppressedSeverity = counters.get(Counter.SUPPRESSED_SEVERITY);
        this.batched = counters.get(Counter.BATCHED);
        this.totalSuppressed = counters.totalSuppressed();
        this.suppressionRate = (double) totalSuppressed / Math.max(totalReceived, 1L);
        this.pendingInBatch = pendingInBatch;
        this.activeMaintenanceWindows = activeMaintenanceWindows;
        this.registeredRules = registeredRules;
        this.alertsLastHour = alertsLastHour;
    }

    static PipelineStats of(AlertCounters counters, int pendingInBatch, int activeMaintenanceWindows,
            int registeredRules, int alertsLastHour) {
        return new PipelineStats(counters, pendingInBatch, activeMaintenanceWindows,
                registeredRules, alertsLastHour);
    }

    @JsonProperty("total_received")
    public long getTotalReceived() {
        return totalReceived;
    }

    @JsonProperty("total_sent")
    public long getTotalSent() {
        return totalSent;
    }

    @JsonProperty("suppressed_duplicate")
    public long getSuppressedDuplicate() {
        return suppressedDuplicate;
    }

    @JsonProperty("suppressed_maintenance")
    public long getSuppressedMaintenance() {
        return suppressedMaintenance;
    }

    @JsonProperty("suppressed_rate_limit")
    public long getSuppressedRateLimit() {
        return suppressedRateLimit;
    }

    @JsonProperty("suppressed_severity")
    public long getSuppressedSeverity() {
        return suppressedSeverity;
    }

    @JsonProperty("batched")
    public long getBatched() {
        return batched;
    }

    @JsonProperty("total_suppressed")
    public long getTotalSuppressed() {
        return totalSuppressed;
    }

    @JsonProperty("suppression_rate")
    public double getSuppressionRate() {
        return suppressionRate;
    }

    @JsonProperty("pending_in_batch")
    public int getPendingInBatch() {
        return pendingInBatch;
    }

    @JsonProperty("active_maintenance_windows")
    public int getActiveMaintenanceWindows() {
        return activeMaintenanceWindows;
    }

    @JsonProperty("registered_rules")
    public int getRegisteredRules() {
        return registeredRules;
    }

    @JsonProperty("alerts_last_hour")
    public int getAlertsLastHour() {
        return alertsLastHour;
    }

    @Override
    public String toString() {
        return "PipelineStats{" +
                "received=" + totalReceived +
                ", sent=" + totalSent +
                ", suppressed=" + totalSuppressed +
                " (duplicate=" + suppressedDuplicate +
                ", maintenance=" + suppressedMaintenance +
                ", rateLimit=" + suppressedRateLimit +
                ", severity=" + suppressedSeverity +
                "), batched=" + batched +
                ", suppressionRate=" + String.format(Locale.ROOT, "%.3f", suppressionRate) +
                ", pending=" + pendingInBatch +
                ", activeWindows=" + activeMaintenanceWindows +
                ", rules=" + registeredRules +
                ", alertsLastHour=" + alertsLastHour +
                '}';
    }
}
