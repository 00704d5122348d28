package com.alertsentinel.core.config;

import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.MaintenanceWindow;
import com.alertsentinel.core.pipeline.PipelineSettings;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the alerting YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * batchWindowSeconds: 60
 * dedupWindowSeconds: 300
 * maxAlertsPerHour: 20
 * rules:
 *   - name: production-oncall
 *     jobPattern: deploy-prod
 *     minSeverity: high
 *     channels: [slack, email]
 *     teamName: On-Call
 * maintenanceWindows:
 *   - name: staging-deploy
 *     start: "2026-01-01T00:00:00Z"
 *     end: "2026-01-01T02:00:00Z"
 *     affectedJobs: [deploy-staging]
 * </pre>
 *
 * <p>
 * Rules keep file order, which is also their matching priority. Call
 * {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertingConfig {

    private long batchWindowSeconds = PipelineSettings.DEFAULT_BATCH_WINDOW.getSeconds();
    private long dedupWindowSeconds = PipelineSettings.DEFAULT_DEDUP_WINDOW.getSeconds();
    private int maxAlertsPerHour = PipelineSettings.DEFAULT_MAX_ALERTS_PER_HOUR;
    private List<AlertRule> rules = new ArrayList<>();
    private List<MaintenanceWindowConfig> maintenanceWindows = new ArrayList<>();

    /**
     * @return validated pipeline settings
     * @throws IllegalArgumentException if a value is out of range
     */
    public PipelineSettings toSettings() {
        return PipelineSettings.builder()
                .batchWindow(Duration.ofSeconds(batchWindowSeconds))
                .dedupWindow(Duration.ofSeconds(dedupWindowSeconds))
                .maxAlertsPerHour(maxAlertsPerHour)
                .build();
    }

    /**
     * Window times written without an offset are read in the system default
     * zone, the same zone {@link #validate()} checks them in.
     *
     * @return the configured windows, in file order
     */
    public List<MaintenanceWindow> toWindows() {
        return toWindows(ZoneId.systemDefault());
    }

    /**
     * @param zone zone for window times written without an offset
     * @return the configured windows, in file order
     */
    public List<MaintenanceWindow> toWindows(ZoneId zone) {
        return maintenanceWindows.stream().map(w -> w.toWindow(zone)).toList();
    }

    /**
     * Check every setting, rule and window, collecting all errors.
     *
     * @throws IllegalStateException if anything is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            toSettings();
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }

        Set<String> ruleNames = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            AlertRule rule = rules.get(i);
            if (rule == null) {
                errors.add("Rule at index " + i + " is null");
                continue;
            }
            try {
                rule.validate();
                if (!ruleNames.add(rule.getName())) {
                    errors.add("Duplicate rule name: " + rule.getName());
                }
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        Set<String> windowNames = new HashSet<>();
        for (int i = 0; i < maintenanceWindows.size(); i++) {
            MaintenanceWindowConfig window = maintenanceWindows.get(i);
            if (window == null) {
                errors.add("Maintenance window at index " + i + " is null");
                continue;
            }
            try {
                window.toWindow(ZoneId.systemDefault());
                if (!windowNames.add(window.getName())) {
                    errors.add("Duplicate maintenance window name: " + window.getName());
                }
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Alerting configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public long getBatchWindowSeconds() {
        return batchWindowSeconds;
    }

    public void setBatchWindowSeconds(long batchWindowSeconds) {
        this.batchWindowSeconds = batchWindowSeconds;
    }

    public long getDedupWindowSeconds() {
        return dedupWindowSeconds;
    }

    public void setDedupWindowSeconds(long dedupWindowSeconds) {
        this.dedupWindowSeconds = dedupWindowSeconds;
    }

    public int getMaxAlertsPerHour() {
        return maxAlertsPerHour;
    }

    public void setMaxAlertsPerHour(int maxAlertsPerHour) {
        this.maxAlertsPerHour = maxAlertsPerHour;
    }

    /**
     * @return unmodifiable list of rules, in priority order
     */
    public List<AlertRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void setRules(List<AlertRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    public List<MaintenanceWindowConfig> getMaintenanceWindows() {
        return Collections.unmodifiableList(maintenanceWindows);
    }

    public void setMaintenanceWindows(List<MaintenanceWindowConfig> maintenanceWindows) {
        this.maintenanceWindows = maintenanceWindows != null
                ? new ArrayList<>(maintenanceWindows)
                : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "AlertingConfig{" +
                "batchWindowSeconds=" + batchWindowSeconds +
                ", dedupWindowSeconds=" + dedupWindowSeconds +
                ", maxAlertsPerHour=" + maxAlertsPerHour +
                ", rules=" + rules +
                ", maintenanceWindows=" + maintenanceWindows +
                '}';
    }
}
