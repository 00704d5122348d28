package com.alertsentinel.core.gate;

import com.alertsentinel.core.model.MaintenanceWindow;
import com.alertsentinel.core.model.OutcomeReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Silences jobs covered by an active {@link MaintenanceWindow}.
 *
 * <p>
 * Windows are OR-combined: one active window that covers the job is enough.
 * The gate also owns the window registry; names are unique and expired
 * windows stay registered until removed.
 * </p>
 *
 * @since 1.0.0
 */
public class MaintenanceGate implements SuppressionGate {

    private static final Logger LOG = LoggerFactory.getLogger(MaintenanceGate.class);

    private final Map<String, MaintenanceWindow> windows = new LinkedHashMap<>();

    @Override
    public boolean suppresses(GateContext context) {
        return isSilenced(context.getJobName(), context.getNow());
    }

    @Override
    public OutcomeReason reason() {
        return OutcomeReason.MAINTENANCE_WINDOW;
    }

    /**
     * @return {@code true} if any registered window silences {@code jobName}
     *         at {@code now}
     */
    public boolean isSilenced(String jobName, Instant now) {
        for (MaintenanceWindow window : windows.values()) {
            if (window.suppresses(jobName, now)) {
                LOG.trace("Job {} silenced by window {}", jobName, window.getName());
                return true;
            }
        }
        return false;
    }

    /**
     * @param window window to register; must not be {@code null}
     * @throws IllegalArgumentException if a window with the same name exists
     */
    public void add(MaintenanceWindow window) {
        Objects.requireNonNull(window, "Maintenance window must not be null");
        if (windows.containsKey(window.getName())) {
            throw new IllegalArgumentException(
                    "Maintenance window already registered: " + window.getName());
        }
        windows.put(window.getName(), window);
    }

    /**
     * @param name window name
     * @return {@code true} if a window was removed
     */
    public boolean remove(String name) {
        return windows.remove(name) != null;
    }

    /**
     * @param now evaluation instant
     * @return windows active at {@code now}, in registration order
     */
    public List<MaintenanceWindow> activeWindows(Instant now) {
        return windows.values().stream()
                .filter(w -> w.isActive(now))
                .toList();
    }

    public int size() {
        return windows.size();
    }
}
