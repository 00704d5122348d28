package com.alertsentinel.core.config;

import com.alertsentinel.core.model.MaintenanceWindow;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * YAML form of a {@link MaintenanceWindow}.
 *
 * <p>
 * {@code start} and {@code end} accept an ISO-8601 instant
 * ({@code 2026-01-01T00:00:00Z}), an offset date-time
 * ({@code 2026-01-01T02:00:00+02:00}) or a local date-time
 * ({@code 2026-01-01T00:00:00}, read in the given zone). Quote them in YAML
 * so they stay strings.
 * </p>
 */
public class MaintenanceWindowConfig {

    private String name;
    private String start;
    private String end;
    private List<String> affectedJobs;

    /**
     * @param zone zone used for local date-times
     * @return the window
     * @throws IllegalArgumentException if a field is missing or unparseable
     */
    public MaintenanceWindow toWindow(ZoneId zone) {
        return new MaintenanceWindow(name,
                parseTime("start", start, zone),
                parseTime("end", end, zone),
                affectedJobs);
    }

    private Instant parseTime(String field, String value, ZoneId zone) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        try {
            return OffsetDateTime.parse(v).toInstant();
        } catch (DateTimeException ignored) {
            // not an offset date-time; try local below
        }
        try {
            return LocalDateTime.parse(v).atZone(zone).toInstant();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Maintenance window '" + name + "' has unparseable '"
                    + field + "': " + value, e);
        }
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }

    public List<String> getAffectedJobs() {
        return affectedJobs;
    }

    public void setAffectedJobs(List<String> affectedJobs) {
        this.affectedJobs = affectedJobs != null ? new ArrayList<>(affectedJobs) : null;
    }

    @Override
    public String toString() {
        return "MaintenanceWindowConfig{name='" + name + "', start='" + start + "', end='" + end
                + "', affectedJobs=" + affectedJobs + '}';
    }
}
