package com.alertsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Operator-declared period during which alerts are silenced.
 *
 * <p>
 * A window is active while {@code start <= now <= end} (both bounds
 * inclusive). When {@code affectedJobs} is absent the window covers every
 * job; otherwise only the listed job names, compared exactly. Expired
 * windows are never removed automatically; they simply evaluate inactive.
 * </p>
 *
 * @since 1.0.0
 */
public final class MaintenanceWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final Instant start;
    private final Instant end;
    private final Set<String> affectedJobs;

    /**
     * @param name         unique window name
     * @param start        first instant of the window
     * @param end          last instant of the window
     * @param affectedJobs job names covered, or {@code null} for all jobs
     * @throws IllegalArgumentException if a required field is missing, a job
     *                                  name is null or blank, or {@code end}
     *                                  precedes {@code start}
     */
    public MaintenanceWindow(String name, Instant start, Instant end, Collection<String> affectedJobs) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Maintenance window 'name' is required");
        }
        if (start == null || end == null) {
            throw new IllegalArgumentException(
                    "Maintenance window '" + name + "' requires both 'start' and 'end'");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException(
                    "Maintenance window '" + name + "' ends before it starts: " + start + " > " + end);
        }
        if (affectedJobs != null) {
            for (String job : affectedJobs) {
                if (job == null || job.isBlank()) {
                    throw new IllegalArgumentException(
                            "Maintenance window '" + name + "' has a null or blank affected job");
                }
            }
        }
        this.name = name;
        this.start = start;
        this.end = end;
        this.affectedJobs = affectedJobs != null
                ? Set.copyOf(new LinkedHashSet<>(affectedJobs))
                : null;
    }

    /**
     * Window covering every job.
     */
    public static MaintenanceWindow forAllJobs(String name, Instant start, Instant end) {
        return new MaintenanceWindow(name, start, end, null);
    }

    public boolean isActive(Instant now) {
        return !now.isBefore(start) && !now.isAfter(end);
    }

    public boolean affectsJob(String jobName) {
        return affectedJobs == null || affectedJobs.contains(jobName);
    }

    /**
     * @return {@code true} if this window silences {@code jobName} at
     *         {@code now}
     */
    public boolean suppresses(String jobName, Instant now) {
        return isActive(now) && affectsJob(jobName);
    }

    public WindowSummary summarize() {
        return new WindowSummary(name, start, end, affectedJobs);
    }

    public String getName() {
        return name;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    /**
     * @return the covered jobs, or empty when the window applies to all jobs
     */
    public Optional<Set<String>> getAffectedJobs() {
        return Optional.ofNullable(affectedJobs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MaintenanceWindow that))
            return false;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "MaintenanceWindow{" +
                "name='" + name + '\'' +
                ", start=" + start +
                ", end=" + end +
                ", affectedJobs=" + (affectedJobs != null ? affectedJobs : "ALL") +
                '}';
    }
}
