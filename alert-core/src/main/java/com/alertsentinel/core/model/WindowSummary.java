package com.alertsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Set;

/**
 * Read-only view of a {@link MaintenanceWindow}. {@code affectedJobs} is
 * {@code null} when the window covers every job.
 */
@JsonPropertyOrder({ "name", "start", "end", "affected_jobs" })
public final class WindowSummary {

    private final String name;
    private final Instant start;
    private final Instant end;
    private final Set<String> affectedJobs;

    public WindowSummary(String name, Instant start, Instant end, Set<String> affectedJobs) {
        this.name = name;
        this.start = start;
        this.end = end;
        this.affectedJobs = affectedJobs;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("start")
    public Instant getStart() {
        return start;
    }

    @JsonProperty("end")
    public Instant getEnd() {
        return end;
    }

    @JsonProperty("affected_jobs")
    public Set<String> getAffectedJobs() {
        return affectedJobs;
    }

    @Override
    public String toString() {
        return "WindowSummary{name='" + name + "', start=" + start + ", end=" + end
                + ", affectedJobs=" + affectedJobs + '}';
    }
}
