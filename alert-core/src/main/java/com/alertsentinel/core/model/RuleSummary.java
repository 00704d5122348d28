package com.alertsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Read-only view of a registered {@link AlertRule}.
 */
@JsonPropertyOrder({ "name", "job_pattern", "min_severity", "channels", "team_name" })
public final class RuleSummary {

    private final String name;
    private final String jobPattern;
    private final String minSeverity;
    private final List<String> channels;
    private final String teamName;

    public RuleSummary(String name, String jobPattern, String minSeverity,
            List<String> channels, String teamName) {
        this.name = name;
        this.jobPattern = jobPattern;
        this.minSeverity = minSeverity;
        this.channels = List.copyOf(channels);
        this.teamName = teamName;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("job_pattern")
    public String getJobPattern() {
        return jobPattern;
    }

    @JsonProperty("min_severity")
    public String getMinSeverity() {
        return minSeverity;
    }

    @JsonProperty("channels")
    public List<String> getChannels() {
        return channels;
    }

    @JsonProperty("team_name")
    public String getTeamName() {
        return teamName;
    }

    @Override
    public String toString() {
        return "RuleSummary{name='" + name + "', jobPattern='" + jobPattern
                + "', minSeverity='" + minSeverity + "', channels=" + channels
                + ", teamName='" + teamName + "'}";
    }
}
