package com.alertsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Routing and filtering policy for a set of jobs.
 *
 * <p>
 * A rule matches a job when its {@code jobPattern} is a case-insensitive
 * substring of the job name; a rule without a pattern matches every job.
 * Matching is purely structural: the severity floor is applied only after a
 * rule has been selected.
 * </p>
 *
 * <p>
 * Mutable JavaBean so SnakeYAML can populate it. Call {@link #validate()}
 * before registering.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Channels used when a rule does not name any. */
    public static final List<String> DEFAULT_CHANNELS = List.of("slack");

    /** Unique rule name. */
    private String name;

    /** Case-insensitive substring of the job name; {@code null} matches all. */
    private String jobPattern;

    /** Lowest severity that gets through, e.g. "medium". */
    private String minSeverity = "low";

    /** Ordered delivery channels. */
    private List<String> channels = new ArrayList<>(DEFAULT_CHANNELS);

    /** Owning team, informational. */
    private String teamName;

    /** Alternate destination for this team, e.g. a dedicated webhook. */
    private String destinationOverride;

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param source rule to copy; must not be {@code null}
     * @return an independent rule with the same fields
     */
    public static AlertRule copyOf(AlertRule source) {
        Objects.requireNonNull(source, "AlertRule must not be null");
        AlertRule copy = new AlertRule();
        copy.name = source.name;
        copy.jobPattern = source.jobPattern;
        copy.minSeverity = source.minSeverity;
        copy.channels = new ArrayList<>(source.channels);
        copy.teamName = source.teamName;
        copy.destinationOverride = source.destinationOverride;
        return copy;
    }

    // ---------------------------------------------------------------
    // Behaviour
    // ---------------------------------------------------------------

    /**
     * @param jobName job identity to test
     * @return {@code true} if this rule's pattern applies to {@code jobName}
     */
    public boolean matchesJob(String jobName) {
        return matches(jobName, jobPattern);
    }

    /**
     * Pure pattern check shared by rule routing.
     *
     * @param jobName job identity, may be {@code null}
     * @param pattern substring pattern; {@code null} matches everything
     * @return {@code true} on a case-insensitive substring match
     */
    public static boolean matches(String jobName, String pattern) {
        if (pattern == null) {
            return true;
        }
        if (jobName == null) {
            return false;
        }
        return jobName.toLowerCase(Locale.ROOT).contains(pattern.toLowerCase(Locale.ROOT));
    }

    /**
     * @param severity severity of the candidate alert
     * @return {@code true} if it meets this rule's floor
     */
    public boolean severityPasses(Severity severity) {
        return severity.meetsOrExceeds(minSeverityLevel());
    }

    /**
     * @return the severity floor; an unparseable value ranks as {@code LOW}
     */
    public Severity minSeverityLevel() {
        return Severity.parse(minSeverity).orElse(Severity.LOW);
    }

    /**
     * @return the destination override, if any
     */
    public Optional<String> destination() {
        return destinationOverride == null || destinationOverride.isBlank()
                ? Optional.empty()
                : Optional.of(destinationOverride);
    }

    public RuleSummary summarize() {
        return new RuleSummary(name, jobPattern, minSeverityLevel().label(), channels, teamName);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Verify required fields and legal values.
     *
     * @throws IllegalStateException if the rule is malformed
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (Severity.parse(minSeverity).isEmpty()) {
            errors.add("Rule '" + name + "' has unknown minSeverity '" + minSeverity
                    + "'. Supported: low, medium, high, critical");
        }
        for (String channel : channels) {
            if (channel == null || channel.isBlank()) {
                errors.add("Rule '" + name + "' has a blank channel name");
                break;
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid AlertRule: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getJobPattern() {
        return jobPattern;
    }

    public void setJobPattern(String jobPattern) {
        this.jobPattern = jobPattern;
    }

    public String getMinSeverity() {
        return minSeverity;
    }

    /**
     * Set the severity floor, normalised to lowercase.
     *
     * @param minSeverity severity name
     */
    public void setMinSeverity(String minSeverity) {
        this.minSeverity = minSeverity != null ? minSeverity.trim().toLowerCase(Locale.ROOT) : "low";
    }

    public List<String> getChannels() {
        return List.copyOf(channels);
    }

    /**
     * Set the delivery channels; {@code null} or empty falls back to
     * {@link #DEFAULT_CHANNELS}.
     *
     * @param channels ordered channel names
     */
    public void setChannels(List<String> channels) {
        this.channels = channels == null || channels.isEmpty()
                ? new ArrayList<>(DEFAULT_CHANNELS)
                : new ArrayList<>(channels);
    }

    public String getTeamName() {
        return teamName;
    }

    public void setTeamName(String teamName) {
        this.teamName = teamName;
    }

    public String getDestinationOverride() {
        return destinationOverride;
    }

    public void setDestinationOverride(String destinationOverride) {
        this.destinationOverride = destinationOverride;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "name='" + name + '\'' +
                ", jobPattern='" + jobPattern + '\'' +
                ", minSeverity='" + minSeverity + '\'' +
                ", channels=" + channels +
                ", teamName='" + teamName + '\'' +
                ", destinationOverride=" + (destinationOverride != null ? "<set>" : "null") +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private final AlertRule rule = new AlertRule();

        public Builder name(String name) {
            rule.setName(name);
            return this;
        }

        public Builder jobPattern(String jobPattern) {
            rule.setJobPattern(jobPattern);
            return this;
        }

        public Builder minSeverity(String minSeverity) {
            rule.setMinSeverity(minSeverity);
            return this;
        }

        public Builder channels(String... channels) {
            rule.setChannels(List.of(channels));
            return this;
        }

        public Builder teamName(String teamName) {
            rule.setTeamName(teamName);
            return this;
        }

        public Builder destinationOverride(String destinationOverride) {
            rule.setDestinationOverride(destinationOverride);
            return this;
        }

        /**
         * @return the validated rule
         * @throws IllegalStateException if the rule is malformed
         */
        public AlertRule build() {
            rule.validate();
            return rule;
        }
    }
}
