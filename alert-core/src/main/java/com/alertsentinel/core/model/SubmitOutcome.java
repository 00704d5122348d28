package com.alertsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Result of submitting one event to the pipeline.
 *
 * <p>
 * {@code sent} is {@code true} only when the submission triggered a flush
 * and the notifier reported success.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "sent", "reason", "job_name", "severity" })
public final class SubmitOutcome {

    private final boolean sent;
    private final OutcomeReason reason;
    private final String jobName;
    private final Severity severity;

    public SubmitOutcome(boolean sent, OutcomeReason reason, String jobName, Severity severity) {
        this.sent = sent;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.jobName = jobName;
        this.severity = severity;
    }

    public static SubmitOutcome suppressed(OutcomeReason reason, String jobName, Severity severity) {
        return new SubmitOutcome(false, reason, jobName, severity);
    }

    @JsonProperty("sent")
    public boolean isSent() {
        return sent;
    }

    @JsonProperty("reason")
    public OutcomeReason getReason() {
        return reason;
    }

    @JsonProperty("job_name")
    public String getJobName() {
        return jobName;
    }

    @JsonProperty("severity")
    public String getSeverityLabel() {
        return severity != null ? severity.label() : null;
    }

    /**
     * @return classified severity of the submitted event
     */
    public Severity severity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SubmitOutcome that))
            return false;
        return sent == that.sent
                && reason == that.reason
                && Objects.equals(jobName, that.jobName)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sent, reason, jobName, severity);
    }

    @Override
    public String toString() {
        return "SubmitOutcome{sent=" + sent + ", reason=" + reason
                + ", jobName='" + jobName + "', severity=" + severity + '}';
    }
}
