package com.alertsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single anomaly detected in CI/CD metrics, as handed over by a scorer.
 *
 * <p>
 * The JSON shape is the one the scorers emit:
 * </p>
 *
 * <pre>
 * {
 *   "severity": "high",
 *   "max_z_score": 4.5,
 *   "data": { "job_name": "deploy-prod", "duration": 800 },
 *   "anomaly_features": [
 *     { "feature": "duration", "value": 800, "expected": 300, "z_score": 4.5 }
 *   ]
 * }
 * </pre>
 *
 * <p>
 * Instances are immutable. The {@code data} map carries arbitrary run
 * attributes; the job identity is read from {@code job_name}, then
 * {@code workflow_name}, and falls back to {@value #UNKNOWN_JOB}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnomalyEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Job identity used when the event carries none. */
    public static final String UNKNOWN_JOB = "unknown";

    static final String JOB_NAME_KEY = "job_name";
    static final String WORKFLOW_NAME_KEY = "workflow_name";

    private final String severity;
    private final Double anomalyScore;
    private final Map<String, Object> data;
    private final List<AnomalyFeature> features;

    @JsonCreator
    public AnomalyEvent(@JsonProperty("severity") String severity,
            @JsonProperty("max_z_score") Double anomalyScore,
            @JsonProperty("data") Map<String, Object> data,
            @JsonProperty("anomaly_features") List<AnomalyFeature> features) {
        this.severity = severity;
        this.anomalyScore = anomalyScore;
        this.data = data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>();
        this.features = features != null ? new ArrayList<>(features) : new ArrayList<>();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * Resolve the job identity. Never {@code null}.
     *
     * @return {@code job_name}, else {@code workflow_name}, else
     *         {@value #UNKNOWN_JOB}
     */
    @JsonIgnore
    public String getJobName() {
        return stringAttribute(JOB_NAME_KEY)
                .or(() -> stringAttribute(WORKFLOW_NAME_KEY))
                .orElse(UNKNOWN_JOB);
    }

    /**
     * @return explicit severity as supplied by the scorer, if any
     */
    @JsonIgnore
    public Optional<String> getExplicitSeverity() {
        return severity == null || severity.isBlank() ? Optional.empty() : Optional.of(severity);
    }

    @JsonProperty("severity")
    String getSeverity() {
        return severity;
    }

    /**
     * @return the anomaly score, or {@code 0} when the scorer supplied none
     */
    @JsonIgnore
    public double getAnomalyScore() {
        return anomalyScore != null ? anomalyScore : 0.0;
    }

    @JsonIgnore
    public boolean hasAnomalyScore() {
        return anomalyScore != null;
    }

    @JsonProperty("max_z_score")
    Double getRawAnomalyScore() {
        return anomalyScore;
    }

    /**
     * @return unmodifiable view of the run attributes
     */
    @JsonProperty("data")
    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    /**
     * @return unmodifiable list of anomalous features, in scorer order
     */
    @JsonProperty("anomaly_features")
    public List<AnomalyFeature> getFeatures() {
        return Collections.unmodifiableList(features);
    }

    /**
     * Retrieve a numeric attribute, coercing string-encoded numbers.
     *
     * @param key attribute name
     * @return the value as a {@code double}, or empty
     */
    public Optional<Double> numericAttribute(String key) {
        Object raw = data.get(key);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * @param key attribute name
     * @return the non-blank string form of the attribute, or empty
     */
    public Optional<String> stringAttribute(String key) {
        Object raw = data.get(key);
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.toString();
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyEvent that))
            return false;
        return Objects.equals(severity, that.severity)
                && Objects.equals(anomalyScore, that.anomalyScore)
                && data.equals(that.data)
                && features.equals(that.features);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, anomalyScore, data, features);
    }

    @Override
    public String toString() {
        return "AnomalyEvent{" +
                "job='" + getJobName() + '\'' +
                ", severity='" + severity + '\'' +
                ", score=" + anomalyScore +
                ", features=" + features.size() +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder, mainly for producers written in Java and for tests.
     */
    public static class Builder {
        private String severity;
        private Double anomalyScore;
        private final Map<String, Object> data = new LinkedHashMap<>();
        private final List<AnomalyFeature> features = new ArrayList<>();

        public Builder jobName(String jobName) {
            data.put(JOB_NAME_KEY, jobName);
            return this;
        }

        public Builder workflowName(String workflowName) {
            data.put(WORKFLOW_NAME_KEY, workflowName);
            return this;
        }

        public Builder severity(String severity) {
            this.severity = severity;
            return this;
        }

        public Builder anomalyScore(double anomalyScore) {
            this.anomalyScore = anomalyScore;
            return this;
        }

        public Builder attribute(String key, Object value) {
            data.put(Objects.requireNonNull(key, "Attribute key must not be null"), value);
            return this;
        }

        public Builder feature(String name, double observed, double expected, double deviation) {
            features.add(new AnomalyFeature(name, observed, expected, deviation));
            return this;
        }

        public Builder feature(AnomalyFeature feature) {
            features.add(Objects.requireNonNull(feature, "Feature must not be null"));
            return this;
        }

        public AnomalyEvent build() {
            return new AnomalyEvent(severity, anomalyScore, data, features);
        }
    }
}
