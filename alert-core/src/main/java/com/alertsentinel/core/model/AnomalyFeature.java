package com.alertsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * One metric that deviated from its expected value.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AnomalyFeature implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final double observedValue;
    private final double expectedValue;
    private final double deviationScore;

    /**
     * @param name           metric name, e.g. {@code duration}; must not be
     *                       {@code null}
     * @param observedValue  value seen in the run
     * @param expectedValue  value the scorer expected
     * @param deviationScore how far off the value is (z-score or equivalent)
     */
    @JsonCreator
    public AnomalyFeature(@JsonProperty("feature") String name,
            @JsonProperty("value") double observedValue,
            @JsonProperty("expected") double expectedValue,
            @JsonProperty("z_score") double deviationScore) {
        this.name = Objects.requireNonNull(name, "Feature name must not be null");
        this.observedValue = observedValue;
        this.expectedValue = expectedValue;
        this.deviationScore = deviationScore;
    }

    @JsonProperty("feature")
    public String getName() {
        return name;
    }

    @JsonProperty("value")
    public double getObservedValue() {
        return observedValue;
    }

    @JsonProperty("expected")
    public double getExpectedValue() {
        return expectedValue;
    }

    @JsonProperty("z_score")
    public double getDeviationScore() {
        return deviationScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyFeature that))
            return false;
        return Double.compare(observedValue, that.observedValue) == 0
                && Double.compare(expectedValue, that.expectedValue) == 0
                && Double.compare(deviationScore, that.deviationScore) == 0
                && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, observedValue, expectedValue, deviationScore);
    }

    @Override
    public String toString() {
        return "AnomalyFeature{" +
                "name='" + name + '\'' +
                ", observed=" + observedValue +
                ", expected=" + expectedValue +
                ", deviation=" + deviationScore +
                '}';
    }
}
