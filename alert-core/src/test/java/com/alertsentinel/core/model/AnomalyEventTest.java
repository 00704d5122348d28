package com.alertsentinel.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnomalyEvent}.
 */
class AnomalyEventTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Job name falls back from job_name to workflow_name to 'unknown'")
    void jobNameFallback() {
        assertThat(AnomalyEvent.builder().jobName("j").workflowName("w").build().getJobName()).isEqualTo("j");
        assertThat(AnomalyEvent.builder().workflowName("w").build().getJobName()).isEqualTo("w");
        assertThat(AnomalyEvent.builder().build().getJobName()).isEqualTo(AnomalyEvent.UNKNOWN_JOB);
    }

    @Test
    @DisplayName("Should read the scorer's JSON shape")
    void readsWireShape() throws Exception {
        String json = "{\"severity\":\"high\",\"max_z_score\":4.7,"
                + "\"data\":{\"job_name\":\"deploy-prod\",\"duration\":812.5,\"result\":\"failure\"},"
                + "\"anomaly_features\":[{\"feature\":\"duration\",\"value\":812.5,\"expected\":300.0,\"z_score\":4.7}],"
                + "\"extra\":true}";

        AnomalyEvent event = mapper.readValue(json, AnomalyEvent.class);

        assertThat(event.getJobName()).isEqualTo("deploy-prod");
        assertThat(event.getExplicitSeverity()).contains("high");
        assertThat(event.getAnomalyScore()).isEqualTo(4.7);
        assertThat(event.numericAttribute("duration")).contains(812.5);
        assertThat(event.stringAttribute("result")).contains("failure");
        assertThat(event.getFeatures()).singleElement()
                .satisfies(f -> {
                    assertThat(f.getName()).isEqualTo("duration");
                    assertThat(f.getDeviationScore()).isEqualTo(4.7);
                });
    }

    @Test
    @DisplayName("Absent score reads as zero and is reported as absent")
    void absentScore() {
        AnomalyEvent event = AnomalyEvent.builder().jobName("x").build();

        assertThat(event.hasAnomalyScore()).isFalse();
        assertThat(event.getAnomalyScore()).isZero();
    }

    @Test
    @DisplayName("Numeric attributes coerce string-encoded numbers")
    void numericCoercion() {
        AnomalyEvent event = AnomalyEvent.builder()
                .attribute("duration", "42.5")
                .attribute("result", "not-a-number")
                .build();

        assertThat(event.numericAttribute("duration")).contains(42.5);
        assertThat(event.numericAttribute("result")).isEmpty();
        assertThat(event.numericAttribute("missing")).isEmpty();
    }
}
