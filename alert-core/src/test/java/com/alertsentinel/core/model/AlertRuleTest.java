package com.alertsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertRule}.
 */
class AlertRuleTest {

    @Test
    @DisplayName("Pattern matches case-insensitive substrings; null pattern matches everything")
    void patternMatching() {
        assertThat(AlertRule.matches("Deploy-PROD-eu", "deploy-prod")).isTrue();
        assertThat(AlertRule.matches("deploy-staging", "deploy-prod")).isFalse();
        assertThat(AlertRule.matches("anything", null)).isTrue();
        assertThat(AlertRule.matches(null, "x")).isFalse();
    }

    @Test
    @DisplayName("Defaults: low floor and slack channel")
    void defaults() {
        AlertRule rule = AlertRule.builder().name("catch-all").build();

        assertThat(rule.getMinSeverity()).isEqualTo("low");
        assertThat(rule.getChannels()).containsExactly("slack");
        assertThat(rule.destination()).isEmpty();
        assertThat(rule.matchesJob("whatever")).isTrue();
    }

    @Test
    @DisplayName("Empty channel list falls back to slack")
    void emptyChannelsFallBack() {
        AlertRule rule = new AlertRule();
        rule.setName("r");
        rule.setChannels(List.of());

        assertThat(rule.getChannels()).containsExactly("slack");
    }

    @Test
    @DisplayName("Severity floor is inclusive")
    void severityFloor() {
        AlertRule rule = AlertRule.builder().name("r").minSeverity("HIGH").build();

        assertThat(rule.getMinSeverity()).isEqualTo("high");
        assertThat(rule.severityPasses(Severity.CRITICAL)).isTrue();
        assertThat(rule.severityPasses(Severity.HIGH)).isTrue();
        assertThat(rule.severityPasses(Severity.MEDIUM)).isFalse();
    }

    @Test
    @DisplayName("Should reject missing name and unknown severity in one message")
    void validationCollectsErrors() {
        AlertRule rule = new AlertRule();
        rule.setMinSeverity("urgent");

        assertThatThrownBy(rule::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'name' is required")
                .hasMessageContaining("unknown minSeverity 'urgent'");
    }

    @Test
    @DisplayName("Should reject blank channel names")
    void rejectsBlankChannel() {
        assertThatThrownBy(() -> AlertRule.builder().name("r").channels("slack", " ").build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("blank channel");
    }

    @Test
    @DisplayName("Summary exposes the rule's routing settings")
    void summary() {
        RuleSummary summary = AlertRule.builder()
                .name("prod")
                .jobPattern("deploy-prod")
                .minSeverity("high")
                .channels("slack", "email")
                .teamName("On-Call")
                .build()
                .summarize();

        assertThat(summary.getName()).isEqualTo("prod");
        assertThat(summary.getJobPattern()).isEqualTo("deploy-prod");
        assertThat(summary.getMinSeverity()).isEqualTo("high");
        assertThat(summary.getChannels()).containsExactly("slack", "email");
        assertThat(summary.getTeamName()).isEqualTo("On-Call");
    }
}
