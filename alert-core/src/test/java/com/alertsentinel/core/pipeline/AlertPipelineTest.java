package com.alertsentinel.core.pipeline;

import com.alertsentinel.core.batch.BatchState;
import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.AnomalyEvent;
import com.alertsentinel.core.model.MaintenanceWindow;
import com.alertsentinel.core.model.OutcomeReason;
import com.alertsentinel.core.model.RuleSummary;
import com.alertsentinel.core.model.SubmitOutcome;
import com.alertsentinel.core.notify.Notifier;
import com.alertsentinel.core.state.InMemoryStateStore;
import com.alertsentinel.core.state.JsonFileStateStore;
import com.alertsentinel.core.state.StateStore;
import com.alertsentinel.core.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Behavioural tests for {@link AlertPipeline}.
 */
@ExtendWith(MockitoExtension.class)
class AlertPipelineTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private static final PipelineSettings IMMEDIATE = PipelineSettings.builder()
            .batchWindow(Duration.ZERO)
            .build();

    @Mock
    private Notifier notifier;

    @Mock
    private Notifier routedNotifier;

    private MutableClock clock;
    private InMemoryStateStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryStateStore();
        lenient().when(notifier.sendOne(any(), anyList())).thenReturn(true);
        lenient().when(notifier.sendBatch(anyList())).thenReturn(true);
        lenient().when(routedNotifier.sendOne(any(), anyList())).thenReturn(true);
        lenient().when(routedNotifier.sendBatch(anyList())).thenReturn(true);
    }

    // ------------------------------------------------------------------
    // Routing and severity
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Production alert is routed to the on-call destination on the rule's channels")
    void routesToRuleDestination() {
        when(notifier.withDestination("#prod-oncall")).thenReturn(routedNotifier);
        AlertPipeline pipeline = pipeline(IMMEDIATE);
        registerStandardRules(pipeline);

        AnomalyEvent event = event("deploy-prod", "high");
        SubmitOutcome outcome = pipeline.submit(event);

        assertThat(outcome.isSent()).isTrue();
        assertThat(outcome.getReason()).isEqualTo(OutcomeReason.BATCH_FLUSHED);
        assertThat(outcome.getSeverityLabel()).isEqualTo("high");
        verify(routedNotifier).sendOne(event, List.of("slack", "email"));
        verify(notifier, never()).sendOne(any(), anyList());
    }

    @Test
    @DisplayName("Queued production alert is delivered on flush; staging noise is filtered by the default rule")
    void endToEndQueueThenFlush() {
        AlertPipeline pipeline = pipeline(PipelineSettings.defaults());
        pipeline.addRule(AlertRule.builder().name("prod-oncall").jobPattern("deploy-prod")
                .minSeverity("high").channels("slack", "email").build());
        pipeline.addRule(AlertRule.builder().name("default").minSeverity("medium").build());

        AnomalyEvent prod = event("deploy-prod-us", "high");
        assertThat(pipeline.submit(prod).getReason()).isEqualTo(OutcomeReason.QUEUED_IN_BATCH);
        assertThat(pipeline.submit(event("deploy-staging", "low")).getReason())
                .isEqualTo(OutcomeReason.BELOW_SEVERITY_THRESHOLD);
        verifyNoInteractions(notifier);

        assertThat(pipeline.flushNow()).isTrue();

        verify(notifier).sendOne(prod, List.of("slack", "email"));
    }

    @Test
    @DisplayName("Alert below the matched rule's floor is suppressed")
    void belowSeverityFloor() {
        AlertPipeline pipeline = pipeline(IMMEDIATE);
        registerStandardRules(pipeline);

        SubmitOutcome prodMedium = pipeline.submit(event("deploy-prod", "medium"));
        SubmitOutcome unitLow = pipeline.submit(event("unit-tests", "low"));

        assertThat(prodMedium.isSent()).isFalse();
        assertThat(prodMedium.getReason()).isEqualTo(OutcomeReason.BELOW_SEVERITY_THRESHOLD);
        assertThat(unitLow.getReason()).isEqualTo(OutcomeReason.BELOW_SEVERITY_THRESHOLD);

        PipelineStats stats = pipeline.getStats();
        assertThat(stats.getSuppressedSeverity()).isEqualTo(2);
        assertThat(stats.getTotalSent()).isZero();
        verifyNoInteractions(notifier);
    }

    @Test
    @DisplayName("Without any rule every severity is admitted on the default channel")
    void noRulesAdmitsEverything() {
        AlertPipeline pipeline = pipeline(IMMEDIATE);
        AnomalyEvent event = event("unit-tests", "low");

        assertThat(pipeline.submit(event).isSent()).isTrue();
        verify(notifier).sendOne(event, List.of("slack"));
    }

    @Test
    @DisplayName("Caller channel override beats the rule's channels")
    void channelOverride() {
        AlertPipeline pipeline = pipeline(IMMEDIATE);
        pipeline.addRule(AlertRule.builder().name("all").channels("slack", "email").build());
        AnomalyEvent event = event("ci", "critical");

        pipeline.submit(event, List.of("webhook"), false);

        verify(notifier).sendOne(event, List.of("webhook"));
    }

    @Test
    @DisplayName("Override with a null channel is rejected before anything is recorded")
    void invalidChannelOverride() {
        AlertPipeline pipeline = pipeline(IMMEDIATE);
        AnomalyEvent event = event("ci", "critical");

        assertThatThrownBy(() -> pipeline.submit(event, Arrays.asList("slack", null), false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("null or blank");
        assertThatThrownBy(() -> pipeline.submit(event, List.of(" "), true))
                .isInstanceOf(IllegalArgumentException.class);

        PipelineStats stats = pipeline.getStats();
        assertThat(stats.getTotalReceived()).isZero();
        assertThat(stats.getBatched()).isZero();
        assertThat(stats.getPendingInBatch()).isZero();
        verifyNoInteractions(notifier);

        assertThat(pipeline.submit(event).getReason()).isEqualTo(OutcomeReason.BATCH_FLUSHED);
        verify(notifier).sendOne(event, List.of("slack"));
    }

    @Test
    @DisplayName("Flush with a null channel override keeps the batch pending")
    void invalidFlushOverride() {
        AlertPipeline pipeline = pipeline(PipelineSettings.defaults());
        pipeline.submit(event("ci", "high"));

        assertThatThrownBy(() -> pipeline.flushNow(Arrays.asList((String) null)))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(pipeline.getStats().getPendingInBatch()).isEqualTo(1);
        verifyNoInteractions(notifier);
    }

    @Test
    @DisplayName("Changing a rule after adding it does not change how alerts are filtered")
    void ruleChangedAfterAdd() {
        AlertPipeline pipeline = pipeline(IMMEDIATE);
        AlertRule strict = AlertRule.builder().name("a").jobPattern("x").minSeverity("critical").build();
        pipeline.addRule(strict);
        pipeline.addRule(AlertRule.builder().name("b").build());

        strict.setName("b");
        strict.setMinSeverity("urgent");

        assertThat(pipeline.submit(event("x-job", "low")).getReason())
                .isEqualTo(OutcomeReason.BELOW_SEVERITY_THRESHOLD);
        assertThat(pipeline.listRules()).extracting(RuleSummary::getName).containsExactly("a", "b");
        assertThat(pipeline.removeRule("b")).isTrue();
        assertThat(pipeline.getStats().getRegisteredRules()).isEqualTo(1);
    }

    @Test
    @DisplayName("Flushed batch is routed by its first pending event")
    void batchRoutedByFirstEvent() {
        when(notifier.withDestination("#prod-oncall")).thenReturn(routedNotifier);
        AlertPipeline pipeline = pipeline(PipelineSettings.defaults());
        registerStandardRules(pipeline);

        AnomalyEvent prod = event("deploy-prod", "critical");
        AnomalyEvent unit = event("unit-tests", "medium");
        assertThat(pipeline.submit(prod).getReason()).isEqualTo(OutcomeReason.QUEUED_IN_BATCH);
        assertThat(pipeline.submit(unit).getReason()).isEqualTo(OutcomeReason.QUEUED_IN_BATCH);
        assertThat(pipeline.getBatchState()).isEqualTo(BatchState.OPEN);

        assertThat(pipeline.flushNow()).isTrue();

        verify(routedNotifier).sendBatch(List.of(prod, unit));
        assertThat(pipeline.getBatchState()).isEqualTo(BatchState.EMPTY);
        assertThat(pipeline.getStats().getTotalSent()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Gates
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Repeat within the dedup window is suppressed; after it the batch flushes")
    void deduplication() {
        AlertPipeline pipeline = pipeline(PipelineSettings.defaults());
        AnomalyEvent event = event("deploy-prod", "high");

        assertThat(pipeline.submit(event).getReason()).isEqualTo(OutcomeReason.QUEUED_IN_BATCH);
        clock.advance(Duration.ofSeconds(10));
        assertThat(pipeline.submit(event).getReason()).isEqualTo(OutcomeReason.DUPLICATE);

        clock.set(T0.plusSeconds(300));
        SubmitOutcome outcome = pipeline.submit(event);

        assertThat(outcome.getReason()).isEqualTo(OutcomeReason.BATCH_FLUSHED);
        assertThat(outcome.isSent()).isTrue();
        verify(notifier).sendBatch(List.of(event, event));
        assertThat(pipeline.getStats().getSuppressedDuplicate()).isEqualTo(1);
    }

    @Test
    @DisplayName("Hourly cap suppresses further alerts until the oldest send ages out")
    void rateLimit() {
        AlertPipeline pipeline = pipeline(PipelineSettings.builder()
                .batchWindow(Duration.ZERO)
                .dedupWindow(Duration.ZERO)
                .maxAlertsPerHour(2)
                .build());

        assertThat(pipeline.submit(event("a", "high")).isSent()).isTrue();
        assertThat(pipeline.submit(event("b", "high")).isSent()).isTrue();
        SubmitOutcome limited = pipeline.submit(event("c", "high"));

        assertThat(limited.isSent()).isFalse();
        assertThat(limited.getReason()).isEqualTo(OutcomeReason.RATE_LIMIT);
        assertThat(pipeline.getStats().getAlertsLastHour()).isEqualTo(2);

        clock.advance(Duration.ofHours(1));
        assertThat(pipeline.submit(event("c", "high")).isSent()).isTrue();
        assertThat(pipeline.getStats().getSuppressedRateLimit()).isEqualTo(1);
    }

    @Test
    @DisplayName("Active maintenance window suppresses; forced delivery bypasses it on every channel")
    void maintenanceAndForce() {
        AlertPipeline pipeline = pipeline(PipelineSettings.defaults());
        pipeline.addRule(AlertRule.builder().name("prod").jobPattern("deploy-prod")
                .destinationOverride("#prod-oncall").build());
        pipeline.addMaintenanceWindow(MaintenanceWindow.forAllJobs("upgrade",
                T0.minusSeconds(60), T0.plusSeconds(3600)));

        AnomalyEvent event = event("deploy-prod", "critical");
        SubmitOutcome suppressed = pipeline.submit(event);
        SubmitOutcome forced = pipeline.submit(event, null, true);

        assertThat(suppressed.getReason()).isEqualTo(OutcomeReason.MAINTENANCE_WINDOW);
        assertThat(forced.isSent()).isTrue();
        assertThat(forced.getReason()).isEqualTo(OutcomeReason.BATCH_FLUSHED);
        verify(notifier).sendOne(event, AlertPipeline.ALL_CHANNELS);
        verify(notifier, never()).withDestination(anyString());
        assertThat(pipeline.listActiveWindows()).extracting("name").containsExactly("upgrade");
    }

    @Test
    @DisplayName("Maintenance window for other jobs does not suppress")
    void maintenanceForOtherJobs() {
        AlertPipeline pipeline = pipeline(IMMEDIATE);
        pipeline.addMaintenanceWindow(new MaintenanceWindow("staging",
                T0, T0.plusSeconds(3600), List.of("deploy-staging")));

        assertThat(pipeline.submit(event("deploy-staging", "high")).getReason())
                .isEqualTo(OutcomeReason.MAINTENANCE_WINDOW);
        assertThat(pipeline.submit(event("deploy-prod", "high")).isSent()).isTrue();
        assertThat(pipeline.getStats().getSuppressedMaintenance()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Flush and delivery failures
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Flushing an empty pipeline succeeds without calling the notifier")
    void flushEmpty() {
        AlertPipeline pipeline = pipeline(PipelineSettings.defaults());

        assertThat(pipeline.flushNow()).isTrue();
        verifyNoInteractions(notifier);
    }

    @Test
    @DisplayName("Notifier exception reports not sent but still counts the send")
    void notifierFailure() {
        when(notifier.sendOne(any(), anyList())).thenThrow(new IllegalStateException("slack down"));
        AlertPipeline pipeline = pipeline(IMMEDIATE);

        SubmitOutcome outcome = pipeline.submit(event("ci", "high"));

        assertThat(outcome.isSent()).isFalse();
        assertThat(outcome.getReason()).isEqualTo(OutcomeReason.BATCH_FLUSHED);
        PipelineStats stats = pipeline.getStats();
        assertThat(stats.getTotalSent()).isEqualTo(1);
        assertThat(stats.getAlertsLastHour()).isEqualTo(1);
        assertThat(stats.getPendingInBatch()).isZero();
    }

    @Test
    @DisplayName("Notifier reporting failure is passed through")
    void notifierReportsFailure() {
        when(notifier.sendOne(any(), anyList())).thenReturn(false);
        AlertPipeline pipeline = pipeline(IMMEDIATE);

        assertThat(pipeline.submit(event("ci", "high")).isSent()).isFalse();
    }

    // ------------------------------------------------------------------
    // State
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Restarted pipeline keeps dedup memory, send history and counters")
    void restoresState() {
        AnomalyEvent event = event("deploy-prod", "high");
        pipeline(IMMEDIATE).submit(event);

        AlertPipeline restarted = pipeline(IMMEDIATE);
        clock.advance(Duration.ofSeconds(30));

        assertThat(restarted.submit(event).getReason()).isEqualTo(OutcomeReason.DUPLICATE);
        PipelineStats stats = restarted.getStats();
        assertThat(stats.getTotalReceived()).isEqualTo(2);
        assertThat(stats.getTotalSent()).isEqualTo(1);
        assertThat(stats.getAlertsLastHour()).isEqualTo(1);
    }

    @Test
    @DisplayName("State survives a restart through the JSON file store")
    void restoresStateFromFile(@TempDir Path tempDir) {
        JsonFileStateStore fileStore = new JsonFileStateStore(tempDir.resolve("state.json"));
        AnomalyEvent event = event("deploy-prod", "high");
        new AlertPipeline(IMMEDIATE, notifier, fileStore, clock).submit(event);

        AlertPipeline restarted = new AlertPipeline(IMMEDIATE, notifier, fileStore, clock);

        assertThat(restarted.submit(event).getReason()).isEqualTo(OutcomeReason.DUPLICATE);
        assertThat(restarted.getStats().getTotalSent()).isEqualTo(1);
    }

    @Test
    @DisplayName("State store failures are logged and never reach the caller")
    void storeFailuresAreSwallowed() throws IOException {
        StateStore failing = mock(StateStore.class);
        when(failing.load()).thenThrow(new IOException("disk gone"));
        doThrow(new IOException("disk full")).when(failing).save(any());

        AlertPipeline pipeline = new AlertPipeline(IMMEDIATE, notifier, failing, clock);

        assertThat(pipeline.submit(event("ci", "high")).isSent()).isTrue();
        assertThat(pipeline.getStats().getTotalSent()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Management and statistics
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Rules and windows can be listed, removed and are unique by name")
    void management() {
        AlertPipeline pipeline = pipeline(PipelineSettings.defaults());
        registerStandardRules(pipeline);
        pipeline.addMaintenanceWindow(MaintenanceWindow.forAllJobs("w", T0, T0.plusSeconds(60)));

        assertThat(pipeline.listRules()).extracting(RuleSummary::getName)
                .containsExactly("prod-oncall", "default");
        assertThatThrownBy(() -> pipeline.addRule(AlertRule.builder().name("default").build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pipeline.addMaintenanceWindow(
                MaintenanceWindow.forAllJobs("w", T0, T0.plusSeconds(5))))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(pipeline.removeRule("prod-oncall")).isTrue();
        assertThat(pipeline.removeRule("missing")).isFalse();
        assertThat(pipeline.removeMaintenanceWindow("w")).isTrue();
        assertThat(pipeline.listActiveWindows()).isEmpty();
        assertThat(pipeline.getStats().getRegisteredRules()).isEqualTo(1);
    }

    @Test
    @DisplayName("Statistics report counters, suppression rate and pending batch size")
    void statistics() {
        AlertPipeline pipeline = pipeline(PipelineSettings.defaults());
        AnomalyEvent event = event("ci", "high");

        PipelineStats empty = pipeline.getStats();
        assertThat(empty.getSuppressionRate()).isZero();

        pipeline.submit(event);
        pipeline.submit(event);
        pipeline.submit(event("other", "low"));
        pipeline.submit(event);

        PipelineStats stats = pipeline.getStats();
        assertThat(stats.getTotalReceived()).isEqualTo(4);
        assertThat(stats.getBatched()).isEqualTo(2);
        assertThat(stats.getTotalSuppressed()).isEqualTo(2);
        assertThat(stats.getSuppressionRate()).isEqualTo(0.5);
        assertThat(stats.getPendingInBatch()).isEqualTo(2);
        assertThat(stats.getActiveMaintenanceWindows()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AlertPipeline pipeline(PipelineSettings settings) {
        return new AlertPipeline(settings, notifier, store, clock);
    }

    private static void registerStandardRules(AlertPipeline pipeline) {
        pipeline.addRule(AlertRule.builder()
                .name("prod-oncall")
                .jobPattern("deploy-prod")
                .minSeverity("high")
                .channels("slack", "email")
                .teamName("On-Call")
                .destinationOverride("#prod-oncall")
                .build());
        pipeline.addRule(AlertRule.builder()
                .name("default")
                .minSeverity("medium")
                .build());
    }

    private static AnomalyEvent event(String job, String severity) {
        return AnomalyEvent.builder()
                .jobName(job)
                .severity(severity)
                .feature("duration", 900, 300, 4.2)
                .build();
    }
}
