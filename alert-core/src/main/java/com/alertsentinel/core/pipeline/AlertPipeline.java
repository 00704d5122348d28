package com.alertsentinel.core.pipeline;

import com.alertsentinel.core.batch.BatchAggregator;
import com.alertsentinel.core.batch.BatchState;
import com.alertsentinel.core.classify.FingerprintEngine;
import com.alertsentinel.core.classify.SeverityClassifier;
import com.alertsentinel.core.gate.DeduplicationGate;
import com.alertsentinel.core.gate.GateContext;
import com.alertsentinel.core.gate.MaintenanceGate;
import com.alertsentinel.core.gate.RateLimitGate;
import com.alertsentinel.core.gate.SuppressionGate;
import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.AnomalyEvent;
import com.alertsentinel.core.model.MaintenanceWindow;
import com.alertsentinel.core.model.OutcomeReason;
import com.alertsentinel.core.model.RuleSummary;
import com.alertsentinel.core.model.Severity;
import com.alertsentinel.core.model.SubmitOutcome;
import com.alertsentinel.core.model.WindowSummary;
import com.alertsentinel.core.notify.Notifier;
import com.alertsentinel.core.routing.RuleRouter;
import com.alertsentinel.core.state.AlertCounters;
import com.alertsentinel.core.state.AlertCounters.Counter;
import com.alertsentinel.core.state.StateSnapshot;
import com.alertsentinel.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides, for each anomaly event, whether and how humans get notified.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   AnomalyEvent
 *     → classify severity, fingerprint
 *     → maintenance gate → dedup gate → rate-limit gate   (first hit wins)
 *     → resolve first matching rule → severity floor
 *     → mark fingerprint admitted → add to batch
 *     → flush if the batch window has elapsed
 * </pre>
 *
 * <p>
 * {@link #flushNow()} delivers whatever is pending regardless of age. There
 * is no timer thread, so callers that poll in cycles should call it at the
 * end of every cycle.
 * </p>
 *
 * <h3>Flush routing</h3>
 * <p>
 * A batch is not keyed by job. When it is flushed, rule, destination and
 * channels are resolved from the <em>first</em> event in the batch, even if
 * later events belong to other jobs. A caller-supplied channel list overrides
 * the rule's channels.
 * </p>
 *
 * <h3>Delivery and state</h3>
 * <p>
 * A flush clears the batch and counts one send against the hourly rate limit
 * before the notifier is called; a failed delivery does not undo either.
 * Notifier and state-store failures are logged, never thrown. After every
 * submission and every non-empty flush the durable state is written to the
 * {@link StateStore}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Every public method is {@code synchronized} on the pipeline, which owns
 * all of its mutable state exclusively.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(AlertPipeline.class);

    /** Channels a forced submission uses when the caller names none. */
    public static final List<String> ALL_CHANNELS = List.of("slack", "email", "webhook");

    private final PipelineSettings settings;
    private final Notifier notifier;
    private final StateStore stateStore;
    private final Clock clock;

    private final MaintenanceGate maintenanceGate = new MaintenanceGate();
    private final DeduplicationGate deduplicationGate;
    private final RateLimitGate rateLimitGate;
    private final List<SuppressionGate> gates;

    private final RuleRouter router = new RuleRouter();
    private final BatchAggregator batch;
    private final AlertCounters counters = new AlertCounters();

    /**
     * Create a pipeline on the system clock in the default time zone.
     */
    public AlertPipeline(PipelineSettings settings, Notifier notifier, StateStore stateStore) {
        this(settings, notifier, stateStore, Clock.systemDefaultZone());
    }

    /**
     * Create a pipeline and restore any persisted state.
     *
     * @param settings   tunables; must not be {@code null}
     * @param notifier   base notifier; never modified
     * @param stateStore durable backend
     * @param clock      time source for every window
     */
    public AlertPipeline(PipelineSettings settings, Notifier notifier, StateStore stateStore, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "PipelineSettings must not be null");
        this.notifier = Objects.requireNonNull(notifier, "Notifier must not be null");
        this.stateStore = Objects.requireNonNull(stateStore, "StateStore must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");

        this.deduplicationGate = new DeduplicationGate(settings.getDedupWindow());
        this.rateLimitGate = new RateLimitGate(settings.getMaxAlertsPerHour());
        this.gates = List.of(maintenanceGate, deduplicationGate, rateLimitGate);
        this.batch = new BatchAggregator(settings.getBatchWindow());

        loadState();
    }

    // ---------------------------------------------------------------
    // Submission
    // ---------------------------------------------------------------

    /**
     * Submit an event with rule-derived channels and full suppression.
     */
    public SubmitOutcome submit(AnomalyEvent event) {
        return submit(event, null, false);
    }

    /**
     * Submit an event.
     *
     * @param event            the anomaly; must not be {@code null}
     * @param channelsOverride channels to use instead of the rule's, or
     *                         {@code null}
     * @param force            skip every gate and deliver immediately on
     *                         {@link #ALL_CHANNELS} unless overridden
     * @return what happened to the event
     * @throws IllegalArgumentException if the override holds a null or blank
     *                                  channel; nothing is recorded
     */
    public synchronized SubmitOutcome submit(AnomalyEvent event, List<String> channelsOverride, boolean force) {
        Objects.requireNonNull(event, "Event must not be null");
        List<String> channels = copyChannels(channelsOverride);
        Instant now = clock.instant();
        counters.increment(Counter.TOTAL_RECEIVED);

        String jobName = event.getJobName();
        Severity severity = SeverityClassifier.classify(event);

        if (force) {
            return submitForced(event, channels, jobName, severity, now);
        }

        GateContext context = new GateContext(jobName, FingerprintEngine.fingerprint(event), now);
        for (SuppressionGate gate : gates) {
            if (gate.suppresses(context)) {
                return suppress(gate.reason(), jobName, severity);
            }
        }

        Optional<AlertRule> rule = router.resolve(jobName);
        if (rule.isPresent() && !rule.get().severityPasses(severity)) {
            LOG.info("Alert suppressed (severity {} < {} of rule {}): {}", severity.label(),
                    rule.get().minSeverityLevel().label(), rule.get().getName(), jobName);
            return suppress(OutcomeReason.BELOW_SEVERITY_THRESHOLD, jobName, severity);
        }

        deduplicationGate.markAdmitted(context.getFingerprint(), now);
        enqueue(event, now);

        SubmitOutcome outcome;
        if (batch.isDue(now)) {
            boolean ok = flushPending(channels, now);
            outcome = new SubmitOutcome(ok, OutcomeReason.BATCH_FLUSHED, jobName, severity);
        } else {
            LOG.info("Alert queued ({} pending): {}", batch.size(), jobName);
            outcome = new SubmitOutcome(false, OutcomeReason.QUEUED_IN_BATCH, jobName, severity);
        }
        persistState();
        return outcome;
    }

    /**
     * Deliver everything pending, using the rule of the first pending event.
     *
     * @return {@code true} if nothing was pending or delivery succeeded
     */
    public boolean flushNow() {
        return flushNow(null);
    }

    /**
     * @param channelsOverride channels to use instead of the rule's, or
     *                         {@code null}
     * @return {@code true} if nothing was pending or delivery succeeded
     * @throws IllegalArgumentException if the override holds a null or blank
     *                                  channel
     */
    public synchronized boolean flushNow(List<String> channelsOverride) {
        List<String> channels = copyChannels(channelsOverride);
        if (batch.isEmpty()) {
            return true;
        }
        boolean ok = flushPending(channels, clock.instant());
        persistState();
        return ok;
    }

    // ---------------------------------------------------------------
    // Rule management
    // ---------------------------------------------------------------

    /**
     * Register a routing rule at the lowest priority.
     *
     * @throws IllegalStateException    if the rule is malformed
     * @throws IllegalArgumentException if the name is already registered
     */
    public synchronized void addRule(AlertRule rule) {
        router.add(rule);
    }

    /**
     * @return {@code true} if a rule with that name was removed
     */
    public synchronized boolean removeRule(String name) {
        return router.remove(name);
    }

    public synchronized List<RuleSummary> listRules() {
        return router.summaries();
    }

    // ---------------------------------------------------------------
    // Maintenance windows
    // ---------------------------------------------------------------

    /**
     * @throws IllegalArgumentException if the name is already registered
     */
    public synchronized void addMaintenanceWindow(MaintenanceWindow window) {
        maintenanceGate.add(window);
        LOG.info("Added maintenance window: {}", window);
    }

    /**
     * @return {@code true} if a window with that name was removed
     */
    public synchronized boolean removeMaintenanceWindow(String name) {
        boolean removed = maintenanceGate.remove(name);
        if (removed) {
            LOG.info("Removed maintenance window: {}", name);
        }
        return removed;
    }

    /**
     * @return windows active right now, in registration order
     */
    public synchronized List<WindowSummary> listActiveWindows() {
        return maintenanceGate.activeWindows(clock.instant()).stream()
                .map(MaintenanceWindow::summarize)
                .toList();
    }

    // ---------------------------------------------------------------
    // Statistics
    // ---------------------------------------------------------------

    public synchronized PipelineStats getStats() {
        Instant now = clock.instant();
        return PipelineStats.of(counters,
                batch.size(),
                maintenanceGate.activeWindows(now).size(),
                router.size(),
                rateLimitGate.countLastHour(now));
    }

    public synchronized BatchState getBatchState() {
        return batch.state();
    }

    public PipelineSettings getSettings() {
        return settings;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private SubmitOutcome submitForced(AnomalyEvent event, List<String> channelsOverride,
            String jobName, Severity severity, Instant now) {
        LOG.info("Forced alert bypasses suppression: {}", jobName);
        enqueue(event, now);
        boolean ok = flush(Optional.empty(), channelsOverride != null ? channelsOverride : ALL_CHANNELS, now);
        persistState();
        return new SubmitOutcome(ok, OutcomeReason.BATCH_FLUSHED, jobName, severity);
    }

    private static List<String> copyChannels(List<String> channelsOverride) {
        if (channelsOverride == null) {
            return null;
        }
        for (String channel : channelsOverride) {
            if (channel == null || channel.isBlank()) {
                throw new IllegalArgumentException("Channel names must not be null or blank: " + channelsOverride);
            }
        }
        return List.copyOf(channelsOverride);
    }

    private SubmitOutcome suppress(OutcomeReason reason, String jobName, Severity severity) {
        counters.increment(Counter.forSuppression(reason));
        if (reason == OutcomeReason.RATE_LIMIT) {
            LOG.warn("Alert suppressed (rate limit): {}", jobName);
        } else if (reason != OutcomeReason.BELOW_SEVERITY_THRESHOLD) {
            LOG.info("Alert suppressed ({}): {}", reason, jobName);
        }
        persistState();
        return SubmitOutcome.suppressed(reason, jobName, severity);
    }

    private void enqueue(AnomalyEvent event, Instant now) {
        batch.add(event, now);
        counters.increment(Counter.BATCHED);
    }

    /**
     * Flush with routing resolved from the first pending event.
     */
    private boolean flushPending(List<String> channelsOverride, Instant now) {
        Optional<AlertRule> rule = batch.firstEvent().flatMap(e -> router.resolve(e.getJobName()));
        return flush(rule, RuleRouter.resolveChannels(rule, channelsOverride), now);
    }

    private boolean flush(Optional<AlertRule> rule, List<String> channels, Instant now) {
        List<AnomalyEvent> events = batch.drain();
        if (events.isEmpty()) {
            return true;
        }
        rateLimitGate.recordSend(now);
        counters.increment(Counter.TOTAL_SENT);

        try {
            Notifier target = effectiveNotifier(rule);
            boolean ok;
            if (events.size() == 1) {
                ok = target.sendOne(events.get(0), channels);
                LOG.info("Sent 1 alert via {}: {}", channels, events.get(0).getJobName());
            } else {
                ok = target.sendBatch(events);
                LOG.info("Sent batch of {} alerts", events.size());
            }
            if (!ok) {
                LOG.warn("Notifier reported failed delivery of {} alert(s)", events.size());
            }
            return ok;
        } catch (RuntimeException e) {
            LOG.error("Notifier failed to deliver {} alert(s): {}", events.size(), e.getMessage(), e);
            return false;
        }
    }

    private Notifier effectiveNotifier(Optional<AlertRule> rule) {
        return rule.flatMap(AlertRule::destination)
                .map(notifier::withDestination)
                .orElse(notifier);
    }

    private void loadState() {
        try {
            Optional<StateSnapshot> snapshot = stateStore.load();
            if (snapshot.isEmpty()) {
                return;
            }
            deduplicationGate.restore(snapshot.get().getFingerprints());
            rateLimitGate.restore(snapshot.get().getAlertTimestamps());
            counters.mergeFrom(snapshot.get().getStats());
            LOG.info("Restored alert state: {} fingerprint(s), {} send timestamp(s)",
                    deduplicationGate.size(), snapshot.get().getAlertTimestamps().size());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not load alert state – starting empty: {}", e.getMessage());
        }
    }

    private void persistState() {
        StateSnapshot snapshot = new StateSnapshot(
                deduplicationGate.snapshot(), rateLimitGate.snapshot(), counters.asMap());
        try {
            stateStore.save(snapshot);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not save alert state: {}", e.getMessage());
        }
    }
}
