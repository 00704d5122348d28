package com.alertsentinel.replay;

import com.alertsentinel.core.config.AlertingConfig;
import com.alertsentinel.core.config.AlertingConfigLoader;
import com.alertsentinel.core.model.AnomalyEvent;
import com.alertsentinel.core.model.SubmitOutcome;
import com.alertsentinel.core.notify.AlertMessageFormatter;
import com.alertsentinel.core.notify.LoggingNotifier;
import com.alertsentinel.core.notify.Notifier;
import com.alertsentinel.core.pipeline.AlertPipeline;
import com.alertsentinel.core.pipeline.PipelineFactory;
import com.alertsentinel.core.pipeline.PipelineStats;
import com.alertsentinel.core.state.InMemoryStateStore;
import com.alertsentinel.core.state.JsonFileStateStore;
import com.alertsentinel.core.state.StateStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Main entry point for the alert replay runner.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   NDJSON file (EVENTS_PATH)
 *     → AnomalyEventReader → AnomalyEvent
 *     → AlertPipeline.submit (per event)
 *     → AlertPipeline.flushNow (end of every cycle)
 *     → LoggingNotifier
 * </pre>
 *
 * <p>
 * A cycle is {@code FLUSH_EVERY} events, or the whole file when that is
 * {@code 0}. Final statistics are logged as JSON.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertReplay {

    private static final Logger LOG = LoggerFactory.getLogger(AlertReplay.class);

    private AlertReplay() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws IOException {
        ReplayConfig config = ReplayConfig.fromEnvironment();
        LOG.info("Starting alert replay with config: {}", config);

        Clock clock = Clock.systemDefaultZone();
        Notifier notifier = new LoggingNotifier(config.getDestination(), new AlertMessageFormatter(clock));
        PipelineStats stats = run(config, notifier, clock);

        LOG.info("Replay finished: {}", toJson(stats));
    }

    /**
     * Replay every event in {@code config.getEventsPath()}.
     *
     * @param config   runner configuration
     * @param notifier delivery backend
     * @param clock    time source for the pipeline
     * @return statistics after the last cycle
     * @throws IOException if the events file cannot be read
     */
    public static PipelineStats run(ReplayConfig config, Notifier notifier, Clock clock) throws IOException {
        AlertingConfig alertingConfig = loadAlertingConfig(config);
        AlertPipeline pipeline = PipelineFactory.create(alertingConfig, notifier, stateStore(config), clock);

        List<AnomalyEvent> events = new AnomalyEventReader().readAll(Path.of(config.getEventsPath()));
        int cycleSize = config.getFlushEvery() > 0 ? config.getFlushEvery() : Math.max(events.size(), 1);

        int inCycle = 0;
        for (AnomalyEvent event : events) {
            SubmitOutcome outcome = pipeline.submit(event);
            LOG.debug("Submitted {}: {}", event.getJobName(), outcome);
            if (++inCycle == cycleSize) {
                endCycle(pipeline);
                inCycle = 0;
            }
        }
        if (inCycle > 0 || events.isEmpty()) {
            endCycle(pipeline);
        }
        return pipeline.getStats();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static void endCycle(AlertPipeline pipeline) {
        if (!pipeline.flushNow()) {
            LOG.warn("Delivery failed at end of replay cycle");
        }
    }

    private static AlertingConfig loadAlertingConfig(ReplayConfig config) {
        String path = config.getAlertingConfigPath();
        if (path != null && !path.isBlank()) {
            return AlertingConfigLoader.fromFile(path);
        }
        return AlertingConfigLoader.load();
    }

    private static StateStore stateStore(ReplayConfig config) {
        if (config.isPersistent()) {
            return new JsonFileStateStore(Path.of(config.getStateFile()));
        }
        LOG.info("No state file configured – alert state is kept in memory only");
        return new InMemoryStateStore();
    }

    static String toJson(PipelineStats stats) {
        try {
            return new ObjectMapper()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(stats);
        } catch (JsonProcessingException e) {
            LOG.warn("Could not render statistics as JSON: {}", e.getMessage());
            return stats.toString();
        }
    }
}
