package com.alertsentinel.core.pipeline;

import com.alertsentinel.core.config.AlertingConfig;
import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.MaintenanceWindow;
import com.alertsentinel.core.notify.Notifier;
import com.alertsentinel.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Builds an {@link AlertPipeline} from an {@link AlertingConfig}.
 *
 * <p>
 * Rules are registered in file order, so the file order is the matching
 * priority. Window times without an offset are read in the clock's zone.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineFactory {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineFactory.class);

    private PipelineFactory() {
        // utility class, not instantiable
    }

    public static AlertPipeline create(AlertingConfig config, Notifier notifier, StateStore stateStore) {
        return create(config, notifier, stateStore, Clock.systemDefaultZone());
    }

    /**
     * @param config     alerting configuration; must not be {@code null}
     * @param notifier   base notifier
     * @param stateStore durable backend
     * @param clock      time source
     * @return a pipeline with every configured rule and window registered
     * @throws IllegalStateException    if a rule is malformed
     * @throws IllegalArgumentException if a window is malformed or a name
     *                                  repeats
     */
    public static AlertPipeline create(AlertingConfig config, Notifier notifier,
            StateStore stateStore, Clock clock) {
        Objects.requireNonNull(config, "AlertingConfig must not be null");
        AlertPipeline pipeline = new AlertPipeline(config.toSettings(), notifier, stateStore, clock);

        for (AlertRule rule : config.getRules()) {
            pipeline.addRule(rule);
        }
        for (MaintenanceWindow window : config.toWindows()) {
            pipeline.addMaintenanceWindow(window);
        }

        LOG.info("Created alert pipeline with {}: {} rule(s), {} maintenance window(s)",
                pipeline.getSettings(), config.getRules().size(), config.getMaintenanceWindows().size());
        return pipeline;
    }
}
