package com.alertsentinel.core.notify;

import com.alertsentinel.core.classify.SeverityClassifier;
import com.alertsentinel.core.model.AnomalyEvent;
import com.alertsentinel.core.model.AnomalyFeature;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders events into the text payloads delivered to humans.
 *
 * <p>
 * Single alert: header, job, time, severity, the top
 * {@value #TOP_FEATURES} anomalous metrics and any build details
 * ({@code duration}, {@code result}, {@code failure_count}). Batch summary:
 * a count header and a numbered line per event, capped at
 * {@value #DEFAULT_BATCH_ITEMS} entries.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertMessageFormatter {

    static final int TOP_FEATURES = 3;
    static final int DEFAULT_BATCH_ITEMS = 10;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public AlertMessageFormatter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * @param event event to render
     * @return multi-line message
     */
    public String formatSingle(AnomalyEvent event) {
        StringBuilder sb = new StringBuilder();
        sb.append("*Anomaly Detected in CI/CD Pipeline*\n\n");
        sb.append("*Job/Workflow:* ").append(event.getJobName()).append('\n');
        sb.append("*Time:* ").append(LocalDateTime.now(clock).format(TIME_FORMAT)).append('\n');
        sb.append("*Severity:* ")
                .append(SeverityClassifier.classify(event).name())
                .append("\n");

        List<AnomalyFeature> features = event.getFeatures();
        if (!features.isEmpty()) {
            sb.append("\n*Anomalous Metrics:*\n");
            features.stream().limit(TOP_FEATURES).forEach(f -> sb.append(String.format(Locale.ROOT,
                    "  - %s: %.2f (expected: %.2f, z-score: %.2f)\n",
                    f.getName(), f.getObservedValue(), f.getExpectedValue(), f.getDeviationScore())));
        }

        event.numericAttribute("duration").ifPresent(d -> sb.append(String.format(Locale.ROOT,
                "\n*Build Duration:* %.1fs\n", d)));
        event.stringAttribute("result").ifPresent(r -> sb.append("*Result:* ").append(r).append('\n'));
        event.stringAttribute("failure_count").ifPresent(c -> sb.append("*Failures:* ").append(c).append('\n'));
        return sb.toString();
    }

    /**
     * @param events events to summarise
     * @return summary message with at most {@value #DEFAULT_BATCH_ITEMS} lines
     */
    public String formatBatch(List<AnomalyEvent> events) {
        return formatBatch(events, DEFAULT_BATCH_ITEMS);
    }

    /**
     * @param events   events to summarise
     * @param maxItems maximum number of listed events; must be &gt;= 1
     * @return summary message
     */
    public String formatBatch(List<AnomalyEvent> events, int maxItems) {
        if (maxItems < 1) {
            throw new IllegalArgumentException("maxItems must be >= 1, got: " + maxItems);
        }
        int count = events.size();
        StringBuilder sb = new StringBuilder();
        sb.append('*').append(count).append(" Anomalies Detected in CI/CD Pipelines*\n\n");

        for (int i = 0; i < Math.min(count, maxItems); i++) {
            AnomalyEvent event = events.get(i);
            sb.append(i + 1).append(". *").append(event.getJobName()).append("* - ");
            if (event.hasAnomalyScore()) {
                sb.append(String.format(Locale.ROOT, "z-score: %.2f\n", event.getAnomalyScore()));
            } else {
                sb.append("Detected by ML model\n");
            }
        }
        if (count > maxItems) {
            sb.append("\n... and ").append(count - maxItems).append(" more\n");
        }
        return sb.toString();
    }
}
