package com.alertsentinel.core.classify;

import com.alertsentinel.core.model.AnomalyEvent;
import com.alertsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Maps an {@link AnomalyEvent} to a {@link Severity}.
 *
 * <p>
 * An explicit severity on the event wins (case-insensitive). Otherwise the
 * anomaly score is placed on a fixed ladder:
 * </p>
 * <ul>
 * <li>score &gt; {@value #CRITICAL_SCORE} → critical</li>
 * <li>score &gt; {@value #HIGH_SCORE} → high</li>
 * <li>score &gt; {@value #MEDIUM_SCORE} → medium</li>
 * <li>otherwise → low</li>
 * </ul>
 *
 * <p>
 * Never fails: an explicit severity that is not one of the four known names
 * ranks as {@code low}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(SeverityClassifier.class);

    static final double CRITICAL_SCORE = 5.0;
    static final double HIGH_SCORE = 4.0;
    static final double MEDIUM_SCORE = 2.5;

    private SeverityClassifier() {
        // utility class, not instantiable
    }

    /**
     * @param event the event to classify; must not be {@code null}
     * @return the event's severity
     */
    public static Severity classify(AnomalyEvent event) {
        Objects.requireNonNull(event, "Event must not be null");

        Optional<String> explicit = event.getExplicitSeverity();
        if (explicit.isPresent()) {
            Optional<Severity> parsed = Severity.parse(explicit.get());
            if (parsed.isEmpty()) {
                LOG.debug("Unrecognised severity '{}' for job {} – treating as low",
                        explicit.get(), event.getJobName());
            }
            return parsed.orElse(Severity.LOW);
        }
        return fromScore(event.getAnomalyScore());
    }

    /**
     * @param score numeric anomaly score
     * @return severity on the score ladder
     */
    public static Severity fromScore(double score) {
        if (score > CRITICAL_SCORE) {
            return Severity.CRITICAL;
        }
        if (score > HIGH_SCORE) {
            return Severity.HIGH;
        }
        if (score > MEDIUM_SCORE) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
