package com.alertsentinel.core.gate;

import com.alertsentinel.core.model.OutcomeReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Suppresses repeats of the same fingerprint within the dedup window.
 *
 * <h3>Two-phase use</h3>
 * <p>
 * {@link #suppresses(GateContext)} only checks. The pipeline calls
 * {@link #markAdmitted(String, Instant)} once the event has cleared every
 * gate and is handed to the batch, i.e. before actual delivery. A failure
 * after that point can therefore hide a genuine repeat, never produce an
 * extra alert.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * One timestamp per fingerprint. Entries whose age reaches the window are
 * pruned on every {@code markAdmitted}.
 * </p>
 *
 * @since 1.0.0
 */
public class DeduplicationGate implements SuppressionGate {

    private static final Logger LOG = LoggerFactory.getLogger(DeduplicationGate.class);

    private final Duration window;

    /** Fingerprint → time of last admission. */
    private final Map<String, Instant> lastAdmitted = new LinkedHashMap<>();

    /**
     * @param window dedup window; must not be negative
     */
    public DeduplicationGate(Duration window) {
        this.window = Objects.requireNonNull(window, "Dedup window must not be null");
        if (window.isNegative()) {
            throw new IllegalArgumentException("Dedup window must not be negative, got: " + window);
        }
    }

    @Override
    public boolean suppresses(GateContext context) {
        return isDuplicate(context.getFingerprint(), context.getNow());
    }

    @Override
    public OutcomeReason reason() {
        return OutcomeReason.DUPLICATE;
    }

    /**
     * @return {@code true} if {@code fingerprint} was admitted less than one
     *         window before {@code now}
     */
    public boolean isDuplicate(String fingerprint, Instant now) {
        Instant last = lastAdmitted.get(fingerprint);
        if (last == null) {
            return false;
        }
        return Duration.between(last, now).compareTo(window) < 0;
    }

    /**
     * Record an admission and prune expired fingerprints.
     *
     * @param fingerprint admitted fingerprint
     * @param now         admission time
     */
    public void markAdmitted(String fingerprint, Instant now) {
        lastAdmitted.put(fingerprint, now);
        int before = lastAdmitted.size();
        lastAdmitted.values().removeIf(t -> Duration.between(t, now).compareTo(window) >= 0);
        if (lastAdmitted.size() < before) {
            LOG.debug("Pruned {} expired fingerprint(s)", before - lastAdmitted.size());
        }
    }

    /**
     * @return unmodifiable copy of the fingerprint ledger
     */
    public Map<String, Instant> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(lastAdmitted));
    }

    /**
     * Replace the ledger with persisted entries.
     *
     * @param entries fingerprint → last admission
     */
    public void restore(Map<String, Instant> entries) {
        lastAdmitted.clear();
        entries.forEach((fp, t) -> {
            if (fp != null && t != null) {
                lastAdmitted.put(fp, t);
            }
        });
    }

    public int size() {
        return lastAdmitted.size();
    }
}
