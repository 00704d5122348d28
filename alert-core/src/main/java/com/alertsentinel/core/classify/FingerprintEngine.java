package com.alertsentinel.core.classify;

import com.alertsentinel.core.model.AnomalyEvent;
import com.alertsentinel.core.model.AnomalyFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Derives a stable identity for "the same kind of problem".
 *
 * <p>
 * The fingerprint is the MD5 hex digest of
 * {@code job|feature1|feature2|...}, where the feature names are the
 * de-duplicated, lexicographically sorted names of the event's anomalous
 * features. Observed and expected values do not take part, so a recurring
 * problem keeps its fingerprint while its numbers drift.
 * </p>
 *
 * <p>
 * MD5 is used for its stable, seed-free output across processes, not for
 * any security property.
 * </p>
 *
 * @since 1.0.0
 */
public final class FingerprintEngine {

    static final String SEPARATOR = "|";

    private FingerprintEngine() {
        // utility class, not instantiable
    }

    /**
     * @param event the event to fingerprint; must not be {@code null}
     * @return 32-character lowercase hex digest
     */
    public static String fingerprint(AnomalyEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        return digest(canonicalForm(event));
    }

    /**
     * @return the pre-hash string, exposed for diagnostics
     */
    static String canonicalForm(AnomalyEvent event) {
        SortedSet<String> featureNames = new TreeSet<>();
        for (AnomalyFeature feature : event.getFeatures()) {
            featureNames.add(feature.getName());
        }
        return event.getJobName() + SEPARATOR + String.join(SEPARATOR, featureNames);
    }

    private static String digest(String raw) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships MD5
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }
}
