package com.alertsentinel.core.gate;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-event facts shared by all gates during one submission.
 */
public final class GateContext {

    private final String jobName;
    private final String fingerprint;
    private final Instant now;

    public GateContext(String jobName, String fingerprint, Instant now) {
        this.jobName = Objects.requireNonNull(jobName, "jobName must not be null");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        this.now = Objects.requireNonNull(now, "now must not be null");
    }

    public String getJobName() {
        return jobName;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public Instant getNow() {
        return now;
    }

    @Override
    public String toString() {
        return "GateContext{job='" + jobName + "', fingerprint=" + fingerprint + ", now=" + now + '}';
    }
}
