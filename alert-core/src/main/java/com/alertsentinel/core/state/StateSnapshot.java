package com.alertsentinel.core.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable part of the pipeline state: the dedup ledger, the rate-limit send
 * history, and the counters. The pending batch is not part of it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "fingerprints", "alert_timestamps", "stats" })
public final class StateSnapshot {

    private final Map<String, Instant> fingerprints;
    private final List<Instant> alertTimestamps;
    private final Map<String, Long> stats;

    @JsonCreator
    public StateSnapshot(@JsonProperty("fingerprints") Map<String, Instant> fingerprints,
            @JsonProperty("alert_timestamps") List<Instant> alertTimestamps,
            @JsonProperty("stats") Map<String, Long> stats) {
        this.fingerprints = fingerprints != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(fingerprints))
                : Collections.emptyMap();
        this.alertTimestamps = alertTimestamps != null
                ? Collections.unmodifiableList(new ArrayList<>(alertTimestamps))
                : Collections.emptyList();
        this.stats = stats != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(stats))
                : Collections.emptyMap();
    }

    @JsonProperty("fingerprints")
    public Map<String, Instant> getFingerprints() {
        return fingerprints;
    }

    @JsonProperty("alert_timestamps")
    public List<Instant> getAlertTimestamps() {
        return alertTimestamps;
    }

    @JsonProperty("stats")
    public Map<String, Long> getStats() {
        return stats;
    }

    @Override
    public String toString() {
        return "StateSnapshot{fingerprints=" + fingerprints.size()
                + ", alertTimestamps=" + alertTimestamps.size()
                + ", stats=" + stats + '}';
    }
}
