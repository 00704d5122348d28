package com.alertsentinel.replay;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable configuration for the alert replay runner.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * runner can be driven entirely from the process environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReplayConfig {

    public static final String ENV_CONFIG_PATH = "ALERTING_CONFIG_PATH";
    public static final String ENV_EVENTS_PATH = "EVENTS_PATH";
    public static final String ENV_STATE_FILE = "STATE_FILE";
    public static final String ENV_DESTINATION = "NOTIFIER_DESTINATION";
    public static final String ENV_FLUSH_EVERY = "FLUSH_EVERY";

    public static final String DEFAULT_STATE_FILE = "./data/smart_alert_state.json";
    public static final String DEFAULT_DESTINATION = "default";

    private final String alertingConfigPath;
    private final String eventsPath;
    private final String stateFile;
    private final String destination;
    private final int flushEvery;

    private ReplayConfig(Builder b) {
        this.alertingConfigPath = b.alertingConfigPath;
        this.eventsPath = b.eventsPath;
        this.stateFile = b.stateFile;
        this.destination = b.destination;
        this.flushEvery = b.flushEvery;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ReplayConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ReplayConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static ReplayConfig fromEnvironment(UnaryOperator<String> env) {
        try {
            return new Builder()
                    .alertingConfigPath(value(env, ENV_CONFIG_PATH, ""))
                    .eventsPath(value(env, ENV_EVENTS_PATH, null))
                    // blank STATE_FILE switches persistence off, so it is read raw
                    .stateFile(env.apply(ENV_STATE_FILE) != null ? env.apply(ENV_STATE_FILE) : DEFAULT_STATE_FILE)
                    .destination(value(env, ENV_DESTINATION, DEFAULT_DESTINATION))
                    .flushEvery(Integer.parseInt(value(env, ENV_FLUSH_EVERY, "0").trim()))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return YAML config path, or an empty string for automatic resolution
     */
    public String getAlertingConfigPath() {
        return alertingConfigPath;
    }

    public String getEventsPath() {
        return eventsPath;
    }

    /**
     * @return state file path, or an empty string when state is kept in
     *         memory only
     */
    public String getStateFile() {
        return stateFile;
    }

    public boolean isPersistent() {
        return !stateFile.isBlank();
    }

    public String getDestination() {
        return destination;
    }

    /**
     * @return events per replay cycle; {@code 0} means one cycle for the
     *         whole file
     */
    public int getFlushEvery() {
        return flushEvery;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ReplayConfig}.
     */
    public static class Builder {
        private String alertingConfigPath = "";
        private String eventsPath;
        private String stateFile = DEFAULT_STATE_FILE;
        private String destination = DEFAULT_DESTINATION;
        private int flushEvery;

        public Builder alertingConfigPath(String v) {
            this.alertingConfigPath = v;
            return this;
        }

        public Builder eventsPath(String v) {
            this.eventsPath = v;
            return this;
        }

        public Builder stateFile(String v) {
            this.stateFile = v;
            return this;
        }

        public Builder destination(String v) {
            this.destination = v;
            return this;
        }

        public Builder flushEvery(int v) {
            this.flushEvery = v;
            return this;
        }

        /**
         * @return a validated {@link ReplayConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ReplayConfig build() {
            requireNonBlank(eventsPath, "eventsPath (" + ENV_EVENTS_PATH + ")");
            requireNonBlank(destination, "destination");
            Objects.requireNonNull(stateFile, "stateFile must not be null");
            if (alertingConfigPath == null) {
                alertingConfigPath = "";
            }
            if (flushEvery < 0) {
                throw new IllegalArgumentException("flushEvery must be >= 0, got: " + flushEvery);
            }
            return new ReplayConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(UnaryOperator<String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ReplayConfig{" +
                "alertingConfigPath='" + alertingConfigPath + '\'' +
                ", eventsPath='" + eventsPath + '\'' +
                ", stateFile='" + stateFile + '\'' +
                ", destination='" + destination + '\'' +
                ", flushEvery=" + flushEvery +
                '}';
    }
}
