package com.alertsentinel.core.notify;

import com.alertsentinel.core.model.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Dry-run notifier: renders payloads and writes them to the log instead of
 * a transport. Always reports success.
 *
 * @since 1.0.0
 */
public class LoggingNotifier implements Notifier {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotifier.class);

    private final String destination;
    private final AlertMessageFormatter formatter;

    /**
     * @param destination label for where messages would go
     * @param formatter   payload renderer
     */
    public LoggingNotifier(String destination, AlertMessageFormatter formatter) {
        this.destination = Objects.requireNonNull(destination, "Destination must not be null");
        this.formatter = Objects.requireNonNull(formatter, "Formatter must not be null");
    }

    @Override
    public boolean sendOne(AnomalyEvent event, List<String> channels) {
        String message = formatter.formatSingle(event);
        for (String channel : channels) {
            LOG.info("[{} -> {}] {}", channel, destination, message);
        }
        return true;
    }

    @Override
    public boolean sendBatch(List<AnomalyEvent> events) {
        LOG.info("[batch -> {}] {}", destination, formatter.formatBatch(events));
        return true;
    }

    @Override
    public Notifier withDestination(String destination) {
        return new LoggingNotifier(destination, formatter);
    }

    public String getDestination() {
        return destination;
    }

    @Override
    public String toString() {
        return "LoggingNotifier{destination='" + destination + "'}";
    }
}
