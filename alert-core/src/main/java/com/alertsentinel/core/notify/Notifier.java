package com.alertsentinel.core.notify;

import com.alertsentinel.core.model.AnomalyEvent;

import java.util.List;

/**
 * Outbound transport the pipeline hands its decisions to.
 *
 * <p>
 * Implementations own delivery and any retry policy. They may throw; the
 * pipeline treats an exception the same as a {@code false} return.
 * </p>
 */
public interface Notifier {

    /**
     * Deliver one event individually.
     *
     * @param event    the event
     * @param channels channel names to deliver on, e.g. {@code slack},
     *                 {@code email}
     * @return {@code true} on success
     */
    boolean sendOne(AnomalyEvent event, List<String> channels);

    /**
     * Deliver several events as one aggregated notification.
     *
     * @param events events in admission order; never empty
     * @return {@code true} on success
     */
    boolean sendBatch(List<AnomalyEvent> events);

    /**
     * Derive a notifier that targets another destination. The receiver must
     * not be modified.
     *
     * @param destination alternate destination, e.g. a team webhook URL
     * @return a new notifier
     */
    Notifier withDestination(String destination);
}
