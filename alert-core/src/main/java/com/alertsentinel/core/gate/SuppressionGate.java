package com.alertsentinel.core.gate;

import com.alertsentinel.core.model.OutcomeReason;

/**
 * Contract for the suppression gates an event passes on its way to a batch.
 *
 * <p>
 * Gates are evaluated in a fixed order and the first one that suppresses
 * short-circuits the rest. A gate decides from the {@link GateContext} plus
 * the state it owns; it never delivers anything.
 * </p>
 */
public interface SuppressionGate {

    /**
     * @param context the event under evaluation
     * @return {@code true} if the event must be dropped
     */
    boolean suppresses(GateContext context);

    /**
     * @return the outcome reported when this gate suppresses an event
     */
    OutcomeReason reason();
}
