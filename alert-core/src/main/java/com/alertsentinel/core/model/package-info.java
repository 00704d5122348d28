/**
 * Domain model shared by every stage of the alert pipeline.
 *
 * <ul>
 * <li>{@link com.alertsentinel.core.model.AnomalyEvent}: scored CI/CD run
 * handed over by the detector</li>
 * <li>{@link com.alertsentinel.core.model.AlertRule}: routing rule
 * POJO</li>
 * <li>{@link com.alertsentinel.core.model.MaintenanceWindow}: scheduled
 * silence period</li>
 * <li>{@link com.alertsentinel.core.model.SubmitOutcome}: what happened to
 * a submitted event</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.model;
