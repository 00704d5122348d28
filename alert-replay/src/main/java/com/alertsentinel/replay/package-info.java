/**
 * Command-line runner that replays recorded anomaly events through the
 * alert pipeline.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.alertsentinel.replay.AlertReplay}: main entry point</li>
 * <li>{@link com.alertsentinel.replay.AnomalyEventReader}: NDJSON event
 * reader</li>
 * <li>{@link com.alertsentinel.replay.ReplayConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.alertsentinel.replay;
