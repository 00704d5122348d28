/**
 * Configuration loading and validation for the alert pipeline.
 *
 * <p>
 * Settings, rules and maintenance windows are defined in YAML and loaded by
 * {@link com.alertsentinel.core.config.AlertingConfigLoader} into an
 * {@link com.alertsentinel.core.config.AlertingConfig} instance. Validation
 * runs automatically after parsing and reports every problem at once.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.config;
