/**
 * Suppression gates, evaluated in order: maintenance, deduplication, rate
 * limit. The first gate that fires decides the outcome.
 */
package com.alertsentinel.core.gate;
