/**
 * The alert decision pipeline and its factory.
 *
 * <p>
 * {@link com.alertsentinel.core.pipeline.AlertPipeline} is the single entry
 * point callers use; everything else in this module is a stage it owns.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.pipeline;
