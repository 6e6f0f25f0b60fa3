/**
 * Anomaly detection strategies.
 *
 * <p>
 * Every {@link com.opssentinel.core.detection.AnomalyDetector} scores a
 * snapshot of current metric values against the metric history. The four
 * strategies run independently and their alerts are concatenated; throttling
 * happens downstream in the monitoring engine.
 * </p>
 *
 * @since 1.0.0
 */
package com.opssentinel.core.detection;
