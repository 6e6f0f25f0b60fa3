/**
 * The monitoring control loop: poll scheduling, alert throttling, the
 * bounded alert queue and engine statistics.
 *
 * @since 1.0.0
 */
package com.opssentinel.core.monitoring;
