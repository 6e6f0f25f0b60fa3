/**
 * Runnable Ops Sentinel service.
 *
 * <p>
 * Wires the core engines to their process-level adapters: an HTTP metrics
 * source, a JSON-lines audit trail, Kafka notifications and the health
 * server. Entry point: {@link com.opssentinel.service.OpsSentinelService}.
 * </p>
 *
 * @since 1.0.0
 */
package com.opssentinel.service;
