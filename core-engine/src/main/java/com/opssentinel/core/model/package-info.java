/**
 * Domain model classes for Ops Sentinel.
 *
 * <p>
 * This package contains the records shared between the detectors, the
 * monitoring engine and the response engine:
 * </p>
 * <ul>
 * <li>{@link com.opssentinel.core.model.MetricPoint} — one metric
 * observation</li>
 * <li>{@link com.opssentinel.core.model.AnomalyAlert} — anomaly emitted by a
 * detector</li>
 * <li>{@link com.opssentinel.core.model.ResponseAction} — remediation step
 * proposed by a handler</li>
 * <li>{@link com.opssentinel.core.model.ResponseExecution} — tracked dispatch
 * of an action</li>
 * <li>{@link com.opssentinel.core.model.ApprovalRequest} — action awaiting
 * human sign-off</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.opssentinel.core.model;
