package com.opssentinel.core.detection;

import com.opssentinel.core.history.MetricHistoryStore;
import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.AnomalyType;

import java.util.List;
import java.util.Map;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Detectors are <strong>stateless</strong>: every call scores a fresh
 * snapshot against the shared {@link MetricHistoryStore}, which never
 * contains the snapshot itself. The monitoring engine appends the snapshot
 * only after all detectors have run.
 * </p>
 * <p>
 * Implementations must not mutate the history store.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Score a snapshot of current metric values.
     *
     * @param snapshot current value per metric name; only finite values
     * @param history  previously observed points
     * @return zero or more alert candidates, never {@code null}
     */
    List<AnomalyAlert> detect(Map<String, Double> snapshot, MetricHistoryStore history);

    /**
     * @return the kind of alert this detector emits
     */
    AnomalyType type();
}
