package com.opssentinel.core.spi;

import java.time.Duration;
import java.util.Map;

/**
 * Supplies current values for the monitored metrics.
 *
 * <p>
 * Implementations must be safe to call repeatedly. A failed call throws
 * {@link MetricsSourceException}; it never returns a partial result.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface MetricsSource {

    /**
     * @param window aggregation window the values should cover
     * @return current value per metric name
     * @throws MetricsSourceException if the source cannot be read
     */
    Map<String, Double> getMetrics(Duration window) throws MetricsSourceException;

    /**
     * @return a short name recorded as the source of every metric point
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
