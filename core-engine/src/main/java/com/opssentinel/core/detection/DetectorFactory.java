package com.opssentinel.core.detection;

import com.opssentinel.core.config.MonitoringConfig;
import com.opssentinel.core.config.SentinelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Builds the detector chain from a {@link SentinelConfig}.
 *
 * <p>
 * The chain order is fixed: statistical, threshold, pattern, correlation.
 * A new detector kind is registered here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
    }

    /**
     * Create all detectors using the system UTC clock.
     *
     * @see #createAll(SentinelConfig, Clock)
     */
    public static List<AnomalyDetector> createAll(SentinelConfig config) {
        return createAll(config, Clock.systemUTC());
    }

    /**
     * Create all detectors.
     *
     * @param config validated configuration; must not be {@code null}
     * @param clock  time source for alert timestamps
     * @return unmodifiable detector list
     */
    public static List<AnomalyDetector> createAll(SentinelConfig config, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        MonitoringConfig monitoring = config.getMonitoring();

        List<AnomalyDetector> detectors = List.of(
                new StatisticalDetector(monitoring.getStatisticalThreshold(), monitoring.getMinHistoryPoints(), clock),
                new ThresholdDetector(config.getThresholds(), clock),
                new PatternDetector(monitoring.getPatternWindow(), monitoring.getPatternMultiplier(), clock),
                new CorrelationDetector(monitoring.getCorrelationThreshold(), clock));

        LOG.info("Created {} detector(s) with {} threshold rule(s)", detectors.size(), config.getThresholds().size());
        return detectors;
    }
}
