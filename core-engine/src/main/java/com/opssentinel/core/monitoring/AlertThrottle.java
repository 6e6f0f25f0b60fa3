package com.opssentinel.core.monitoring;

import com.opssentinel.core.model.AnomalyAlert;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-metric cooldown plus a global sliding one-minute rate limit.
 *
 * <p>
 * Only accepted alerts start a cooldown or count against the rate limit.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertThrottle {

    /** Outcome of {@link #evaluate}. */
    public enum Decision {
        ACCEPTED,
        COOLDOWN,
        RATE_LIMITED
    }

    private static final Duration RATE_WINDOW = Duration.ofMinutes(1);

    private final Duration cooldown;
    private final int maxPerMinute;

    private final Map<String, Instant> lastAlertByMetric = new HashMap<>();
    private final Deque<Instant> acceptedInWindow = new ArrayDeque<>();

    public AlertThrottle(Duration cooldown, int maxPerMinute) {
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown must not be null");
        if (maxPerMinute <= 0) {
            throw new IllegalArgumentException("maxPerMinute must be > 0, got: " + maxPerMinute);
        }
        this.maxPerMinute = maxPerMinute;
    }

    /**
     * Decide whether {@code alert} may pass at {@code now}, recording it when
     * accepted.
     */
    public synchronized Decision evaluate(AnomalyAlert alert, Instant now) {
        Instant last = lastAlertByMetric.get(alert.getMetricName());
        if (last != null && now.isBefore(last.plus(cooldown))) {
            return Decision.COOLDOWN;
        }

        Instant windowStart = now.minus(RATE_WINDOW);
        while (!acceptedInWindow.isEmpty() && !acceptedInWindow.peekFirst().isAfter(windowStart)) {
            acceptedInWindow.pollFirst();
        }
        if (acceptedInWindow.size() >= maxPerMinute) {
            return Decision.RATE_LIMITED;
        }

        acceptedInWindow.addLast(now);
        lastAlertByMetric.put(alert.getMetricName(), now);
        return Decision.ACCEPTED;
    }

    /**
     * Forget all cooldowns and rate-limit history.
     */
    public synchronized void reset() {
        lastAlertByMetric.clear();
        acceptedInWindow.clear();
    }
}
