package com.opssentinel.core.history;

import com.opssentinel.core.model.MetricPoint;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded, time-ordered buffer of {@link MetricPoint}s per metric.
 *
 * <p>
 * Each metric owns an independent ring of at most {@code capacity} points;
 * points older than {@code retention} are evicted as well. Eviction is FIFO
 * in both cases. Every buffer is guarded by its own monitor, so readers of
 * one metric never contend with writers of another.
 * </p>
 *
 * <p>
 * All read methods return snapshot copies ordered oldest first.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricHistoryStore {

    public static final int DEFAULT_CAPACITY = 1000;
    public static final Duration DEFAULT_RETENTION = Duration.ofMinutes(60);

    private final int capacity;
    private final Duration retention;
    private final Clock clock;

    private final Map<String, Deque<MetricPoint>> buffers = new ConcurrentHashMap<>();

    public MetricHistoryStore() {
        this(DEFAULT_CAPACITY, DEFAULT_RETENTION, Clock.systemUTC());
    }

    /**
     * @param capacity  maximum points kept per metric; must be positive
     * @param retention maximum age of kept points; must be positive
     * @param clock     time source used for age-based eviction
     */
    public MetricHistoryStore(int capacity, Duration retention, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        Objects.requireNonNull(retention, "retention must not be null");
        if (retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive, got: " + retention);
        }
        this.capacity = capacity;
        this.retention = retention;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * Append a point to its metric's buffer, evicting the oldest points
     * when the buffer is full or they fall out of the retention window.
     */
    public void append(MetricPoint point) {
        Objects.requireNonNull(point, "point must not be null");
        Deque<MetricPoint> buffer = buffers.computeIfAbsent(point.getMetricName(), k -> new ArrayDeque<>());
        synchronized (buffer) {
            buffer.addLast(point);
            while (buffer.size() > capacity) {
                buffer.pollFirst();
            }
            evictExpired(buffer);
        }
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * @return at most {@code count} most recent points, oldest first
     */
    public List<MetricPoint> recent(String metricName, int count) {
        if (count <= 0) {
            return List.of();
        }
        Deque<MetricPoint> buffer = buffers.get(metricName);
        if (buffer == null) {
            return List.of();
        }
        synchronized (buffer) {
            evictExpired(buffer);
            List<MetricPoint> result = new ArrayList<>(Math.min(count, buffer.size()));
            Iterator<MetricPoint> it = buffer.descendingIterator();
            while (it.hasNext() && result.size() < count) {
                result.add(it.next());
            }
            Collections.reverse(result);
            return result;
        }
    }

    /**
     * @return points recorded within {@code window} of now, oldest first
     */
    public List<MetricPoint> recent(String metricName, Duration window) {
        Objects.requireNonNull(window, "window must not be null");
        Deque<MetricPoint> buffer = buffers.get(metricName);
        if (buffer == null) {
            return List.of();
        }
        Instant cutoff = clock.instant().minus(window);
        synchronized (buffer) {
            evictExpired(buffer);
            List<MetricPoint> result = new ArrayList<>();
            for (MetricPoint point : buffer) {
                if (!point.getTimestamp().isBefore(cutoff)) {
                    result.add(point);
                }
            }
            return result;
        }
    }

    /**
     * @return every retained value of the metric, oldest first
     */
    public List<Double> values(String metricName) {
        Deque<MetricPoint> buffer = buffers.get(metricName);
        if (buffer == null) {
            return List.of();
        }
        synchronized (buffer) {
            evictExpired(buffer);
            List<Double> result = new ArrayList<>(buffer.size());
            for (MetricPoint point : buffer) {
                result.add(point.getValue());
            }
            return result;
        }
    }

    public int size(String metricName) {
        Deque<MetricPoint> buffer = buffers.get(metricName);
        if (buffer == null) {
            return 0;
        }
        synchronized (buffer) {
            return buffer.size();
        }
    }

    /**
     * @return point count per metric, sorted by metric name
     */
    public Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new TreeMap<>();
        buffers.forEach((metric, buffer) -> {
            synchronized (buffer) {
                sizes.put(metric, buffer.size());
            }
        });
        return sizes;
    }

    public int getCapacity() {
        return capacity;
    }

    public Duration getRetention() {
        return retention;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    // caller holds the buffer's monitor
    private void evictExpired(Deque<MetricPoint> buffer) {
        Instant cutoff = clock.instant().minus(retention);
        while (!buffer.isEmpty() && buffer.peekFirst().getTimestamp().isBefore(cutoff)) {
            buffer.pollFirst();
        }
    }
}
