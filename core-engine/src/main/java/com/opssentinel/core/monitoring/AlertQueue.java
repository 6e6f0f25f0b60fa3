package com.opssentinel.core.monitoring;

import com.opssentinel.core.model.AnomalyAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded, thread-safe FIFO of accepted alerts.
 *
 * <p>
 * {@link #offer} never blocks: when the queue is full the oldest alert is
 * dropped and a warning is logged.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertQueue {

    private static final Logger LOG = LoggerFactory.getLogger(AlertQueue.class);

    private final int capacity;
    private final Deque<AnomalyAlert> alerts = new ArrayDeque<>();

    public AlertQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Enqueue an alert.
     *
     * @return the alert dropped to make room, if any
     */
    public synchronized Optional<AnomalyAlert> offer(AnomalyAlert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        AnomalyAlert dropped = null;
        if (alerts.size() >= capacity) {
            dropped = alerts.pollFirst();
            LOG.warn("Alert queue full (capacity {}), dropped oldest alert {}", capacity, dropped.getId());
        }
        alerts.addLast(alert);
        return Optional.ofNullable(dropped);
    }

    /**
     * Remove and return the oldest alert.
     */
    public synchronized Optional<AnomalyAlert> poll() {
        return Optional.ofNullable(alerts.pollFirst());
    }

    /**
     * @return up to {@code limit} alerts, newest first
     */
    public synchronized List<AnomalyAlert> recent(int limit) {
        List<AnomalyAlert> result = new ArrayList<>();
        Iterator<AnomalyAlert> it = alerts.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    /**
     * Drop every alert whose timestamp is before {@code cutoff}.
     *
     * @return number of alerts removed
     */
    public synchronized int removeOlderThan(Instant cutoff) {
        int before = alerts.size();
        alerts.removeIf(alert -> alert.getTimestamp().isBefore(cutoff));
        return before - alerts.size();
    }

    public synchronized int size() {
        return alerts.size();
    }

    public int capacity() {
        return capacity;
    }
}
