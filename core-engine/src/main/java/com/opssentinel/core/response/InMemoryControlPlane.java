package com.opssentinel.core.response;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * {@link ControlPlane} that keeps switches in memory.
 *
 * <p>
 * Each switch held by actions keeps a stack of holders plus the value it had
 * before the first one, so holders can be released in any order. Components
 * are healthy unless marked otherwise, the load starts at
 * {@value #DEFAULT_LOAD} and the models in {@link #DEFAULT_MODELS} are
 * available. All methods are thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryControlPlane implements ControlPlane {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryControlPlane.class);

    public static final double DEFAULT_LOAD = 0.6;
    public static final Set<String> DEFAULT_MODELS = Set.of("gemini-1.5-flash", "gemini-1.5-pro");

    private final Map<String, Object> switches = new HashMap<>();
    private final Map<String, Deque<Hold>> holds = new HashMap<>();
    private final Map<String, Object> baseValues = new HashMap<>();
    private final Map<String, Boolean> health = new HashMap<>();
    private final Set<String> models = new HashSet<>(DEFAULT_MODELS);
    private double load = DEFAULT_LOAD;

    @Override
    public synchronized Map<String, Object> apply(String owner, Map<String, Object> values) {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(values, "values must not be null");
        Map<String, Object> previous = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            Object before = switches.get(name);
            Deque<Hold> stack = holds.get(name);
            if (stack == null) {
                stack = new ArrayDeque<>();
                holds.put(name, stack);
                baseValues.put(name, before);
            }
            stack.removeIf(hold -> hold.owner.equals(owner));
            stack.addLast(new Hold(owner, value));
            switches.put(name, value);
            previous.put(name, before);
        });
        LOG.info("{} applied switches {}", owner, values);
        return previous;
    }

    @Override
    public synchronized Map<String, Object> release(String owner, Collection<String> names) {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(names, "names must not be null");
        Map<String, Object> effective = new LinkedHashMap<>();
        for (String name : names) {
            Deque<Hold> stack = holds.get(name);
            if (stack == null || !stack.removeIf(hold -> hold.owner.equals(owner))) {
                continue;
            }
            Object value;
            if (stack.isEmpty()) {
                holds.remove(name);
                value = baseValues.remove(name);
            } else {
                value = stack.peekLast().value;
            }
            put(name, value);
            effective.put(name, value);
        }
        if (!effective.isEmpty()) {
            LOG.info("{} released switches {}", owner, effective.keySet());
        }
        return effective;
    }

    /**
     * Set switches directly, outside any action. While actions hold a switch
     * the new value only becomes effective once the last holder is released.
     */
    public synchronized void set(Map<String, Object> values) {
        Objects.requireNonNull(values, "values must not be null");
        values.forEach((name, value) -> {
            if (holds.containsKey(name)) {
                baseValues.put(name, value);
            } else {
                put(name, value);
            }
        });
    }

    @Override
    public synchronized double systemLoad() {
        return load;
    }

    @Override
    public synchronized boolean isHealthy(String component) {
        return health.getOrDefault(component, Boolean.TRUE);
    }

    @Override
    public synchronized boolean isModelAvailable(String model) {
        return model != null && models.contains(model);
    }

    /**
     * @return current value of a switch, or {@code null} when unset
     */
    public synchronized Object get(String name) {
        return switches.get(name);
    }

    /**
     * @return sorted copy of all set switches
     */
    public synchronized Map<String, Object> switches() {
        return new TreeMap<>(switches);
    }

    public synchronized void setSystemLoad(double load) {
        this.load = load;
    }

    public synchronized void setHealthy(String component, boolean healthy) {
        health.put(component, healthy);
    }

    public synchronized void setModelAvailable(String model, boolean available) {
        if (available) {
            models.add(model);
        } else {
            models.remove(model);
        }
    }

    private void put(String name, Object value) {
        if (value == null) {
            switches.remove(name);
        } else {
            switches.put(name, value);
        }
    }

    private static final class Hold {
        final String owner;
        final Object value;

        Hold(String owner, Object value) {
            this.owner = owner;
            this.value = value;
        }
    }
}
