package com.opssentinel.core.response;

import java.util.Collection;
import java.util.Map;

/**
 * Runtime switches and health probes of the system being protected.
 *
 * <p>
 * Response handlers remediate by flipping named switches (caching, rate
 * limiting, active model, ...) and consult the probes during validation.
 * </p>
 *
 * @since 1.0.0
 */
public interface ControlPlane {

    String CACHE = "cache";
    String LOAD_BALANCER = "load_balancer";
    String SERVICE_RESTART = "service_restart";
    String FALLBACK_SOURCES = "fallback_sources";

    /**
     * Set switches on behalf of {@code owner}, typically an action id.
     *
     * <p>
     * Several owners may hold the same switch; the most recent holder's value
     * is in effect.
     * </p>
     *
     * @return the value each switch had before, {@code null} where it was
     *         unset
     */
    Map<String, Object> apply(String owner, Map<String, Object> switches);

    /**
     * Drop the values {@code owner} holds on the named switches. A switch
     * still held by another owner takes that owner's value; a switch nobody
     * holds any more returns to its value before the first holder.
     *
     * @return the value now in effect for every switch the owner released,
     *         {@code null} where the switch is unset; empty when the owner
     *         held none of them
     */
    Map<String, Object> release(String owner, Collection<String> names);

    /**
     * @return current load as a fraction in {@code [0, 1]}
     */
    double systemLoad();

    boolean isHealthy(String component);

    boolean isModelAvailable(String model);
}
