package com.txwatch.health;

import java.util.concurrent.Callable;

/**
 * Registry of named dependencies whose liveness a dashboard can poll.
 */
public interface HealthRegistry {

    /**
     * Registers or replaces a service probe.
     *
     * @param probe returns true when healthy, false when degraded; throwing marks the service unhealthy
     */
    void register(String name, String url, long timeoutMs, Callable<Boolean> probe, boolean critical);

    boolean unregister(String name);
}
