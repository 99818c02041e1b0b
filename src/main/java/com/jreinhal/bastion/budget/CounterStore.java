package com.jreinhal.bastion.budget;

import java.util.OptionalLong;

/**
 * Shared integer counters with per-key expiry. Implementations must make
 * {@link #increment(String)} atomic across concurrent callers.
 */
public interface CounterStore {

    /**
     * Atomically increments the counter, creating it at 1 when absent.
     *
     * @throws CounterStoreException when the store cannot be reached
     */
    long increment(String key);

    void expire(String key, long seconds);

    OptionalLong get(String key);

    /**
     * Reachability check for health reporting. Never throws.
     */
    boolean isAvailable();
}
