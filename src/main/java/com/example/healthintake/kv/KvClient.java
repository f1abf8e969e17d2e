package com.example.healthintake.kv;

import java.time.Duration;
import java.util.Optional;

/**
 * Minimal TTL-capable key-value contract the session store is written against.
 */
public interface KvClient {
    Optional<String> get(String key);

    /**
     * Overwrites {@code key}. A positive {@code ttl} (re)starts the expiry clock; null or non-positive means no expiry.
     */
    void set(String key, String value, Duration ttl);

    /**
     * Like {@link #set} but only when {@code key} does not exist yet.
     *
     * @return true when the value was written
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    boolean ping();
}
