package com.premiergroup.ad_conversion_hub.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Small keyed store with optional per-entry expiry. Expiry is enforced by the store:
 * an expired entry is never returned.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /**
     * @param ttl time to live, or {@code null} for an entry that never expires
     */
    void put(String key, String value, Duration ttl);

    default void put(String key, String value) {
        put(key, value, null);
    }

    void delete(String key);
}
