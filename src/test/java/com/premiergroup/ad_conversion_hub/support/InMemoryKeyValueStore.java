package com.premiergroup.ad_conversion_hub.support;

import com.premiergroup.ad_conversion_hub.store.KeyValueStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryKeyValueStore implements KeyValueStore {

    private final Clock clock;
    private final Map<String, String> values = new HashMap<>();
    private final Map<String, Instant> expiries = new HashMap<>();
    private final Map<String, Duration> ttls = new HashMap<>();

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Instant expiresAt = expiries.get(key);
        if (expiresAt != null && !expiresAt.isAfter(clock.instant())) {
            delete(key);
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        values.put(key, value);
        ttls.put(key, ttl);
        if (ttl == null) {
            expiries.remove(key);
        } else {
            expiries.put(key, clock.instant().plus(ttl));
        }
    }

    @Override
    public void delete(String key) {
        values.remove(key);
        expiries.remove(key);
        ttls.remove(key);
    }

    /**
     * TTL of the last write, {@code null} when written without expiry.
     */
    public Duration ttlOf(String key) {
        return ttls.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }
}
