package com.premiergroup.ad_conversion_hub.store;

import com.premiergroup.ad_conversion_hub.entity.TransientEntry;
import com.premiergroup.ad_conversion_hub.repository.TransientEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * {@link KeyValueStore} backed by the {@code transients} table, shared by every worker.
 */
@Component
@RequiredArgsConstructor
public class JpaKeyValueStore implements KeyValueStore {

    private final TransientEntryRepository repository;
    private final Clock clock;

    @Override
    @Transactional
    public Optional<String> get(String key) {
        Optional<TransientEntry> entry = repository.findById(key);
        if (entry.isEmpty()) {
            return Optional.empty();
        }

        Instant expiresAt = entry.get().getExpiresAt();
        if (expiresAt != null && !expiresAt.isAfter(clock.instant())) {
            repository.deleteById(key);
            return Optional.empty();
        }
        return Optional.ofNullable(entry.get().getValue());
    }

    @Override
    @Transactional
    public void put(String key, String value, Duration ttl) {
        Instant expiresAt = ttl == null ? null : clock.instant().plus(ttl);
        repository.save(TransientEntry.builder()
                .name(key)
                .value(value)
                .expiresAt(expiresAt)
                .build());
    }

    @Override
    @Transactional
    public void delete(String key) {
        if (repository.existsById(key)) {
            repository.deleteById(key);
        }
    }
}
