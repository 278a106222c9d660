package com.premiergroup.ad_conversion_hub.service;

import com.premiergroup.ad_conversion_hub.enums.CredentialErrorReason;
import com.premiergroup.ad_conversion_hub.store.KeyValueStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Persistent marker telling the admin notice that uploads fail because of credentials.
 * No expiry; raised by the reporter, cleared on a successful upload or any settings save.
 */
@Component
@RequiredArgsConstructor
public class CredentialErrorFlag {

    public static final String KEY = "gads_credential_error";

    private final KeyValueStore store;

    public void raise(CredentialErrorReason reason) {
        store.put(KEY, reason.value());
    }

    public void clear() {
        store.delete(KEY);
    }

    public Optional<String> current() {
        return store.get(KEY);
    }

    public boolean isRaised() {
        return current().isPresent();
    }
}
