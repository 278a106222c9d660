package com.premiergroup.ad_conversion_hub.support;

import com.premiergroup.ad_conversion_hub.store.SettingsStore;

import java.util.LinkedHashMap;
import java.util.Map;

public class InMemorySettingsStore implements SettingsStore {

    private Map<String, String> stored = new LinkedHashMap<>();

    @Override
    public Map<String, String> load() {
        return new LinkedHashMap<>(stored);
    }

    @Override
    public void save(Map<String, String> values) {
        stored = new LinkedHashMap<>(values);
    }
}
