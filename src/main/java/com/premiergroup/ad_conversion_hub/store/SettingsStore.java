package com.premiergroup.ad_conversion_hub.store;

import java.util.Map;

/**
 * Persistence for the single settings map. The whole map is read and written at once.
 */
public interface SettingsStore {

    /**
     * @return the stored map, empty when nothing has been saved yet
     */
    Map<String, String> load();

    void save(Map<String, String> values);
}
