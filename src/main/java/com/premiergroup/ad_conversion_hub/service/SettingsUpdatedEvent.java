package com.premiergroup.ad_conversion_hub.service;

import com.premiergroup.ad_conversion_hub.dto.GoogleAdsSettings;

/**
 * Published after every settings save, whether or not any value changed.
 */
public record SettingsUpdatedEvent(GoogleAdsSettings settings) {
}
