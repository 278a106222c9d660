package com.premiergroup.ad_conversion_hub.dto;

import com.premiergroup.ad_conversion_hub.enums.SettingKey;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Google Ads settings with defaults applied. Every field is a non-null string.
 */
public record GoogleAdsSettings(
        String customerId,
        String conversionActionId,
        String conversionActionName,
        String conversionActionCategory,
        String developerToken,
        String clientId,
        String clientSecret,
        String refreshToken,
        String loginCustomerId,
        String conversionValue,
        String currencyCode,
        String enableLogging
) {

    /**
     * Builds settings from a stored map, filling every missing or null key with its default.
     * Unknown keys are ignored.
     */
    public static GoogleAdsSettings fromMap(Map<String, String> stored) {
        Map<SettingKey, String> v = new LinkedHashMap<>();
        for (SettingKey key : SettingKey.values()) {
            String value = stored.get(key.key());
            v.put(key, value != null ? value : key.defaultValue());
        }

        return new GoogleAdsSettings(
                v.get(SettingKey.CUSTOMER_ID),
                v.get(SettingKey.CONVERSION_ACTION_ID),
                v.get(SettingKey.CONVERSION_ACTION_NAME),
                v.get(SettingKey.CONVERSION_ACTION_CATEGORY),
                v.get(SettingKey.DEVELOPER_TOKEN),
                v.get(SettingKey.CLIENT_ID),
                v.get(SettingKey.CLIENT_SECRET),
                v.get(SettingKey.REFRESH_TOKEN),
                v.get(SettingKey.LOGIN_CUSTOMER_ID),
                v.get(SettingKey.CONVERSION_VALUE),
                v.get(SettingKey.CURRENCY_CODE),
                v.get(SettingKey.ENABLE_LOGGING));
    }

    public String value(SettingKey key) {
        return switch (key) {
            case CUSTOMER_ID -> customerId;
            case CONVERSION_ACTION_ID -> conversionActionId;
            case CONVERSION_ACTION_NAME -> conversionActionName;
            case CONVERSION_ACTION_CATEGORY -> conversionActionCategory;
            case DEVELOPER_TOKEN -> developerToken;
            case CLIENT_ID -> clientId;
            case CLIENT_SECRET -> clientSecret;
            case REFRESH_TOKEN -> refreshToken;
            case LOGIN_CUSTOMER_ID -> loginCustomerId;
            case CONVERSION_VALUE -> conversionValue;
            case CURRENCY_CODE -> currencyCode;
            case ENABLE_LOGGING -> enableLogging;
        };
    }

    /**
     * @return every known key in declaration order
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (SettingKey key : SettingKey.values()) {
            map.put(key.key(), value(key));
        }
        return map;
    }

    public boolean isConfigured() {
        return Arrays.stream(SettingKey.values())
                .filter(SettingKey::required)
                .noneMatch(key -> value(key).isEmpty());
    }

    public boolean isLoggingEnabled() {
        return !enableLogging.isEmpty() && !"0".equals(enableLogging);
    }
}
