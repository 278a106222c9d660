package com.premiergroup.ad_conversion_hub.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed set of Google Ads settings, with the stored key and its default value.
 */
public enum SettingKey {

    CUSTOMER_ID("customer_id", "", true),
    CONVERSION_ACTION_ID("conversion_action_id", "", true),
    CONVERSION_ACTION_NAME("conversion_action_name", "", false),
    CONVERSION_ACTION_CATEGORY("conversion_action_category", "SUBMIT_LEAD_FORM", false),
    DEVELOPER_TOKEN("developer_token", "", true),
    CLIENT_ID("client_id", "", true),
    CLIENT_SECRET("client_secret", "", true),
    REFRESH_TOKEN("refresh_token", "", true),
    LOGIN_CUSTOMER_ID("login_customer_id", "", false),
    CONVERSION_VALUE("conversion_value", "0", false),
    CURRENCY_CODE("currency_code", "SEK", false),
    ENABLE_LOGGING("enable_logging", "", false);

    private final String key;
    private final String defaultValue;
    private final boolean required;

    SettingKey(String key, String defaultValue, boolean required) {
        this.key = key;
        this.defaultValue = defaultValue;
        this.required = required;
    }

    public String key() {
        return key;
    }

    public String defaultValue() {
        return defaultValue;
    }

    /**
     * Whether the field must be non-empty for the integration to count as configured.
     */
    public boolean required() {
        return required;
    }

    public static Optional<SettingKey> fromKey(String key) {
        return Arrays.stream(values())
                .filter(k -> k.key.equals(key))
                .findFirst();
    }
}
