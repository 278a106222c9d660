package com.premiergroup.ad_conversion_hub.enums;

/**
 * Why uploads are failing on credentials. Stored verbatim as the flag value.
 */
public enum CredentialErrorReason {

    /** Required credentials were still empty after merging payload and settings. */
    MISSING("missing"),

    /** Google rejected the credentials while obtaining an access token. */
    TOKEN_REFRESH_FAILED("token_refresh_failed");

    private final String value;

    CredentialErrorReason(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
