package com.premiergroup.ad_conversion_hub.dto;

/**
 * Admin-facing alert state. The message is the same for every reason.
 */
public record CredentialNotice(boolean active, String reason, String message) {

    public static final String MESSAGE =
            "Google Ads conversion uploads are failing due to invalid or missing credentials. "
                    + "Please check your Google Ads settings.";

    public static CredentialNotice inactive() {
        return new CredentialNotice(false, "", "");
    }
}
