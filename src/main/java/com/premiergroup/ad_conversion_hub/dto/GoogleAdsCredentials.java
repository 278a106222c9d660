package com.premiergroup.ad_conversion_hub.dto;

/**
 * Everything needed to talk to one Google Ads account.
 *
 * @param loginCustomerId    manager (MCC) account id, empty when not used
 * @param conversionActionId only consulted by the connection test, may be empty
 */
public record GoogleAdsCredentials(
        String customerId,
        String developerToken,
        String clientId,
        String clientSecret,
        String refreshToken,
        String loginCustomerId,
        String conversionActionId
) {

    public static GoogleAdsCredentials from(GoogleAdsSettings settings) {
        return new GoogleAdsCredentials(
                settings.customerId(),
                settings.developerToken(),
                settings.clientId(),
                settings.clientSecret(),
                settings.refreshToken(),
                settings.loginCustomerId(),
                settings.conversionActionId());
    }
}
