package com.premiergroup.ad_conversion_hub.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Queue job body for one Google Ads click conversion.
 * <p>
 * Credential fields are a snapshot of the settings at enqueue time and may be empty;
 * they are reconciled with the current settings when the job is processed.
 */
public record ConversionPayload(
        @JsonProperty("gclid") String gclid,
        @JsonProperty("conversion_datetime") String conversionDatetime,
        @JsonProperty("attribution_fraction") double attributionFraction,
        @JsonProperty("customer_id") String customerId,
        @JsonProperty("conversion_action_id") String conversionActionId,
        @JsonProperty("conversion_value") String conversionValue,
        @JsonProperty("currency_code") String currencyCode,
        @JsonProperty("developer_token") String developerToken,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_secret") String clientSecret,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("login_customer_id") String loginCustomerId
) {
}
