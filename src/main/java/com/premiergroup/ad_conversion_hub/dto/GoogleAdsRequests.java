package com.premiergroup.ad_conversion_hub.dto;

import java.util.List;

/**
 * JSON request bodies of the Google Ads REST endpoints. Component names are the wire names.
 */
public final class GoogleAdsRequests {

    private GoogleAdsRequests() {
    }

    public record UploadClickConversions(List<ClickConversion> conversions, boolean partialFailure) {

        public static UploadClickConversions single(ClickConversion conversion) {
            return new UploadClickConversions(List.of(conversion), true);
        }
    }

    public record ClickConversion(
            String gclid,
            String conversionAction,
            String conversionDateTime,
            double conversionValue,
            String currencyCode
    ) {
    }

    public record Search(String query) {
    }

    public record MutateConversionActions(List<Operation> operations) {

        public static MutateConversionActions create(ConversionActionCreate create) {
            return new MutateConversionActions(List.of(new Operation(create)));
        }
    }

    public record Operation(ConversionActionCreate create) {
    }

    public record ConversionActionCreate(
            String name,
            String type,
            String category,
            String status,
            ValueSettings valueSettings
    ) {
    }

    public record ValueSettings(double defaultValue, boolean alwaysUseDefaultValue, String defaultCurrencyCode) {
    }
}
