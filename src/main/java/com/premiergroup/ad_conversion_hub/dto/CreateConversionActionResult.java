package com.premiergroup.ad_conversion_hub.dto;

public record CreateConversionActionResult(
        boolean success,
        String error,
        boolean credentialError,
        String conversionActionId
) {

    public static CreateConversionActionResult ok(String conversionActionId) {
        return new CreateConversionActionResult(true, "", false, conversionActionId);
    }

    public static CreateConversionActionResult failure(String error, boolean credentialError) {
        return new CreateConversionActionResult(false, error, credentialError, "");
    }
}
