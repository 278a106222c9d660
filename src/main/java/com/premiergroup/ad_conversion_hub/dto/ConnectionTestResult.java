package com.premiergroup.ad_conversion_hub.dto;

/**
 * @param debug raw upstream status and body, for diagnostics only
 */
public record ConnectionTestResult(
        boolean success,
        String error,
        boolean credentialError,
        String debug,
        String conversionActionName,
        String conversionActionCategory
) {

    public static ConnectionTestResult ok(String conversionActionName, String conversionActionCategory) {
        return new ConnectionTestResult(true, "", false, "", conversionActionName, conversionActionCategory);
    }

    public static ConnectionTestResult failure(String error, boolean credentialError, String debug) {
        return new ConnectionTestResult(false, error, credentialError, debug, "", "");
    }
}
