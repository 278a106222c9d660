package com.premiergroup.ad_conversion_hub.dto;

public record ConversionActionDetails(boolean success, String error, String name, String category) {

    public static ConversionActionDetails ok(String name, String category) {
        return new ConversionActionDetails(true, "", name, category);
    }

    public static ConversionActionDetails failure(String error) {
        return new ConversionActionDetails(false, error, "", "");
    }
}
