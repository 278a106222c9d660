package com.premiergroup.ad_conversion_hub.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Blank currency or category fall back to the current settings.
 */
public record CreateConversionActionRequest(
        @NotBlank String name,
        @PositiveOrZero double defaultValue,
        String currencyCode,
        String category
) {
}
