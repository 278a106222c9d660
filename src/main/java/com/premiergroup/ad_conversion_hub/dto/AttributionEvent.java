package com.premiergroup.ad_conversion_hub.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record AttributionEvent(
        @NotNull Map<String, Double> attributions,
        Map<String, Map<String, String>> clickIds,
        Map<String, Map<String, String>> campaigns,
        @NotBlank String timestamp
) {
}
