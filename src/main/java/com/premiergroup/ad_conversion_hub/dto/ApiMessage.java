package com.premiergroup.ad_conversion_hub.dto;

public record ApiMessage(boolean success, String message) {
}
