package com.premiergroup.ad_conversion_hub.dto;

public record EnqueueResponse(int queued) {
}
