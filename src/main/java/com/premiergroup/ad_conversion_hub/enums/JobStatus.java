package com.premiergroup.ad_conversion_hub.enums;

public enum JobStatus {
    PENDING,
    DONE,
    FAILED
}
