package com.premiergroup.ad_conversion_hub.dto;

public record UploadResult(boolean success, String error, boolean credentialError) {

    public static UploadResult ok() {
        return new UploadResult(true, "", false);
    }

    public static UploadResult failure(String error, boolean credentialError) {
        return new UploadResult(false, error, credentialError);
    }
}
