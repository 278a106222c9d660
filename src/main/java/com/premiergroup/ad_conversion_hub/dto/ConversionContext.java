package com.premiergroup.ad_conversion_hub.dto;

/**
 * Context of one attribution event.
 *
 * @param timestamp when the conversion happened; ISO-8601 with offset, or a local
 *                  {@code yyyy-MM-dd HH:mm:ss} read in the service time zone
 */
public record ConversionContext(String timestamp) {
}
