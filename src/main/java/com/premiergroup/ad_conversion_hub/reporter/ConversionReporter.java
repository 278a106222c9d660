package com.premiergroup.ad_conversion_hub.reporter;

import com.premiergroup.ad_conversion_hub.dto.ConversionContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ad platform that receives offline conversions through the queue.
 *
 * @param <P> queue payload, stored as JSON between {@link #enqueue} and {@link #process}
 */
public interface ConversionReporter<P> {

    /**
     * Registry key, also stored on every queue job of this reporter.
     */
    String provider();

    Class<P> payloadType();

    /**
     * Builds one payload per attributed click that belongs to this platform.
     *
     * @param attributions hash to attribution fraction, iteration order is kept
     * @param clickIds     hash to platform to click id
     * @param campaigns    hash to campaign data
     */
    List<P> enqueue(Map<String, Double> attributions,
                    Map<String, Map<String, String>> clickIds,
                    Map<String, Map<String, String>> campaigns,
                    ConversionContext context);

    /**
     * Delivers one payload.
     *
     * @return {@code true} when delivered, {@code false} to let the queue retry
     */
    boolean process(P payload);

    /**
     * Returns a copy of {@code reporters} with this reporter added under {@link #provider()}.
     * Existing entries keep their order; a previous entry with the same key is replaced.
     */
    default Map<String, ConversionReporter<?>> register(Map<String, ConversionReporter<?>> reporters) {
        Map<String, ConversionReporter<?>> registered = new LinkedHashMap<>(reporters);
        registered.put(provider(), this);
        return registered;
    }
}
