package com.premiergroup.ad_conversion_hub.reporter;

import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every reporter known to the queue, keyed by provider. Built once, read-only afterwards.
 */
@Component
@Log4j2
public class ConversionReporterRegistry {

    private final Map<String, ConversionReporter<?>> reporters;

    public ConversionReporterRegistry(List<ConversionReporter<?>> candidates) {
        Map<String, ConversionReporter<?>> registered = new LinkedHashMap<>();
        for (ConversionReporter<?> reporter : candidates) {
            registered = reporter.register(registered);
        }
        this.reporters = Collections.unmodifiableMap(registered);
        log.info("Registered conversion reporters: {}", reporters.keySet());
    }

    public Optional<ConversionReporter<?>> find(String provider) {
        return Optional.ofNullable(reporters.get(provider));
    }

    public Collection<ConversionReporter<?>> all() {
        return reporters.values();
    }

    public Map<String, ConversionReporter<?>> asMap() {
        return reporters;
    }
}
