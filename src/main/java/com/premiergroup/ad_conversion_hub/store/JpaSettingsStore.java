package com.premiergroup.ad_conversion_hub.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiergroup.ad_conversion_hub.entity.StoredOption;
import com.premiergroup.ad_conversion_hub.repository.StoredOptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps the settings map as one JSON document in the {@code stored_options} table.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class JpaSettingsStore implements SettingsStore {

    static final String OPTION_NAME = "gads_settings";

    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {
    };

    private final StoredOptionRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Map<String, String> load() {
        return repository.findById(OPTION_NAME)
                .map(StoredOption::getValue)
                .map(this::parse)
                .orElseGet(LinkedHashMap::new);
    }

    @Override
    @Transactional
    public void save(Map<String, String> values) {
        try {
            repository.save(StoredOption.builder()
                    .name(OPTION_NAME)
                    .value(objectMapper.writeValueAsString(values))
                    .build());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize settings", e);
        }
    }

    private Map<String, String> parse(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            // a corrupt row reads as "nothing stored" so defaults still apply
            log.error("Stored settings are not valid JSON, falling back to defaults", e);
            return new LinkedHashMap<>();
        }
    }
}
