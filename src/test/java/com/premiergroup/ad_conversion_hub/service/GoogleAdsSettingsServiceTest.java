package com.premiergroup.ad_conversion_hub.service;

import com.premiergroup.ad_conversion_hub.dto.GoogleAdsSettings;
import com.premiergroup.ad_conversion_hub.enums.SettingKey;
import com.premiergroup.ad_conversion_hub.support.InMemorySettingsStore;
import com.premiergroup.ad_conversion_hub.support.TestSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GoogleAdsSettingsServiceTest {

    private InMemorySettingsStore store;
    private List<Object> events;
    private GoogleAdsSettingsService service;

    @BeforeEach
    void setUp() {
        store = new InMemorySettingsStore();
        events = new ArrayList<>();
        service = new GoogleAdsSettingsService(store, events::add);
    }

    @Test
    void emptyStore_returnsDefaults() {
        GoogleAdsSettings settings = service.getAll();

        assertThat(settings.conversionActionCategory()).isEqualTo("SUBMIT_LEAD_FORM");
        assertThat(settings.conversionValue()).isEqualTo("0");
        assertThat(settings.currencyCode()).isEqualTo("SEK");
        assertThat(settings.customerId()).isEmpty();
        assertThat(settings.isConfigured()).isFalse();
        assertThat(settings.isLoggingEnabled()).isFalse();
    }

    @Test
    void update_mergesKnownKeys_andDropsUnknownOnes() {
        service.update(Map.of("customer_id", "123", "nonsense", "x"));
        service.update(Map.of("currency_code", "EUR"));

        Map<String, String> stored = store.load();
        assertThat(stored).doesNotContainKey("nonsense");
        assertThat(stored).containsEntry("customer_id", "123").containsEntry("currency_code", "EUR");
        assertThat(stored).containsOnlyKeys(Arrays.stream(SettingKey.values()).map(SettingKey::key).toList());
    }

    @Test
    void update_nullValue_resetsToDefault() {
        service.update(Map.of("currency_code", "EUR"));

        Map<String, String> reset = new HashMap<>();
        reset.put("currency_code", null);
        service.update(reset);

        assertThat(service.get(SettingKey.CURRENCY_CODE)).isEqualTo("SEK");
    }

    @Test
    void update_publishesEventOnEverySave() {
        service.update(TestSettings.complete());
        service.update(TestSettings.complete());

        assertThat(events).hasSize(2);
        assertThat(events.get(1)).isInstanceOfSatisfying(SettingsUpdatedEvent.class,
                event -> assertThat(event.settings().isConfigured()).isTrue());
        assertThat(service.isConfigured()).isTrue();
    }

    @Test
    void isConfigured_ignoresOptionalKeys() {
        Map<String, String> settings = TestSettings.complete();
        settings.put("login_customer_id", "");
        settings.put("conversion_action_name", "");
        service.update(settings);
        assertThat(service.isConfigured()).isTrue();

        service.update(Map.of("refresh_token", ""));
        assertThat(service.isConfigured()).isFalse();
    }

    @Test
    void sanitize_normalizesOperatorInput() {
        Map<String, String> input = new HashMap<>();
        input.put("customer_id", " 123-456-7890 ");
        input.put("login_customer_id", "111-222-3333");
        input.put("conversion_value", "250.50");
        input.put("currency_code", "eur");
        input.put("client_id", "  id  ");

        Map<String, String> clean = service.sanitize(input);

        assertThat(clean)
                .containsEntry("customer_id", "1234567890")
                .containsEntry("login_customer_id", "1112223333")
                .containsEntry("conversion_value", "250.5")
                .containsEntry("currency_code", "EUR")
                .containsEntry("client_id", "id");
    }

    @Test
    void sanitize_rejectsBadAmountsAndCurrencies() {
        assertThat(service.sanitize(Map.of("conversion_value", "-5"))).containsEntry("conversion_value", "0");
        assertThat(service.sanitize(Map.of("conversion_value", "abc"))).containsEntry("conversion_value", "0");
        assertThat(service.sanitize(Map.of("conversion_value", "100"))).containsEntry("conversion_value", "100");
        assertThat(service.sanitize(Map.of("currency_code", "XXX"))).doesNotContainKey("currency_code");
    }

    @Test
    void sanitizedUnsupportedCurrency_keepsCurrentValue() {
        service.update(Map.of("currency_code", "NOK"));

        service.update(service.sanitize(Map.of("currency_code", "ABC")));

        assertThat(service.get(SettingKey.CURRENCY_CODE)).isEqualTo("NOK");
    }
}
