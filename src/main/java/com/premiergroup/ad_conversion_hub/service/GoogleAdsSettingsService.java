package com.premiergroup.ad_conversion_hub.service;

import com.premiergroup.ad_conversion_hub.dto.GoogleAdsSettings;
import com.premiergroup.ad_conversion_hub.enums.SettingKey;
import com.premiergroup.ad_conversion_hub.store.SettingsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
@Log4j2
@RequiredArgsConstructor
public class GoogleAdsSettingsService {

    /**
     * ISO 4217 currency codes accepted by Google Ads.
     */
    public static final Set<String> CURRENCY_CODES = Set.of(
            "AED", "ARS", "AUD", "BGN", "BHD", "BND", "BOB", "BRL", "CAD",
            "CHF", "CLP", "CNY", "COP", "CZK", "DKK", "EGP", "EUR", "GBP",
            "HKD", "HRK", "HUF", "IDR", "ILS", "INR", "ISK", "JPY", "KRW",
            "KWD", "LKR", "MAD", "MXN", "MYR", "NGN", "NOK", "NZD", "PEN",
            "PHP", "PKR", "PLN", "QAR", "RON", "RUB", "SAR", "SEK", "SGD",
            "THB", "TRY", "TWD", "UAH", "USD", "VND", "ZAR");

    private final SettingsStore settingsStore;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Reads the stored settings with defaults merged in. Never cached.
     */
    public GoogleAdsSettings getAll() {
        return GoogleAdsSettings.fromMap(settingsStore.load());
    }

    public String get(SettingKey key) {
        return getAll().value(key);
    }

    public boolean isConfigured() {
        return getAll().isConfigured();
    }

    /**
     * Merges the given values into the current settings and saves the whole map.
     * Unknown keys are discarded, a {@code null} value resets the key to its default.
     */
    public GoogleAdsSettings update(Map<String, String> values) {
        Map<String, String> merged = getAll().toMap();
        values.forEach((name, value) -> SettingKey.fromKey(name).ifPresent(key ->
                merged.put(key.key(), value != null ? value : key.defaultValue())));

        settingsStore.save(merged);
        GoogleAdsSettings updated = GoogleAdsSettings.fromMap(merged);
        log.info("Google Ads settings saved (configured: {})", updated.isConfigured());

        eventPublisher.publishEvent(new SettingsUpdatedEvent(updated));
        return updated;
    }

    /**
     * Normalizes raw operator input before {@link #update(Map)}.
     * <ul>
     *     <li>every value is trimmed</li>
     *     <li>dashes are stripped from customer ids ("123-456-7890")</li>
     *     <li>the conversion value must be a non-negative number, otherwise "0"</li>
     *     <li>an unsupported currency code is dropped so the current one stays</li>
     * </ul>
     */
    public Map<String, String> sanitize(Map<String, String> input) {
        Map<String, String> clean = new LinkedHashMap<>();
        input.forEach((key, value) -> clean.put(key, value == null ? "" : value.trim()));

        clean.computeIfPresent(SettingKey.CUSTOMER_ID.key(), (k, v) -> v.replace("-", ""));
        clean.computeIfPresent(SettingKey.LOGIN_CUSTOMER_ID.key(), (k, v) -> v.replace("-", ""));
        clean.computeIfPresent(SettingKey.CONVERSION_VALUE.key(), (k, v) -> normalizeAmount(v));

        String currency = clean.get(SettingKey.CURRENCY_CODE.key());
        if (currency != null) {
            String upper = currency.toUpperCase(Locale.ROOT);
            if (CURRENCY_CODES.contains(upper)) {
                clean.put(SettingKey.CURRENCY_CODE.key(), upper);
            } else {
                log.warn("Ignoring unsupported currency code '{}'", currency);
                clean.remove(SettingKey.CURRENCY_CODE.key());
            }
        }
        return clean;
    }

    private static String normalizeAmount(String raw) {
        try {
            BigDecimal amount = new BigDecimal(raw);
            return amount.signum() < 0 ? "0" : amount.stripTrailingZeros().toPlainString();
        } catch (NumberFormatException e) {
            return "0";
        }
    }
}
