package com.premiergroup.ad_conversion_hub.service;

import com.premiergroup.ad_conversion_hub.client.GoogleAdsRestClient;
import com.premiergroup.ad_conversion_hub.client.GoogleAdsRestClientFactory;
import com.premiergroup.ad_conversion_hub.dto.ApiMessage;
import com.premiergroup.ad_conversion_hub.dto.ConnectionTestResult;
import com.premiergroup.ad_conversion_hub.dto.ConversionActionDetails;
import com.premiergroup.ad_conversion_hub.dto.CreateConversionActionRequest;
import com.premiergroup.ad_conversion_hub.dto.CreateConversionActionResult;
import com.premiergroup.ad_conversion_hub.dto.CredentialNotice;
import com.premiergroup.ad_conversion_hub.dto.GoogleAdsCredentials;
import com.premiergroup.ad_conversion_hub.dto.GoogleAdsSettings;
import com.premiergroup.ad_conversion_hub.enums.SettingKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Operator actions on the Google Ads account: connection test, conversion action management,
 * masked settings view and the credential notice.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class GoogleAdsAdminService {

    private static final Set<SettingKey> SECRET_KEYS =
            EnumSet.of(SettingKey.CLIENT_SECRET, SettingKey.REFRESH_TOKEN, SettingKey.DEVELOPER_TOKEN);

    private final GoogleAdsSettingsService settingsService;
    private final GoogleAdsRestClientFactory clientFactory;
    private final CredentialErrorFlag credentialErrorFlag;

    public Map<String, String> maskedSettings() {
        GoogleAdsSettings settings = settingsService.getAll();
        Map<String, String> view = new LinkedHashMap<>();
        for (SettingKey key : SettingKey.values()) {
            String value = settings.value(key);
            view.put(key.key(), SECRET_KEYS.contains(key) ? DiagnosticLogger.mask(value) : value);
        }
        return view;
    }

    public Map<String, String> updateSettings(Map<String, String> input) {
        settingsService.update(settingsService.sanitize(input));
        return maskedSettings();
    }

    /**
     * Runs the two-phase connection test against the stored settings.
     * A failure message carries masked credentials and the raw Google response.
     *
     * @throws IllegalStateException when required settings are missing
     */
    public ApiMessage testConnection() {
        GoogleAdsSettings settings = settingsService.getAll();
        if (!settings.isConfigured()) {
            throw new IllegalStateException("Please fill in all required credentials first.");
        }

        ConnectionTestResult result = clientFactory.create(GoogleAdsCredentials.from(settings)).testConnection();

        if (result.success()) {
            String message = result.conversionActionName().isEmpty()
                    ? "Connection successful! OAuth2 token refresh succeeded."
                    : "Connection successful! All credentials verified. Conversion action: " + result.conversionActionName();
            return new ApiMessage(true, message);
        }

        log.warn("Google Ads connection test failed: {}", result.error());
        String diagnostics = String.format(
                "%n%nDiagnostics: client_id=%s | client_secret=%s | refresh_token=%s | customer_id=%s"
                        + " | developer_token=%s | login_customer_id=%s | conversion_action_id=%s%n%nGoogle response: %s",
                settings.clientId(),
                DiagnosticLogger.mask(settings.clientSecret()),
                DiagnosticLogger.mask(settings.refreshToken()),
                settings.customerId(),
                DiagnosticLogger.mask(settings.developerToken()),
                settings.loginCustomerId().isEmpty() ? "(empty)" : settings.loginCustomerId(),
                settings.conversionActionId(),
                result.debug().isEmpty() ? "N/A" : result.debug());
        return new ApiMessage(false, result.error() + diagnostics);
    }

    /**
     * Creates a conversion action and, on success, makes it the configured one.
     * Blank currency and category fall back to the current settings.
     *
     * @throws IllegalStateException when account credentials are missing
     */
    public CreateConversionActionResult createConversionAction(CreateConversionActionRequest request) {
        GoogleAdsSettings settings = settingsService.getAll();
        requireAccountCredentials(settings);

        String currency = isBlank(request.currencyCode()) ? settings.currencyCode() : request.currencyCode().trim().toUpperCase(Locale.ROOT);
        String category = isBlank(request.category()) ? settings.conversionActionCategory() : request.category().trim();
        String name = request.name().trim();

        GoogleAdsRestClient client = clientFactory.create(GoogleAdsCredentials.from(settings));
        CreateConversionActionResult result = client.createConversionAction(name, request.defaultValue(), currency, category);

        if (result.success()) {
            Map<String, String> values = new LinkedHashMap<>();
            values.put(SettingKey.CONVERSION_ACTION_ID.key(), result.conversionActionId());
            values.put(SettingKey.CONVERSION_ACTION_NAME.key(), name);
            values.put(SettingKey.CONVERSION_ACTION_CATEGORY.key(), category);
            settingsService.update(values);
            log.info("Conversion action '{}' created with ID {}", name, result.conversionActionId());
        }
        return result;
    }

    /**
     * @throws IllegalStateException when account credentials are missing
     */
    public ConversionActionDetails fetchConversionActionDetails(String conversionActionId) {
        GoogleAdsSettings settings = settingsService.getAll();
        requireAccountCredentials(settings);
        return clientFactory.create(GoogleAdsCredentials.from(settings)).fetchConversionActionDetails(conversionActionId);
    }

    public CredentialNotice credentialNotice() {
        return credentialErrorFlag.current()
                .map(reason -> new CredentialNotice(true, reason, CredentialNotice.MESSAGE))
                .orElseGet(CredentialNotice::inactive);
    }

    // everything but the conversion action itself
    private static void requireAccountCredentials(GoogleAdsSettings settings) {
        for (SettingKey key : SettingKey.values()) {
            if (key.required() && key != SettingKey.CONVERSION_ACTION_ID && settings.value(key).isEmpty()) {
                throw new IllegalStateException("Please fill in all required credentials first.");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
