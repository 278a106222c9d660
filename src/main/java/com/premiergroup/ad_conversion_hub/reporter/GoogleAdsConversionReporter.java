package com.premiergroup.ad_conversion_hub.reporter;

import com.premiergroup.ad_conversion_hub.client.GoogleAdsRestClient;
import com.premiergroup.ad_conversion_hub.client.GoogleAdsRestClientFactory;
import com.premiergroup.ad_conversion_hub.dto.ConversionContext;
import com.premiergroup.ad_conversion_hub.dto.ConversionPayload;
import com.premiergroup.ad_conversion_hub.dto.GoogleAdsCredentials;
import com.premiergroup.ad_conversion_hub.dto.GoogleAdsSettings;
import com.premiergroup.ad_conversion_hub.dto.UploadResult;
import com.premiergroup.ad_conversion_hub.enums.CredentialErrorReason;
import com.premiergroup.ad_conversion_hub.queue.QueueProcessingTrigger;
import com.premiergroup.ad_conversion_hub.repository.ConversionJobRepository;
import com.premiergroup.ad_conversion_hub.service.CredentialErrorFlag;
import com.premiergroup.ad_conversion_hub.service.DiagnosticLogger;
import com.premiergroup.ad_conversion_hub.service.GoogleAdsSettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports offline click conversions to Google Ads.
 * <p>
 * Always registered, even without credentials, so conversions are queued during a credential
 * outage. Credentials are snapshotted at enqueue time and reconciled with the current settings
 * when the job runs.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class GoogleAdsConversionReporter implements ConversionReporter<ConversionPayload> {

    public static final String PROVIDER = "google_ads";

    static final DateTimeFormatter CONVERSION_DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssxxx");

    private final GoogleAdsSettingsService settingsService;
    private final GoogleAdsRestClientFactory clientFactory;
    private final CredentialErrorFlag credentialErrorFlag;
    private final DiagnosticLogger diagnostics;
    private final ConversionJobRepository jobRepository;
    private final QueueProcessingTrigger queueTrigger;
    private final Clock clock;

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public Class<ConversionPayload> payloadType() {
        return ConversionPayload.class;
    }

    /**
     * One payload per attributed hash carrying a {@code google_ads} click id, in attribution
     * order. Only raw values are stored; the resource name and the attributed value are worked
     * out at process time.
     *
     * @throws DateTimeParseException when the context timestamp cannot be read
     */
    @Override
    public List<ConversionPayload> enqueue(Map<String, Double> attributions,
                                           Map<String, Map<String, String>> clickIds,
                                           Map<String, Map<String, String>> campaigns,
                                           ConversionContext context) {
        GoogleAdsSettings settings = settingsService.getAll();
        String datetime = formatConversionDateTime(context.timestamp());
        List<ConversionPayload> payloads = new ArrayList<>();

        attributions.forEach((hash, fraction) -> {
            Map<String, String> platforms = clickIds == null ? null : clickIds.get(hash);
            String gclid = platforms == null ? null : platforms.get(PROVIDER);
            if (isEmpty(gclid)) {
                return;
            }

            double attributionFraction = fraction == null ? 0.0 : fraction;
            diagnostics.info("Enqueued, gclid: " + gclid + ", datetime: " + datetime + ", fraction: " + attributionFraction);
            payloads.add(new ConversionPayload(
                    gclid,
                    datetime,
                    attributionFraction,
                    settings.customerId(),
                    settings.conversionActionId(),
                    settings.conversionValue(),
                    settings.currencyCode(),
                    settings.developerToken(),
                    settings.clientId(),
                    settings.clientSecret(),
                    settings.refreshToken(),
                    settings.loginCustomerId()));
        });

        return payloads;
    }

    /**
     * Uploads one queued conversion.
     * <p>
     * Each field comes from the payload unless it is unset (null, empty or "0"), then from the
     * current settings.
     * The conversion action id is the exception: the current setting wins, so queued jobs follow
     * an operator who replaced a misconfigured action.
     */
    @Override
    public boolean process(ConversionPayload payload) {
        GoogleAdsSettings settings = settingsService.getAll();

        String customerId = firstNonEmpty(payload.customerId(), settings.customerId());
        String conversionActionId = firstNonEmpty(settings.conversionActionId(), payload.conversionActionId());
        String conversionValue = firstNonEmpty(payload.conversionValue(), settings.conversionValue());
        String currencyCode = firstNonEmpty(payload.currencyCode(), settings.currencyCode());
        String developerToken = firstNonEmpty(payload.developerToken(), settings.developerToken());
        String clientId = firstNonEmpty(payload.clientId(), settings.clientId());
        String clientSecret = firstNonEmpty(payload.clientSecret(), settings.clientSecret());
        String refreshToken = firstNonEmpty(payload.refreshToken(), settings.refreshToken());
        String loginCustomerId = firstNonEmpty(payload.loginCustomerId(), settings.loginCustomerId());

        if (isUnset(customerId) || isUnset(conversionActionId) || isUnset(developerToken)
                || isUnset(clientId) || isUnset(clientSecret) || isUnset(refreshToken)) {
            credentialErrorFlag.raise(CredentialErrorReason.MISSING);
            diagnostics.error("Aborted, gclid: " + payload.gclid() + ", missing credentials");
            log.error("Cannot process gclid {}, required Google Ads credentials are still missing", payload.gclid());
            return false;
        }

        diagnostics.info("Processing, gclid: " + payload.gclid() + ", customer: " + customerId
                + ", action_id: " + conversionActionId);

        String conversionAction = "customers/" + customerId + "/conversionActions/" + conversionActionId;
        double attributedValue = parseAmount(conversionValue) * payload.attributionFraction();

        GoogleAdsRestClient client = clientFactory.create(new GoogleAdsCredentials(
                customerId, developerToken, clientId, clientSecret, refreshToken, loginCustomerId, ""));

        UploadResult result = client.uploadClickConversion(
                payload.gclid(), conversionAction, payload.conversionDatetime(), attributedValue, currencyCode);

        if (!result.success()) {
            if (result.credentialError()) {
                credentialErrorFlag.raise(CredentialErrorReason.TOKEN_REFRESH_FAILED);
            }
            log.error("Conversion upload failed for gclid {}: {}", payload.gclid(), result.error());
            return false;
        }

        credentialErrorFlag.clear();
        return true;
    }

    /**
     * Gives every failed Google Ads job a fresh attempt budget and asks the queue for an
     * immediate run.
     */
    public void resetFailedJobs() {
        int reset = jobRepository.resetFailedJobs(PROVIDER);
        log.info("Reset {} failed Google Ads conversion job(s) to pending", reset);
        queueTrigger.scheduleImmediateRun();
    }

    /**
     * Reads an ISO-8601 timestamp, with or without offset, and formats it for Google Ads.
     * A timestamp without offset is taken to be in the clock's zone.
     */
    String formatConversionDateTime(String timestamp) {
        String iso = timestamp.trim().replaceFirst(" ", "T");
        try {
            return OffsetDateTime.parse(iso).format(CONVERSION_DATETIME);
        } catch (DateTimeParseException e) {
            ZonedDateTime local = LocalDateTime.parse(iso).atZone(clock.getZone());
            return local.format(CONVERSION_DATETIME);
        }
    }

    private static double parseAmount(String value) {
        if (value == null) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static String firstNonEmpty(String preferred, String fallback) {
        return isUnset(preferred) ? fallback : preferred;
    }

    /** Null, empty and "0" all count as not configured. */
    private static boolean isUnset(String value) {
        return isEmpty(value) || "0".equals(value);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
