package com.premiergroup.ad_conversion_hub.service;

import com.premiergroup.ad_conversion_hub.reporter.GoogleAdsConversionReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Gives failed uploads another chance once the operator has re-entered credentials.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class CredentialRestoreListener {

    private final CredentialErrorFlag credentialErrorFlag;
    private final GoogleAdsConversionReporter reporter;

    @EventListener
    public void onSettingsUpdated(SettingsUpdatedEvent event) {
        // the notice goes away immediately, before the next run confirms the credentials
        credentialErrorFlag.clear();

        if (event.settings().isConfigured()) {
            log.info("Settings are complete, re-queuing failed Google Ads conversions");
            reporter.resetFailedJobs();
        }
    }
}
