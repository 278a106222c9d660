package com.premiergroup.ad_conversion_hub.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiergroup.ad_conversion_hub.dto.GoogleAdsCredentials;
import com.premiergroup.ad_conversion_hub.service.DiagnosticLogger;
import com.premiergroup.ad_conversion_hub.store.KeyValueStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Builds a {@link GoogleAdsRestClient} per credential set. The HTTP client, the token cache
 * and the diagnostic log are shared by all of them.
 */
@Component
public class GoogleAdsRestClientFactory {

    private final RestClient restClient;
    private final KeyValueStore tokenCache;
    private final ObjectMapper objectMapper;
    private final DiagnosticLogger diagnostics;
    private final String tokenUrl;
    private final String apiBaseUrl;

    public GoogleAdsRestClientFactory(RestClient googleAdsRestClient,
                                      KeyValueStore tokenCache,
                                      ObjectMapper objectMapper,
                                      DiagnosticLogger diagnostics,
                                      @Value("${google.ads.token-url:https://oauth2.googleapis.com/token}") String tokenUrl,
                                      @Value("${google.ads.api-base-url:https://googleads.googleapis.com/v23}") String apiBaseUrl) {
        this.restClient = googleAdsRestClient;
        this.tokenCache = tokenCache;
        this.objectMapper = objectMapper;
        this.diagnostics = diagnostics;
        this.tokenUrl = tokenUrl;
        this.apiBaseUrl = apiBaseUrl;
    }

    public GoogleAdsRestClient create(GoogleAdsCredentials credentials) {
        return new GoogleAdsRestClient(credentials, restClient, tokenCache, objectMapper, diagnostics, tokenUrl, apiBaseUrl);
    }
}
