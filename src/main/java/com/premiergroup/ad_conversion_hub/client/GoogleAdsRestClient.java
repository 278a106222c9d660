package com.premiergroup.ad_conversion_hub.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.premiergroup.ad_conversion_hub.dto.ConnectionTestResult;
import com.premiergroup.ad_conversion_hub.dto.ConversionActionDetails;
import com.premiergroup.ad_conversion_hub.dto.CreateConversionActionResult;
import com.premiergroup.ad_conversion_hub.dto.GoogleAdsCredentials;
import com.premiergroup.ad_conversion_hub.dto.GoogleAdsRequests;
import com.premiergroup.ad_conversion_hub.dto.UploadResult;
import com.premiergroup.ad_conversion_hub.service.DiagnosticLogger;
import com.premiergroup.ad_conversion_hub.store.KeyValueStore;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Google Ads REST client for offline click conversions, bound to one set of credentials.
 * <p>
 * OAuth2 access tokens are shared through the {@link KeyValueStore}, so every instance reuses
 * a token until it is close to expiry. No operation throws on HTTP or transport failures;
 * each returns a result whose {@code credentialError} flag tells bad configuration apart
 * from other API errors.
 */
@Log4j2
public class GoogleAdsRestClient {

    public static final String TOKEN_CACHE_KEY = "gads_access_token";

    /** Seconds taken off the token lifetime so a cached token never expires mid-request. */
    static final long TOKEN_TTL_MARGIN_SECONDS = 300;

    private static final String TOKEN_FAILURE = "Failed to obtain access token.";
    private static final Pattern ACTION_ID = Pattern.compile("conversionActions/(\\d+)$");

    private final GoogleAdsCredentials credentials;
    private final RestClient restClient;
    private final KeyValueStore tokenCache;
    private final ObjectMapper objectMapper;
    private final DiagnosticLogger diagnostics;
    private final String tokenUrl;
    private final String apiBaseUrl;

    private String lastRefreshError = "";
    private String lastRefreshDebug = "";

    public GoogleAdsRestClient(GoogleAdsCredentials credentials,
                               RestClient restClient,
                               KeyValueStore tokenCache,
                               ObjectMapper objectMapper,
                               DiagnosticLogger diagnostics,
                               String tokenUrl,
                               String apiBaseUrl) {
        this.credentials = credentials;
        this.restClient = restClient;
        this.tokenCache = tokenCache;
        this.objectMapper = objectMapper;
        this.diagnostics = diagnostics;
        this.tokenUrl = tokenUrl;
        this.apiBaseUrl = apiBaseUrl;
    }

    /**
     * Verifies the credentials in two phases.
     * <p>
     * Phase 1 forces a fresh token refresh, which checks client id, client secret and refresh
     * token. Phase 2 runs only when a conversion action id is configured: one query for that
     * action checks developer token, customer id, login customer id and the action id itself.
     */
    public ConnectionTestResult testConnection() {
        diagnostics.info("Test connection, phase 1: verifying OAuth2 credentials");
        Optional<String> token = refreshAccessToken();

        if (token.isEmpty()) {
            String error = orDefault(lastRefreshError, TOKEN_FAILURE);
            diagnostics.error("Test connection, phase 1 failed: " + error);
            return ConnectionTestResult.failure(error, true, lastRefreshDebug);
        }
        diagnostics.info("Test connection, phase 1 passed: token refresh successful");

        if (credentials.conversionActionId().isEmpty()) {
            return ConnectionTestResult.ok("", "");
        }

        diagnostics.info("Test connection, phase 2: verifying Google Ads API access for conversion action "
                + credentials.conversionActionId());
        ConnectionTestResult result = verifyGoogleAdsAccess(token.get());
        if (result.success()) {
            diagnostics.info("Test connection, phase 2 passed: conversion action '" + result.conversionActionName() + "'");
        } else {
            diagnostics.error("Test connection, phase 2 failed: " + result.error());
        }
        return result;
    }

    /**
     * Uploads a single click conversion with partial failure enabled.
     *
     * @param conversionAction   resource name {@code customers/{id}/conversionActions/{id}}
     * @param conversionDateTime {@code yyyy-MM-dd HH:mm:ss+HH:MM}
     */
    public UploadResult uploadClickConversion(String gclid,
                                              String conversionAction,
                                              String conversionDateTime,
                                              double conversionValue,
                                              String currencyCode) {
        diagnostics.info("Uploading conversion, gclid: " + gclid + ", action: " + conversionAction
                + ", value: " + conversionValue + " " + currencyCode);

        Optional<String> token = getAccessToken();
        if (token.isEmpty()) {
            String error = orDefault(lastRefreshError, TOKEN_FAILURE);
            diagnostics.error("Conversion upload failed, gclid: " + gclid + ", error: " + error);
            return UploadResult.failure(error, true);
        }

        GoogleAdsRequests.UploadClickConversions body = GoogleAdsRequests.UploadClickConversions.single(
                new GoogleAdsRequests.ClickConversion(
                        gclid, conversionAction, conversionDateTime, conversionValue, currencyCode));

        ApiResponse response;
        try {
            response = postJson("/customers/" + credentials.customerId() + ":uploadClickConversions", body, token.get());
        } catch (RestClientException e) {
            String error = messageOf(e);
            diagnostics.error("Conversion upload failed, gclid: " + gclid + ", error: " + error);
            return UploadResult.failure(error, false);
        }

        if (response.status() != 200) {
            String error = "HTTP " + response.status() + ": " + response.body();
            diagnostics.error("Conversion upload failed, gclid: " + gclid + ", error: " + error);
            return UploadResult.failure(error, false);
        }

        JsonNode partialFailure = parse(response.body()).path("partialFailureError");
        if (isPresent(partialFailure)) {
            String error = orDefault(partialFailure.path("message").asText(""), "Partial failure error");
            diagnostics.error("Conversion partial failure, gclid: " + gclid + ", error: " + error);
            return UploadResult.failure(error, false);
        }

        diagnostics.info("Conversion uploaded, gclid: " + gclid);
        return UploadResult.ok();
    }

    /**
     * Creates an {@code UPLOAD_CLICKS} conversion action, refusing to create a second action
     * with the same name.
     */
    public CreateConversionActionResult createConversionAction(String name,
                                                               double defaultValue,
                                                               String currencyCode,
                                                               String category) {
        diagnostics.info("Creating conversion action, name: " + name + ", category: " + category
                + ", value: " + defaultValue + " " + currencyCode);

        Optional<String> token = getAccessToken();
        if (token.isEmpty()) {
            String error = orDefault(lastRefreshError, TOKEN_FAILURE);
            diagnostics.error("Create conversion action failed: " + error);
            return CreateConversionActionResult.failure(error, true);
        }

        Optional<String> existingId = findConversionActionIdByName(token.get(), name);
        if (existingId.isPresent()) {
            diagnostics.error("Create conversion action failed, name '" + name + "' already exists with ID " + existingId.get());
            return CreateConversionActionResult.failure(
                    String.format("A conversion action named \"%s\" already exists (ID: %s).", name, existingId.get()),
                    false);
        }

        GoogleAdsRequests.MutateConversionActions body = GoogleAdsRequests.MutateConversionActions.create(
                new GoogleAdsRequests.ConversionActionCreate(
                        name,
                        "UPLOAD_CLICKS",
                        category,
                        "ENABLED",
                        new GoogleAdsRequests.ValueSettings(defaultValue, true, currencyCode)));

        ApiResponse response;
        try {
            response = postJson("/customers/" + credentials.customerId() + "/conversionActions:mutate", body, token.get());
        } catch (RestClientException e) {
            String error = messageOf(e);
            diagnostics.error("Create conversion action failed: " + error);
            return CreateConversionActionResult.failure(error, false);
        }

        if (response.status() != 200) {
            String error = apiError(response);
            diagnostics.error("Create conversion action failed: " + error);
            return CreateConversionActionResult.failure(error, true);
        }

        String resourceName = parse(response.body()).path("results").path(0).path("resourceName").asText("");
        Matcher matcher = ACTION_ID.matcher(resourceName);
        if (resourceName.isEmpty() || !matcher.find()) {
            diagnostics.error("Create conversion action failed, unexpected response: " + response.body());
            return CreateConversionActionResult.failure(
                    "Unexpected response: could not extract conversion action ID.", false);
        }

        String actionId = matcher.group(1);
        diagnostics.info("Conversion action created, name: " + name + ", ID: " + actionId);
        return CreateConversionActionResult.ok(actionId);
    }

    /**
     * Looks up name and category of a conversion action. Used to fill in the settings, so
     * failures are plain errors without a credential classification.
     */
    public ConversionActionDetails fetchConversionActionDetails(String conversionActionId) {
        diagnostics.info("Fetching conversion action details, ID: " + conversionActionId);

        Optional<String> token = getAccessToken();
        if (token.isEmpty()) {
            String error = orDefault(lastRefreshError, TOKEN_FAILURE);
            diagnostics.error("Fetch conversion action failed: " + error);
            return ConversionActionDetails.failure(error);
        }

        ApiResponse response;
        try {
            response = search(actionByIdQuery(conversionActionId), token.get());
        } catch (RestClientException e) {
            String error = messageOf(e);
            diagnostics.error("Fetch conversion action failed: " + error);
            return ConversionActionDetails.failure(error);
        }

        if (response.status() != 200) {
            String error = apiError(response);
            diagnostics.error("Fetch conversion action failed: " + error);
            return ConversionActionDetails.failure(error);
        }

        JsonNode results = parse(response.body()).path("results");
        if (!hasResults(results)) {
            diagnostics.error("Fetch conversion action failed, ID " + conversionActionId + " not found");
            return ConversionActionDetails.failure(String.format("Conversion action %s not found.", conversionActionId));
        }

        JsonNode action = results.path(0).path("conversionAction");
        String name = action.path("name").asText("");
        String category = action.path("category").asText("");
        diagnostics.info("Conversion action fetched, name: " + name + ", category: " + category);
        return ConversionActionDetails.ok(name, category);
    }

    /**
     * Returns the cached access token, refreshing it when the cache has none.
     */
    public Optional<String> getAccessToken() {
        Optional<String> cached = tokenCache.get(TOKEN_CACHE_KEY);
        if (cached.isPresent()) {
            return cached;
        }
        return refreshAccessToken();
    }

    /**
     * Exchanges the refresh token for a new access token and caches it for
     * {@code expires_in - 300} seconds. On failure the reason is kept in
     * {@link #getLastRefreshError()} and the raw response in {@link #getLastRefreshDebug()}.
     */
    public Optional<String> refreshAccessToken() {
        lastRefreshError = "";
        lastRefreshDebug = "";

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("client_id", credentials.clientId());
        form.add("client_secret", credentials.clientSecret());
        form.add("refresh_token", credentials.refreshToken());

        ApiResponse response;
        try {
            response = restClient.post()
                    .uri(tokenUrl)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .exchange((request, clientResponse) -> toApiResponse(clientResponse));
        } catch (RestClientException e) {
            lastRefreshError = messageOf(e);
            lastRefreshDebug = "Transport error: " + lastRefreshError;
            diagnostics.error("Token refresh failed: " + lastRefreshError);
            log.warn("Google OAuth2 token refresh failed: {}", lastRefreshError);
            return Optional.empty();
        }

        lastRefreshDebug = "HTTP " + response.status() + ": " + response.body();

        JsonNode json = parse(response.body());
        String accessToken = json.path("access_token").asText("");
        long expiresIn = json.path("expires_in").asLong(0);

        if (accessToken.isEmpty() || expiresIn <= 0) {
            lastRefreshError = orDefault(json.path("error_description").asText(""),
                    orDefault(json.path("error").asText(""), "Unexpected token response."));
            diagnostics.error("Token refresh failed: " + lastRefreshError
                    + " (client_id: " + credentials.clientId()
                    + ", client_secret: " + DiagnosticLogger.mask(credentials.clientSecret())
                    + ", refresh_token: " + DiagnosticLogger.mask(credentials.refreshToken()) + ")");
            log.warn("Google OAuth2 token refresh rejected: {}", lastRefreshError);
            return Optional.empty();
        }

        long ttl = Math.max(0, expiresIn - TOKEN_TTL_MARGIN_SECONDS);
        tokenCache.put(TOKEN_CACHE_KEY, accessToken, Duration.ofSeconds(ttl));
        diagnostics.info("Token refresh successful, expires_in: " + expiresIn + "s");

        return Optional.of(accessToken);
    }

    public String getLastRefreshError() {
        return lastRefreshError;
    }

    public String getLastRefreshDebug() {
        return lastRefreshDebug;
    }

    private ConnectionTestResult verifyGoogleAdsAccess(String accessToken) {
        ApiResponse response;
        try {
            response = search(actionByIdQuery(credentials.conversionActionId()), accessToken);
        } catch (RestClientException e) {
            return ConnectionTestResult.failure(messageOf(e), false, "");
        }

        String debug = "HTTP " + response.status() + ": " + response.body();

        // non-200: developer token, customer id or login customer id rejected
        if (response.status() != 200) {
            return ConnectionTestResult.failure(apiError(response), true, debug);
        }

        JsonNode results = parse(response.body()).path("results");
        if (!hasResults(results)) {
            return ConnectionTestResult.failure(
                    String.format("Conversion action %s not found in Google Ads account %s.",
                            credentials.conversionActionId(), credentials.customerId()),
                    true,
                    debug);
        }

        JsonNode action = results.path(0).path("conversionAction");
        return ConnectionTestResult.ok(action.path("name").asText(""), action.path("category").asText(""));
    }

    // Any failure counts as "not found" so that creation goes ahead.
    private Optional<String> findConversionActionIdByName(String accessToken, String name) {
        String escaped = name.replace("'", "\\'");
        String query = "SELECT conversion_action.id, conversion_action.name FROM conversion_action "
                + "WHERE conversion_action.name = '" + escaped + "'";

        ApiResponse response;
        try {
            response = search(query, accessToken);
        } catch (RestClientException e) {
            log.debug("Conversion action lookup by name failed: {}", e.getMessage());
            return Optional.empty();
        }

        if (response.status() != 200) {
            return Optional.empty();
        }

        JsonNode results = parse(response.body()).path("results");
        if (!hasResults(results)) {
            return Optional.empty();
        }
        return Optional.of(results.path(0).path("conversionAction").path("id").asText(""));
    }

    private static String actionByIdQuery(String conversionActionId) {
        return "SELECT conversion_action.id, conversion_action.name, conversion_action.category "
                + "FROM conversion_action WHERE conversion_action.id = " + conversionActionId;
    }

    private ApiResponse search(String query, String accessToken) {
        return postJson("/customers/" + credentials.customerId() + "/googleAds:search",
                new GoogleAdsRequests.Search(query), accessToken);
    }

    private ApiResponse postJson(String path, Object body, String accessToken) {
        return restClient.post()
                .uri(apiBaseUrl + path)
                .headers(headers -> applyApiHeaders(headers, accessToken))
                .body(body)
                .exchange((request, clientResponse) -> toApiResponse(clientResponse));
    }

    private void applyApiHeaders(HttpHeaders headers, String accessToken) {
        headers.setBearerAuth(accessToken);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("developer-token", credentials.developerToken());

        // an empty login-customer-id header is rejected for manager accounts
        if (credentials.loginCustomerId() != null && !credentials.loginCustomerId().isEmpty()) {
            headers.set("login-customer-id", credentials.loginCustomerId());
        }
    }

    private static ApiResponse toApiResponse(ClientHttpResponse response) throws IOException {
        String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        return new ApiResponse(response.getStatusCode().value(), body);
    }

    private String apiError(ApiResponse response) {
        String message = parse(response.body()).path("error").path("message").asText("");
        return orDefault(message, "HTTP " + response.status() + ": " + response.body());
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Google Ads response is not JSON: {}", body);
            return MissingNode.getInstance();
        }
    }

    private static boolean hasResults(JsonNode results) {
        return results.isArray() && !results.isEmpty();
    }

    private static boolean isPresent(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return false;
        }
        if (node.isContainerNode()) {
            return !node.isEmpty();
        }
        return !node.asText().isEmpty();
    }

    private static String messageOf(RestClientException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }

    private record ApiResponse(int status, String body) {
    }
}
