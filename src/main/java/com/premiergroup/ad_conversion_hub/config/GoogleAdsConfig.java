package com.premiergroup.ad_conversion_hub.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

@Configuration(proxyBeanMethods = false)
public class GoogleAdsConfig {

    @Value("${google.ads.timeout-seconds:30}")
    private long timeoutSeconds;

    /**
     * Blocking HTTP client shared by every Google Ads call (token endpoint included).
     * A timeout surfaces as a transport error, there is no mid-call cancellation.
     */
    @Bean
    public RestClient googleAdsRestClient(RestClient.Builder builder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(timeoutSeconds));
        requestFactory.setReadTimeout(Duration.ofSeconds(timeoutSeconds));

        return builder
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
