package com.restaurantintel.discovery.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class PlacesApiConfig {

    public static final String PLACES_API_RETRY = "placesApi";

    @Bean
    public RestTemplate placesRestTemplate(RestTemplateBuilder builder, DiscoveryProperties properties) {
        DiscoveryProperties.Api api = properties.getApi();
        return builder
                .setConnectTimeout(Duration.ofSeconds(api.getConnectTimeoutSeconds()))
                .setReadTimeout(Duration.ofSeconds(api.getReadTimeoutSeconds()))
                .build();
    }

    /**
     * Shared retry policy for every Places call. Attempts, backoff and the
     * retryable exception classes live under resilience4j.retry.instances.placesApi.
     */
    @Bean
    public Retry placesApiRetry(RetryRegistry retryRegistry) {
        return retryRegistry.retry(PLACES_API_RETRY);
    }
}
