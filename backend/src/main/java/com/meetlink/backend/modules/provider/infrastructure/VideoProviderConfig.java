package com.meetlink.backend.modules.provider.infrastructure;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

import com.meetlink.backend.modules.provider.application.VideoProviderClient;
import com.meetlink.backend.modules.provider.infrastructure.daily.DailyVideoProviderClient;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the provider adapter from explicit settings; credentials never live in static state.
 */
@Configuration
public class VideoProviderConfig {

    @Bean
    public VideoProviderClient videoProviderClient(
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${app.video-provider.base-url:https://api.daily.co/v1}") String baseUrl,
            @Value("${app.video-provider.api-key}") String apiKey,
            @Value("${app.video-provider.timeout:PT5S}") Duration timeout,
            @Value("${app.video-provider.create-attempts:2}") int createAttempts
    ) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        return new DailyVideoProviderClient(httpClient, objectMapper, baseUrl, apiKey, timeout, createAttempts, clock);
    }
}
