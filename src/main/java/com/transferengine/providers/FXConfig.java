package com.transferengine.providers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Wires the FX provider.
 *
 * {@code transfer-engine.fx.mode=http} (default) talks to the configured primary
 * and fallback rate APIs; {@code mock} serves the static rate table.
 */
@Configuration
@Slf4j
public class FXConfig {

    @Value("${transfer-engine.fx.cache-ttl:30s}")
    private Duration cacheTtl;

    @Value("${transfer-engine.fx.cache-max-size:1000}")
    private long cacheMaxSize;

    @Bean
    @ConditionalOnProperty(name = "transfer-engine.fx.mode", havingValue = "http", matchIfMissing = true)
    public FXProvider httpFxProvider(
            RestTemplateBuilder restTemplateBuilder,
            @Value("${transfer-engine.fx.primary.base-url:https://api.exchangerate.host}") String primaryUrl,
            @Value("${transfer-engine.fx.fallback.base-url:https://api.currencyconverter.example}") String fallbackUrl,
            @Value("${transfer-engine.fx.connect-timeout:2s}") Duration connectTimeout,
            @Value("${transfer-engine.fx.read-timeout:3s}") Duration readTimeout) {

        RestTemplate restTemplate = restTemplateBuilder
            .setConnectTimeout(connectTimeout)
            .setReadTimeout(readTimeout)
            .build();

        return new CachingFXProvider(
            new HttpRateSource("primary", restTemplate, primaryUrl),
            new HttpRateSource("fallback", restTemplate, fallbackUrl),
            cacheTtl,
            cacheMaxSize
        );
    }

    @Bean
    @ConditionalOnProperty(name = "transfer-engine.fx.mode", havingValue = "mock")
    public FXProvider mockFxProvider() {
        log.info("Using mock exchange rates");
        return new CachingFXProvider(
            new MockRateSource("mock-primary"),
            new MockRateSource("mock-fallback"),
            cacheTtl,
            cacheMaxSize
        );
    }
}
