package com.priceplatform.price.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.priceplatform.price.engine.RefreshEngineSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class PricingConfig {

    @Value("${pricing.refresh.batch-size:10}")
    private int batchSize;

    @Value("${pricing.refresh.batch-timeout-ms:30000}")
    private long batchTimeoutMs;

    @Value("${pricing.refresh.inter-batch-delay-ms:1000}")
    private long interBatchDelayMs;

    @Value("${pricing.refresh.max-attempts:3}")
    private int maxAttempts;

    @Value("${pricing.refresh.retry-delay-ms:1000}")
    private long retryDelayMs;

    @Value("${pricing.refresh.start-delay-ms:10}")
    private long startDelayMs;

    @Value("${pricing.refresh.poll-interval-ms:500}")
    private long pollIntervalMs;

    @Value("${pricing.refresh.max-poll-attempts:600}")
    private int maxPollAttempts;

    @Value("${pricing.refresh.status-retention-ms:3600000}")
    private long statusRetentionMs;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public RefreshEngineSettings refreshEngineSettings() {
        return new RefreshEngineSettings(
            batchSize,
            Duration.ofMillis(batchTimeoutMs),
            Duration.ofMillis(interBatchDelayMs),
            maxAttempts,
            Duration.ofMillis(retryDelayMs),
            Duration.ofMillis(startDelayMs),
            Duration.ofMillis(pollIntervalMs),
            maxPollAttempts,
            Duration.ofMillis(statusRetentionMs));
    }
}
