package com.labelrun.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.labelrun.common.RetryPolicy;
import com.labelrun.common.Sleeper;
import com.labelrun.domain.Label;
import com.labelrun.ingestion.adapter.ClassificationServiceClient;
import com.labelrun.ingestion.adapter.WebClientClassificationServiceClient;
import com.labelrun.ingestion.governor.RateGovernor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the classification pipeline from labelrun.* properties: service client, rate governor, retry schedule,
 * clock and sleeper.
 */
@Configuration
@EnableConfigurationProperties({ ClassifierProperties.class, RateGovernorProperties.class, ClassificationServiceProperties.class, CampaignProperties.class })
public class IngestionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    /** One governor per process; every batch thread shares the same window. */
    @Bean
    public RateGovernor rateGovernor(RateGovernorProperties properties, ClassifierProperties classifierProperties,
                                     Clock clock, Sleeper sleeper) {
        // canProceed needs unitsInWindow + estimate < maxUnits, so an estimate at or above the cap never passes
        if (classifierProperties.getEstimatedUnitsPerCall() >= properties.getMaxUnits()) {
            throw new IllegalStateException("labelrun.classifier.estimated-units-per-call ("
                    + classifierProperties.getEstimatedUnitsPerCall() + ") must be below labelrun.governor.max-units ("
                    + properties.getMaxUnits() + ")");
        }
        return new RateGovernor(
                properties.getMaxCalls(),
                properties.getMaxUnits(),
                Duration.ofSeconds(properties.getWindowSeconds()),
                Duration.ofMillis(properties.getPollIntervalMs()),
                clock,
                sleeper);
    }

    @Bean
    public RetryPolicy classificationRetryPolicy(ClassifierProperties properties) {
        if (properties.getFallbackLabel() == null || !properties.getFallbackLabel().isValid()) {
            throw new IllegalStateException("labelrun.classifier.fallback-label must be one of " + Label.whitelist());
        }
        return new RetryPolicy(
                properties.getRetryBaseDelayMs(),
                properties.getRetryJitterFactor(),
                properties.getMaxRetries());
    }

    @Bean
    public ClassificationServiceClient classificationServiceClient(WebClient.Builder webClientBuilder,
                                                                   ClassificationServiceProperties properties,
                                                                   ObjectMapper objectMapper) {
        return new WebClientClassificationServiceClient(webClientBuilder, properties, objectMapper);
    }
}
