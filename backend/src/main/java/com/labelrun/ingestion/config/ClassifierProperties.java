package com.labelrun.ingestion.config;

import com.labelrun.domain.Label;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Batch classification config. Documented in application.yml under labelrun.classifier.
 */
@ConfigurationProperties(prefix = "labelrun.classifier")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ClassifierProperties {

    /** Max records per outbound call. Default 25. */
    @Min(1)
    private int batchSize = 25;

    /** Retries after the initial call before a batch is soft-failed. Default 3. */
    @Min(0)
    private int maxRetries = 3;

    /** Base backoff delay in ms; doubles each attempt. Default 2000. */
    @Min(1)
    private long retryBaseDelayMs = 2_000L;

    /** Jitter factor 0..1 applied to the backoff delay. Default 0 (deterministic schedule). */
    @DecimalMin("0.0")
    @DecimalMax(value = "1.0", inclusive = false)
    private double retryJitterFactor = 0.0;

    /** Label used when the service omits an index, returns a value outside the whitelist, or retries run out. */
    @NotNull
    private Label fallbackLabel = Label.HINDU;

    /** Capacity units reserved per call when checking the rate budget and when usage is not reported. */
    @Min(0)
    private long estimatedUnitsPerCall = 1_000L;

    /** Batches dispatched concurrently per chunk. Default 1. */
    @Min(1)
    private int maxParallel = 1;

    /** Minimum wall-clock duration of one batch; shorter batches wait out the remainder. Default 1500 ms. */
    @Min(0)
    private long minBatchDurationMs = 1_500L;

    /** Upper bound on one blocking service call. Default 120 s. */
    @Min(1)
    private long callTimeoutMs = 120_000L;
}
