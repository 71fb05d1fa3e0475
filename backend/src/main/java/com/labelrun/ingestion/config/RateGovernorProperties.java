package com.labelrun.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Trailing-window call and capacity budget for the classification service.
 */
@ConfigurationProperties(prefix = "labelrun.governor")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class RateGovernorProperties {

    /** Max successful calls per window. Default 40. */
    @Min(1)
    private int maxCalls = 40;

    /** Max capacity units (tokens) per window. Default 80000. */
    @Min(1)
    private long maxUnits = 80_000L;

    /** Trailing window length in seconds. Default 60. */
    @Min(1)
    private long windowSeconds = 60;

    /** Poll interval while waiting for capacity. Default 500 ms. */
    @Min(1)
    private long pollIntervalMs = 500;
}
