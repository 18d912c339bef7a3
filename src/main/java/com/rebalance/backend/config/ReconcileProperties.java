package com.rebalance.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "reconcile")
@Data
@Validated
public class ReconcileProperties {

    private boolean refresherEnabled = true;

    @Min(1)
    private long refreshIntervalSeconds = 30;

    @Min(0)
    private long openOrdersGraceSeconds = 60;

    @Min(0)
    private long openOrdersRunGraceSeconds = 180;

    @Min(0)
    private long openOrdersInactiveGraceSeconds = 60;

    @Min(0)
    private long unconfirmedFinalizeSeconds = 300;

    @Min(0)
    private long unconfirmedFinalizeInactiveSeconds = 90;

    @Min(0)
    private long newOrderMinAgeSeconds = 60;

    @Min(0)
    private long fallbackGraceSeconds = 300;

    // Window in which a low-confidence CANCELED/SKIPPED order may be reopened by stronger evidence
    @Min(0)
    private long lowConfidenceReopenGraceSeconds = 900;

    @Min(1)
    private long stallWindowMinutes = 15;

    @NotBlank
    private String marketTimezone = "America/New_York";
}
