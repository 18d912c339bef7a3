package com.rebalance.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Pre-submission limits. A limit left null is not enforced.
 */
@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @DecimalMin("0")
    private BigDecimal maxOrderNotional;

    @DecimalMin("0")
    @DecimalMax("1")
    private BigDecimal maxPositionRatio;

    @DecimalMin("0")
    private BigDecimal maxTotalNotional;

    @Min(1)
    private Integer maxSymbols;

    @DecimalMin("0")
    @DecimalMax("1")
    private BigDecimal minCashBufferRatio;

    public boolean hasNotionalLimits() {
        return maxOrderNotional != null || maxPositionRatio != null || maxTotalNotional != null
                || minCashBufferRatio != null;
    }
}
