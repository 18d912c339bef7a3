package com.rebalance.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "execution")
@Data
@Validated
public class ExecutionProperties {

    @NotBlank
    private String artifactsDir = "./data/artifacts";

    // Historical price root holding curated_adjusted/*_<SYMBOL>_Daily.csv
    @NotBlank
    private String dataRoot = "./data";

    // Fallback process command line; {config} and {runId} are substituted
    private List<String> launcherCommand = new ArrayList<>();

    @Min(1)
    private long submitPendingTimeoutSeconds = 45;

    @Min(0)
    private long fallbackMinIntervalSeconds = 30;

    @Min(1)
    private long terminateGraceSeconds = 5;

    @Min(1)
    private long stallDeadlineMinutes = 120;

    private boolean exitAfterSubmit = true;

    private String defaultOrderType = "MKT";

    private Sizing sizing = new Sizing();

    private UnfilledOrders unfilled = new UnfilledOrders();

    private Costs costs = new Costs();

    public Path artifactsPath() {
        return Path.of(artifactsDir);
    }

    public Path dataRootPath() {
        return Path.of(dataRoot);
    }

    @Data
    public static class Sizing {
        @Positive
        private BigDecimal lotSize = BigDecimal.ONE;

        @DecimalMin("0")
        private BigDecimal minQty = BigDecimal.ONE;

        @DecimalMin("0")
        @DecimalMax("0.95")
        private BigDecimal cashBufferRatio = BigDecimal.ZERO;
    }

    @Data
    public static class UnfilledOrders {
        @Min(0)
        private long timeoutSeconds = 300;

        @Min(0)
        private int maxReprices = 2;

        @DecimalMin("0")
        private BigDecimal repriceStepBps = new BigDecimal("5");
    }

    @Data
    public static class Costs {
        @DecimalMin("0")
        private BigDecimal feeBps = new BigDecimal("1");

        @DecimalMin("0")
        private BigDecimal slippageBps = new BigDecimal("5");
    }
}
