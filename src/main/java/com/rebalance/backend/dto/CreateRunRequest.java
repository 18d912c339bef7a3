package com.rebalance.backend.dto;

import com.rebalance.backend.model.TradeMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRunRequest {
    @NotNull
    private Long projectId;
    private Long decisionSnapshotId;
    @NotNull
    private TradeMode mode;
    // Must be "LIVE" for live runs
    private String confirmToken;
    private Map<String, BigDecimal> targetWeights;
    @Valid
    @Size(max = 500)
    private List<OrderLine> orders;
    @Positive
    private BigDecimal portfolioValue;
    @DecimalMin("0")
    private BigDecimal cashAvailable;
    @DecimalMin("0")
    @DecimalMax("0.95")
    private BigDecimal cashBufferRatio;
    @Positive
    private BigDecimal lotSize;
    @DecimalMin("0")
    private BigDecimal minQty;
    private String orderType;
    private Boolean outsideRth;
    private boolean riskBypass;
    @Min(1)
    private Long stallDeadlineMinutes;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrderLine {
        @NotBlank
        private String symbol;
        @NotBlank
        private String side;
        @NotNull
        @Positive
        private BigDecimal quantity;
        private String orderType;
        private BigDecimal limitPrice;
    }
}
