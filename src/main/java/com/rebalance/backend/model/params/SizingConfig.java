package com.rebalance.backend.model.params;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SizingConfig {
    private BigDecimal portfolioValue;
    private BigDecimal cashAvailable;
    private BigDecimal cashBufferRatio;
    private BigDecimal lotSize;
    private BigDecimal minQty;
    private String orderType;
    private Boolean outsideRth;
}
