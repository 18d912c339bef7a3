package com.rebalance.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SymbolSummaryRow {
    private String symbol;
    private BigDecimal targetWeight;
    // Signed: buys positive, sells negative
    private BigDecimal requestedQuantity;
    private BigDecimal filledQuantity;
    private BigDecimal avgFillPrice;
    private List<String> statuses;
}
