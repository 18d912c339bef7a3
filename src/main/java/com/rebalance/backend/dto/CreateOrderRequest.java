package com.rebalance.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {
    private Long runId;
    @NotBlank
    @Size(max = 128)
    private String clientOrderId;
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
