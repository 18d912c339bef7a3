package com.rebalance.backend.dto;

import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.params.OrderParams;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {
    private Long id;
    private Long runId;
    private String clientOrderId;
    private String symbol;
    private String side;
    private BigDecimal quantity;
    private String orderType;
    private BigDecimal limitPrice;
    private String status;
    private BigDecimal filledQuantity;
    private BigDecimal avgFillPrice;
    private String brokerOrderId;
    private String rejectedReason;
    private OrderParams params;
    private Instant createdAt;
    private Instant updatedAt;

    public static OrderResponse from(TradeOrder order) {
        return OrderResponse.builder()
                .id(order.getId())
                .runId(order.getRunId())
                .clientOrderId(order.getClientOrderId())
                .symbol(order.getSymbol())
                .side(order.getSide().name())
                .quantity(order.getQuantity())
                .orderType(order.getOrderType())
                .limitPrice(order.getLimitPrice())
                .status(order.getStatus().name())
                .filledQuantity(order.getFilledQuantity())
                .avgFillPrice(order.getAvgFillPrice())
                .brokerOrderId(order.getBrokerOrderId())
                .rejectedReason(order.getRejectedReason())
                .params(order.getParams())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }
}
