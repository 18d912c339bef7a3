package com.rebalance.backend.model;

import com.rebalance.backend.model.params.OrderParams;
import com.rebalance.backend.model.params.OrderParamsConverter;
import com.rebalance.backend.util.MoneyUtils;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Set;

@Entity
@Table(name = "trade_orders")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class TradeOrder {

    // Sync reasons produced purely from absence of evidence
    public static final Set<String> LOW_CONFIDENCE_REASONS = Set.of("missing_from_open_orders", "no_orders_submitted");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id")
    private Long runId;

    @Column(name = "client_order_id", nullable = false, unique = true, length = 128)
    private String clientOrderId;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private OrderSide side;

    @Column(nullable = false, precision = 24, scale = 6)
    private BigDecimal quantity;

    @Column(name = "order_type", nullable = false, length = 16)
    private String orderType;

    @Column(name = "limit_price", precision = 19, scale = 4)
    private BigDecimal limitPrice;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private OrderStatus status = OrderStatus.NEW;

    @Column(name = "filled_quantity", nullable = false, precision = 24, scale = 6)
    @Builder.Default
    private BigDecimal filledQuantity = BigDecimal.ZERO;

    @Column(name = "avg_fill_price", precision = 19, scale = 4)
    private BigDecimal avgFillPrice;

    @Column(name = "broker_order_id", length = 64)
    private String brokerOrderId;

    @Convert(converter = OrderParamsConverter.class)
    @Column(name = "params")
    @Builder.Default
    private OrderParams params = new OrderParams();

    @Column(name = "rejected_reason", length = 512)
    private String rejectedReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isLowConfidence() {
        return (status == OrderStatus.CANCELED || status == OrderStatus.SKIPPED)
                && params != null
                && params.getSyncReason() != null
                && LOW_CONFIDENCE_REASONS.contains(params.getSyncReason());
    }

    public String tag() {
        if (params != null && params.getBrokerOrderTag() != null && !params.getBrokerOrderTag().isBlank()) {
            return params.getBrokerOrderTag();
        }
        return clientOrderId;
    }

    public BigDecimal remainingQuantity() {
        BigDecimal remaining = quantity.subtract(filledQuantity == null ? BigDecimal.ZERO : filledQuantity);
        return remaining.signum() < 0 ? BigDecimal.ZERO : remaining;
    }

    public boolean isFullyFilled() {
        return MoneyUtils.sameQuantity(filledQuantity, quantity);
    }

    /**
     * Transition to a new status with validation.
     * @throws IllegalStateException if the transition is invalid
     */
    public void transitionTo(OrderStatus newStatus, Instant now) {
        if (!status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid state transition: %s -> %s for order %s", status, newStatus, clientOrderId));
        }
        if (status == newStatus) {
            return;
        }
        OrderStatus previous = this.status;
        this.status = newStatus;
        this.updatedAt = now;
        log.info("Order state transition clientOrderId={} runId={} from={} to={}", clientOrderId, runId, previous, newStatus);
    }

    /**
     * Overrides a low-confidence terminal status with stronger evidence.
     * @throws IllegalStateException if the order is not low-confidence or the target is not a reopen target
     */
    public void reopenTo(OrderStatus newStatus, String evidence, Instant now) {
        if (!isLowConfidence() || !status.canReopenTo(newStatus)) {
            throw new IllegalStateException(
                    String.format("Cannot reopen order %s from %s to %s", clientOrderId, status, newStatus));
        }
        OrderStatus previous = this.status;
        this.status = newStatus;
        this.updatedAt = now;
        params.getProvenance().put("reopened_from", previous.name());
        params.getProvenance().put("reopened_by", evidence);
        params.getProvenance().put("reopened_at", now.toString());
        params.setSyncReason(null);
        log.info("Order reopened clientOrderId={} runId={} from={} to={} evidence={}", clientOrderId, runId, previous,
                newStatus, evidence);
    }

    /**
     * Replaces a low-confidence terminal status with REJECTED once a runtime fault explains the missing evidence.
     */
    public void rejectLowConfidence(String reason, Instant now) {
        if (!isLowConfidence()) {
            throw new IllegalStateException(
                    String.format("Order %s is not low-confidence (%s)", clientOrderId, status));
        }
        OrderStatus previous = this.status;
        this.status = OrderStatus.REJECTED;
        this.rejectedReason = reason;
        this.updatedAt = now;
        params.getProvenance().put("rejected_from", previous.name());
        params.setSyncReason(null);
        log.info("Low-confidence order rejected clientOrderId={} runId={} from={} reason={}", clientOrderId, runId,
                previous, reason);
    }

    /**
     * Adds executed quantity; filled quantity never decreases and never exceeds the requested quantity.
     * @return the quantity actually applied
     */
    public BigDecimal applyFill(BigDecimal fillQuantity, BigDecimal fillPrice) {
        if (fillQuantity == null || fillQuantity.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal applied = fillQuantity.min(remainingQuantity());
        if (applied.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal previousFilled = filledQuantity == null ? BigDecimal.ZERO : filledQuantity;
        BigDecimal newFilled = previousFilled.add(applied);
        if (fillPrice != null && fillPrice.signum() > 0) {
            BigDecimal previousNotional = avgFillPrice == null ? BigDecimal.ZERO : avgFillPrice.multiply(previousFilled);
            BigDecimal notional = previousNotional.add(fillPrice.multiply(applied));
            BigDecimal pricedQty = avgFillPrice == null ? applied : newFilled;
            avgFillPrice = notional.divide(pricedQty, MoneyUtils.SCALE, RoundingMode.HALF_UP);
        }
        filledQuantity = MoneyUtils.qty(newFilled);
        return applied;
    }
}
