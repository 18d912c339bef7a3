package com.rebalance.backend.service;

import com.rebalance.backend.exception.BadRequestException;
import com.rebalance.backend.exception.ConflictException;
import com.rebalance.backend.exception.NotFoundException;
import com.rebalance.backend.model.OrderSide;
import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.OrderType;
import com.rebalance.backend.model.TradeFill;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.params.OrderParams;
import com.rebalance.backend.repository.TradeFillRepository;
import com.rebalance.backend.repository.TradeOrderRepository;
import com.rebalance.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Order persistence: idempotent creation by client order id and idempotent fill recording by exec id.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeOrderService {

    private final TradeOrderRepository tradeOrderRepository;
    private final TradeFillRepository tradeFillRepository;
    private final OrderStateMachine orderStateMachine;
    private final TradeMetrics tradeMetrics;
    private final Clock clock;

    public record CreateOrderCommand(
            Long runId,
            String clientOrderId,
            String symbol,
            String side,
            BigDecimal quantity,
            String orderType,
            BigDecimal limitPrice,
            OrderParams params
    ) {
    }

    public record CreateOrderResult(TradeOrder order, boolean created) {
    }

    /**
     * @param inferred true for quantity deduced from holdings rather than reported by the broker; broker
     *                 executions arriving later confirm inferred quantity before adding to it
     */
    public record FillEvidence(String execId, BigDecimal quantity, BigDecimal price, BigDecimal commission,
                               Instant executedAt, boolean inferred) {
    }

    @Transactional
    public CreateOrderResult createOrder(CreateOrderCommand command) {
        if (command.clientOrderId() == null || command.clientOrderId().isBlank()) {
            throw new BadRequestException("client_order_id is required");
        }
        OrderSide side = OrderSide.fromString(command.side());
        if (side == null) {
            throw new BadRequestException("Unsupported side: " + command.side());
        }
        if (!MoneyUtils.isPositive(command.quantity())) {
            throw new BadRequestException("quantity must be positive");
        }
        OrderType orderType = OrderType.parse(command.orderType() == null ? "MKT" : command.orderType());
        if (orderType == null) {
            throw new BadRequestException("Unsupported order type: " + command.orderType());
        }
        if (orderType.isLimitLike() && !MoneyUtils.isPositive(command.limitPrice())) {
            throw new BadRequestException("limit_price is required for " + orderType);
        }
        String symbol = command.symbol() == null ? "" : command.symbol().trim().toUpperCase(Locale.ROOT);
        if (symbol.isEmpty()) {
            throw new BadRequestException("symbol is required");
        }

        Optional<TradeOrder> existing = tradeOrderRepository.findByClientOrderId(command.clientOrderId());
        if (existing.isPresent()) {
            TradeOrder order = existing.get();
            if (!order.getSymbol().equals(symbol) || order.getSide() != side
                    || order.getQuantity().compareTo(command.quantity()) != 0) {
                throw new ConflictException("client_order_id reused with different payload: " + command.clientOrderId());
            }
            return new CreateOrderResult(order, false);
        }

        Instant now = Instant.now(clock);
        TradeOrder order = TradeOrder.builder()
                .runId(command.runId())
                .clientOrderId(command.clientOrderId())
                .symbol(symbol)
                .side(side)
                .quantity(MoneyUtils.qty(command.quantity()))
                .orderType(orderType.name())
                .limitPrice(command.limitPrice() == null ? null : MoneyUtils.scale(command.limitPrice()))
                .status(OrderStatus.NEW)
                .filledQuantity(MoneyUtils.qty(BigDecimal.ZERO))
                .params(command.params() == null ? new OrderParams() : command.params())
                .createdAt(now)
                .updatedAt(now)
                .build();
        return new CreateOrderResult(tradeOrderRepository.save(order), true);
    }

    @Transactional(readOnly = true)
    public TradeOrder getOrder(Long orderId) {
        return tradeOrderRepository.findById(orderId)
                .orElseThrow(() -> new NotFoundException("Order not found: " + orderId));
    }

    /**
     * Records one execution against the order and advances its status. Replays of the same exec id and
     * evidence that would not increase the filled quantity are ignored. A broker execution first confirms
     * quantity already inferred from holdings and only the excess is added, so one execution seen both ways
     * is counted once; its fill row then carries the added quantity only.
     * @return true when a fill row was written
     */
    @Transactional
    public boolean recordFill(TradeOrder order, FillEvidence evidence, String reason) {
        if (tradeFillRepository.existsByExecId(evidence.execId())) {
            return false;
        }
        if (evidence.quantity() == null || evidence.quantity().signum() <= 0) {
            return false;
        }
        Instant now = Instant.now(clock);
        OrderParams params = order.getParams();
        BigDecimal inferred = params.inferredFilledOrZero();
        BigDecimal confirmed = evidence.inferred() ? BigDecimal.ZERO : inferred.min(evidence.quantity());
        BigDecimal applied = order.applyFill(evidence.quantity().subtract(confirmed), evidence.price());
        if (applied.signum() <= 0 && confirmed.signum() <= 0) {
            log.debug("Fill ignored, nothing remaining clientOrderId={} execId={}", order.getClientOrderId(), evidence.execId());
            return false;
        }
        if (evidence.inferred()) {
            params.setInferredFilledQuantity(MoneyUtils.qty(inferred.add(applied)));
        } else if (confirmed.signum() > 0) {
            params.setInferredFilledQuantity(MoneyUtils.qty(inferred.subtract(confirmed)));
            log.info("Execution confirms inferred fill clientOrderId={} execId={} confirmed={}",
                    order.getClientOrderId(), evidence.execId(), confirmed);
        }
        tradeFillRepository.save(TradeFill.builder()
                .orderId(order.getId())
                .quantity(MoneyUtils.qty(applied))
                .price(evidence.price() == null ? null : MoneyUtils.scale(evidence.price()))
                .commission(evidence.commission() == null ? null : MoneyUtils.scale(evidence.commission()))
                .execId(evidence.execId())
                .executedAt(evidence.executedAt() != null ? evidence.executedAt() : now)
                .createdAt(now)
                .build());
        if (applied.signum() <= 0) {
            order.setUpdatedAt(now);
            tradeOrderRepository.save(order);
            return true;
        }
        tradeMetrics.recordFill();
        OrderStatus target = order.isFullyFilled() ? OrderStatus.FILLED : OrderStatus.PARTIAL;
        if (order.isLowConfidence()) {
            orderStateMachine.reopen(order, target, reason, now);
        } else if (!orderStateMachine.transition(order, target, reason, now)) {
            order.setUpdatedAt(now);
            tradeOrderRepository.save(order);
        }
        log.info("Fill recorded clientOrderId={} execId={} qty={} filled={}/{}", order.getClientOrderId(),
                evidence.execId(), applied, order.getFilledQuantity(), order.getQuantity());
        return true;
    }
}
