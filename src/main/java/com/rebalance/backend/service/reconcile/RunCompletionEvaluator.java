package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.RunStatus;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.params.CompletionSummary;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Optional;

/**
 * Derives a run's terminal status from its orders.
 */
@Component
public class RunCompletionEvaluator {

    public record Completion(RunStatus status, String message, CompletionSummary summary) {
    }

    /**
     * @return empty while any order can still change, or when the run has no orders at all
     */
    public Optional<Completion> evaluate(Collection<TradeOrder> orders) {
        if (orders.isEmpty()) {
            return Optional.empty();
        }
        for (TradeOrder order : orders) {
            if (!order.isTerminal()) {
                return Optional.empty();
            }
        }
        CompletionSummary summary = summarize(orders);
        BigDecimal totalFilled = orders.stream()
                .map(order -> order.getFilledQuantity() == null ? BigDecimal.ZERO : order.getFilledQuantity())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (totalFilled.signum() == 0) {
            return Optional.of(new Completion(RunStatus.FAILED, "no_fills", summary));
        }
        if (summary.filled() == summary.total()) {
            return Optional.of(new Completion(RunStatus.DONE, "completed", summary));
        }
        return Optional.of(new Completion(RunStatus.PARTIAL, "partially_filled", summary));
    }

    public CompletionSummary summarize(Collection<TradeOrder> orders) {
        int filled = 0;
        int cancelled = 0;
        int rejected = 0;
        int skipped = 0;
        for (TradeOrder order : orders) {
            OrderStatus status = order.getStatus();
            switch (status) {
                case FILLED -> filled++;
                case CANCELED -> cancelled++;
                case REJECTED -> rejected++;
                case SKIPPED -> skipped++;
                default -> {
                }
            }
        }
        return new CompletionSummary(orders.size(), filled, cancelled, rejected, skipped);
    }
}
