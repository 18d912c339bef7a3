package com.rebalance.backend.service.bridge;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only views of the bridge files. Every snapshot carries its own freshness.
 */
public final class BridgeSnapshots {

    private BridgeSnapshots() {
    }

    public record BridgeStatus(String status, boolean stale, Instant lastHeartbeat, Long pid) {

        private static final Set<String> HEALTHY = Set.of("ok", "connected", "running", "healthy");

        public static BridgeStatus missing() {
            return new BridgeStatus("missing", true, null, null);
        }

        public boolean isMissing() {
            return "missing".equals(status);
        }

        public boolean isHealthy() {
            return !stale && status != null && HEALTHY.contains(status);
        }
    }

    public record OpenOrderItem(String tag, String brokerOrderId, String status, String symbol, BigDecimal quantity) {
    }

    public record OpenOrdersSnapshot(List<OpenOrderItem> items, Instant refreshedAt, boolean stale, boolean runScoped) {

        public Set<String> tags() {
            return items.stream()
                    .map(OpenOrderItem::tag)
                    .filter(tag -> tag != null && !tag.isBlank())
                    .collect(Collectors.toSet());
        }

        public boolean isFresh() {
            return !stale;
        }
    }

    public record PositionItem(String symbol, BigDecimal quantity, BigDecimal avgCost) {
    }

    public record PositionsSnapshot(Map<String, PositionItem> bySymbol, Instant refreshedAt, boolean stale) {

        public BigDecimal quantity(String symbol) {
            PositionItem item = bySymbol.get(symbol);
            return item == null || item.quantity() == null ? BigDecimal.ZERO : item.quantity();
        }

        public BigDecimal avgCost(String symbol) {
            PositionItem item = bySymbol.get(symbol);
            return item == null ? null : item.avgCost();
        }

        public Map<String, BigDecimal> quantities() {
            return bySymbol.values().stream()
                    .filter(item -> item.quantity() != null)
                    .collect(Collectors.toMap(PositionItem::symbol, PositionItem::quantity, (a, b) -> a));
        }
    }

    public record Quote(String symbol, BigDecimal bid, BigDecimal ask, BigDecimal last, BigDecimal close) {
    }

    public record QuotesSnapshot(Map<String, Quote> bySymbol, Instant refreshedAt, boolean stale) {
    }

    public record AccountSummary(BigDecimal netLiquidation, BigDecimal cashAvailable, Instant refreshedAt, boolean stale) {
    }

    public record CommandResult(String commandId, String status, Instant processedAt, String brokerOrderId, String error) {
    }

    public record PendingCommand(String commandId, Instant requestedAt) {
    }

    public record ExecutionEvent(String eventId, String tag, String status, BigDecimal filled, BigDecimal fillPrice,
                                 BigDecimal commission, Instant time, String brokerOrderId) {
    }
}
