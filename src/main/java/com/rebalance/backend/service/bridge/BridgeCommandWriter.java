package com.rebalance.backend.service.bridge;

import com.rebalance.backend.config.BridgeProperties;
import com.rebalance.backend.exception.BridgeIoException;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes one command file per request into the queue drained by the leader session.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BridgeCommandWriter {

    static final int COMMAND_VERSION = 1;

    private final BridgeProperties bridgeProperties;
    private final BridgeFiles bridgeFiles;
    private final Retry bridgeWriteRetry;
    private final Clock clock;

    public record SubmitOrderCommand(
            Long orderId,
            String symbol,
            BigDecimal signedQuantity,
            String tag,
            String orderType,
            BigDecimal limitPrice,
            boolean outsideRth,
            String adaptivePriority
    ) {
    }

    public record CommandRef(String commandId, Path path, Instant requestedAt) {
    }

    public CommandRef writeSubmitCommand(SubmitOrderCommand command) {
        Instant now = Instant.now(clock);
        String commandId = "submit_order_" + command.orderId() + "_" + now.toEpochMilli();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("command_id", commandId);
        payload.put("type", "submit_order");
        payload.put("symbol", command.symbol());
        payload.put("quantity", command.signedQuantity());
        payload.put("tag", command.tag());
        payload.put("order_type", command.orderType());
        if (command.limitPrice() != null) {
            payload.put("limit_price", command.limitPrice());
        }
        payload.put("outside_rth", command.outsideRth());
        if (command.adaptivePriority() != null) {
            payload.put("adaptive_priority", command.adaptivePriority());
        }
        payload.put("order_id", command.orderId());
        payload.put("actor", "trade_executor");
        payload.put("reason", "auto_trade_submit");
        payload.put("requested_at", now.toString());
        payload.put("expires_at", now.plusSeconds(bridgeProperties.getCommandExpirySeconds()).toString());
        payload.put("version", COMMAND_VERSION);
        return write(commandId, payload, now);
    }

    public CommandRef writeCancelCommand(Long orderId, String tag, String brokerOrderId, String reason) {
        Instant now = Instant.now(clock);
        String commandId = "cancel_order_" + orderId + "_" + now.toEpochMilli();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("command_id", commandId);
        payload.put("type", "cancel_order");
        payload.put("tag", tag);
        if (brokerOrderId != null) {
            payload.put("order_id", brokerOrderId);
        }
        payload.put("actor", "trade_executor");
        payload.put("reason", reason);
        payload.put("requested_at", now.toString());
        payload.put("expires_at", now.plusSeconds(bridgeProperties.getCommandExpirySeconds()).toString());
        payload.put("version", COMMAND_VERSION);
        return write(commandId, payload, now);
    }

    private CommandRef write(String commandId, Map<String, Object> payload, Instant now) {
        Path path = bridgeProperties.rootPath().resolve(BridgeReader.COMMANDS_DIR).resolve(commandId + ".json");
        try {
            Retry.decorateRunnable(bridgeWriteRetry, () -> bridgeFiles.writeJsonAtomic(path, payload)).run();
        } catch (UncheckedIOException e) {
            throw new BridgeIoException("bridge_command_write_failed:" + commandId, e);
        }
        log.info("Bridge command written commandId={} type={} tag={}", commandId, payload.get("type"), payload.get("tag"));
        return new CommandRef(commandId, path, now);
    }
}
