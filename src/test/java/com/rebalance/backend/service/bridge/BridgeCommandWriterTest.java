package com.rebalance.backend.service.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebalance.backend.config.BridgeProperties;
import com.rebalance.backend.exception.BridgeIoException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BridgeCommandWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T15:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path bridgeRoot;

    private BridgeProperties properties;
    private BridgeCommandWriter writer;

    @BeforeEach
    void setUp() {
        properties = new BridgeProperties();
        properties.setRoot(bridgeRoot.toString());
        properties.setCommandExpirySeconds(120);
        Retry retry = Retry.of("test", RetryConfig.custom().maxAttempts(1).build());
        writer = new BridgeCommandWriter(properties, new BridgeFiles(objectMapper), retry, clock);
    }

    @Test
    void submitCommandCarriesSignedQuantityAndExpiry() throws IOException {
        BridgeCommandWriter.CommandRef ref = writer.writeSubmitCommand(new BridgeCommandWriter.SubmitOrderCommand(
                42L, "AAA", new BigDecimal("-15"), "oi_7_0", "LMT", new BigDecimal("101.25"), false, null));

        assertThat(ref.path()).isEqualTo(bridgeRoot.resolve("commands").resolve(ref.commandId() + ".json"));
        JsonNode json = objectMapper.readTree(Files.readString(ref.path()));
        assertThat(json.get("type").asText()).isEqualTo("submit_order");
        assertThat(json.get("quantity").decimalValue()).isEqualByComparingTo("-15");
        assertThat(json.get("tag").asText()).isEqualTo("oi_7_0");
        assertThat(json.get("limit_price").decimalValue()).isEqualByComparingTo("101.25");
        assertThat(json.get("requested_at").asText()).isEqualTo("2026-03-02T15:00:00Z");
        assertThat(json.get("expires_at").asText()).isEqualTo("2026-03-02T15:02:00Z");
        assertThat(json.has("adaptive_priority")).isFalse();
        try (var leftovers = Files.list(ref.path().getParent())) {
            assertThat(leftovers.filter(p -> p.toString().endsWith(".tmp"))).isEmpty();
        }
    }

    @Test
    void cancelCommandReferencesTagAndBrokerId() throws IOException {
        BridgeCommandWriter.CommandRef ref = writer.writeCancelCommand(42L, "oi_7_0", "9001", "manual_terminate");

        JsonNode json = objectMapper.readTree(Files.readString(ref.path()));
        assertThat(json.get("type").asText()).isEqualTo("cancel_order");
        assertThat(json.get("order_id").asText()).isEqualTo("9001");
        assertThat(json.get("reason").asText()).isEqualTo("manual_terminate");
    }

    @Test
    void unwritableQueueRaisesBridgeIoException() throws IOException {
        Path blocker = bridgeRoot.resolve("blocked");
        Files.writeString(blocker, "not a directory");
        properties.setRoot(blocker.toString());

        assertThatThrownBy(() -> writer.writeCancelCommand(1L, "oi_1_0", null, "test"))
                .isInstanceOf(BridgeIoException.class)
                .hasMessageStartingWith("bridge_command_write_failed:");
    }
}
