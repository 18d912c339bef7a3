package com.rebalance.backend.service.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebalance.backend.config.BridgeProperties;
import com.rebalance.backend.service.bridge.CommandChannelHealthChecker.ChannelHealth;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class CommandChannelHealthCheckerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T15:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path bridgeRoot;

    private BridgeProperties properties;
    private CommandChannelHealthChecker checker;

    @BeforeEach
    void setUp() {
        properties = new BridgeProperties();
        properties.setRoot(bridgeRoot.toString());
        BridgeReader reader = new BridgeReader(properties, new BridgeFiles(new ObjectMapper()), clock);
        checker = new CommandChannelHealthChecker(properties, reader, clock);
    }

    @Test
    void freshHeartbeatWithEmptyQueueIsHealthy() throws IOException {
        writeStatus("ok", NOW.minusSeconds(2));

        ChannelHealth health = checker.check();

        assertThat(health.healthy()).isTrue();
        assertThat(health.status().pid()).isEqualTo(4242L);
    }

    @Test
    void missingStatusIsUnhealthy() {
        ChannelHealth health = checker.check();

        assertThat(health.healthy()).isFalse();
        assertThat(health.reason()).isEqualTo("bridge_status_stale");
    }

    @Test
    void staleHeartbeatIsUnhealthy() throws IOException {
        writeStatus("ok", NOW.minusSeconds(60));

        assertThat(checker.check().reason()).isEqualTo("bridge_status_stale");
    }

    @Test
    void degradedStatusIsUnhealthy() throws IOException {
        writeStatus("disconnected", NOW);

        assertThat(checker.check().reason()).isEqualTo("bridge_status_disconnected");
    }

    @Test
    void disabledLeaderIsNeverUsed() throws IOException {
        writeStatus("ok", NOW);
        properties.getLeader().setEnabled(false);

        assertThat(checker.check().reason()).isEqualTo("leader_disabled");
    }

    @Test
    void unansweredCommandsMarkQueueStuck() throws IOException {
        writeStatus("ok", NOW);
        writeCommand("submit_order_1_1", NOW.minusSeconds(45));
        writeCommand("submit_order_2_1", NOW.minusSeconds(5));
        // Abandoned long ago, no longer counted
        writeCommand("submit_order_3_1", NOW.minusSeconds(3600));

        ChannelHealth health = checker.check();

        assertThat(health.healthy()).isFalse();
        assertThat(health.reason()).isEqualTo("command_queue_stuck");
        assertThat(health.stuckCommands()).isEqualTo(1);
    }

    @Test
    void answeredCommandsAreNotPending() throws IOException {
        writeStatus("ok", NOW);
        writeCommand("submit_order_1_1", NOW.minusSeconds(45));
        Path results = Files.createDirectories(bridgeRoot.resolve("command_results"));
        Files.writeString(results.resolve("submit_order_1_1.json"), "{\"status\":\"submitted\"}");

        assertThat(checker.check().healthy()).isTrue();
    }

    private void writeStatus(String status, Instant heartbeat) throws IOException {
        Files.writeString(bridgeRoot.resolve("lean_bridge_status.json"),
                "{\"status\":\"" + status + "\",\"last_heartbeat\":\"" + heartbeat + "\",\"pid\":4242}");
    }

    private void writeCommand(String commandId, Instant requestedAt) throws IOException {
        Path commands = Files.createDirectories(bridgeRoot.resolve("commands"));
        Files.writeString(commands.resolve(commandId + ".json"),
                "{\"command_id\":\"" + commandId + "\",\"requested_at\":\"" + requestedAt + "\"}");
    }
}
