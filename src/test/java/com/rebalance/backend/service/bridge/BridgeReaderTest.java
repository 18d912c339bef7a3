package com.rebalance.backend.service.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebalance.backend.config.BridgeProperties;
import com.rebalance.backend.service.bridge.BridgeSnapshots.ExecutionEvent;
import com.rebalance.backend.service.bridge.BridgeSnapshots.OpenOrdersSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BridgeReaderTest {

    private static final Instant NOW = Instant.parse("2026-03-02T15:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path bridgeRoot;

    private BridgeReader reader;

    @BeforeEach
    void setUp() {
        BridgeProperties properties = new BridgeProperties();
        properties.setRoot(bridgeRoot.toString());
        properties.setSnapshotStaleSeconds(30);
        reader = new BridgeReader(properties, new BridgeFiles(new ObjectMapper()), clock);
    }

    @Test
    void openOrdersWithoutRefreshTimeAreStale() throws IOException {
        Files.writeString(bridgeRoot.resolve(BridgeReader.OPEN_ORDERS_FILE),
                "{\"items\":[{\"tag\":\"oi_1_0\",\"order_id\":\"9001\",\"symbol\":\"AAA\",\"quantity\":10}]}");

        OpenOrdersSnapshot snapshot = reader.readOpenOrders(null);

        assertThat(snapshot.refreshedAt()).isNull();
        assertThat(snapshot.isFresh()).isFalse();
        assertThat(snapshot.tags()).containsExactly("oi_1_0");
    }

    @Test
    void openOrdersRefreshedRecentlyAreFresh() throws IOException {
        Files.writeString(bridgeRoot.resolve(BridgeReader.OPEN_ORDERS_FILE),
                "{\"refreshed_at\":\"" + NOW.minusSeconds(5) + "\",\"items\":[]}");

        assertThat(reader.readOpenOrders(null).isFresh()).isTrue();
    }

    @Test
    void positionsWithoutRefreshTimeAreStale() throws IOException {
        Files.writeString(bridgeRoot.resolve(BridgeReader.POSITIONS_FILE),
                "{\"items\":[{\"symbol\":\"AAA\",\"quantity\":5}]}");

        assertThat(reader.readPositions().stale()).isTrue();
    }

    @Test
    void eventsWithoutIdsInSameNamedLogsGetDistinctIds() throws IOException {
        Path runDir = Files.createDirectories(bridgeRoot.resolve("runs").resolve("7"));
        String line = "{\"tag\":\"oi_7_0\",\"status\":\"filled\",\"filled\":5,\"fill_price\":10}\n";
        Files.writeString(bridgeRoot.resolve(BridgeReader.EXECUTION_EVENTS_FILE), line);
        Files.writeString(runDir.resolve(BridgeReader.EXECUTION_EVENTS_FILE), line);

        List<ExecutionEvent> events = reader.readExecutionEvents(List.of(
                bridgeRoot.resolve(BridgeReader.EXECUTION_EVENTS_FILE),
                runDir.resolve(BridgeReader.EXECUTION_EVENTS_FILE)), new HashMap<>());

        assertThat(events).extracting(ExecutionEvent::eventId)
                .containsExactly("execution_events.jsonl@0",
                        Path.of("runs", "7", "execution_events.jsonl") + "@0");
    }

    @Test
    void secondReadOnlyReturnsAppendedLines() throws IOException {
        Path log = bridgeRoot.resolve(BridgeReader.EXECUTION_EVENTS_FILE);
        Files.writeString(log, "{\"event_id\":\"e1\",\"tag\":\"oi_7_0\",\"filled\":5}\n");
        Map<String, Long> offsets = new HashMap<>();

        assertThat(reader.readExecutionEvents(List.of(log), offsets))
                .extracting(ExecutionEvent::eventId).containsExactly("e1");
        assertThat(reader.readExecutionEvents(List.of(log), offsets)).isEmpty();

        Files.writeString(log, "not json\n{\"event_id\":\"e2\",\"tag\":\"oi_7_0\",\"filled\":3}\n",
                StandardOpenOption.APPEND);
        List<ExecutionEvent> appended = reader.readExecutionEvents(List.of(log), offsets);

        assertThat(appended).extracting(ExecutionEvent::eventId).containsExactly("e2");
        assertThat(offsets.get(log.toAbsolutePath().normalize().toString())).isEqualTo(Files.size(log));
    }

    @Test
    void partialTrailingLineIsReadOnceCompleted() throws IOException {
        Path log = bridgeRoot.resolve(BridgeReader.EXECUTION_EVENTS_FILE);
        String first = "{\"event_id\":\"e1\",\"tag\":\"oi_7_0\",\"filled\":5}\n";
        Files.writeString(log, first + "{\"event_id\":\"e2\",\"tag\":\"oi_");
        Map<String, Long> offsets = new HashMap<>();

        assertThat(reader.readExecutionEvents(List.of(log), offsets))
                .extracting(ExecutionEvent::eventId).containsExactly("e1");
        assertThat(offsets.get(log.toAbsolutePath().normalize().toString()))
                .isEqualTo((long) first.getBytes(StandardCharsets.UTF_8).length);

        Files.writeString(log, "7_0\",\"filled\":2}\n", StandardOpenOption.APPEND);

        assertThat(reader.readExecutionEvents(List.of(log), offsets))
                .extracting(ExecutionEvent::eventId).containsExactly("e2");
    }

    @Test
    void truncatedLogIsReadFromStart() throws IOException {
        Path log = bridgeRoot.resolve(BridgeReader.EXECUTION_EVENTS_FILE);
        Files.writeString(log, "{\"event_id\":\"e1\",\"tag\":\"oi_7_0\",\"filled\":5}\n");
        Map<String, Long> offsets = new HashMap<>();
        offsets.put(log.toAbsolutePath().normalize().toString(), 10_000L);

        assertThat(reader.readExecutionEvents(List.of(log), offsets))
                .extracting(ExecutionEvent::eventId).containsExactly("e1");
    }
}
