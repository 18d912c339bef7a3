package com.rebalance.backend.service.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebalance.backend.config.BridgeProperties;
import com.rebalance.backend.service.bridge.BridgeSnapshots.AccountSummary;
import com.rebalance.backend.service.bridge.BridgeSnapshots.BridgeStatus;
import com.rebalance.backend.service.bridge.BridgeSnapshots.CommandResult;
import com.rebalance.backend.service.bridge.BridgeSnapshots.ExecutionEvent;
import com.rebalance.backend.service.bridge.BridgeSnapshots.OpenOrderItem;
import com.rebalance.backend.service.bridge.BridgeSnapshots.OpenOrdersSnapshot;
import com.rebalance.backend.service.bridge.BridgeSnapshots.PendingCommand;
import com.rebalance.backend.service.bridge.BridgeSnapshots.PositionItem;
import com.rebalance.backend.service.bridge.BridgeSnapshots.PositionsSnapshot;
import com.rebalance.backend.service.bridge.BridgeSnapshots.Quote;
import com.rebalance.backend.service.bridge.BridgeSnapshots.QuotesSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.rebalance.backend.service.bridge.BridgeFiles.decimal;
import static com.rebalance.backend.service.bridge.BridgeFiles.instant;
import static com.rebalance.backend.service.bridge.BridgeFiles.longValue;
import static com.rebalance.backend.service.bridge.BridgeFiles.text;

/**
 * Reads the snapshots the broker session publishes. A missing, unreadable or undated file is reported as
 * stale, never as an error.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BridgeReader {

    public static final String STATUS_FILE = "lean_bridge_status.json";
    public static final String OPEN_ORDERS_FILE = "open_orders.json";
    public static final String POSITIONS_FILE = "positions.json";
    public static final String QUOTES_FILE = "quotes.json";
    public static final String ACCOUNT_SUMMARY_FILE = "account_summary.json";
    public static final String EXECUTION_EVENTS_FILE = "execution_events.jsonl";
    public static final String COMMANDS_DIR = "commands";
    public static final String COMMAND_RESULTS_DIR = "command_results";

    private final BridgeProperties bridgeProperties;
    private final BridgeFiles bridgeFiles;
    private final Clock clock;

    public Path root() {
        return bridgeProperties.rootPath();
    }

    public BridgeStatus readStatus() {
        Optional<JsonNode> json = bridgeFiles.readJson(root().resolve(STATUS_FILE));
        if (json.isEmpty()) {
            return BridgeStatus.missing();
        }
        JsonNode node = json.get();
        String status = Optional.ofNullable(text(node, "status")).orElse("unknown").toLowerCase(Locale.ROOT);
        Instant heartbeat = instant(text(node, "last_heartbeat", "heartbeat_at", "updated_at"));
        boolean stale = heartbeat == null
                || Duration.between(heartbeat, Instant.now(clock)).getSeconds() > bridgeProperties.getHeartbeatStaleSeconds();
        return new BridgeStatus(status, stale, heartbeat, longValue(node, "pid"));
    }

    /**
     * Prefers the run-scoped snapshot written by a short-lived process over the shared one.
     */
    public OpenOrdersSnapshot readOpenOrders(Path runOutputDir) {
        if (runOutputDir != null) {
            Path runScoped = runOutputDir.resolve(OPEN_ORDERS_FILE);
            Optional<JsonNode> json = bridgeFiles.readJson(runScoped);
            if (json.isPresent()) {
                return toOpenOrders(json.get(), true);
            }
        }
        return bridgeFiles.readJson(root().resolve(OPEN_ORDERS_FILE))
                .map(node -> toOpenOrders(node, false))
                .orElseGet(() -> new OpenOrdersSnapshot(List.of(), null, true, false));
    }

    public PositionsSnapshot readPositions() {
        Optional<JsonNode> json = bridgeFiles.readJson(root().resolve(POSITIONS_FILE));
        if (json.isEmpty()) {
            return new PositionsSnapshot(Map.of(), null, true);
        }
        JsonNode node = json.get();
        Map<String, PositionItem> items = new LinkedHashMap<>();
        for (JsonNode item : node.path("items")) {
            String symbol = normalizeSymbol(text(item, "symbol"));
            if (symbol == null) {
                continue;
            }
            items.put(symbol, new PositionItem(symbol, decimal(item, "quantity", "position"),
                    decimal(item, "avg_cost", "average_cost", "avg_price")));
        }
        Instant refreshedAt = instant(text(node, "refreshed_at", "updated_at"));
        return new PositionsSnapshot(items, refreshedAt, isStale(node, refreshedAt));
    }

    public QuotesSnapshot readQuotes() {
        Optional<JsonNode> json = bridgeFiles.readJson(root().resolve(QUOTES_FILE));
        if (json.isEmpty()) {
            return new QuotesSnapshot(Map.of(), null, true);
        }
        JsonNode node = json.get();
        Map<String, Quote> quotes = new LinkedHashMap<>();
        for (JsonNode item : node.path("items")) {
            String symbol = normalizeSymbol(text(item, "symbol"));
            if (symbol == null) {
                continue;
            }
            quotes.put(symbol, new Quote(symbol, decimal(item, "bid"), decimal(item, "ask"), decimal(item, "last"),
                    decimal(item, "close")));
        }
        Instant refreshedAt = instant(text(node, "refreshed_at", "updated_at"));
        return new QuotesSnapshot(quotes, refreshedAt, isStale(node, refreshedAt));
    }

    public AccountSummary readAccountSummary() {
        Optional<JsonNode> json = bridgeFiles.readJson(root().resolve(ACCOUNT_SUMMARY_FILE));
        if (json.isEmpty()) {
            return new AccountSummary(null, null, null, true);
        }
        JsonNode node = json.get();
        JsonNode values = node.has("values") ? node.get("values") : node;
        Instant refreshedAt = instant(text(node, "refreshed_at", "updated_at"));
        return new AccountSummary(
                decimal(values, "NetLiquidation", "net_liquidation"),
                decimal(values, "AvailableFunds", "cash_available", "TotalCashValue"),
                refreshedAt,
                isStale(node, refreshedAt));
    }

    public Optional<CommandResult> readCommandResult(String commandId) {
        if (commandId == null || commandId.isBlank()) {
            return Optional.empty();
        }
        return bridgeFiles.readJson(root().resolve(COMMAND_RESULTS_DIR).resolve(commandId + ".json"))
                .map(node -> new CommandResult(
                        Optional.ofNullable(text(node, "command_id")).orElse(commandId),
                        Optional.ofNullable(text(node, "status")).orElse("unknown").toLowerCase(Locale.ROOT),
                        instant(text(node, "processed_at")),
                        text(node, "order_id", "broker_order_id", "ib_order_id"),
                        text(node, "error", "message")));
    }

    /**
     * Commands in the queue that have no result file yet.
     */
    public List<PendingCommand> listPendingCommands() {
        Path commandsDir = root().resolve(COMMANDS_DIR);
        if (!Files.isDirectory(commandsDir)) {
            return List.of();
        }
        Path resultsDir = root().resolve(COMMAND_RESULTS_DIR);
        List<PendingCommand> pending = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(commandsDir, "*.json")) {
            for (Path file : stream) {
                String fileName = file.getFileName().toString();
                String commandId = fileName.substring(0, fileName.length() - ".json".length());
                if (Files.exists(resultsDir.resolve(fileName))) {
                    continue;
                }
                Instant requestedAt = bridgeFiles.readJson(file)
                        .map(node -> instant(text(node, "requested_at")))
                        .orElse(null);
                if (requestedAt == null) {
                    requestedAt = Files.getLastModifiedTime(file).toInstant();
                }
                pending.add(new PendingCommand(commandId, requestedAt));
            }
        } catch (IOException e) {
            log.warn("Failed to list bridge commands dir={} error={}", commandsDir, e.getMessage());
        }
        return pending;
    }

    /**
     * Parses execution event logs from the given byte offsets and moves each offset past the last complete
     * line read. A log shorter than its offset was rotated and is read again from the start. Malformed lines
     * are skipped; a trailing line without newline is left for the next read unless it already parses.
     *
     * @param offsets consumed byte offset per absolute file path, updated in place
     */
    public List<ExecutionEvent> readExecutionEvents(List<Path> files, Map<String, Long> offsets) {
        List<ExecutionEvent> events = new ArrayList<>();
        for (Path file : files) {
            if (file == null || !Files.isRegularFile(file)) {
                continue;
            }
            String key = file.toAbsolutePath().normalize().toString();
            long offset = offsets.getOrDefault(key, 0L);
            try {
                long consumed = readEventsFrom(file, offset, events);
                if (consumed != offset) {
                    offsets.put(key, consumed);
                }
            } catch (IOException e) {
                log.warn("Failed to read execution events file={} error={}", file, e.getMessage());
            }
        }
        return events;
    }

    /**
     * Current end of each existing event log, keyed like the offsets of {@link #readExecutionEvents}. Reading
     * from these offsets returns only lines appended afterwards.
     */
    public Map<String, Long> eventLogEnds(List<Path> files) {
        Map<String, Long> ends = new LinkedHashMap<>();
        for (Path file : files) {
            if (file == null || !Files.isRegularFile(file)) {
                continue;
            }
            try {
                ends.put(file.toAbsolutePath().normalize().toString(), Files.size(file));
            } catch (IOException e) {
                log.warn("Failed to size execution events file={} error={}", file, e.getMessage());
            }
        }
        return ends;
    }

    private long readEventsFrom(Path file, long offset, List<ExecutionEvent> events) throws IOException {
        String source = eventSourceName(file);
        int skipped = 0;
        long consumed;
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long size = channel.size();
            long start = offset <= size ? offset : 0L;
            if (start == size) {
                return start;
            }
            channel.position(start);
            InputStream in = new BufferedInputStream(Channels.newInputStream(channel));
            ByteArrayOutputStream line = new ByteArrayOutputStream();
            long position = start;
            long lineStart = start;
            consumed = start;
            int next;
            while ((next = in.read()) != -1) {
                position++;
                if (next != '\n') {
                    line.write(next);
                    continue;
                }
                if (!parseEventLine(source, lineStart, line.toString(StandardCharsets.UTF_8), events)) {
                    skipped++;
                }
                line.reset();
                lineStart = position;
                consumed = position;
            }
            String tail = line.toString(StandardCharsets.UTF_8);
            if (!tail.isBlank() && parseEventLine(source, lineStart, tail, events)) {
                consumed = position;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} malformed execution event lines in {}", skipped, file);
        }
        return consumed;
    }

    // Blank lines count as parsed; only malformed or untagged lines return false
    private boolean parseEventLine(String source, long lineStart, String line, List<ExecutionEvent> events) {
        if (line.isBlank()) {
            return true;
        }
        try {
            JsonNode node = bridgeFiles.parseLine(line);
            String tag = text(node, "tag", "order_tag");
            if (tag == null) {
                return false;
            }
            String eventId = text(node, "event_id", "exec_id", "id");
            if (eventId == null) {
                eventId = source + "@" + lineStart;
            }
            events.add(new ExecutionEvent(eventId, tag,
                    text(node, "status"),
                    abs(decimal(node, "filled", "fill_quantity", "quantity")),
                    decimal(node, "fill_price", "price"),
                    decimal(node, "commission", "fee"),
                    instant(text(node, "time", "timestamp")),
                    text(node, "order_id", "broker_order_id")));
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    // Logs under the bridge root are named relative to it, others by absolute path
    private String eventSourceName(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path bridgeRoot = root().toAbsolutePath().normalize();
        return absolute.startsWith(bridgeRoot) ? bridgeRoot.relativize(absolute).toString() : absolute.toString();
    }

    private OpenOrdersSnapshot toOpenOrders(JsonNode node, boolean runScoped) {
        List<OpenOrderItem> items = new ArrayList<>();
        for (JsonNode item : node.path("items")) {
            items.add(new OpenOrderItem(
                    text(item, "tag", "order_ref", "client_order_id"),
                    text(item, "order_id", "broker_order_id"),
                    text(item, "status"),
                    normalizeSymbol(text(item, "symbol")),
                    decimal(item, "quantity")));
        }
        Instant refreshedAt = instant(text(node, "refreshed_at", "updated_at"));
        return new OpenOrdersSnapshot(items, refreshedAt, isStale(node, refreshedAt), runScoped);
    }

    private boolean isStale(JsonNode node, Instant refreshedAt) {
        if (node.path("stale").asBoolean(false)) {
            return true;
        }
        if (refreshedAt == null) {
            return true;
        }
        return Duration.between(refreshedAt, Instant.now(clock)).getSeconds() > bridgeProperties.getSnapshotStaleSeconds();
    }

    private static BigDecimal abs(BigDecimal value) {
        return value == null ? null : value.abs();
    }

    static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return null;
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
