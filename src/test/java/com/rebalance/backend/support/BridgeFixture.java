package com.rebalance.backend.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes the snapshot files a broker session would publish into a bridge directory.
 */
public class BridgeFixture {

    private final Path root;

    public BridgeFixture(Path root) {
        this.root = root;
    }

    public static Path tempDir(String prefix) {
        try {
            return Files.createTempDirectory(prefix);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public Path root() {
        return root;
    }

    public void reset() {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> files = Files.walk(root)) {
            files.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(root))
                    .forEach(path -> path.toFile().delete());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void status(String status, Instant heartbeat, long pid) {
        write(root.resolve("lean_bridge_status.json"),
                "{\"status\":\"" + status + "\",\"last_heartbeat\":\"" + heartbeat + "\",\"pid\":" + pid + "}");
    }

    public void positions(Instant refreshedAt, Map<String, String> quantities) {
        String items = quantities.entrySet().stream()
                .map(entry -> "{\"symbol\":\"" + entry.getKey() + "\",\"quantity\":" + entry.getValue() + "}")
                .collect(Collectors.joining(","));
        write(root.resolve("positions.json"), "{\"refreshed_at\":\"" + refreshedAt + "\",\"items\":[" + items + "]}");
    }

    public void quotes(Instant refreshedAt, Map<String, String> lastPrices) {
        String items = lastPrices.entrySet().stream()
                .map(entry -> "{\"symbol\":\"" + entry.getKey() + "\",\"last\":" + entry.getValue() + "}")
                .collect(Collectors.joining(","));
        write(root.resolve("quotes.json"), "{\"refreshed_at\":\"" + refreshedAt + "\",\"items\":[" + items + "]}");
    }

    public void accountSummary(Instant refreshedAt, String netLiquidation, String cash) {
        write(root.resolve("account_summary.json"), "{\"refreshed_at\":\"" + refreshedAt + "\",\"values\":{"
                + "\"NetLiquidation\":" + netLiquidation + ",\"AvailableFunds\":" + cash + "}}");
    }

    public void commandResult(String commandId, String status, String brokerOrderId, Instant processedAt) {
        write(root.resolve("command_results").resolve(commandId + ".json"),
                "{\"command_id\":\"" + commandId + "\",\"status\":\"" + status + "\",\"order_id\":\""
                        + brokerOrderId + "\",\"processed_at\":\"" + processedAt + "\"}");
    }

    public long commandCount() {
        Path commands = root.resolve("commands");
        if (!Files.isDirectory(commands)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(commands)) {
            return files.filter(path -> path.toString().endsWith(".json")).count();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(Path path, String content) {
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
