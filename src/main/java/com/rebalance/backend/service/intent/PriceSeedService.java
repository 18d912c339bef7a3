package com.rebalance.backend.service.intent;

import com.rebalance.backend.config.ExecutionProperties;
import com.rebalance.backend.service.bridge.BridgeReader;
import com.rebalance.backend.service.bridge.BridgeSnapshots.Quote;
import com.rebalance.backend.service.bridge.BridgeSnapshots.QuotesSnapshot;
import com.rebalance.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves sizing prices from the live quote snapshot, falling back to the latest daily close on disk.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PriceSeedService {

    static final String CURATED_DIR = "curated_adjusted";

    private final BridgeReader bridgeReader;
    private final ExecutionProperties executionProperties;

    public Map<String, PriceSeed> resolve(Collection<String> symbols) {
        QuotesSnapshot quotes = bridgeReader.readQuotes();
        Map<String, PriceSeed> seeds = new LinkedHashMap<>();
        for (String symbol : symbols) {
            Optional<PriceSeed> seed = quotes.stale() ? Optional.empty() : fromQuote(quotes.bySymbol().get(symbol));
            if (seed.isEmpty()) {
                seed = latestClose(symbol).map(close -> PriceSeed.ofClose(close, "daily_close"));
            }
            if (seed.isPresent()) {
                seeds.put(symbol, seed.get());
            } else {
                log.warn("No price available symbol={}", symbol);
            }
        }
        return seeds;
    }

    Optional<PriceSeed> fromQuote(Quote quote) {
        if (quote == null) {
            return Optional.empty();
        }
        PriceSeed partial = new PriceSeed(null, quote.bid(), quote.ask(), quote.last(), "quote");
        BigDecimal reference = firstPositive(quote.last(), partial.mid(), quote.close(), quote.bid(), quote.ask());
        if (reference == null) {
            return Optional.empty();
        }
        return Optional.of(new PriceSeed(reference, quote.bid(), quote.ask(), quote.last(), "quote"));
    }

    Optional<BigDecimal> latestClose(String symbol) {
        Path dir = executionProperties.dataRootPath().resolve(CURATED_DIR);
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        String suffix = "_" + symbol.toUpperCase(Locale.ROOT) + "_Daily.csv";
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + suffix)) {
            for (Path file : stream) {
                Optional<BigDecimal> close = lastClose(file);
                if (close.isPresent()) {
                    return close;
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan price files dir={} symbol={} error={}", dir, symbol, e.getMessage());
        }
        return Optional.empty();
    }

    private Optional<BigDecimal> lastClose(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        if (lines.size() < 2) {
            return Optional.empty();
        }
        String[] header = lines.get(0).split(",");
        int closeIndex = -1;
        for (int i = 0; i < header.length; i++) {
            if ("close".equalsIgnoreCase(header[i].trim())) {
                closeIndex = i;
            }
        }
        if (closeIndex < 0) {
            return Optional.empty();
        }
        for (int i = lines.size() - 1; i > 0; i--) {
            String[] cells = lines.get(i).split(",");
            if (cells.length > closeIndex) {
                BigDecimal close = MoneyUtils.toBigDecimal(cells[closeIndex]);
                if (MoneyUtils.isPositive(close)) {
                    return Optional.of(close);
                }
            }
        }
        return Optional.empty();
    }

    private static BigDecimal firstPositive(BigDecimal... candidates) {
        for (BigDecimal candidate : candidates) {
            if (MoneyUtils.isPositive(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
