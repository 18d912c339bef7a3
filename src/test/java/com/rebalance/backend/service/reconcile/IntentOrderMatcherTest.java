package com.rebalance.backend.service.reconcile;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebalance.backend.config.ExecutionProperties;
import com.rebalance.backend.model.OrderSide;
import com.rebalance.backend.model.OrderType;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.params.IntentOrderMismatch;
import com.rebalance.backend.service.bridge.BridgeFiles;
import com.rebalance.backend.service.intent.OrderIntent;
import com.rebalance.backend.service.intent.OrderIntentFileService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class IntentOrderMatcherTest {

    @TempDir
    Path artifacts;

    private OrderIntentFileService fileService;
    private IntentOrderMatcher matcher;

    @BeforeEach
    void setUp() {
        ExecutionProperties properties = new ExecutionProperties();
        properties.setArtifactsDir(artifacts.toString());
        fileService = new OrderIntentFileService(properties, new BridgeFiles(new ObjectMapper()));
        matcher = new IntentOrderMatcher(fileService);
    }

    @Test
    void matchingSymbolsAgree() {
        Path path = fileService.writeIntents(5L, List.of(intent("AAA", OrderSide.BUY), intent("BBB", OrderSide.SELL)));

        assertThat(fileService.readIntentSymbols(path)).contains(Set.of("AAA", "BBB"));
        assertThat(matcher.compare(path, List.of(order("BBB"), order("AAA")))).isEmpty();
    }

    @Test
    void reportsMissingAndExtraSymbols() {
        Path path = fileService.writeIntents(6L, List.of(intent("AAA", OrderSide.BUY), intent("CCC", OrderSide.BUY)));

        Optional<IntentOrderMismatch> mismatch = matcher.compare(path, List.of(order("AAA"), order("BBB")));

        assertThat(mismatch).isPresent();
        assertThat(mismatch.get().missingSymbols()).containsExactly("BBB");
        assertThat(mismatch.get().extraSymbols()).containsExactly("CCC");
    }

    @Test
    void unreadableIntentFileMeansEveryOrderIsMissing() {
        Optional<IntentOrderMismatch> mismatch = matcher.compare(artifacts.resolve("absent.json"), List.of(order("AAA")));

        assertThat(mismatch).isPresent();
        assertThat(mismatch.get().missingSymbols()).containsExactly("AAA");
        assertThat(mismatch.get().extraSymbols()).isEmpty();
    }

    private static OrderIntent intent(String symbol, OrderSide side) {
        return new OrderIntent("oi_1_" + symbol, symbol, side, BigDecimal.TEN, new BigDecimal("0.1"),
                OrderType.MKT, null, new BigDecimal("20"), false);
    }

    private static TradeOrder order(String symbol) {
        TradeOrder order = new TradeOrder();
        order.setSymbol(symbol);
        return order;
    }
}
