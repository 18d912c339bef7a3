package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.dto.CreateRunRequest;
import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.RunStatus;
import com.rebalance.backend.model.TradeMode;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.TradeRun;
import com.rebalance.backend.model.params.SubmissionSource;
import com.rebalance.backend.repository.TradeFillRepository;
import com.rebalance.backend.repository.TradeOrderRepository;
import com.rebalance.backend.repository.TradeRunRepository;
import com.rebalance.backend.service.TradeRunService;
import com.rebalance.backend.service.execution.FallbackRateLimiter;
import com.rebalance.backend.service.execution.ProcessControl;
import com.rebalance.backend.support.BridgeFixture;
import com.rebalance.backend.support.MutableClock;
import com.rebalance.backend.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest
@Import(TestClockConfig.class)
class ReconciliationFlowIntegrationTest {

    private static final Path BRIDGE_ROOT = BridgeFixture.tempDir("bridge");
    private static final Path ARTIFACTS = BridgeFixture.tempDir("artifacts");
    private static final AtomicLong PROJECT_IDS = new AtomicLong(1000);

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("bridge.root", BRIDGE_ROOT::toString);
        registry.add("execution.artifacts-dir", ARTIFACTS::toString);
        registry.add("execution.launcher-command[0]", () -> "lean-launcher");
        registry.add("execution.launcher-command[1]", () -> "{config}");
    }

    @Autowired
    private TradeRunService tradeRunService;

    @Autowired
    private TradeRunRepository tradeRunRepository;

    @Autowired
    private TradeOrderRepository tradeOrderRepository;

    @Autowired
    private TradeFillRepository tradeFillRepository;

    @Autowired
    private MutableClock clock;

    @Autowired
    private FallbackRateLimiter fallbackRateLimiter;

    @MockBean
    private ProcessControl processControl;

    private final BridgeFixture bridge = new BridgeFixture(BRIDGE_ROOT);

    @BeforeEach
    void setUp() {
        clock.set(TestClockConfig.MARKET_OPEN);
        bridge.reset();
        bridge.quotes(clock.instant(), Map.of("AAA", "50", "BBB", "40"));
        bridge.accountSummary(clock.instant(), "100000", "100000");
        bridge.positions(clock.instant(), Map.of());
    }

    @Test
    void leaderSubmissionFillsThroughHoldingsAndCompletes() {
        bridge.status("ok", clock.instant(), 4242);
        TradeRun run = executeNewRun();

        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.getMessage()).isEqualTo("submitted_leader");
        assertThat(run.getParams().getSubmission().getSource()).isEqualTo(SubmissionSource.LEADER_COMMAND);
        assertThat(bridge.commandCount()).isEqualTo(2);

        List<TradeOrder> orders = orders(run);
        assertThat(orders).extracting(TradeOrder::getSymbol).containsExactly("AAA", "BBB");
        assertThat(orders.get(0).getQuantity()).isEqualByComparingTo("1200");
        assertThat(orders.get(1).getQuantity()).isEqualByComparingTo("1000");

        clock.advance(Duration.ofSeconds(5));
        for (TradeOrder order : orders) {
            bridge.commandResult(order.getParams().getSubmitCommand().getCommandId(), "submitted",
                    "90" + order.getId(), clock.instant());
        }
        ReconcileResult submitted = tradeRunService.refreshRun(run.getId());
        assertThat(submitted.changed()).isTrue();
        assertThat(orders(run)).extracting(TradeOrder::getStatus).containsOnly(OrderStatus.SUBMITTED);

        clock.advance(Duration.ofSeconds(5));
        bridge.positions(clock.instant(), Map.of("AAA", "1200", "BBB", "600"));
        ReconcileResult partial = tradeRunService.refreshRun(run.getId());
        assertThat(partial.status()).isEqualTo(RunStatus.RUNNING);
        orders = orders(run);
        assertThat(orders.get(0).getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(orders.get(1).getStatus()).isEqualTo(OrderStatus.PARTIAL);
        assertThat(orders.get(1).getFilledQuantity()).isEqualByComparingTo("600");

        ReconcileResult repeat = tradeRunService.refreshRun(run.getId());
        assertThat(repeat.changed()).isFalse();
        assertThat(tradeFillRepository.findByOrderIdOrderByIdAsc(orders.get(1).getId())).hasSize(1);

        clock.advance(Duration.ofSeconds(5));
        bridge.positions(clock.instant(), Map.of("AAA", "1200", "BBB", "1000"));
        ReconcileResult done = tradeRunService.refreshRun(run.getId());
        assertThat(done.status()).isEqualTo(RunStatus.DONE);
        assertThat(done.message()).isEqualTo("completed");
        assertThat(tradeFillRepository.findByOrderIdOrderByIdAsc(orders.get(1).getId())).hasSize(2);

        // Holdings moving away later does not touch a finished run
        bridge.positions(clock.instant(), Map.of());
        ReconcileResult after = tradeRunService.refreshRun(run.getId());
        assertThat(after.changed()).isFalse();
        assertThat(after.status()).isEqualTo(RunStatus.DONE);
        assertThat(orders(run)).extracting(TradeOrder::getStatus).containsOnly(OrderStatus.FILLED);
    }

    @Test
    void concurrentPassesRecordEachFillOnce() throws Exception {
        bridge.status("ok", clock.instant(), 4242);
        TradeRun run = executeNewRun();
        clock.advance(Duration.ofSeconds(5));
        bridge.positions(clock.instant(), Map.of("AAA", "700", "BBB", "1000"));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<ReconcileResult>> passes = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                passes.add(() -> tradeRunService.refreshRun(run.getId()));
            }
            for (Future<ReconcileResult> future : pool.invokeAll(passes, 30, TimeUnit.SECONDS)) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        List<TradeOrder> orders = orders(run);
        assertThat(orders.get(0).getFilledQuantity()).isEqualByComparingTo("700");
        assertThat(orders.get(1).getStatus()).isEqualTo(OrderStatus.FILLED);
        for (TradeOrder order : orders) {
            assertThat(tradeFillRepository.findByOrderIdOrderByIdAsc(order.getId())).hasSize(1);
        }
    }

    @Test
    void pendingCommandsStallThenMoveToFallbackProcess() throws IOException {
        bridge.status("ok", clock.instant(), 4242);
        TradeRun run = executeNewRun();
        when(processControl.launch(any(), any(), any()))
                .thenThrow(new IOException("launcher missing"))
                .thenReturn(777L);

        clock.advance(Duration.ofSeconds(46));
        ReconcileResult stalled = tradeRunService.refreshRun(run.getId());
        assertThat(stalled.status()).isEqualTo(RunStatus.STALLED);
        assertThat(tradeRunRepository.findById(run.getId()).orElseThrow().getStalledReason())
                .isEqualTo("submit_command_pending_timeout");

        // Still inside the fallback spacing window
        clock.advance(Duration.ofSeconds(10));
        assertThat(tradeRunService.refreshRun(run.getId()).status()).isEqualTo(RunStatus.STALLED);

        clock.advance(Duration.ofSeconds(25));
        ReconcileResult resumed = tradeRunService.refreshRun(run.getId());
        assertThat(resumed.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(resumed.message()).isEqualTo("submitted_fallback");

        TradeRun reloaded = tradeRunRepository.findById(run.getId()).orElseThrow();
        assertThat(reloaded.getParams().getSubmission().getSource()).isEqualTo(SubmissionSource.SHORT_LIVED_FALLBACK);
        assertThat(reloaded.getParams().getSubmission().getPid()).isEqualTo(777L);
        assertThat(reloaded.getParams().getRuntimeFallback().getClearedPendingOrders()).hasSize(2);
        assertThat(orders(run)).allSatisfy(order -> {
            assertThat(order.getParams().getSubmitCommand().isPending()).isFalse();
            assertThat(order.getParams().getSubmitCommand().isSuperseded()).isTrue();
        });
        assertThat(ARTIFACTS.resolve("order_intents").resolve("order_intent_run_" + run.getId() + "_fallback.json"))
                .exists();
        assertThat(fallbackRateLimiter.tracks(run.getId())).isTrue();

        tradeRunService.terminateRun(run.getId(), "operator");
        assertThat(fallbackRateLimiter.tracks(run.getId())).isFalse();
    }

    @Test
    void warmupSubmissionFailsRunAndRejectsOrders() throws IOException {
        bridge.status("disconnected", clock.instant(), 4242);
        when(processControl.launch(any(), any(), any())).thenReturn(888L);
        TradeRun run = executeNewRun();

        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.getMessage()).isEqualTo("submitted_short_lived");
        assertThat(run.getParams().getLeaderSubmitFallback()).isNotNull();
        Path outputDir = Path.of(run.getParams().getSubmission().getOutputDir());
        Files.createDirectories(outputDir);
        Files.writeString(outputDir.resolve("log.txt"),
                "ERROR: Order placement is not allowed in Initialize or during warm up\n");

        clock.advance(Duration.ofSeconds(10));
        ReconcileResult failed = tradeRunService.refreshRun(run.getId());

        assertThat(failed.status()).isEqualTo(RunStatus.FAILED);
        assertThat(failed.message()).isEqualTo("execution_error:submit_during_warmup");
        assertThat(orders(run)).allSatisfy(order -> {
            assertThat(order.getStatus()).isEqualTo(OrderStatus.REJECTED);
            assertThat(order.getRejectedReason()).isEqualTo("OrderRequest.Submit blocked during warmup/initialize");
        });
        TradeRun reloaded = tradeRunRepository.findById(run.getId()).orElseThrow();
        assertThat(reloaded.getParams().getSubmission().getTerminationOutcome()).isEqualTo("not_running");
    }

    @Test
    void executionConfirmsFillAlreadyInferredFromHoldings() {
        bridge.status("ok", clock.instant(), 4242);
        TradeRun run = executeNewRun();
        List<TradeOrder> orders = orders(run);
        TradeOrder bbb = orders.get(1);
        for (TradeOrder order : orders) {
            bridge.commandResult(order.getParams().getSubmitCommand().getCommandId(), "submitted",
                    "90" + order.getId(), clock.instant());
        }

        clock.advance(Duration.ofSeconds(5));
        bridge.status("ok", clock.instant(), 4242);
        bridge.positions(clock.instant(), Map.of("BBB", "600"));
        tradeRunService.refreshRun(run.getId());
        assertThat(reload(bbb).getFilledQuantity()).isEqualByComparingTo("600");

        // The broker reports the same 600 shares the holdings already showed
        clock.advance(Duration.ofSeconds(5));
        bridge.status("ok", clock.instant(), 4242);
        bridge.positions(clock.instant(), Map.of("BBB", "600"));
        appendEvent(BRIDGE_ROOT, "{\"event_id\":\"e1\",\"tag\":\"" + bbb.tag()
                + "\",\"status\":\"partially_filled\",\"filled\":600,\"fill_price\":40}");
        ReconcileResult confirmed = tradeRunService.refreshRun(run.getId());

        assertThat(confirmed.status()).isEqualTo(RunStatus.RUNNING);
        TradeOrder afterConfirm = reload(bbb);
        assertThat(afterConfirm.getStatus()).isEqualTo(OrderStatus.PARTIAL);
        assertThat(afterConfirm.getFilledQuantity()).isEqualByComparingTo("600");
        assertThat(afterConfirm.getParams().inferredFilledOrZero()).isEqualByComparingTo("0");

        clock.advance(Duration.ofSeconds(5));
        bridge.status("ok", clock.instant(), 4242);
        bridge.positions(clock.instant(), Map.of("BBB", "1000"));
        appendEvent(BRIDGE_ROOT, "{\"event_id\":\"e2\",\"tag\":\"" + bbb.tag()
                + "\",\"status\":\"filled\",\"filled\":400,\"fill_price\":40}");
        tradeRunService.refreshRun(run.getId());

        TradeOrder filled = reload(bbb);
        assertThat(filled.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(filled.getFilledQuantity()).isEqualByComparingTo("1000");
        assertThat(tradeFillRepository.findByOrderIdOrderByIdAsc(bbb.getId()))
                .extracting(fill -> fill.getQuantity().stripTrailingZeros().toPlainString())
                .containsExactly("600", "0", "400");
    }

    @Test
    void undatedOpenOrdersSnapshotNeverCancels() throws IOException {
        bridge.status("ok", clock.instant(), 4242);
        TradeRun run = executeNewRun();
        List<TradeOrder> orders = orders(run);
        clock.advance(Duration.ofSeconds(5));
        for (TradeOrder order : orders) {
            bridge.commandResult(order.getParams().getSubmitCommand().getCommandId(), "submitted",
                    "90" + order.getId(), clock.instant());
        }
        tradeRunService.refreshRun(run.getId());
        assertThat(orders(run)).extracting(TradeOrder::getStatus).containsOnly(OrderStatus.SUBMITTED);

        // Lists only the first order and carries no refresh time
        Files.writeString(BRIDGE_ROOT.resolve("open_orders.json"),
                "{\"items\":[{\"tag\":\"" + orders.get(0).tag() + "\",\"symbol\":\"AAA\",\"quantity\":1200}]}");
        for (int i = 0; i < 4; i++) {
            clock.advance(Duration.ofSeconds(70));
            bridge.status("ok", clock.instant(), 4242);
            bridge.positions(clock.instant(), Map.of());
            tradeRunService.refreshRun(run.getId());
        }

        assertThat(orders(run)).allSatisfy(order -> {
            assertThat(order.getStatus()).isEqualTo(OrderStatus.SUBMITTED);
            assertThat(order.getParams().getOpenOrdersMissingSince()).isNull();
        });
    }

    @Test
    void sameNamedEventLogsWithoutIdsAreBothApplied() throws IOException {
        bridge.status("disconnected", clock.instant(), 4242);
        when(processControl.launch(any(), any(), any())).thenReturn(889L);
        TradeRun run = executeNewRun();
        List<TradeOrder> orders = orders(run);
        Path outputDir = Path.of(run.getParams().getSubmission().getOutputDir());
        Files.createDirectories(outputDir);

        appendEvent(BRIDGE_ROOT, "{\"tag\":\"" + orders.get(0).tag()
                + "\",\"status\":\"partially_filled\",\"filled\":200,\"fill_price\":50}");
        appendEvent(outputDir, "{\"tag\":\"" + orders.get(1).tag()
                + "\",\"status\":\"partially_filled\",\"filled\":300,\"fill_price\":40}");
        clock.advance(Duration.ofSeconds(5));
        tradeRunService.refreshRun(run.getId());

        assertThat(reload(orders.get(0)).getFilledQuantity()).isEqualByComparingTo("200");
        assertThat(reload(orders.get(1)).getFilledQuantity()).isEqualByComparingTo("300");
        assertThat(tradeRunRepository.findById(run.getId()).orElseThrow().getParams().getEventLogOffsets())
                .hasSize(2);

        assertThat(tradeRunService.refreshRun(run.getId()).changed()).isFalse();

        appendEvent(outputDir, "{\"tag\":\"" + orders.get(1).tag()
                + "\",\"status\":\"filled\",\"filled\":700,\"fill_price\":40}");
        tradeRunService.refreshRun(run.getId());

        TradeOrder bbb = reload(orders.get(1));
        assertThat(bbb.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(tradeFillRepository.findByOrderIdOrderByIdAsc(bbb.getId())).hasSize(2);
        assertThat(tradeFillRepository.findByOrderIdOrderByIdAsc(orders.get(0).getId())).hasSize(1);
    }

    private static void appendEvent(Path dir, String line) {
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve("execution_events.jsonl"), line + "\n", StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private TradeOrder reload(TradeOrder order) {
        return tradeOrderRepository.findById(order.getId()).orElseThrow();
    }

    private TradeRun executeNewRun() {
        CreateRunRequest request = CreateRunRequest.builder()
                .projectId(PROJECT_IDS.incrementAndGet())
                .decisionSnapshotId(1L)
                .mode(TradeMode.PAPER)
                .targetWeights(Map.of("AAA", new BigDecimal("0.6"), "BBB", new BigDecimal("0.4")))
                .build();
        TradeRun created = tradeRunService.createRun(request).run();
        return tradeRunService.executeRun(created.getId(), false);
    }

    private List<TradeOrder> orders(TradeRun run) {
        return tradeOrderRepository.findByRunIdOrderByIdAsc(run.getId());
    }
}
