package com.rebalance.backend.service;

import com.rebalance.backend.exception.BadRequestException;
import com.rebalance.backend.exception.ConflictException;
import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.repository.TradeOrderRepository;
import com.rebalance.backend.service.TradeOrderService.CreateOrderCommand;
import com.rebalance.backend.service.risk.SystemGuardService;
import com.rebalance.backend.support.BridgeFixture;
import com.rebalance.backend.support.MutableClock;
import com.rebalance.backend.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestClockConfig.class)
class DirectOrderServiceIntegrationTest {

    private static final Path BRIDGE_ROOT = BridgeFixture.tempDir("bridge");
    private static final Path ARTIFACTS = BridgeFixture.tempDir("artifacts");
    private static final AtomicLong CLIENT_IDS = new AtomicLong(100);

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("bridge.root", BRIDGE_ROOT::toString);
        registry.add("execution.artifacts-dir", ARTIFACTS::toString);
    }

    @Autowired
    private DirectOrderService directOrderService;

    @Autowired
    private TradeOrderService tradeOrderService;

    @Autowired
    private TradeOrderRepository tradeOrderRepository;

    @Autowired
    private SystemGuardService systemGuardService;

    @Autowired
    private MutableClock clock;

    private final BridgeFixture bridge = new BridgeFixture(BRIDGE_ROOT);

    @BeforeEach
    void setUp() {
        clock.set(TestClockConfig.MARKET_OPEN);
        // Orders left open by earlier tests would otherwise join every sweep
        for (TradeOrder order : directOrderService.listOrders(null)) {
            if (order.getRunId() == null && !order.isTerminal()) {
                directOrderService.cancel(order.getId());
            }
        }
        bridge.reset();
        bridge.status("ok", clock.instant(), 4242);
        bridge.positions(clock.instant(), Map.of());
    }

    @Test
    void directOrderIsSubmittedThroughLeaderAndConfirmedByCommandResult() {
        TradeOrder order = directOrderService.createAndSubmit(command("AAA", "BUY", "10"));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.NEW);
        assertThat(order.getParams().getSubmitCommand().isPending()).isTrue();
        assertThat(order.getParams().getSubmitCommand().getSource()).isEqualTo(DirectOrderService.SOURCE_DIRECT);
        assertThat(order.getParams().getEventLogOffsets()).isNotNull();
        assertThat(bridge.commandCount()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(5));
        bridge.commandResult(order.getParams().getSubmitCommand().getCommandId(), "submitted", "7001", clock.instant());
        TradeOrder submitted = directOrderService.getOrder(order.getId());

        assertThat(submitted.getStatus()).isEqualTo(OrderStatus.SUBMITTED);
        assertThat(submitted.getBrokerOrderId()).isEqualTo("7001");
        assertThat(submitted.getParams().getSubmitCommand().isPending()).isFalse();
    }

    @Test
    void repeatedCreateWithSameClientOrderIdDoesNotResubmit() {
        CreateOrderCommand command = command("AAA", "BUY", "10");

        TradeOrder first = directOrderService.createAndSubmit(command);
        TradeOrder second = directOrderService.createAndSubmit(command);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(bridge.commandCount()).isEqualTo(1);
    }

    @Test
    void eventLogLinesWrittenBeforeSubmitAreNotApplied() throws IOException {
        CreateOrderCommand command = command("BBB", "BUY", "20");
        appendEvent("{\"event_id\":\"old-" + command.clientOrderId() + "\",\"tag\":\"" + command.clientOrderId()
                + "\",\"status\":\"filled\",\"filled\":5,\"fill_price\":40}");
        TradeOrder order = directOrderService.createAndSubmit(command);

        clock.advance(Duration.ofSeconds(5));
        appendEvent("{\"event_id\":\"new-" + command.clientOrderId() + "\",\"tag\":\"" + order.tag()
                + "\",\"status\":\"partially_filled\",\"filled\":10,\"fill_price\":40}");
        directOrderService.refresh();

        TradeOrder partial = tradeOrderRepository.findById(order.getId()).orElseThrow();
        assertThat(partial.getStatus()).isEqualTo(OrderStatus.PARTIAL);
        assertThat(partial.getFilledQuantity()).isEqualByComparingTo("10");

        directOrderService.refresh();
        assertThat(tradeOrderRepository.findById(order.getId()).orElseThrow().getFilledQuantity())
                .isEqualByComparingTo("10");
    }

    @Test
    void unsubmittedOrderMissingFromLeaderListIsSkipped() {
        TradeOrder order = tradeOrderService.createOrder(command("AAA", "SELL", "5")).order();

        clock.advance(Duration.ofSeconds(61));
        publishEmptyOpenOrders();
        directOrderService.refresh();
        assertThat(tradeOrderRepository.findById(order.getId()).orElseThrow().getParams().getOpenOrdersMissingSince())
                .isEqualTo(clock.instant());

        clock.advance(Duration.ofSeconds(301));
        publishEmptyOpenOrders();
        directOrderService.refresh();

        TradeOrder skipped = tradeOrderRepository.findById(order.getId()).orElseThrow();
        assertThat(skipped.getStatus()).isEqualTo(OrderStatus.SKIPPED);
        assertThat(skipped.isLowConfidence()).isTrue();
    }

    @Test
    void unansweredSubmitCommandExpires() {
        TradeOrder order = directOrderService.createAndSubmit(command("AAA", "BUY", "3"));

        clock.advance(Duration.ofSeconds(121));
        bridge.status("ok", clock.instant(), 4242);
        directOrderService.refresh();

        TradeOrder expired = tradeOrderRepository.findById(order.getId()).orElseThrow();
        assertThat(expired.getStatus()).isEqualTo(OrderStatus.REJECTED);
        assertThat(expired.getRejectedReason()).isEqualTo("submit_command_expired");
        assertThat(expired.getParams().getSubmitCommand().getStatus()).isEqualTo("expired");
        assertThat(expired.getParams().getSubmitCommand().isPending()).isFalse();
    }

    @Test
    void cancelSendsBrokerCancelOnlyForOrdersTheBrokerMayHold() {
        TradeOrder sent = directOrderService.createAndSubmit(command("AAA", "BUY", "10"));
        clock.advance(Duration.ofSeconds(5));
        bridge.commandResult(sent.getParams().getSubmitCommand().getCommandId(), "submitted", "7002", clock.instant());
        directOrderService.refresh();

        TradeOrder canceled = directOrderService.cancel(sent.getId());

        assertThat(canceled.getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(canceled.getParams().getProvenance()).containsKey("cancel_command_id");
        assertThat(bridge.commandCount()).isEqualTo(2);
        assertThat(directOrderService.cancel(sent.getId()).getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(bridge.commandCount()).isEqualTo(2);

        TradeOrder local = tradeOrderService.createOrder(command("BBB", "BUY", "1")).order();
        assertThat(directOrderService.cancel(local.getId()).getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(bridge.commandCount()).isEqualTo(2);
    }

    @Test
    void submitRefusesWhatCannotBeSent() {
        CreateOrderCommand withRun = new CreateOrderCommand(1L, "direct-run-" + CLIENT_IDS.incrementAndGet(), "AAA",
                "BUY", BigDecimal.ONE, "MKT", null, null);
        assertThatThrownBy(() -> directOrderService.createAndSubmit(withRun))
                .isInstanceOf(BadRequestException.class);

        TradeOrder pending = directOrderService.createAndSubmit(command("AAA", "BUY", "1"));
        assertThatThrownBy(() -> directOrderService.submit(pending.getId()))
                .isInstanceOf(ConflictException.class);

        bridge.status("disconnected", clock.instant(), 4242);
        CreateOrderCommand offline = command("AAA", "BUY", "2");
        assertThatThrownBy(() -> directOrderService.createAndSubmit(offline))
                .isInstanceOf(ConflictException.class)
                .hasMessage("bridge_unreachable");
        assertThat(tradeOrderRepository.findByClientOrderId(offline.clientOrderId())).isEmpty();
        assertThat(bridge.commandCount()).isEqualTo(1);
    }

    @Test
    void tradingHaltRefusesDirectSubmit() {
        systemGuardService.halt("drawdown");
        try {
            assertThatThrownBy(() -> directOrderService.createAndSubmit(command("AAA", "BUY", "1")))
                    .isInstanceOf(ConflictException.class)
                    .hasMessage("risk_blocked:risk_halt:drawdown");
            assertThat(bridge.commandCount()).isZero();
        } finally {
            systemGuardService.clear();
        }
    }

    @Test
    void listRejectsUnknownStatus() {
        assertThatThrownBy(() -> directOrderService.listOrders("PARKED")).isInstanceOf(BadRequestException.class);
    }

    private static CreateOrderCommand command(String symbol, String side, String quantity) {
        return new CreateOrderCommand(null, "direct-" + CLIENT_IDS.incrementAndGet(), symbol, side,
                new BigDecimal(quantity), "MKT", null, null);
    }

    private void publishEmptyOpenOrders() {
        bridge.status("ok", clock.instant(), 4242);
        BridgeFixture.write(BRIDGE_ROOT.resolve("open_orders.json"),
                "{\"refreshed_at\":\"" + clock.instant() + "\",\"items\":[]}");
    }

    private static void appendEvent(String line) throws IOException {
        Files.writeString(BRIDGE_ROOT.resolve("execution_events.jsonl"), line + "\n", StandardOpenOption.CREATE,
                StandardOpenOption.APPEND);
    }
}
