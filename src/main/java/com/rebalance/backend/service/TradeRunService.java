package com.rebalance.backend.service;

import com.rebalance.backend.config.ExecutionProperties;
import com.rebalance.backend.dto.CreateRunRequest;
import com.rebalance.backend.dto.SymbolSummaryRow;
import com.rebalance.backend.exception.BadRequestException;
import com.rebalance.backend.exception.BridgeIoException;
import com.rebalance.backend.exception.ConflictException;
import com.rebalance.backend.exception.NotFoundException;
import com.rebalance.backend.exception.OrdersEmptyException;
import com.rebalance.backend.exception.PortfolioValueRequiredException;
import com.rebalance.backend.exception.TradingException;
import com.rebalance.backend.model.OrderSide;
import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.OrderType;
import com.rebalance.backend.model.RunStatus;
import com.rebalance.backend.model.TradeMode;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.TradeRun;
import com.rebalance.backend.model.params.CompletionSummary;
import com.rebalance.backend.model.params.ExplicitOrder;
import com.rebalance.backend.model.params.IntentOrderMismatch;
import com.rebalance.backend.model.params.OrderParams;
import com.rebalance.backend.model.params.RunParams;
import com.rebalance.backend.model.params.SizingConfig;
import com.rebalance.backend.model.params.SubmissionMetadata;
import com.rebalance.backend.repository.TradeOrderRepository;
import com.rebalance.backend.repository.TradeRunRepository;
import com.rebalance.backend.service.TradeOrderService.CreateOrderCommand;
import com.rebalance.backend.service.bridge.BridgeCommandWriter;
import com.rebalance.backend.service.bridge.BridgeReader;
import com.rebalance.backend.service.bridge.BridgeSnapshots.AccountSummary;
import com.rebalance.backend.service.bridge.BridgeSnapshots.BridgeStatus;
import com.rebalance.backend.service.bridge.BridgeSnapshots.PositionsSnapshot;
import com.rebalance.backend.service.execution.FallbackRateLimiter;
import com.rebalance.backend.service.execution.ProcessLifecycleManager;
import com.rebalance.backend.service.execution.SubmissionDispatcher;
import com.rebalance.backend.service.execution.SubmissionDispatcher.DispatchResult;
import com.rebalance.backend.service.intent.IntentRequest;
import com.rebalance.backend.service.intent.OrderIntent;
import com.rebalance.backend.service.intent.OrderIntentBuilder;
import com.rebalance.backend.service.intent.OrderIntentFileService;
import com.rebalance.backend.service.intent.PriceSeed;
import com.rebalance.backend.service.intent.PriceSeedService;
import com.rebalance.backend.service.reconcile.IntentOrderMatcher;
import com.rebalance.backend.service.reconcile.ReconcileResult;
import com.rebalance.backend.service.reconcile.ReconciliationEngine;
import com.rebalance.backend.service.reconcile.RunCompletionEvaluator;
import com.rebalance.backend.service.risk.RiskGate;
import com.rebalance.backend.service.risk.RiskGateDecision;
import com.rebalance.backend.service.risk.RiskGateRequest;
import com.rebalance.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Run lifecycle: creation, execution up to submission, and the operator actions on a running run.
 * Status reads go through the reconciliation engine first.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeRunService {

    public static final String LIVE_CONFIRM_TOKEN = "LIVE";
    static final BigDecimal WEIGHT_SUM_TOLERANCE = new BigDecimal("1.0001");

    private final TradeRunRepository tradeRunRepository;
    private final TradeOrderRepository tradeOrderRepository;
    private final TradeOrderService tradeOrderService;
    private final OrderStateMachine orderStateMachine;
    private final JobLockService jobLockService;
    private final BridgeReader bridgeReader;
    private final BridgeCommandWriter bridgeCommandWriter;
    private final PriceSeedService priceSeedService;
    private final OrderIntentBuilder orderIntentBuilder;
    private final OrderIntentFileService orderIntentFileService;
    private final IntentOrderMatcher intentOrderMatcher;
    private final RiskGate riskGate;
    private final SubmissionDispatcher submissionDispatcher;
    private final ProcessLifecycleManager processLifecycleManager;
    private final FallbackRateLimiter fallbackRateLimiter;
    private final ReconciliationEngine reconciliationEngine;
    private final RunCompletionEvaluator runCompletionEvaluator;
    private final ExecutionProperties executionProperties;
    private final AuditEventService auditEventService;
    private final TradeMetrics tradeMetrics;
    private final Clock clock;

    public record CreateRunResult(TradeRun run, boolean created) {
    }

    public record RunDetail(TradeRun run, List<TradeOrder> orders, CompletionSummary summary, boolean reconciled) {
    }

    /**
     * Creates a QUEUED run. A second request for the same project, snapshot and mode on the same UTC day
     * returns the run that is still active instead of creating another.
     */
    @Transactional
    public CreateRunResult createRun(CreateRunRequest request) {
        if (request.getMode() == TradeMode.LIVE && !LIVE_CONFIRM_TOKEN.equals(request.getConfirmToken())) {
            throw new BadRequestException("live_confirm_token_required");
        }
        Map<String, BigDecimal> weights = normalizeWeights(request.getTargetWeights());
        List<ExplicitOrder> explicitOrders = normalizeOrders(request.getOrders());
        if (weights.isEmpty() && explicitOrders.isEmpty()) {
            throw new BadRequestException("target_weights or orders required");
        }

        Instant now = Instant.now(clock);
        Instant dayStart = LocalDate.ofInstant(now, ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant();
        Optional<TradeRun> existing = tradeRunRepository
                .findByProjectIdAndModeAndStatusInAndCreatedAtGreaterThanEqualOrderByIdDesc(
                        request.getProjectId(), request.getMode(), RunStatus.ACTIVE, dayStart)
                .stream()
                .filter(run -> Objects.equals(run.getDecisionSnapshotId(), request.getDecisionSnapshotId()))
                .findFirst();
        if (existing.isPresent()) {
            log.info("Active run reused runId={} projectId={}", existing.get().getId(), request.getProjectId());
            return new CreateRunResult(existing.get(), false);
        }

        RunParams params = new RunParams();
        params.setTargetWeights(weights);
        params.setExplicitOrders(explicitOrders);
        params.setRiskBypass(request.isRiskBypass());
        params.setStallDeadlineMinutes(request.getStallDeadlineMinutes());
        params.setSizing(SizingConfig.builder()
                .portfolioValue(request.getPortfolioValue())
                .cashAvailable(request.getCashAvailable())
                .cashBufferRatio(request.getCashBufferRatio())
                .lotSize(request.getLotSize())
                .minQty(request.getMinQty())
                .orderType(request.getOrderType())
                .outsideRth(request.getOutsideRth())
                .build());
        TradeRun run = tradeRunRepository.save(TradeRun.builder()
                .projectId(request.getProjectId())
                .decisionSnapshotId(request.getDecisionSnapshotId())
                .mode(request.getMode())
                .status(RunStatus.QUEUED)
                .params(params)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Run created runId={} projectId={} mode={} targets={} orders={}", run.getId(), run.getProjectId(),
                run.getMode(), weights.size(), explicitOrders.size());
        auditEventService.recordEvent(run.getId(), "run", "CREATED", "Trade run created",
                Map.of("projectId", run.getProjectId(), "mode", run.getMode().name()));
        return new CreateRunResult(run, true);
    }

    /**
     * Sizes, risk checks, persists and submits the run's orders.
     * @param force re-executes a BLOCKED or FAILED run and ignores an active trading halt
     * @throws ConflictException when the run is not executable or another execution holds the lock
     */
    @Transactional
    public TradeRun executeRun(Long runId, boolean force) {
        TradeRun run = lockRun(runId);
        Instant now = Instant.now(clock);
        RunStatus status = run.getStatus();
        if (status == RunStatus.BLOCKED || status == RunStatus.FAILED) {
            if (!force) {
                throw new ConflictException("Run " + runId + " is " + status + "; re-execute with force");
            }
            run.requeue(now);
            run.getParams().setAttempt(run.getParams().currentAttempt() + 1);
        } else if (status != RunStatus.QUEUED) {
            throw new ConflictException("Run " + runId + " is not executable from " + status);
        }
        JobLockService.Lease lease = jobLockService.tryAcquire(JobLockService.TRADE_EXECUTION, "execute_run_" + runId)
                .orElseThrow(() -> new ConflictException("trade_execution lock busy"));
        MDC.put("runId", String.valueOf(runId));
        try (lease) {
            execute(run, force, now);
        } finally {
            MDC.remove("runId");
        }
        return tradeRunRepository.save(run);
    }

    private void execute(TradeRun run, boolean force, Instant now) {
        BridgeStatus bridgeStatus = bridgeReader.readStatus();
        if (bridgeStatus.isMissing()) {
            block(run, "bridge_unreachable", now);
            return;
        }
        RunParams params = run.getParams();
        AccountSummary account = bridgeReader.readAccountSummary();
        PositionsSnapshot positions = bridgeReader.readPositions();
        if (positions.stale()) {
            log.warn("Positions snapshot stale at execution runId={}", run.getId());
        }
        SizingConfig sizing = resolveSizing(params.getSizing(), account);
        params.setSizing(sizing);
        Map<String, BigDecimal> holdings = positions.quantities();

        List<OrderIntent> intents;
        try {
            intents = params.hasExplicitOrders() ? explicitIntents(run, sizing) : targetIntents(run, sizing, holdings);
        } catch (PortfolioValueRequiredException e) {
            block(run, PortfolioValueRequiredException.REASON, now);
            return;
        } catch (OrdersEmptyException e) {
            run.transitionTo(RunStatus.DONE, OrdersEmptyException.REASON, now);
            auditEventService.recordEvent(run.getId(), "run", "ORDERS_EMPTY", "Portfolio already at target", null);
            return;
        }

        RiskGateDecision decision = riskGate.evaluate(RiskGateRequest.builder()
                .orders(intents)
                .holdings(holdings)
                .portfolioValue(sizing.getPortfolioValue())
                .cashAvailable(sizing.getCashAvailable())
                .bypass(params.isRiskBypass())
                .force(force)
                .build());
        params.setRisk(decision.snapshot());
        if (!decision.allowed()) {
            block(run, "risk_blocked", now);
            return;
        }
        List<String> unpriced = unpricedLimitOrders(intents);
        if (!unpriced.isEmpty()) {
            params.getProvenance().put("missing_price_symbols", unpriced);
            block(run, "missing_price", now);
            return;
        }

        List<TradeOrder> orders = persistOrders(run, intents);
        Path intentPath;
        try {
            intentPath = orderIntentFileService.writeIntents(run.getId(), intents);
            Path paramsPath = orderIntentFileService.writeExecutionParams(run.getId(), intentRequest(run, sizing, Map.of(), Map.of()));
            params.setOrderIntentPath(intentPath.toString());
            params.setExecutionParamsPath(paramsPath.toString());
        } catch (UncheckedIOException e) {
            fail(run, "intent_write_failed", e, now);
            return;
        }

        Optional<IntentOrderMismatch> mismatch = intentOrderMatcher.compare(intentPath, orders);
        if (mismatch.isPresent()) {
            params.setIntentOrderMismatch(mismatch.get());
            cancelAll(orders, "intent_order_mismatch", now);
            params.setCompletionSummary(runCompletionEvaluator.summarize(orders));
            run.transitionTo(RunStatus.FAILED, "intent_order_mismatch", now);
            log.error("Intent file does not match persisted orders runId={} missing={} extra={}", run.getId(),
                    mismatch.get().missingSymbols(), mismatch.get().extraSymbols());
            return;
        }

        run.transitionTo(RunStatus.RUNNING, "submitting", now);
        run.markProgress("submit", "orders_persisted", now);
        try {
            DispatchResult result = submissionDispatcher.submit(run, orders);
            run.setMessage(result.message());
            run.markProgress("submit", result.source().name().toLowerCase(Locale.ROOT), now);
            auditEventService.recordEvent(run.getId(), "run", "SUBMITTED", result.message(),
                    Map.of("orders", orders.size(), "source", result.source().name()));
        } catch (TradingException | UncheckedIOException e) {
            cancelAll(orders, "submit_failed", now);
            fail(run, errorCode(e), e, now);
        }
    }

    @Transactional
    public ReconcileResult refreshRun(Long runId) {
        return reconciliationEngine.reconcile(runId);
    }

    /**
     * Reconciles the run, then returns it with the orders of its current attempt.
     */
    public RunDetail getRunDetail(Long runId) {
        ReconcileResult result = reconciliationEngine.reconcile(runId);
        TradeRun run = getRun(runId);
        List<TradeOrder> orders = currentOrders(run);
        return new RunDetail(run, orders, runCompletionEvaluator.summarize(orders), result.changed());
    }

    @Transactional(readOnly = true)
    public TradeRun getRun(Long runId) {
        return tradeRunRepository.findById(runId)
                .orElseThrow(() -> new NotFoundException("Run not found: " + runId));
    }

    @Transactional(readOnly = true)
    public List<TradeRun> listRuns(Long projectId) {
        return projectId == null
                ? tradeRunRepository.findTop100ByOrderByIdDesc()
                : tradeRunRepository.findTop100ByProjectIdOrderByIdDesc(projectId);
    }

    @Transactional(readOnly = true)
    public List<TradeOrder> listOrders(Long runId) {
        getRun(runId);
        return tradeOrderRepository.findByRunIdOrderByIdAsc(runId);
    }

    /**
     * Per-symbol roll-up of the current attempt: target weight, signed requested and filled quantity,
     * quantity-weighted average fill price and the distinct order statuses.
     */
    @Transactional(readOnly = true)
    public List<SymbolSummaryRow> symbolSummary(Long runId) {
        TradeRun run = getRun(runId);
        Map<String, BigDecimal> weights = run.getParams().getTargetWeights() == null
                ? Map.of() : run.getParams().getTargetWeights();
        Map<String, List<TradeOrder>> bySymbol = new TreeMap<>();
        for (TradeOrder order : currentOrders(run)) {
            bySymbol.computeIfAbsent(order.getSymbol(), key -> new ArrayList<>()).add(order);
        }
        for (String symbol : weights.keySet()) {
            bySymbol.putIfAbsent(symbol, new ArrayList<>());
        }
        List<SymbolSummaryRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<TradeOrder>> entry : bySymbol.entrySet()) {
            BigDecimal requested = BigDecimal.ZERO;
            BigDecimal filled = BigDecimal.ZERO;
            BigDecimal filledAbs = BigDecimal.ZERO;
            BigDecimal notional = BigDecimal.ZERO;
            Set<String> statuses = new LinkedHashSet<>();
            for (TradeOrder order : entry.getValue()) {
                BigDecimal orderFilled = order.getFilledQuantity() == null ? BigDecimal.ZERO : order.getFilledQuantity();
                requested = requested.add(order.getSide().signed(order.getQuantity()));
                filled = filled.add(order.getSide().signed(orderFilled));
                if (order.getAvgFillPrice() != null && orderFilled.signum() > 0) {
                    filledAbs = filledAbs.add(orderFilled);
                    notional = notional.add(order.getAvgFillPrice().multiply(orderFilled));
                }
                statuses.add(order.getStatus().name());
            }
            rows.add(SymbolSummaryRow.builder()
                    .symbol(entry.getKey())
                    .targetWeight(weights.get(entry.getKey()))
                    .requestedQuantity(MoneyUtils.qty(requested))
                    .filledQuantity(MoneyUtils.qty(filled))
                    .avgFillPrice(filledAbs.signum() > 0
                            ? notional.divide(filledAbs, MoneyUtils.SCALE, RoundingMode.HALF_UP) : null)
                    .statuses(new ArrayList<>(statuses))
                    .build());
        }
        return rows;
    }

    @Transactional
    public TradeRun resumeRun(Long runId) {
        TradeRun run = lockRun(runId);
        if (run.getStatus() != RunStatus.STALLED) {
            throw new ConflictException("Run " + runId + " is not stalled (" + run.getStatus() + ")");
        }
        Instant now = Instant.now(clock);
        run.transitionTo(RunStatus.RUNNING, "manual_resume", now);
        run.markProgress("manual_resume", "operator", now);
        auditEventService.recordEvent(runId, "run", "RESUMED", "Stalled run resumed by operator", null);
        return tradeRunRepository.save(run);
    }

    /**
     * Cancels everything still open, asks the broker to cancel submitted orders and stops the run's
     * execution process.
     */
    @Transactional
    public TradeRun terminateRun(Long runId, String reason) {
        TradeRun run = lockRun(runId);
        if (run.isTerminal()) {
            throw new ConflictException("Run " + runId + " already finished (" + run.getStatus() + ")");
        }
        Instant now = Instant.now(clock);
        List<TradeOrder> orders = currentOrders(run);
        for (TradeOrder order : orders) {
            if (order.isTerminal()) {
                continue;
            }
            if (order.getStatus() != OrderStatus.NEW || order.getParams().hasPendingCommand()) {
                requestBrokerCancel(order);
            }
            orderStateMachine.transition(order, OrderStatus.CANCELED, "manual_terminate", now);
        }
        stopProcess(run, now);
        run.getParams().setCompletionSummary(runCompletionEvaluator.summarize(orders));
        if (reason != null && !reason.isBlank()) {
            run.getParams().getProvenance().put("terminate_reason", reason);
        }
        run.transitionTo(RunStatus.CANCELED, "manual_terminate", now);
        fallbackRateLimiter.release(runId);
        auditEventService.recordEvent(runId, "run", "TERMINATED", "Run terminated by operator",
                reason == null ? null : Map.of("reason", reason));
        return tradeRunRepository.save(run);
    }

    /**
     * Gives up on a run: open orders are cancelled locally and the run fails.
     */
    @Transactional
    public TradeRun forceClose(Long runId, String reason) {
        TradeRun run = lockRun(runId);
        if (run.isTerminal() || run.getStatus() == RunStatus.BLOCKED) {
            throw new ConflictException("Run " + runId + " cannot be force closed from " + run.getStatus());
        }
        Instant now = Instant.now(clock);
        List<TradeOrder> orders = currentOrders(run);
        cancelAll(orders, "force_close", now);
        stopProcess(run, now);
        run.getParams().setCompletionSummary(runCompletionEvaluator.summarize(orders));
        run.getParams().getProvenance().put("force_close_reason", reason == null ? "manual" : reason);
        run.transitionTo(RunStatus.FAILED, "force_closed", now);
        fallbackRateLimiter.release(runId);
        log.warn("Run force closed runId={} reason={}", runId, reason);
        auditEventService.recordEvent(runId, "run", "FORCE_CLOSED", "Run force closed",
                Map.of("reason", reason == null ? "manual" : reason));
        return tradeRunRepository.save(run);
    }

    private TradeRun lockRun(Long runId) {
        return tradeRunRepository.findByIdForUpdate(runId)
                .orElseThrow(() -> new NotFoundException("Run not found: " + runId));
    }

    private List<TradeOrder> currentOrders(TradeRun run) {
        int attempt = run.getParams().currentAttempt();
        return tradeOrderRepository.findByRunIdOrderByIdAsc(run.getId()).stream()
                .filter(order -> order.getParams().attemptOrDefault() == attempt)
                .collect(Collectors.toList());
    }

    private List<OrderIntent> targetIntents(TradeRun run, SizingConfig sizing, Map<String, BigDecimal> holdings) {
        Set<String> symbols = new TreeSet<>(run.getParams().getTargetWeights().keySet());
        symbols.addAll(holdings.keySet());
        Map<String, PriceSeed> prices = priceSeedService.resolve(symbols);
        List<OrderIntent> intents = orderIntentBuilder.build(intentRequest(run, sizing, holdings, prices));
        return rekeyForAttempt(run, intents);
    }

    private List<OrderIntent> explicitIntents(TradeRun run, SizingConfig sizing) {
        List<ExplicitOrder> explicit = run.getParams().getExplicitOrders();
        Set<String> symbols = explicit.stream().map(ExplicitOrder::symbol).collect(Collectors.toCollection(TreeSet::new));
        Map<String, PriceSeed> prices = priceSeedService.resolve(symbols);
        OrderType defaultType = defaultOrderType(sizing);
        List<OrderIntent> intents = new ArrayList<>(explicit.size());
        for (int i = 0; i < explicit.size(); i++) {
            ExplicitOrder order = explicit.get(i);
            OrderType type = order.orderType() == null ? defaultType : OrderType.parse(order.orderType());
            OrderSide side = OrderSide.fromString(order.side());
            PriceSeed seed = prices.get(order.symbol());
            BigDecimal limitPrice = order.limitPrice();
            if (limitPrice == null && type.isLimitLike() && seed != null) {
                BigDecimal quoted = type == OrderType.PEG_MID && seed.mid() != null ? seed.mid() : seed.priceFor(side);
                limitPrice = MoneyUtils.scale(quoted);
            }
            intents.add(new OrderIntent(
                    OrderIntentBuilder.intentId(run.getId(), i),
                    order.symbol(),
                    side,
                    order.quantity(),
                    BigDecimal.ZERO,
                    type,
                    limitPrice,
                    seed == null ? null : seed.reference(),
                    Boolean.TRUE.equals(sizing.getOutsideRth())));
        }
        return rekeyForAttempt(run, intents);
    }

    // Limit-like orders cannot be placed without a limit price, even when the risk limits are bypassed
    private static List<String> unpricedLimitOrders(List<OrderIntent> intents) {
        List<String> symbols = new ArrayList<>();
        for (OrderIntent intent : intents) {
            if (intent.orderType().isLimitLike() && !MoneyUtils.isPositive(intent.limitPrice())) {
                symbols.add(intent.symbol());
            }
        }
        return symbols;
    }

    private List<OrderIntent> rekeyForAttempt(TradeRun run, List<OrderIntent> intents) {
        int attempt = run.getParams().currentAttempt();
        if (attempt == 1) {
            return intents;
        }
        List<OrderIntent> rekeyed = new ArrayList<>(intents.size());
        for (int i = 0; i < intents.size(); i++) {
            rekeyed.add(intents.get(i).withIntentId("oi_" + run.getId() + "_a" + attempt + "_" + i));
        }
        return rekeyed;
    }

    private IntentRequest intentRequest(TradeRun run, SizingConfig sizing, Map<String, BigDecimal> holdings,
                                        Map<String, PriceSeed> prices) {
        return IntentRequest.builder()
                .runId(run.getId())
                .targetWeights(run.getParams().getTargetWeights())
                .holdings(holdings)
                .prices(prices)
                .portfolioValue(sizing.getPortfolioValue())
                .cashBufferRatio(sizing.getCashBufferRatio())
                .lotSize(sizing.getLotSize())
                .minQty(sizing.getMinQty())
                .orderType(defaultOrderType(sizing))
                .outsideRth(Boolean.TRUE.equals(sizing.getOutsideRth()))
                .build();
    }

    private List<TradeOrder> persistOrders(TradeRun run, List<OrderIntent> intents) {
        List<TradeOrder> orders = new ArrayList<>(intents.size());
        int attempt = run.getParams().currentAttempt();
        for (OrderIntent intent : intents) {
            OrderParams params = new OrderParams();
            params.setIntentId(intent.intentId());
            params.setBrokerOrderTag(intent.intentId());
            params.setPrimePrice(intent.primePrice());
            params.setWeight(intent.weight());
            params.setOutsideRth(intent.outsideRth());
            params.setAttempt(attempt == 1 ? null : attempt);
            TradeOrderService.CreateOrderResult result = tradeOrderService.createOrder(new CreateOrderCommand(
                    run.getId(),
                    intent.intentId(),
                    intent.symbol(),
                    intent.side().name(),
                    intent.quantity(),
                    intent.orderType().name(),
                    intent.limitPrice(),
                    params));
            orders.add(result.order());
        }
        log.info("Orders persisted runId={} count={}", run.getId(), orders.size());
        return orders;
    }

    private SizingConfig resolveSizing(SizingConfig requested, AccountSummary account) {
        SizingConfig base = requested == null ? new SizingConfig() : requested;
        ExecutionProperties.Sizing defaults = executionProperties.getSizing();
        return SizingConfig.builder()
                .portfolioValue(base.getPortfolioValue() != null ? base.getPortfolioValue() : account.netLiquidation())
                .cashAvailable(base.getCashAvailable() != null ? base.getCashAvailable() : account.cashAvailable())
                .cashBufferRatio(base.getCashBufferRatio() != null ? base.getCashBufferRatio() : defaults.getCashBufferRatio())
                .lotSize(base.getLotSize() != null ? base.getLotSize() : defaults.getLotSize())
                .minQty(base.getMinQty() != null ? base.getMinQty() : defaults.getMinQty())
                .orderType(base.getOrderType() != null ? base.getOrderType() : executionProperties.getDefaultOrderType())
                .outsideRth(base.getOutsideRth())
                .build();
    }

    private OrderType defaultOrderType(SizingConfig sizing) {
        OrderType type = OrderType.parse(sizing.getOrderType());
        return type == null ? OrderType.MKT : type;
    }

    private void block(TradeRun run, String reason, Instant now) {
        run.transitionTo(RunStatus.BLOCKED, reason, now);
        tradeMetrics.recordRunBlocked();
        log.warn("Run blocked runId={} reason={}", run.getId(), reason);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("reason", reason);
        if (run.getParams().getRisk() != null) {
            metadata.put("riskReasons", run.getParams().getRisk().reasons());
        }
        auditEventService.recordEvent(run.getId(), "run", "BLOCKED", "Run blocked before submission", metadata);
    }

    private void fail(TradeRun run, String code, Exception cause, Instant now) {
        run.getParams().setRuntimeError(cause.getMessage());
        run.transitionTo(RunStatus.FAILED, "execution_error:" + code, now);
        log.error("Run execution failed runId={} code={}", run.getId(), code, cause);
        auditEventService.recordEvent(run.getId(), "run", "EXECUTION_ERROR", "Run execution failed",
                Map.of("code", code, "error", String.valueOf(cause.getMessage())));
    }

    private void cancelAll(List<TradeOrder> orders, String reason, Instant now) {
        for (TradeOrder order : orders) {
            if (!order.isTerminal()) {
                orderStateMachine.transition(order, OrderStatus.CANCELED, reason, now);
            }
        }
    }

    private void requestBrokerCancel(TradeOrder order) {
        try {
            bridgeCommandWriter.writeCancelCommand(order.getId(), order.tag(), order.getBrokerOrderId(), "manual_terminate");
        } catch (BridgeIoException e) {
            log.warn("Cancel command not written clientOrderId={} error={}", order.getClientOrderId(), e.getMessage());
            auditEventService.recordEvent(order.getRunId(), "order", "CANCEL_COMMAND_FAILED",
                    "Cancel command could not be written", Map.of("clientOrderId", order.getClientOrderId()));
        }
    }

    private void stopProcess(TradeRun run, Instant now) {
        SubmissionMetadata submission = run.getParams().getSubmission();
        if (submission == null || submission.getSource() == null || !submission.getSource().isShortLived()) {
            return;
        }
        String outcome = processLifecycleManager.terminateIfRunning(run.getId(), submission.getPid(),
                bridgeReader.readStatus().pid());
        submission.setTerminationOutcome(outcome);
        submission.setTerminationAt(now);
    }

    private static String errorCode(Exception e) {
        String message = e.getMessage() == null ? "unknown" : e.getMessage();
        int colon = message.indexOf(':');
        return colon > 0 ? message.substring(0, colon) : message;
    }

    private static Map<String, BigDecimal> normalizeWeights(Map<String, BigDecimal> weights) {
        Map<String, BigDecimal> normalized = new LinkedHashMap<>();
        if (weights == null) {
            return normalized;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : weights.entrySet()) {
            String symbol = entry.getKey() == null ? "" : entry.getKey().trim().toUpperCase(Locale.ROOT);
            if (symbol.isEmpty() || entry.getValue() == null) {
                throw new BadRequestException("Invalid target weight entry: " + entry.getKey());
            }
            if (entry.getValue().signum() < 0) {
                throw new BadRequestException("Target weight must not be negative: " + symbol);
            }
            normalized.merge(symbol, entry.getValue(), BigDecimal::add);
            sum = sum.add(entry.getValue());
        }
        if (sum.compareTo(WEIGHT_SUM_TOLERANCE) > 0) {
            throw new BadRequestException("Target weights sum to more than 1: " + sum);
        }
        return normalized;
    }

    private static List<ExplicitOrder> normalizeOrders(List<CreateRunRequest.OrderLine> lines) {
        List<ExplicitOrder> orders = new ArrayList<>();
        if (lines == null) {
            return orders;
        }
        for (CreateRunRequest.OrderLine line : lines) {
            OrderSide side = OrderSide.fromString(line.getSide());
            if (side == null) {
                throw new BadRequestException("Unsupported side: " + line.getSide());
            }
            OrderType type = line.getOrderType() == null ? null : OrderType.parse(line.getOrderType());
            if (line.getOrderType() != null && type == null) {
                throw new BadRequestException("Unsupported order type: " + line.getOrderType());
            }
            if (type != null && type.isLimitLike() && !MoneyUtils.isPositive(line.getLimitPrice())) {
                throw new BadRequestException("limit_price is required for " + type);
            }
            orders.add(new ExplicitOrder(line.getSymbol().trim().toUpperCase(Locale.ROOT), side.name(),
                    line.getQuantity(), type == null ? null : type.name(), line.getLimitPrice()));
        }
        return orders;
    }
}
