package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.TradeRun;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state shared by the steps of one pass over one run, or over the free-standing orders when no run
 * owns them.
 */
final class ReconcilePass {

    private final TradeRun run;
    private final Map<String, Long> eventLogOffsets;
    private final List<TradeOrder> orders;
    private final ReconcilePassConfig config;
    private final List<String> actions = new ArrayList<>();
    private final Path outputDir;
    private final boolean executorActive;
    private Set<String> visibleOpenOrderTags = Set.of();
    private boolean changed;

    ReconcilePass(TradeRun run, List<TradeOrder> orders, ReconcilePassConfig config, Path outputDir,
                  boolean executorActive) {
        this(run, orders, config, outputDir, executorActive, runOffsets(run));
    }

    private ReconcilePass(TradeRun run, List<TradeOrder> orders, ReconcilePassConfig config, Path outputDir,
                          boolean executorActive, Map<String, Long> eventLogOffsets) {
        this.run = run;
        this.orders = orders;
        this.config = config;
        this.outputDir = outputDir;
        this.executorActive = executorActive;
        this.eventLogOffsets = eventLogOffsets;
    }

    /**
     * @param leaderActive whether the leader session that received the orders' commands is healthy
     * @param offsets      event log offsets the pass reads from and advances
     */
    static ReconcilePass freeStanding(List<TradeOrder> orders, ReconcilePassConfig config, boolean leaderActive,
                                      Map<String, Long> offsets) {
        return new ReconcilePass(null, orders, config, null, leaderActive, offsets);
    }

    private static Map<String, Long> runOffsets(TradeRun run) {
        if (run.getParams().getEventLogOffsets() == null) {
            run.getParams().setEventLogOffsets(new LinkedHashMap<>());
        }
        return run.getParams().getEventLogOffsets();
    }

    /**
     * @return the run, or null for a pass over free-standing orders
     */
    TradeRun run() {
        return run;
    }

    boolean freeStanding() {
        return run == null;
    }

    Map<String, Long> eventLogOffsets() {
        return eventLogOffsets;
    }

    List<TradeOrder> orders() {
        return orders;
    }

    ReconcilePassConfig config() {
        return config;
    }

    Path outputDir() {
        return outputDir;
    }

    boolean executorActive() {
        return executorActive;
    }

    Set<String> visibleOpenOrderTags() {
        return visibleOpenOrderTags;
    }

    void setVisibleOpenOrderTags(Set<String> tags) {
        this.visibleOpenOrderTags = tags;
    }

    boolean changed() {
        return changed;
    }

    List<String> actions() {
        return actions;
    }

    Map<String, TradeOrder> ordersByTag() {
        Map<String, TradeOrder> byTag = new HashMap<>();
        for (TradeOrder order : orders) {
            byTag.put(order.tag(), order);
            byTag.putIfAbsent(order.getClientOrderId(), order);
        }
        return byTag;
    }

    /**
     * Whether new evidence may still change the order: non-terminal orders always, low-confidence terminal
     * orders only within the reopen grace.
     */
    boolean acceptsEvidence(TradeOrder order) {
        if (!order.isTerminal()) {
            return true;
        }
        if (!order.isLowConfidence()) {
            return false;
        }
        if (order.getParams().getEventTime() == null) {
            return true;
        }
        Duration since = Duration.between(order.getParams().getEventTime(), config.now());
        return since.compareTo(config.lowConfidenceReopenGrace()) <= 0;
    }

    /**
     * Records that the pass wrote something and moves the run's progress marker.
     */
    void progress(String stage, String reason) {
        if (run != null) {
            run.markProgress(stage, reason, config.now());
        }
        changed = true;
        actions.add(stage + ":" + reason);
    }

    void markChanged(String action) {
        changed = true;
        actions.add(action);
    }
}
