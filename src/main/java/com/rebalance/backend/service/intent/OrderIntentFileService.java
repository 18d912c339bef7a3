package com.rebalance.backend.service.intent;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebalance.backend.config.ExecutionProperties;
import com.rebalance.backend.service.bridge.BridgeFiles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Files handed to the execution process: the order intent list, the execution parameters and the
 * per-run launcher config.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderIntentFileService {

    static final String INTENTS_DIR = "order_intents";
    static final String EXECUTION_DIR = "lean_execution";

    private final ExecutionProperties executionProperties;
    private final BridgeFiles bridgeFiles;

    public Path intentPath(Long runId) {
        return executionProperties.artifactsPath().resolve(INTENTS_DIR).resolve("order_intent_run_" + runId + ".json");
    }

    public Path fallbackIntentPath(Long runId) {
        return executionProperties.artifactsPath().resolve(INTENTS_DIR).resolve("order_intent_run_" + runId + "_fallback.json");
    }

    public Path executionParamsPath(Long runId) {
        return executionProperties.artifactsPath().resolve(EXECUTION_DIR).resolve("execution_params_run_" + runId + ".json");
    }

    public Path runConfigPath(Long runId) {
        return executionProperties.artifactsPath().resolve(EXECUTION_DIR).resolve("trade_run_" + runId + ".json");
    }

    public Path runOutputDir(Long runId) {
        return executionProperties.artifactsPath().resolve(EXECUTION_DIR).resolve("run_" + runId);
    }

    public Path writeIntents(Long runId, List<OrderIntent> intents) {
        return writeIntents(runId, intentPath(runId), intents);
    }

    public Path writeIntents(Long runId, Path path, List<OrderIntent> intents) {
        List<Map<String, Object>> items = new ArrayList<>(intents.size());
        for (OrderIntent intent : intents) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("order_intent_id", intent.intentId());
            item.put("symbol", intent.symbol());
            item.put("quantity", intent.signedQuantity());
            item.put("weight", intent.weight());
            item.put("order_type", intent.orderType().name());
            item.put("limit_price", intent.limitPrice());
            item.put("prime_price", intent.primePrice());
            item.put("outside_rth", intent.outsideRth());
            item.put("session", intent.outsideRth() ? "extended" : "regular");
            items.add(item);
        }
        bridgeFiles.writeJsonAtomic(path, items);
        log.info("Order intent file written runId={} items={} path={}", runId, items.size(), path);
        return path;
    }

    public Path writeExecutionParams(Long runId, IntentRequest request) {
        ExecutionProperties.UnfilledOrders unfilled = executionProperties.getUnfilled();
        ExecutionProperties.Costs costs = executionProperties.getCosts();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("run_id", runId);
        params.put("lot_size", request.lotSize());
        params.put("min_qty", request.minQty());
        params.put("cash_buffer_ratio", request.cashBufferRatio());
        params.put("fee_bps", costs.getFeeBps());
        params.put("slippage_bps", costs.getSlippageBps());
        params.put("unfilled_timeout_seconds", unfilled.getTimeoutSeconds());
        params.put("unfilled_max_reprices", unfilled.getMaxReprices());
        params.put("unfilled_reprice_step_bps", unfilled.getRepriceStepBps());
        Path path = executionParamsPath(runId);
        bridgeFiles.writeJsonAtomic(path, params);
        return path;
    }

    public Path writeRunConfig(Long runId, Path intentPath, Path paramsPath, Path outputDir) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("run_id", runId);
        config.put("order_intent_path", intentPath.toAbsolutePath().toString());
        config.put("execution_params_path", paramsPath.toAbsolutePath().toString());
        config.put("output_dir", outputDir.toAbsolutePath().toString());
        config.put("exit_after_submit", executionProperties.isExitAfterSubmit());
        Path path = runConfigPath(runId);
        bridgeFiles.writeJsonAtomic(path, config);
        return path;
    }

    /**
     * Symbols listed in an intent file, or empty when the file cannot be read.
     */
    public Optional<Set<String>> readIntentSymbols(Path path) {
        Optional<JsonNode> json = bridgeFiles.readJson(path);
        if (json.isEmpty() || !json.get().isArray()) {
            return Optional.empty();
        }
        Set<String> symbols = new TreeSet<>();
        for (JsonNode item : json.get()) {
            String symbol = item.path("symbol").asText("").trim();
            if (!symbol.isEmpty()) {
                symbols.add(symbol.toUpperCase(Locale.ROOT));
            }
        }
        return Optional.of(symbols);
    }
}
