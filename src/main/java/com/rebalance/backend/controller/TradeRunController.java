package com.rebalance.backend.controller;

import com.rebalance.backend.dto.CreateRunRequest;
import com.rebalance.backend.dto.ExecuteRunRequest;
import com.rebalance.backend.dto.OrderResponse;
import com.rebalance.backend.dto.RefreshResponse;
import com.rebalance.backend.dto.RunDetailResponse;
import com.rebalance.backend.dto.RunResponse;
import com.rebalance.backend.dto.SymbolSummaryRow;
import com.rebalance.backend.dto.TerminateRunRequest;
import com.rebalance.backend.service.TradeRunService;
import com.rebalance.backend.service.TradeRunService.CreateRunResult;
import com.rebalance.backend.service.TradeRunService.RunDetail;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/trade/runs")
@RequiredArgsConstructor
@Tag(name = "Trade runs")
public class TradeRunController {

    private final TradeRunService tradeRunService;

    @PostMapping
    @Operation(summary = "Create a rebalance run")
    @ApiResponse(responseCode = "201", description = "Run created")
    @ApiResponse(responseCode = "200", description = "Active run for the same snapshot returned")
    public ResponseEntity<RunResponse> create(@Valid @RequestBody CreateRunRequest request) {
        CreateRunResult result = tradeRunService.createRun(request);
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(RunResponse.from(result.run()));
    }

    @GetMapping
    @Operation(summary = "List recent runs")
    public ResponseEntity<List<RunResponse>> list(@RequestParam(value = "projectId", required = false) Long projectId) {
        return ResponseEntity.ok(tradeRunService.listRuns(projectId).stream().map(RunResponse::from).toList());
    }

    @GetMapping("/{runId}")
    @Operation(summary = "Reconcile and return a run with its orders")
    public ResponseEntity<RunDetailResponse> get(@PathVariable Long runId) {
        RunDetail detail = tradeRunService.getRunDetail(runId);
        return ResponseEntity.ok(RunDetailResponse.builder()
                .run(RunResponse.from(detail.run()))
                .orders(detail.orders().stream().map(OrderResponse::from).toList())
                .summary(detail.summary())
                .reconciled(detail.reconciled())
                .build());
    }

    @PostMapping("/{runId}/execute")
    @Operation(summary = "Size, risk check and submit a queued run")
    public ResponseEntity<RunResponse> execute(@PathVariable Long runId,
                                               @RequestBody(required = false) ExecuteRunRequest request) {
        boolean force = request != null && request.isForce();
        return ResponseEntity.ok(RunResponse.from(tradeRunService.executeRun(runId, force)));
    }

    @PostMapping("/{runId}/refresh")
    @Operation(summary = "Run one reconciliation pass")
    public ResponseEntity<RefreshResponse> refresh(@PathVariable Long runId) {
        return ResponseEntity.ok(RefreshResponse.from(tradeRunService.refreshRun(runId)));
    }

    @GetMapping("/{runId}/orders")
    @Operation(summary = "List all orders of a run")
    public ResponseEntity<List<OrderResponse>> orders(@PathVariable Long runId) {
        return ResponseEntity.ok(tradeRunService.listOrders(runId).stream().map(OrderResponse::from).toList());
    }

    @GetMapping("/{runId}/symbols")
    @Operation(summary = "Per-symbol summary of the current attempt")
    public ResponseEntity<List<SymbolSummaryRow>> symbols(@PathVariable Long runId) {
        return ResponseEntity.ok(tradeRunService.symbolSummary(runId));
    }

    @PostMapping("/{runId}/resume")
    @Operation(summary = "Resume a stalled run")
    public ResponseEntity<RunResponse> resume(@PathVariable Long runId) {
        return ResponseEntity.ok(RunResponse.from(tradeRunService.resumeRun(runId)));
    }

    @PostMapping("/{runId}/terminate")
    @Operation(summary = "Cancel open orders and stop the run")
    public ResponseEntity<RunResponse> terminate(@PathVariable Long runId,
                                                 @Valid @RequestBody(required = false) TerminateRunRequest request) {
        String reason = request == null ? null : request.getReason();
        return ResponseEntity.ok(RunResponse.from(tradeRunService.terminateRun(runId, reason)));
    }

    @PostMapping("/{runId}/force-close")
    @Operation(summary = "Fail a run that cannot finish on its own")
    public ResponseEntity<RunResponse> forceClose(@PathVariable Long runId,
                                                  @Valid @RequestBody(required = false) TerminateRunRequest request) {
        String reason = request == null ? null : request.getReason();
        return ResponseEntity.ok(RunResponse.from(tradeRunService.forceClose(runId, reason)));
    }
}
