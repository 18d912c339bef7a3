package com.rebalance.backend.controller;

import com.rebalance.backend.dto.CreateOrderRequest;
import com.rebalance.backend.dto.OrderResponse;
import com.rebalance.backend.service.DirectOrderService;
import com.rebalance.backend.service.TradeOrderService;
import com.rebalance.backend.service.TradeOrderService.CreateOrderCommand;
import com.rebalance.backend.service.TradeOrderService.CreateOrderResult;
import com.rebalance.backend.service.reconcile.FreeStandingSweep;
import io.swagger.v3.oas.annotations.Operation;
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
@RequestMapping("/api/trade/orders")
@RequiredArgsConstructor
@Tag(name = "Trade orders")
public class TradeOrderController {

    private final TradeOrderService tradeOrderService;
    private final DirectOrderService directOrderService;

    @PostMapping
    @Operation(summary = "Create an order, idempotent on client order id")
    public ResponseEntity<OrderResponse> create(@Valid @RequestBody CreateOrderRequest request) {
        CreateOrderResult result = tradeOrderService.createOrder(toCommand(request));
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(OrderResponse.from(result.order()));
    }

    @PostMapping("/direct")
    @Operation(summary = "Create a free-standing order and send it through the leader session")
    public ResponseEntity<OrderResponse> direct(@Valid @RequestBody CreateOrderRequest request) {
        return ResponseEntity.ok(OrderResponse.from(directOrderService.createAndSubmit(toCommand(request))));
    }

    @GetMapping
    @Operation(summary = "List the most recent orders")
    public ResponseEntity<List<OrderResponse>> list(@RequestParam(value = "status", required = false) String status) {
        return ResponseEntity.ok(directOrderService.listOrders(status).stream().map(OrderResponse::from).toList());
    }

    @GetMapping("/{orderId}")
    @Operation(summary = "Get an order, reconciling it first when it belongs to no run")
    public ResponseEntity<OrderResponse> get(@PathVariable Long orderId) {
        return ResponseEntity.ok(OrderResponse.from(directOrderService.getOrder(orderId)));
    }

    @PostMapping("/{orderId}/submit")
    @Operation(summary = "Submit a new free-standing order")
    public ResponseEntity<OrderResponse> submit(@PathVariable Long orderId) {
        return ResponseEntity.ok(OrderResponse.from(directOrderService.submit(orderId)));
    }

    @PostMapping("/{orderId}/cancel")
    @Operation(summary = "Cancel an order")
    public ResponseEntity<OrderResponse> cancel(@PathVariable Long orderId) {
        return ResponseEntity.ok(OrderResponse.from(directOrderService.cancel(orderId)));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Reconcile all orders that belong to no run")
    public ResponseEntity<FreeStandingSweep> refresh() {
        return ResponseEntity.ok(directOrderService.refresh());
    }

    private static CreateOrderCommand toCommand(CreateOrderRequest request) {
        return new CreateOrderCommand(
                request.getRunId(),
                request.getClientOrderId(),
                request.getSymbol(),
                request.getSide(),
                request.getQuantity(),
                request.getOrderType(),
                request.getLimitPrice(),
                null);
    }
}
