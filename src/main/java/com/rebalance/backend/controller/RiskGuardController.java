package com.rebalance.backend.controller;

import com.rebalance.backend.dto.GuardStateResponse;
import com.rebalance.backend.dto.HaltRequest;
import com.rebalance.backend.service.risk.SystemGuardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/trade/guard")
@RequiredArgsConstructor
@Tag(name = "Risk guard")
public class RiskGuardController {

    private final SystemGuardService systemGuardService;

    @GetMapping("/state")
    @Operation(summary = "Current trading halt state")
    public ResponseEntity<GuardStateResponse> getState() {
        return ResponseEntity.ok(GuardStateResponse.from(systemGuardService.getState()));
    }

    @PostMapping("/halt")
    @Operation(summary = "Halt new submissions")
    public ResponseEntity<GuardStateResponse> halt(@Valid @RequestBody HaltRequest request) {
        return ResponseEntity.ok(GuardStateResponse.from(systemGuardService.halt(request.getReason())));
    }

    @PostMapping("/clear")
    @Operation(summary = "Clear the trading halt")
    public ResponseEntity<GuardStateResponse> clear() {
        return ResponseEntity.ok(GuardStateResponse.from(systemGuardService.clear()));
    }
}
