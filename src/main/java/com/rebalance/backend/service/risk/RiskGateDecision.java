package com.rebalance.backend.service.risk;

import com.rebalance.backend.model.params.RiskSnapshot;

import java.util.List;

public record RiskGateDecision(boolean allowed, List<String> reasons, RiskSnapshot snapshot) {
}
