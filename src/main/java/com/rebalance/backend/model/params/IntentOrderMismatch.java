package com.rebalance.backend.model.params;

import java.util.List;

public record IntentOrderMismatch(List<String> missingSymbols, List<String> extraSymbols) {
}
