package com.rebalance.backend.model.params;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameter bag of a trade run, one typed section per concern. {@link #provenance} is the only
 * free-form part and carries diagnostics that nothing reads back.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunParams {

    private Map<String, BigDecimal> targetWeights = new LinkedHashMap<>();

    private List<ExplicitOrder> explicitOrders = new ArrayList<>();

    private SizingConfig sizing;

    private boolean riskBypass;

    private String orderIntentPath;

    private String executionParamsPath;

    private SubmissionMetadata submission;

    private LeaderSubmitFallback leaderSubmitFallback;

    private RuntimeFallback runtimeFallback;

    private RiskSnapshot risk;

    private CompletionSummary completionSummary;

    private PositionsBaseline positionsBaseline;

    private List<String> alreadyHeldSymbols;

    private IntentOrderMismatch intentOrderMismatch;

    private String runtimeError;

    private Long stallDeadlineMinutes;

    // Incremented by each forced re-execution; orders of earlier attempts no longer count
    private Integer attempt;

    // Byte offset already consumed per execution event log, keyed by absolute path
    private Map<String, Long> eventLogOffsets = new LinkedHashMap<>();

    private Map<String, Object> provenance = new LinkedHashMap<>();

    public int currentAttempt() {
        return attempt == null ? 1 : attempt;
    }

    public boolean hasExplicitOrders() {
        return explicitOrders != null && !explicitOrders.isEmpty();
    }
}
