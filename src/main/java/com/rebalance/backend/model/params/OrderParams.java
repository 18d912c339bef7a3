package com.rebalance.backend.model.params;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Order parameter bag. The event fields record where the last status update came from.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderParams {

    private String intentId;

    private String brokerOrderTag;

    private String eventSource;

    private String eventTag;

    private Instant eventTime;

    private String eventStatus;

    private String syncReason;

    private SubmitCommandState submitCommand;

    private Instant openOrdersMissingSince;

    private BigDecimal baselineQuantity;

    private Boolean alreadyHeld;

    private BigDecimal primePrice;

    private BigDecimal weight;

    private Boolean outsideRth;

    private Integer attempt;

    // Filled quantity deduced from holdings and not yet confirmed by a broker execution
    private BigDecimal inferredFilledQuantity;

    // Event log read position of a free-standing order, keyed by absolute path
    private Map<String, Long> eventLogOffsets;

    private Map<String, Object> provenance = new LinkedHashMap<>();

    public void recordEvent(String source, String tag, String status, String reason, Instant at) {
        this.eventSource = source;
        this.eventTag = tag;
        this.eventStatus = status;
        this.syncReason = reason;
        this.eventTime = at;
    }

    public int attemptOrDefault() {
        return attempt == null ? 1 : attempt;
    }

    public BigDecimal inferredFilledOrZero() {
        return inferredFilledQuantity == null ? BigDecimal.ZERO : inferredFilledQuantity;
    }

    public boolean hasPendingCommand() {
        return submitCommand != null && submitCommand.isPending();
    }
}
