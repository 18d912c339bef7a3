package com.rebalance.backend.model.params;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuntimeFallback {
    private boolean triggered;
    private Instant triggeredAt;
    private String reason;
    private List<String> clearedPendingOrders;
    private Instant autoResumedAt;
}
