package com.rebalance.backend.dto;

import com.rebalance.backend.model.params.CompletionSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunDetailResponse {
    private RunResponse run;
    private List<OrderResponse> orders;
    private CompletionSummary summary;
    private boolean reconciled;
}
