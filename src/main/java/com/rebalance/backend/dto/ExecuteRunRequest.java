package com.rebalance.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteRunRequest {
    // Re-executes a BLOCKED or FAILED run and ignores an active trading halt
    private boolean force;
}
