package com.rebalance.backend.model.params;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubmitCommandState {

    public static final String STATUS_SUPERSEDED = "superseded";

    private boolean pending;
    private String commandId;
    private Instant requestedAt;
    private String source;
    private String status;
    private String supersededBy;
    private Instant processedAt;

    public boolean isSuperseded() {
        return STATUS_SUPERSEDED.equals(status);
    }
}
