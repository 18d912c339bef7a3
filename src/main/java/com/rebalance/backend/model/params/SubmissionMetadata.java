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
public class SubmissionMetadata {
    private SubmissionSource source;
    private Long pid;
    private String outputDir;
    private String configPath;
    private Instant submittedAt;
    private Instant launchedAt;
    private Integer commandCount;
    private String terminationOutcome;
    private Instant terminationAt;
}
