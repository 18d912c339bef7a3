package com.rebalance.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebalance.backend.model.AuditEvent;
import com.rebalance.backend.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void recordEvent(Long runId, String eventType, String action, String description, Object metadata) {
        try {
            String payload = metadata == null ? null : objectMapper.writeValueAsString(metadata);
            AuditEvent event = AuditEvent.builder()
                    .runId(runId)
                    .eventType(eventType)
                    .action(action)
                    .description(truncate(description))
                    .metadata(payload)
                    .correlationId(MDC.get("correlationId"))
                    .createdAt(Instant.now(clock))
                    .build();
            auditEventRepository.save(event);
        } catch (Exception e) {
            log.warn("Failed to record audit event {}:{} runId={} - {}", eventType, action, runId, e.getMessage());
        }
    }

    private String truncate(String description) {
        if (description == null || description.length() <= 512) {
            return description;
        }
        return description.substring(0, 512);
    }
}
