package com.rebalance.backend.service.risk;

import com.rebalance.backend.model.SystemGuardState;
import com.rebalance.backend.repository.SystemGuardStateRepository;
import com.rebalance.backend.service.AuditEventService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class SystemGuardService implements RiskHaltGuard {

    private static final long SINGLETON_ID = 1L;

    private final SystemGuardStateRepository systemGuardStateRepository;
    private final AuditEventService auditEventService;
    private final Clock clock;

    @Transactional
    public SystemGuardState getState() {
        return systemGuardStateRepository.findById(SINGLETON_ID)
                .orElseGet(() -> systemGuardStateRepository.save(SystemGuardState.builder()
                        .id(SINGLETON_ID)
                        .halted(false)
                        .updatedAt(Instant.now(clock))
                        .build()));
    }

    @Transactional
    public SystemGuardState halt(String reason) {
        SystemGuardState state = getState();
        Instant now = Instant.now(clock);
        state.setHalted(true);
        state.setHaltReason(reason == null || reason.isBlank() ? "manual" : reason);
        state.setHaltedAt(now);
        state.setUpdatedAt(now);
        log.warn("Trading halted reason={}", state.getHaltReason());
        auditEventService.recordEvent(null, "risk_halt", "HALT", "Trading halted", Map.of("reason", state.getHaltReason()));
        return systemGuardStateRepository.save(state);
    }

    @Transactional
    public SystemGuardState clear() {
        SystemGuardState state = getState();
        state.setHalted(false);
        state.setHaltReason(null);
        state.setHaltedAt(null);
        state.setUpdatedAt(Instant.now(clock));
        log.info("Trading halt cleared");
        auditEventService.recordEvent(null, "risk_halt", "CLEAR", "Trading halt cleared", null);
        return systemGuardStateRepository.save(state);
    }

    @Override
    @Transactional
    public HaltStatus currentStatus() {
        SystemGuardState state = getState();
        return state.isHalted() ? new HaltStatus(true, state.getHaltReason()) : HaltStatus.clear();
    }
}
