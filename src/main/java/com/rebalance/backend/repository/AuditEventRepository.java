package com.rebalance.backend.repository;

import com.rebalance.backend.model.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {

    List<AuditEvent> findByRunIdOrderByIdAsc(Long runId);
}
