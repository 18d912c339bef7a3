package com.rebalance.backend.repository;

import com.rebalance.backend.model.SystemGuardState;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SystemGuardStateRepository extends JpaRepository<SystemGuardState, Long> {
}
