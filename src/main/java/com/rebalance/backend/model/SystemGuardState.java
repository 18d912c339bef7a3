package com.rebalance.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "system_guard_state")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemGuardState {

    @Id
    private Long id;

    @Column(nullable = false)
    private boolean halted;

    @Column(name = "halt_reason", length = 255)
    private String haltReason;

    @Column(name = "halted_at")
    private Instant haltedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
