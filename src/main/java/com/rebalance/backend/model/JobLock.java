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
@Table(name = "job_locks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobLock {

    @Id
    @Column(name = "lock_key", length = 64)
    private String lockKey;

    @Column(nullable = false, length = 128)
    private String owner;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "heartbeat_at", nullable = false)
    private Instant heartbeatAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;
}
