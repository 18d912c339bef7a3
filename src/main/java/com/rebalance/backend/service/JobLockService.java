package com.rebalance.backend.service;

import com.rebalance.backend.model.JobLock;
import com.rebalance.backend.repository.JobLockRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Named advisory locks on shared broker-session resources. A lease that outlives its TTL is treated as
 * abandoned and may be taken over.
 */
@Service
@Slf4j
public class JobLockService {

    public static final String TRADE_EXECUTION = "trade_execution";

    private final JobLockRepository jobLockRepository;
    private final TransactionTemplate requiresNew;
    private final Clock clock;
    private final Duration ttl;

    public JobLockService(JobLockRepository jobLockRepository,
                          PlatformTransactionManager transactionManager,
                          Clock clock,
                          @Value("${job-lock.ttl-seconds:900}") long ttlSeconds) {
        this.jobLockRepository = jobLockRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    public Optional<Lease> tryAcquire(String lockKey, String purpose) {
        String owner = ownerId(purpose);
        Instant now = Instant.now(clock);
        Instant expiresAt = now.plus(ttl);
        boolean acquired;
        try {
            acquired = Boolean.TRUE.equals(requiresNew.execute(status -> {
                if (jobLockRepository.findById(lockKey).isEmpty()) {
                    jobLockRepository.saveAndFlush(JobLock.builder()
                            .lockKey(lockKey)
                            .owner(owner)
                            .acquiredAt(now)
                            .heartbeatAt(now)
                            .expiresAt(expiresAt)
                            .build());
                    return true;
                }
                return jobLockRepository.takeOver(lockKey, owner, now, expiresAt) == 1;
            }));
        } catch (DataIntegrityViolationException e) {
            acquired = false;
        }
        if (!acquired) {
            log.info("Job lock busy lockKey={} purpose={}", lockKey, purpose);
            return Optional.empty();
        }
        log.debug("Job lock acquired lockKey={} owner={}", lockKey, owner);
        return Optional.of(new Lease(lockKey, owner));
    }

    public boolean heartbeat(Lease lease) {
        Instant now = Instant.now(clock);
        Integer updated = requiresNew.execute(status ->
                jobLockRepository.heartbeat(lease.lockKey(), lease.owner(), now, now.plus(ttl)));
        return updated != null && updated == 1;
    }

    public void release(Lease lease) {
        Integer removed = requiresNew.execute(status -> jobLockRepository.release(lease.lockKey(), lease.owner()));
        if (removed == null || removed == 0) {
            log.warn("Job lock already gone lockKey={} owner={}", lease.lockKey(), lease.owner());
        }
    }

    private String ownerId(String purpose) {
        return purpose + "@" + ManagementFactory.getRuntimeMXBean().getName() + ":" + UUID.randomUUID().toString().substring(0, 8);
    }

    public final class Lease implements AutoCloseable {
        private final String lockKey;
        private final String owner;

        private Lease(String lockKey, String owner) {
            this.lockKey = lockKey;
            this.owner = owner;
        }

        public String lockKey() {
            return lockKey;
        }

        public String owner() {
            return owner;
        }

        @Override
        public void close() {
            release(this);
        }
    }
}
