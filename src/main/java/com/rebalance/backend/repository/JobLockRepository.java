package com.rebalance.backend.repository;

import com.rebalance.backend.model.JobLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface JobLockRepository extends JpaRepository<JobLock, String> {

    @Modifying
    @Query("update JobLock l set l.owner = :owner, l.acquiredAt = :now, l.heartbeatAt = :now, l.expiresAt = :expiresAt "
            + "where l.lockKey = :lockKey and (l.expiresAt < :now or l.owner = :owner)")
    int takeOver(@Param("lockKey") String lockKey, @Param("owner") String owner,
                 @Param("now") Instant now, @Param("expiresAt") Instant expiresAt);

    @Modifying
    @Query("update JobLock l set l.heartbeatAt = :now, l.expiresAt = :expiresAt "
            + "where l.lockKey = :lockKey and l.owner = :owner")
    int heartbeat(@Param("lockKey") String lockKey, @Param("owner") String owner,
                  @Param("now") Instant now, @Param("expiresAt") Instant expiresAt);

    @Modifying
    @Query("delete from JobLock l where l.lockKey = :lockKey and l.owner = :owner")
    int release(@Param("lockKey") String lockKey, @Param("owner") String owner);
}
