package com.rebalance.backend.repository;

import com.rebalance.backend.model.RunStatus;
import com.rebalance.backend.model.TradeMode;
import com.rebalance.backend.model.TradeRun;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TradeRunRepository extends JpaRepository<TradeRun, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from TradeRun r where r.id = :id")
    Optional<TradeRun> findByIdForUpdate(@Param("id") Long id);

    List<TradeRun> findByStatusInOrderByIdAsc(Collection<RunStatus> statuses);

    List<TradeRun> findTop100ByProjectIdOrderByIdDesc(Long projectId);

    List<TradeRun> findTop100ByOrderByIdDesc();

    List<TradeRun> findByProjectIdAndModeAndStatusInAndCreatedAtGreaterThanEqualOrderByIdDesc(
            Long projectId, TradeMode mode, Collection<RunStatus> statuses, Instant createdFrom);
}
