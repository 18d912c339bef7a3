package com.rebalance.backend.repository;

import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.TradeOrder;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TradeOrderRepository extends JpaRepository<TradeOrder, Long> {

    Optional<TradeOrder> findByClientOrderId(String clientOrderId);

    List<TradeOrder> findByRunIdOrderByIdAsc(Long runId);

    boolean existsByClientOrderId(String clientOrderId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from TradeOrder o where o.id = :id")
    Optional<TradeOrder> findByIdForUpdate(@Param("id") Long id);

    /**
     * Orders without a run that evidence may still move: open ones, and reopenable ones touched since {@code since}.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from TradeOrder o where o.runId is null and (o.status in :open "
            + "or (o.status in :reopenable and o.updatedAt >= :since)) order by o.id")
    List<TradeOrder> findFreeStandingForUpdate(@Param("open") Collection<OrderStatus> open,
                                               @Param("reopenable") Collection<OrderStatus> reopenable,
                                               @Param("since") Instant since);

    List<TradeOrder> findTop100ByOrderByIdDesc();

    List<TradeOrder> findTop100ByStatusOrderByIdDesc(OrderStatus status);
}
