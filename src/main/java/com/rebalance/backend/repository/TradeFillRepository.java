package com.rebalance.backend.repository;

import com.rebalance.backend.model.TradeFill;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface TradeFillRepository extends JpaRepository<TradeFill, Long> {

    boolean existsByExecId(String execId);

    List<TradeFill> findByOrderIdOrderByIdAsc(Long orderId);

    List<TradeFill> findByOrderIdIn(Collection<Long> orderIds);

    long countByOrderId(Long orderId);
}
