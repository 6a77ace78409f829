package com.chicu.gridbot.ledger.trade.repository;

import com.chicu.gridbot.ledger.trade.model.TradeLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TradeLogRepository extends JpaRepository<TradeLogEntity, Long> {

    Optional<TradeLogEntity> findTopBySymbolOrderByExecutedAtDescIdDesc(String symbol);

    List<TradeLogEntity> findBySymbolOrderByExecutedAtDescIdDesc(String symbol, Pageable pageable);
}
