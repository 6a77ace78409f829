package com.chicu.gridbot.ledger.portfolio.repository;

import com.chicu.gridbot.ledger.portfolio.model.ProfitEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface ProfitEventRepository extends JpaRepository<ProfitEventEntity, Long> {

    @Query("select sum(p.profit) from ProfitEventEntity p")
    BigDecimal sumProfit();

    @Query("select sum(p.profit) from ProfitEventEntity p where p.symbol = :symbol")
    BigDecimal sumProfitBySymbol(@Param("symbol") String symbol);

    List<ProfitEventEntity> findBySymbolOrderByCreatedAtAsc(String symbol);
}
