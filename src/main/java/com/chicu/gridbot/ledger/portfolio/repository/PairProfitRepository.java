package com.chicu.gridbot.ledger.portfolio.repository;

import com.chicu.gridbot.ledger.portfolio.model.PairProfitEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PairProfitRepository extends JpaRepository<PairProfitEntity, String> {
}
