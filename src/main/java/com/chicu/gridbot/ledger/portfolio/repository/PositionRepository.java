package com.chicu.gridbot.ledger.portfolio.repository;

import com.chicu.gridbot.ledger.portfolio.model.PositionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PositionRepository extends JpaRepository<PositionEntity, String> {
}
