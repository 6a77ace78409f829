package com.chicu.gridbot.ledger.order.repository;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.ledger.order.model.OpenOrderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface OpenOrderRepository extends JpaRepository<OpenOrderEntity, Long> {

    Optional<OpenOrderEntity> findBySymbolAndSideAndOrderId(String symbol, OrderSide side, String orderId);

    Optional<OpenOrderEntity> findBySymbolAndOrderId(String symbol, String orderId);

    List<OpenOrderEntity> findBySymbolOrderByCreatedAtAsc(String symbol);

    List<OpenOrderEntity> findBySymbolAndSideOrderByCreatedAtAsc(String symbol, OrderSide side);

    long deleteBySymbolAndOrderId(String symbol, String orderId);

    long deleteBySymbolAndSide(String symbol, OrderSide side);

    long deleteBySymbol(String symbol);
}
