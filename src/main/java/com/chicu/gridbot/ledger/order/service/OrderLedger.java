package com.chicu.gridbot.ledger.order.service;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.ledger.order.model.OpenOrderEntity;
import com.chicu.gridbot.ledger.order.repository.OpenOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Журнал открытых ордеров по символам. Воркер пишет сюда своё рабочее состояние лестницы.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderLedger {

    public static final String STATUS_OPEN = "open";

    private final OpenOrderRepository repo;

    /**
     * Upsert: BUY — одна строка на символ (старая заменяется), SELL — одна строка на orderId.
     */
    @Transactional
    public OpenOrderEntity setOrder(String symbol, OrderSide side, BigDecimal price, BigDecimal quantity,
                                    String orderId, String exchange) {
        return upsert(symbol, side, price, quantity, orderId, exchange, null, null);
    }

    /** SELL вместе с ценой покупки и удержанным остатком. */
    @Transactional
    public OpenOrderEntity setSellOrder(String symbol, BigDecimal price, BigDecimal quantity, String orderId,
                                        String exchange, BigDecimal buyPrice, BigDecimal retainedQty) {
        return upsert(symbol, OrderSide.SELL, price, quantity, orderId, exchange, buyPrice, retainedQty);
    }

    private OpenOrderEntity upsert(String symbol, OrderSide side, BigDecimal price, BigDecimal quantity,
                                   String orderId, String exchange, BigDecimal buyPrice, BigDecimal retainedQty) {
        Instant now = Instant.now();
        OpenOrderEntity e;
        if (side == OrderSide.BUY) {
            List<OpenOrderEntity> rows = repo.findBySymbolAndSideOrderByCreatedAtAsc(symbol, OrderSide.BUY);
            e = rows.isEmpty() ? new OpenOrderEntity() : rows.get(0);
            if (rows.size() > 1) {
                log.warn("{}: в журнале {} BUY-строк, лишние удаляются", symbol, rows.size());
                repo.deleteAll(rows.subList(1, rows.size()));
            }
        } else {
            e = repo.findBySymbolAndSideAndOrderId(symbol, OrderSide.SELL, orderId)
                    .orElseGet(OpenOrderEntity::new);
        }

        e.setSymbol(symbol);
        e.setSide(side);
        e.setOrderId(orderId);
        e.setExchange(exchange);
        e.setPrice(price);
        e.setQuantity(quantity);
        e.setFilledQty(BigDecimal.ZERO);
        e.setStatus(STATUS_OPEN);
        e.setBuyPrice(buyPrice);
        e.setRetainedQty(retainedQty);
        if (e.getCreatedAt() == null) {
            e.setCreatedAt(now);
        }
        e.setUpdatedAt(now);
        return repo.save(e);
    }

    /** Обновить исполненное количество и статус. */
    @Transactional
    public Optional<OpenOrderEntity> updateFill(String symbol, String orderId, BigDecimal filledQty, String status) {
        return repo.findBySymbolAndOrderId(symbol, orderId).map(e -> {
            e.setFilledQty(filledQty);
            if (status != null) e.setStatus(status);
            e.setUpdatedAt(Instant.now());
            return repo.save(e);
        });
    }

    @Transactional(readOnly = true)
    public Optional<OpenOrderEntity> findOrder(String symbol, OrderSide side) {
        return repo.findBySymbolAndSideOrderByCreatedAtAsc(symbol, side).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<OpenOrderEntity> findOpenOrders(String symbol, OrderSide side) {
        return repo.findBySymbolAndSideOrderByCreatedAtAsc(symbol, side);
    }

    @Transactional(readOnly = true)
    public List<OpenOrderEntity> findOpenOrders(String symbol) {
        return repo.findBySymbolOrderByCreatedAtAsc(symbol);
    }

    @Transactional
    public boolean removeOrder(String symbol, String orderId) {
        return repo.deleteBySymbolAndOrderId(symbol, orderId) > 0;
    }

    @Transactional
    public long removeSide(String symbol, OrderSide side) {
        return repo.deleteBySymbolAndSide(symbol, side);
    }

    @Transactional
    public long removeAll(String symbol) {
        long n = repo.deleteBySymbol(symbol);
        if (n > 0) {
            log.info("🧹 {}: из журнала удалено ордеров: {}", symbol, n);
        }
        return n;
    }
}
