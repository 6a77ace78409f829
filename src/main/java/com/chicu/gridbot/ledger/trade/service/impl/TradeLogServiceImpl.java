package com.chicu.gridbot.ledger.trade.service.impl;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.ledger.trade.model.TradeLogEntity;
import com.chicu.gridbot.ledger.trade.model.TradeLogEntry;
import com.chicu.gridbot.ledger.trade.repository.TradeLogRepository;
import com.chicu.gridbot.ledger.trade.service.TradeLogService;
import com.chicu.gridbot.trading.model.TradingMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class TradeLogServiceImpl implements TradeLogService {

    private final TradeLogRepository repo;

    @Override
    @Transactional
    public void logTrade(String symbol, OrderSide side, BigDecimal price, BigDecimal amount,
                         String exchange, TradingMode tradingMode) {
        TradeLogEntity entity = TradeLogEntity.builder()
                .symbol(symbol)
                .side(side)
                .price(price)
                .amount(amount)
                .quoteValue(price.multiply(amount).setScale(2, RoundingMode.HALF_UP))
                .exchange(exchange)
                .tradingMode(tradingMode)
                .executedAt(Instant.now())
                .build();

        repo.save(entity);
        log.info("💾 Записана сделка: {} {} {} @ {} = {} ({} {})",
                entity.getSide(), entity.getAmount(), entity.getSymbol(),
                entity.getPrice(), entity.getQuoteValue(), exchange, tradingMode);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TradeLogEntry> getLastTrade(String symbol) {
        return repo.findTopBySymbolOrderByExecutedAtDescIdDesc(symbol).map(TradeLogServiceImpl::toEntry);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TradeLogEntry> getRecentTrades(String symbol, int limit) {
        return repo.findBySymbolOrderByExecutedAtDescIdDesc(symbol, PageRequest.of(0, Math.max(1, limit)))
                .stream()
                .map(TradeLogServiceImpl::toEntry)
                .toList();
    }

    private static TradeLogEntry toEntry(TradeLogEntity e) {
        return TradeLogEntry.builder()
                .symbol(e.getSymbol())
                .side(e.getSide())
                .price(e.getPrice())
                .amount(e.getAmount())
                .quoteValue(e.getQuoteValue())
                .exchange(e.getExchange())
                .tradingMode(e.getTradingMode())
                .executedAt(e.getExecutedAt())
                .build();
    }
}
