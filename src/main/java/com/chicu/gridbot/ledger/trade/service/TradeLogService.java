package com.chicu.gridbot.ledger.trade.service;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.ledger.trade.model.TradeLogEntry;
import com.chicu.gridbot.trading.model.TradingMode;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface TradeLogService {

    /** Записать исполненную сделку */
    void logTrade(String symbol, OrderSide side, BigDecimal price, BigDecimal amount,
                  String exchange, TradingMode tradingMode);

    /** Последняя сделка по символу */
    Optional<TradeLogEntry> getLastTrade(String symbol);

    /** Последние сделки, новые первыми */
    List<TradeLogEntry> getRecentTrades(String symbol, int limit);
}
