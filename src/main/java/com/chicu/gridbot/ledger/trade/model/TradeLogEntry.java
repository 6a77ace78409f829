package com.chicu.gridbot.ledger.trade.model;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.trading.model.TradingMode;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Сделка для дашборда.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeLogEntry {

    private String symbol;
    private OrderSide side;

    private BigDecimal price;
    private BigDecimal amount;
    private BigDecimal quoteValue;

    private String exchange;
    private TradingMode tradingMode;
    private Instant executedAt;
}
