package com.chicu.gridbot.ledger.portfolio.model;

import com.chicu.gridbot.trading.model.ProfitMode;
import com.chicu.gridbot.trading.model.TradingMode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Исполненная продажа для записи в портфель.
 */
@Value
@Builder
public class SellFill {
    String symbol;
    String pairId;
    BigDecimal buyPrice;
    BigDecimal sellPrice;
    BigDecimal quantity;
    @Builder.Default
    BigDecimal retainedQty = BigDecimal.ZERO;
    String exchange;
    TradingMode tradingMode;
    ProfitMode profitMode;
}
