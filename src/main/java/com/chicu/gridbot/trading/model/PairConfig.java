package com.chicu.gridbot.trading.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Настройки торговой пары на время работы воркера. Не меняются, пока воркер запущен.
 */
@Value
@Builder(toBuilder = true)
public class PairConfig {

    String pairId;

    /** BASE/QUOTE, например ETH/USDC */
    String symbol;

    /** Идентификатор биржи: binance, bybit */
    String exchange;

    /** Сумма цикла в котируемой валюте */
    BigDecimal amount;

    /** Скидка повторного входа, %. Знак не важен: берётся модуль */
    BigDecimal buyPct;

    /** Наценка фиксации прибыли, % */
    BigDecimal sellPct;

    @Builder.Default
    TradingMode tradingMode = TradingMode.TESTNET;

    @Builder.Default
    ProfitMode profitMode = ProfitMode.USDC;
}
