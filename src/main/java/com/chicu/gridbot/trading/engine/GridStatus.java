package com.chicu.gridbot.trading.engine;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Снимок лестницы для дашборда. Неизменяемый, публикуется воркером после каждого тика.
 */
@Value
@Builder(toBuilder = true)
public class GridStatus {
    String pairId;
    String symbol;
    GridPhase phase;
    LadderOrder buy;
    List<LadderOrder> sells;
    String pendingMarketBuyId;
    BigDecimal unsoldQty;
    long tickCount;
    String lastError;
    Instant lastTickAt;

    /** Остановка запрошена, но воркер ещё не вышел: повторный старт пары пока невозможен */
    boolean stopping;
}
