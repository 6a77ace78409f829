package com.chicu.gridbot.trading.engine;

import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Рабочее состояние лестницы одного символа. Принадлежит одному воркеру, не потокобезопасно.
 */
@Getter
public class GridState {

    private final String symbol;

    @Setter
    private GridPhase phase = GridPhase.STARTING;

    @Setter
    private LadderOrder buy;

    private final List<LadderOrder> sells = new ArrayList<>();

    /** Рыночная покупка, принятая биржей без подтверждённого исполнения */
    @Setter
    private String pendingMarketBuyId;

    /** USDC: куплено, но не вошло в продажу после округления; добавляется к следующей продаже */
    @Setter
    private BigDecimal unsoldQty = BigDecimal.ZERO;

    private long tickCount;

    @Setter
    private String lastError;

    private Instant lastTickAt;

    public GridState(String symbol) {
        this.symbol = symbol;
    }

    public List<LadderOrder> getSells() {
        return Collections.unmodifiableList(sells);
    }

    public void addSell(LadderOrder sell) {
        sells.add(sell);
    }

    public boolean removeSell(LadderOrder sell) {
        return sells.remove(sell);
    }

    public boolean isLadderEmpty() {
        return buy == null && sells.isEmpty();
    }

    public boolean isAwaitingMarketBuy() {
        return pendingMarketBuyId != null;
    }

    void beginTick(Instant now) {
        tickCount++;
        lastTickAt = now;
        lastError = null;
    }

    public GridStatus snapshot(String pairId) {
        return GridStatus.builder()
                .pairId(pairId)
                .symbol(symbol)
                .phase(phase)
                .buy(buy)
                .sells(List.copyOf(sells))
                .pendingMarketBuyId(pendingMarketBuyId)
                .unsoldQty(unsoldQty)
                .tickCount(tickCount)
                .lastError(lastError)
                .lastTickAt(lastTickAt)
                .build();
    }
}
