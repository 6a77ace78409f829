package com.chicu.gridbot.trading.engine;

import com.chicu.gridbot.exchange.client.ExchangeError;
import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.gateway.*;
import com.chicu.gridbot.ledger.order.service.OrderLedger;
import com.chicu.gridbot.ledger.portfolio.model.SellFill;
import com.chicu.gridbot.ledger.portfolio.service.PortfolioLedger;
import com.chicu.gridbot.ledger.trade.service.TradeLogService;
import com.chicu.gridbot.trading.model.PairConfig;
import com.chicu.gridbot.trading.model.ProfitMode;
import com.chicu.gridbot.util.Sleeper;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.function.BooleanSupplier;

/**
 * Грид-лестница одного символа: одна лимитная покупка ниже и одна или несколько продаж выше.
 * <p>
 * Цены новых ордеров считаются от цены того исполнения, которое их породило:
 * продажа {@code fill × (1 + sellPct/100)}, следующая покупка {@code fill × (1 − |buyPct|/100)}.
 * Пустая лестница запускает новый цикл рыночной покупкой.
 */
@Slf4j
@RequiredArgsConstructor
public class TradeLoopEngine {

    static final int QTY_SCALE = 6;
    private static final int BUY_QTY_SCALE = 8;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PairConfig config;
    private final ExchangeGateway gateway;
    private final OrderLedger orderLedger;
    private final PortfolioLedger portfolio;
    private final TradeLogService tradeLog;
    private final Duration tickInterval;
    private final Clock clock;

    /** Последний опубликованный снимок, читается из других потоков */
    @Getter
    private volatile GridStatus status;

    public GridState newState() {
        GridState state = new GridState(config.getSymbol());
        status = state.snapshot(config.getPairId());
        return state;
    }

    /**
     * Цикл воркера: тик, пауза, пока {@code running} истинно.
     * Ошибка тика логируется, цикл продолжается.
     */
    public void run(BooleanSupplier running, Sleeper sleeper) {
        GridState state = newState();
        log.info("▶️ Пара {} ({}) запущена: сумма={}, buy={}%, sell={}%, режим={}/{}",
                config.getPairId(), config.getSymbol(), config.getAmount(), config.getBuyPct(),
                config.getSellPct(), config.getTradingMode(), config.getProfitMode());

        while (running.getAsBoolean()) {
            try {
                tick(state);
            } catch (RuntimeException e) {
                state.setLastError(e.getMessage());
                status = state.snapshot(config.getPairId());
                log.error("❌ Ошибка тика {} ({}): {}", config.getPairId(), config.getSymbol(), e.getMessage(), e);
            }
            if (!running.getAsBoolean()) break;
            try {
                sleeper.sleep(tickInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Воркер {} прерван", config.getPairId());
                break;
            }
        }
        log.info("⏹️ Пара {} ({}) остановлена после {} тиков",
                config.getPairId(), config.getSymbol(), state.getTickCount());
    }

    /**
     * Один проход: сверка неподтверждённой рыночной покупки, продажи, покупка,
     * при пустой лестнице — новый цикл.
     */
    public void tick(GridState state) {
        state.beginTick(clock.instant());

        if (state.isAwaitingMarketBuy()) {
            reconcileMarketBuy(state);
        }
        checkSells(state);
        checkBuy(state);
        if (state.isLadderEmpty() && !state.isAwaitingMarketBuy()) {
            startCycle(state);
        }

        state.setPhase(state.isAwaitingMarketBuy() ? GridPhase.AWAITING_FILL
                : state.isLadderEmpty() ? GridPhase.STARTING : GridPhase.LADDER_ACTIVE);
        status = state.snapshot(config.getPairId());
        log.debug("📊 {} [{}] buy={} sells={}", config.getSymbol(), state.getPhase(),
                state.getBuy() == null ? "-" : state.getBuy().getPrice(),
                state.getSells().stream().map(LadderOrder::getPrice).toList());
    }

    /* ====================== продажи ====================== */

    private void checkSells(GridState state) {
        String symbol = config.getSymbol();
        for (LadderOrder sell : new ArrayList<>(state.getSells())) {
            OrderStatusSnapshot st = gateway.checkOrderStatus(sell.getOrderId(), symbol);
            switch (st.getState()) {
                case CLOSED -> onSellFilled(state, sell);
                case CANCELED, NOT_FOUND -> {
                    log.info("{}: продажа #{} {} на бирже, убираем из лестницы",
                            symbol, sell.getOrderId(), st.getState());
                    state.removeSell(sell);
                    orderLedger.removeOrder(symbol, sell.getOrderId());
                }
                case OPEN -> trackPartialFill(sell, st);
                case ERROR -> state.setLastError(st.getMessage());
            }
        }
    }

    private void onSellFilled(GridState state, LadderOrder sell) {
        String symbol = config.getSymbol();
        log.info("✅ {}: продажа #{} исполнена: {} по {} (удержано {})",
                symbol, sell.getOrderId(), sell.getQuantity(), sell.getPrice(), sell.getRetainedQty());

        portfolio.recordSell(SellFill.builder()
                .symbol(symbol)
                .pairId(config.getPairId())
                .buyPrice(sell.getBuyPrice())
                .sellPrice(sell.getPrice())
                .quantity(sell.getQuantity())
                .retainedQty(sell.getRetainedQty())
                .exchange(config.getExchange())
                .tradingMode(config.getTradingMode())
                .profitMode(config.getProfitMode())
                .build());
        tradeLog.logTrade(symbol, OrderSide.SELL, sell.getPrice(), sell.getQuantity(),
                config.getExchange(), config.getTradingMode());

        state.removeSell(sell);
        orderLedger.removeOrder(symbol, sell.getOrderId());

        // исполненная продажа отменяет текущую покупку: новая считается от цены продажи
        LadderOrder buy = state.getBuy();
        if (buy != null) {
            gateway.cancelOrder(buy.getOrderId(), symbol);
            orderLedger.removeSide(symbol, OrderSide.BUY);
            state.setBuy(null);
            log.info("{}: покупка #{} отменена после продажи", symbol, buy.getOrderId());
        }

        if (!state.getSells().isEmpty()) {
            placeBuyRung(state, sell.getPrice());
        } else {
            log.info("🏁 {}: все продажи исполнены, новый цикл", symbol);
        }
    }

    /* ====================== покупка ====================== */

    private void checkBuy(GridState state) {
        LadderOrder buy = state.getBuy();
        if (buy == null) return;

        String symbol = config.getSymbol();
        OrderStatusSnapshot st = gateway.checkOrderStatus(buy.getOrderId(), symbol);
        switch (st.getState()) {
            case CLOSED -> {
                BigDecimal qty = st.getFilled() != null && st.getFilled().signum() > 0
                        ? st.getFilled()
                        : buy.getQuantity();
                BigDecimal price = buy.getPrice();
                log.info("✅ {}: покупка #{} исполнена: {} по {}", symbol, buy.getOrderId(), qty, price);

                orderLedger.removeSide(symbol, OrderSide.BUY);
                state.setBuy(null);
                onBought(state, price, qty);
            }
            case CANCELED, NOT_FOUND -> {
                log.info("{}: покупка #{} {} на бирже", symbol, buy.getOrderId(), st.getState());
                orderLedger.removeSide(symbol, OrderSide.BUY);
                state.setBuy(null);
            }
            case OPEN -> trackPartialFill(buy, st);
            case ERROR -> state.setLastError(st.getMessage());
        }
    }

    /* ====================== новый цикл ====================== */

    private void startCycle(GridState state) {
        String symbol = config.getSymbol();
        log.info("🔄 {}: новый цикл", symbol);

        gateway.cancelAllOrders(symbol);
        orderLedger.removeAll(symbol);

        ExchangeResult<MarketFill> result = gateway.marketBuy(symbol, config.getAmount());
        if (result.is(ExchangeError.INSUFFICIENT_FUNDS)) {
            FundsShortfall f = result.getShortfall();
            log.warn("🚨 {}: недостаточно средств для цикла: нужно {}, доступно {}. Пропускаем тик",
                    symbol, f.required(), f.available());
            state.setLastError(result.getMessage());
            return;
        }
        if (result.is(ExchangeError.UNCONFIRMED)) {
            // ордер на бирже есть: до сверки новый цикл не начинаем, иначе купим дважды
            log.warn("⏳ {}: рыночная покупка #{} без подтверждения исполнения, сверим на следующем тике",
                    symbol, result.getOrderId());
            state.setPendingMarketBuyId(result.getOrderId());
            orderLedger.setOrder(symbol, OrderSide.BUY, null, null, result.getOrderId(), config.getExchange());
            state.setLastError(result.getMessage());
            return;
        }
        if (!result.isOk()) {
            log.error("❌ {}: рыночная покупка не удалась ({}): {}", symbol, result.getError(), result.getMessage());
            state.setLastError(result.getMessage());
            return;
        }

        MarketFill fill = result.getValue();
        onBought(state, fill.getAvgPrice(), fill.getFilledQty());
    }

    /** Рыночная покупка без подтверждённого исполнения: статус по orderId, повторной покупки нет. */
    private void reconcileMarketBuy(GridState state) {
        String symbol = config.getSymbol();
        String orderId = state.getPendingMarketBuyId();
        OrderStatusSnapshot st = gateway.checkOrderStatus(orderId, symbol);
        BigDecimal filled = st.getFilled() == null ? BigDecimal.ZERO : st.getFilled();
        boolean hasFill = filled.signum() > 0 && st.getAvgPrice() != null && st.getAvgPrice().signum() > 0;

        switch (st.getState()) {
            case CLOSED, CANCELED -> {
                if (hasFill) {
                    log.info("✅ {}: рыночная покупка #{} подтверждена: {} по {}",
                            symbol, orderId, filled, st.getAvgPrice());
                    forgetMarketBuy(state, symbol);
                    onBought(state, st.getAvgPrice(), filled);
                } else if (st.getState() == OrderState.CANCELED) {
                    log.warn("{}: рыночная покупка #{} отменена без исполнения", symbol, orderId);
                    forgetMarketBuy(state, symbol);
                } else {
                    state.setLastError("Нет данных об исполнении рыночной покупки #" + orderId);
                }
            }
            case NOT_FOUND -> {
                log.warn("{}: рыночная покупка #{} биржей не найдена", symbol, orderId);
                forgetMarketBuy(state, symbol);
            }
            case OPEN -> log.info("⏳ {}: рыночная покупка #{} ещё исполняется", symbol, orderId);
            case ERROR -> state.setLastError(st.getMessage());
        }
    }

    private void forgetMarketBuy(GridState state, String symbol) {
        state.setPendingMarketBuyId(null);
        orderLedger.removeSide(symbol, OrderSide.BUY);
    }

    /** Учесть покупку и выставить от её цены продажу и следующую ступень покупки. */
    private void onBought(GridState state, BigDecimal price, BigDecimal qty) {
        String symbol = config.getSymbol();
        portfolio.recordBuy(symbol, qty, price);
        tradeLog.logTrade(symbol, OrderSide.BUY, price, qty, config.getExchange(), config.getTradingMode());

        placeSell(state, price, qty);
        placeBuyRung(state, price);
    }

    private void placeSell(GridState state, BigDecimal buyPrice, BigDecimal boughtQty) {
        String symbol = config.getSymbol();
        BigDecimal sellPrice = sellPrice(buyPrice);
        boolean sellAll = config.getProfitMode() == ProfitMode.USDC;
        BigDecimal sellable = sellAll ? boughtQty.add(state.getUnsoldQty()) : boughtQty;
        SellSizing sizing = sizeSell(config.getProfitMode(), sellable, config.getAmount(), sellPrice);

        ExchangeResult<PlacedOrder> r = gateway.placeLimitOrder(symbol, OrderSide.SELL, sellPrice, sizing.sellQty());
        if (!r.isOk()) {
            log.error("❌ {}: продажа {} @ {} не выставлена ({}), сторона остаётся пустой",
                    symbol, sizing.sellQty(), sellPrice, r.getError());
            state.setLastError(r.getMessage());
            return;
        }

        PlacedOrder placed = r.getValue();
        // всё, что не ушло в ордер после округления биржи, остаётся на руках
        BigDecimal retained = sellable.subtract(placed.getQuantity()).max(BigDecimal.ZERO);
        if (sellAll) {
            state.setUnsoldQty(retained);
        }
        LadderOrder sell = LadderOrder.builder()
                .orderId(placed.getOrderId())
                .price(placed.getPrice())
                .quantity(placed.getQuantity())
                .buyPrice(buyPrice)
                .retainedQty(retained)
                .build();
        state.addSell(sell);
        orderLedger.setSellOrder(symbol, sell.getPrice(), sell.getQuantity(), sell.getOrderId(),
                config.getExchange(), buyPrice, retained);
        log.info("📤 {}: продажа #{} {} @ {} (удержано {}, режим {})",
                symbol, sell.getOrderId(), sell.getQuantity(), sell.getPrice(), retained, config.getProfitMode());
    }

    private void placeBuyRung(GridState state, BigDecimal fromPrice) {
        String symbol = config.getSymbol();
        BigDecimal buyPrice = buyPrice(fromPrice);
        BigDecimal qty = config.getAmount().divide(buyPrice, BUY_QTY_SCALE, RoundingMode.DOWN);

        ExchangeResult<PlacedOrder> r = gateway.placeLimitOrder(symbol, OrderSide.BUY, buyPrice, qty);
        if (!r.isOk()) {
            log.error("❌ {}: покупка {} @ {} не выставлена ({}), сторона остаётся пустой",
                    symbol, qty, buyPrice, r.getError());
            state.setLastError(r.getMessage());
            return;
        }

        PlacedOrder placed = r.getValue();
        LadderOrder buy = LadderOrder.builder()
                .orderId(placed.getOrderId())
                .price(placed.getPrice())
                .quantity(placed.getQuantity())
                .build();
        state.setBuy(buy);
        orderLedger.setOrder(symbol, OrderSide.BUY, buy.getPrice(), buy.getQuantity(), buy.getOrderId(),
                config.getExchange());
        log.info("📥 {}: покупка #{} {} @ {}", symbol, buy.getOrderId(), buy.getQuantity(), buy.getPrice());
    }

    private void trackPartialFill(LadderOrder order, OrderStatusSnapshot st) {
        if (st.getFilled() != null && st.getFilled().signum() > 0) {
            orderLedger.updateFill(config.getSymbol(), order.getOrderId(), st.getFilled(), OrderLedger.STATUS_OPEN);
        }
    }

    /* ====================== арифметика ====================== */

    BigDecimal sellPrice(BigDecimal fillPrice) {
        return fillPrice.multiply(BigDecimal.ONE.add(config.getSellPct().divide(HUNDRED)));
    }

    BigDecimal buyPrice(BigDecimal fillPrice) {
        return fillPrice.multiply(BigDecimal.ONE.subtract(config.getBuyPct().abs().divide(HUNDRED)));
    }

    /**
     * USDC: продаётся всё. CRYPTO: продаётся {@code min(qty, notional / sellPrice)}, остаток удерживается.
     * Количество продажи округляется вниз до 6 знаков, чтобы не продать больше купленного.
     */
    static SellSizing sizeSell(ProfitMode mode, BigDecimal qty, BigDecimal notional, BigDecimal sellPrice) {
        BigDecimal sellQty = qty;
        if (mode == ProfitMode.CRYPTO) {
            sellQty = qty.min(notional.divide(sellPrice, QTY_SCALE + 4, RoundingMode.HALF_UP));
        }
        sellQty = sellQty.setScale(QTY_SCALE, RoundingMode.DOWN);
        BigDecimal retained = qty.subtract(sellQty).max(BigDecimal.ZERO).setScale(QTY_SCALE, RoundingMode.HALF_UP);
        return new SellSizing(sellQty, retained);
    }

    record SellSizing(BigDecimal sellQty, BigDecimal retainedQty) {
    }
}
