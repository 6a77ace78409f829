package com.chicu.gridbot.exchange.gateway;

import com.chicu.gridbot.config.GridBotProperties;
import com.chicu.gridbot.exchange.client.ExchangeApiException;
import com.chicu.gridbot.exchange.client.ExchangeClient;
import com.chicu.gridbot.exchange.client.ExchangeError;
import com.chicu.gridbot.exchange.enums.Exchange;
import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.enums.OrderType;
import com.chicu.gridbot.exchange.model.*;
import com.chicu.gridbot.util.Sleeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Шлюз поверх адаптера биржи: повтор после rate limit, округление под фильтры символа,
 * нормализация ответов. Экземпляр на воркер, ключи зафиксированы при создании.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultExchangeGateway implements ExchangeGateway {

    private static final int BASE_QTY_SCALE = 8;

    private final ExchangeClient client;
    private final ExchangeCredentials credentials;
    private final GridBotProperties.ExchangeSettings settings;
    private final Sleeper sleeper;

    @Override
    public Exchange getExchange() {
        return client.getExchange();
    }

    /* ====================== rate limit ====================== */

    /**
     * Вызов с одним повтором после RATE_LIMITED. Повторный rate limit уходит наверх как обычная ошибка.
     */
    <T> T withRateLimitRetry(String op, Supplier<T> call) {
        try {
            return call.get();
        } catch (ExchangeApiException e) {
            if (e.getError() != ExchangeError.RATE_LIMITED) throw e;

            Duration pause = e.getRetryAfterMs() != null
                    ? Duration.ofMillis(e.getRetryAfterMs())
                    : settings.getRateLimitBackoff();
            log.warn("⏳ {} {}: rate limit, пауза {} мс и повтор", client.getExchange(), op, pause.toMillis());
            try {
                sleeper.sleep(pause);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new ExchangeApiException(ExchangeError.TRANSIENT, op + ": прервано во время паузы rate limit", ie);
            }
            return call.get();
        }
    }

    private void runWithRateLimitRetry(String op, Runnable call) {
        withRateLimitRetry(op, () -> {
            call.run();
            return null;
        });
    }

    /* ====================== балансы и цены ====================== */

    @Override
    public ExchangeResult<BigDecimal> getPrice(String symbol) {
        TradingSymbol ts = TradingSymbol.parse(symbol);
        try {
            return ExchangeResult.ok(withRateLimitRetry("getPrice",
                    () -> client.getLastPrice(ts.exchangeSymbol(), credentials.network())));
        } catch (ExchangeApiException e) {
            log.warn("Цена {} недоступна: {}", symbol, e.getMessage());
            return ExchangeResult.failure(e.getError(), e.getMessage());
        }
    }

    @Override
    public ExchangeResult<BigDecimal> getBalance(String currency) {
        try {
            Map<String, BigDecimal> balances = withRateLimitRetry("getBalance", () -> client.getFreeBalances(credentials));
            return ExchangeResult.ok(balances.getOrDefault(currency, BigDecimal.ZERO));
        } catch (ExchangeApiException e) {
            if (e.getError() == ExchangeError.AUTH_ERROR) {
                log.error("🔑 {}: ключи отклонены при запросе баланса {}", client.getExchange(), currency);
            } else {
                log.warn("Баланс {} недоступен: {}", currency, e.getMessage());
            }
            return ExchangeResult.failure(e.getError(), e.getMessage());
        }
    }

    /* ====================== ордера ====================== */

    @Override
    public ExchangeResult<MarketFill> marketBuy(String symbol, BigDecimal quoteAmount) {
        TradingSymbol ts = TradingSymbol.parse(symbol);
        BigDecimal notional = quoteAmount.max(settings.getMinNotional());
        if (notional.compareTo(quoteAmount) > 0) {
            log.info("Сумма {} {} меньше минимальной, покупаем на {}", quoteAmount, ts.quote(), notional);
        }

        ExchangeResult<BigDecimal> balance = getBalance(ts.quote());
        if (!balance.isOk()) {
            return ExchangeResult.failure(balance.getError(), "Баланс " + ts.quote() + ": " + balance.getMessage());
        }
        if (balance.getValue().compareTo(notional) < 0) {
            log.warn("💸 Не хватает {}: нужно {}, доступно {}", ts.quote(), notional, balance.getValue());
            return ExchangeResult.insufficientFunds(notional, balance.getValue());
        }

        try {
            OrderRequest.OrderRequestBuilder req = OrderRequest.builder()
                    .symbol(ts.exchangeSymbol())
                    .side(OrderSide.BUY)
                    .type(OrderType.MARKET);

            if (client.supportsQuoteMarketBuy()) {
                req.quoteQuantity(notional);
            } else {
                BigDecimal price = withRateLimitRetry("getPrice",
                        () -> client.getLastPrice(ts.exchangeSymbol(), credentials.network()));
                BigDecimal qty = notional.divide(price, BASE_QTY_SCALE, RoundingMode.DOWN);
                qty = snapQuantity(qty, rules(ts).orElse(null));
                if (qty.signum() <= 0) {
                    return ExchangeResult.failure(ExchangeError.REJECTED, "Количество после округления = 0");
                }
                req.quantity(qty);
            }

            OrderRequest request = req.build();
            // повтор после rate limit только для самого создания: отклонённый запрос ордер не создал
            OrderResponse r = withRateLimitRetry("marketBuy", () -> client.placeOrder(credentials, request));
            if (r == null || r.getOrderId() == null || r.getOrderId().isBlank()) {
                return ExchangeResult.failure(ExchangeError.INVALID_RESPONSE, "Нет orderId в ответе на рыночную покупку");
            }

            Optional<MarketFill> fill = fillOf(r.getOrderId(), r.getExecutedQty(), r.getAvgPrice(), r.getQuoteQty());
            if (fill.isEmpty()) {
                fill = awaitMarketFill(ts, r.getOrderId());
            }
            if (fill.isEmpty()) {
                log.error("❗ Рыночная покупка {} #{} принята биржей, но исполнение не подтверждено", symbol, r.getOrderId());
                return ExchangeResult.unconfirmed(r.getOrderId(),
                        "Исполнение ордера " + r.getOrderId() + " не подтверждено");
            }

            MarketFill f = fill.get();
            log.info("✅ Куплено {} {} по {} (#{}, потрачено {})", f.getFilledQty(), symbol, f.getAvgPrice(),
                    f.getOrderId(), f.getCost());
            return ExchangeResult.ok(f);
        } catch (ExchangeApiException e) {
            log.error("❌ Рыночная покупка {} на {} не удалась: {}", symbol, notional, e.getMessage());
            return ExchangeResult.failure(e.getError(), e.getMessage());
        }
    }

    /**
     * Исполнение уже созданного рыночного ордера. Ошибки запроса здесь не ведут к повтору создания:
     * ордер опрашивается по id до {@code marketFillPollAttempts} раз.
     */
    private Optional<MarketFill> awaitMarketFill(TradingSymbol ts, String orderId) {
        int attempts = settings.getMarketFillPollAttempts();
        for (int i = 1; i <= attempts; i++) {
            try {
                Optional<OrderInfo> info = withRateLimitRetry("marketFill",
                        () -> client.getOrder(credentials, ts.exchangeSymbol(), orderId));
                if (info.isPresent() && mapState(info.get().getStatus()) != OrderState.OPEN) {
                    OrderInfo o = info.get();
                    Optional<MarketFill> fill = fillOf(orderId, o.getExecutedQty(), o.getAvgPrice(), o.getQuoteQty());
                    if (fill.isPresent()) return fill;
                }
            } catch (ExchangeApiException e) {
                log.warn("Исполнение #{} {} ({}/{}) недоступно: {}", orderId, ts, i, attempts, e.getMessage());
            }
            if (i < attempts) {
                try {
                    sleeper.sleep(settings.getMarketFillPollInterval());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        return Optional.empty();
    }

    /** Без количества и цены исполнения покупки нет: ничего не додумываем. */
    private static Optional<MarketFill> fillOf(String orderId, BigDecimal filled, BigDecimal avg, BigDecimal quote) {
        if (filled == null || filled.signum() <= 0) return Optional.empty();
        boolean hasQuote = quote != null && quote.signum() > 0;
        if ((avg == null || avg.signum() <= 0) && hasQuote) {
            avg = quote.divide(filled, 12, RoundingMode.HALF_UP);
        }
        if (avg == null || avg.signum() <= 0) return Optional.empty();
        return Optional.of(MarketFill.builder()
                .orderId(orderId)
                .avgPrice(avg)
                .filledQty(filled)
                .cost(hasQuote ? quote : avg.multiply(filled))
                .build());
    }

    @Override
    public ExchangeResult<PlacedOrder> placeLimitOrder(String symbol, OrderSide side, BigDecimal price, BigDecimal quantity) {
        TradingSymbol ts = TradingSymbol.parse(symbol);
        if (price == null || price.signum() <= 0 || quantity == null || quantity.signum() <= 0) {
            return ExchangeResult.failure(ExchangeError.REJECTED,
                    "Некорректные параметры ордера: price=" + price + ", qty=" + quantity);
        }

        SymbolRules rules = rules(ts).orElse(null);
        BigDecimal p = snapPrice(price, rules);
        BigDecimal q = snapQuantity(quantity, rules);

        Optional<String> violation = checkLimits(p, q, rules);
        if (violation.isPresent()) {
            log.warn("⚠️ {} {} {} @ {} не выставлен: {}", side, q, symbol, p, violation.get());
            return ExchangeResult.failure(ExchangeError.REJECTED, violation.get());
        }

        OrderRequest request = OrderRequest.builder()
                .symbol(ts.exchangeSymbol())
                .side(side)
                .type(OrderType.LIMIT)
                .price(p)
                .quantity(q)
                .build();
        try {
            OrderResponse r = withRateLimitRetry("placeLimitOrder", () -> client.placeOrder(credentials, request));
            if (r == null || r.getOrderId() == null || r.getOrderId().isBlank()) {
                return ExchangeResult.failure(ExchangeError.INVALID_RESPONSE, "Нет orderId в ответе на лимитный ордер");
            }
            log.info("📌 {} LIMIT {} {} @ {} → #{}", side, q, symbol, p, r.getOrderId());
            return ExchangeResult.ok(PlacedOrder.builder()
                    .orderId(r.getOrderId())
                    .price(p)
                    .quantity(q)
                    .status(r.getStatus())
                    .build());
        } catch (ExchangeApiException e) {
            log.error("❌ {} LIMIT {} {} @ {} не выставлен: {}", side, q, symbol, p, e.getMessage());
            return ExchangeResult.failure(e.getError(), e.getMessage());
        }
    }

    @Override
    public void cancelOrder(String orderId, String symbol) {
        if (orderId == null) return;
        TradingSymbol ts = TradingSymbol.parse(symbol);
        try {
            runWithRateLimitRetry("cancelOrder", () -> client.cancelOrder(credentials, ts.exchangeSymbol(), orderId));
            log.info("🗑️ Ордер #{} {} отменён", orderId, symbol);
        } catch (ExchangeApiException e) {
            if (e.getError() == ExchangeError.NOT_FOUND) {
                log.debug("Ордер #{} {} уже не существует", orderId, symbol);
            } else {
                log.warn("Не удалось отменить #{} {}: {}", orderId, symbol, e.getMessage());
            }
        }
    }

    @Override
    public int cancelAllOrders(String symbol) {
        TradingSymbol ts = TradingSymbol.parse(symbol);
        List<OrderInfo> open;
        try {
            open = withRateLimitRetry("openOrders", () -> client.getOpenOrders(credentials, ts.exchangeSymbol()));
        } catch (ExchangeApiException e) {
            log.warn("Не удалось получить открытые ордера {}: {}", symbol, e.getMessage());
            return 0;
        }
        int cancelled = 0;
        for (OrderInfo o : open) {
            try {
                runWithRateLimitRetry("cancelOrder", () -> client.cancelOrder(credentials, ts.exchangeSymbol(), o.getOrderId()));
                cancelled++;
            } catch (ExchangeApiException e) {
                if (e.getError() != ExchangeError.NOT_FOUND) {
                    log.warn("Не удалось отменить #{} {}: {}", o.getOrderId(), symbol, e.getMessage());
                }
            }
        }
        if (cancelled > 0) {
            log.info("🧹 {}: отменено открытых ордеров: {}", symbol, cancelled);
        }
        return cancelled;
    }

    @Override
    public OrderStatusSnapshot checkOrderStatus(String orderId, String symbol) {
        TradingSymbol ts = TradingSymbol.parse(symbol);
        Optional<OrderInfo> info;
        try {
            info = withRateLimitRetry("getOrder", () -> client.getOrder(credentials, ts.exchangeSymbol(), orderId));
        } catch (ExchangeApiException e) {
            if (e.getError() == ExchangeError.NOT_FOUND) {
                return OrderStatusSnapshot.of(OrderState.NOT_FOUND);
            }
            log.warn("Статус #{} {} недоступен: {}", orderId, symbol, e.getMessage());
            return OrderStatusSnapshot.error(e.getMessage());
        }
        if (info.isEmpty()) {
            return OrderStatusSnapshot.of(OrderState.NOT_FOUND);
        }

        OrderInfo o = info.get();
        BigDecimal filled = nz(o.getExecutedQty());
        BigDecimal remaining = nz(o.getOrigQty()).subtract(filled).max(BigDecimal.ZERO);
        return OrderStatusSnapshot.builder()
                .state(mapState(o.getStatus()))
                .filled(filled)
                .remaining(remaining)
                .avgPrice(o.getAvgPrice())
                .build();
    }

    static OrderState mapState(String status) {
        if (status == null) return OrderState.ERROR;
        return switch (status.toUpperCase()) {
            case "NEW", "PARTIALLY_FILLED", "PENDING_NEW" -> OrderState.OPEN;
            case "FILLED" -> OrderState.CLOSED;
            case "CANCELED", "PENDING_CANCEL", "EXPIRED", "EXPIRED_IN_MATCH", "REJECTED" -> OrderState.CANCELED;
            default -> OrderState.ERROR;
        };
    }

    /* ====================== точность ====================== */

    private Optional<SymbolRules> rules(TradingSymbol ts) {
        try {
            return Optional.ofNullable(withRateLimitRetry("symbolRules",
                    () -> client.getSymbolRules(ts.exchangeSymbol(), credentials.network())));
        } catch (ExchangeApiException e) {
            log.warn("Фильтры {} недоступны, округляем по умолчанию: {}", ts, e.getMessage());
            return Optional.empty();
        }
    }

    BigDecimal snapPrice(BigDecimal price, SymbolRules rules) {
        if (rules != null && rules.getTickSize() != null && rules.getTickSize().signum() > 0) {
            return floorToStep(price, rules.getTickSize());
        }
        return price.setScale(settings.getFallbackPriceScale(), RoundingMode.HALF_UP);
    }

    BigDecimal snapQuantity(BigDecimal qty, SymbolRules rules) {
        if (rules != null && rules.getStepSize() != null && rules.getStepSize().signum() > 0) {
            return floorToStep(qty, rules.getStepSize());
        }
        return qty.setScale(settings.getFallbackQuantityScale(), RoundingMode.DOWN);
    }

    private static BigDecimal floorToStep(BigDecimal value, BigDecimal step) {
        BigDecimal steps = value.divide(step, 0, RoundingMode.DOWN);
        int scale = Math.max(0, step.stripTrailingZeros().scale());
        return steps.multiply(step).setScale(scale, RoundingMode.DOWN);
    }

    private static Optional<String> checkLimits(BigDecimal price, BigDecimal qty, SymbolRules rules) {
        if (price.signum() <= 0) return Optional.of("цена после округления = 0");
        if (qty.signum() <= 0) return Optional.of("количество после округления = 0");
        if (rules == null) return Optional.empty();
        if (rules.getMinQty() != null && qty.compareTo(rules.getMinQty()) < 0) {
            return Optional.of("количество " + qty.toPlainString() + " < minQty " + rules.getMinQty().toPlainString());
        }
        if (rules.getMinNotional() != null && price.multiply(qty).compareTo(rules.getMinNotional()) < 0) {
            return Optional.of("сумма " + price.multiply(qty).toPlainString()
                    + " < minNotional " + rules.getMinNotional().toPlainString());
        }
        return Optional.empty();
    }

    private static BigDecimal nz(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v;
    }
}
