package com.chicu.gridbot.exchange.gateway;

import com.chicu.gridbot.exchange.enums.Exchange;
import com.chicu.gridbot.exchange.enums.OrderSide;

import java.math.BigDecimal;

/**
 * Торговые операции одного воркера на одной бирже. Символы — в формате {@code BASE/QUOTE}.
 * <p>
 * Методы не бросают исключений биржи: ошибки приходят в {@link ExchangeResult} / {@link OrderStatusSnapshot}.
 * Один повтор после rate limit шлюз делает сам.
 */
public interface ExchangeGateway {

    Exchange getExchange();

    ExchangeResult<BigDecimal> getPrice(String symbol);

    /** Свободный баланс; {@code AUTH_ERROR}, если биржа отвергла ключи. */
    ExchangeResult<BigDecimal> getBalance(String currency);

    /**
     * Рыночная покупка на сумму в котируемой валюте (не меньше минимальной).
     * При нехватке средств — {@code INSUFFICIENT_FUNDS} с required/available.
     * Если ордер создан, но исполнение не удалось получить, — {@code UNCONFIRMED} с orderId:
     * такой ордер сверяют через {@link #checkOrderStatus}, а не покупают заново.
     */
    ExchangeResult<MarketFill> marketBuy(String symbol, BigDecimal quoteAmount);

    ExchangeResult<PlacedOrder> placeLimitOrder(String symbol, OrderSide side, BigDecimal price, BigDecimal quantity);

    /** Отмена без гарантий: отсутствие ордера не ошибка. */
    void cancelOrder(String orderId, String symbol);

    /**
     * Отменить все открытые на бирже ордера символа.
     *
     * @return сколько ордеров отменено
     */
    int cancelAllOrders(String symbol);

    OrderStatusSnapshot checkOrderStatus(String orderId, String symbol);
}
