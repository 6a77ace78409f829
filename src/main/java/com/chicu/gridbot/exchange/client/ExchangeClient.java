package com.chicu.gridbot.exchange.client;

import com.chicu.gridbot.exchange.enums.Exchange;
import com.chicu.gridbot.exchange.enums.NetworkType;
import com.chicu.gridbot.exchange.model.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Адаптер REST API одной биржи. Символы — в биржевом формате ({@code ETHUSDC}).
 * <p>
 * Все методы при ошибке бросают {@link ExchangeApiException} с типом из {@link ExchangeError};
 * молча подменять ответ дефолтами адаптер не должен.
 */
public interface ExchangeClient {

    Exchange getExchange();

    /**
     * Умеет ли биржа MARKET BUY на сумму в котируемой валюте
     * (Binance {@code quoteOrderQty}). Если нет — количество считает вызывающий.
     */
    boolean supportsQuoteMarketBuy();

    /** Цена последней сделки. */
    BigDecimal getLastPrice(String symbol, NetworkType network);

    /** Фильтры символа. Поля, которых биржа не отдала, остаются {@code null}. */
    SymbolRules getSymbolRules(String symbol, NetworkType network);

    /** Свободные балансы: актив → free. */
    Map<String, BigDecimal> getFreeBalances(ExchangeCredentials credentials);

    OrderResponse placeOrder(ExchangeCredentials credentials, OrderRequest request);

    /**
     * Информация по ордеру.
     *
     * @return empty, если биржа ордер не знает
     */
    Optional<OrderInfo> getOrder(ExchangeCredentials credentials, String symbol, String orderId);

    /** Открытые ордера по символу. */
    List<OrderInfo> getOpenOrders(ExchangeCredentials credentials, String symbol);

    /** Отмена. Если ордера нет — {@link ExchangeError#NOT_FOUND}. */
    void cancelOrder(ExchangeCredentials credentials, String symbol, String orderId);
}
