package com.chicu.gridbot.exchange.gateway;

import com.chicu.gridbot.exchange.client.ExchangeError;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Результат вызова шлюза: либо значение, либо тип ошибки с текстом.
 * Для {@link ExchangeError#INSUFFICIENT_FUNDS} дополнительно заполнен {@link #getShortfall()},
 * для {@link ExchangeError#UNCONFIRMED} — {@link #getOrderId()} принятого биржей ордера.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ExchangeResult<T> {

    private final T value;
    private final ExchangeError error;
    private final String message;
    private final FundsShortfall shortfall;
    private final String orderId;

    public static <T> ExchangeResult<T> ok(T value) {
        return new ExchangeResult<>(value, null, null, null, null);
    }

    public static <T> ExchangeResult<T> failure(ExchangeError error, String message) {
        return new ExchangeResult<>(null, error, message, null, null);
    }

    public static <T> ExchangeResult<T> insufficientFunds(BigDecimal required, BigDecimal available) {
        return new ExchangeResult<>(null, ExchangeError.INSUFFICIENT_FUNDS,
                "Недостаточно средств: нужно " + required.toPlainString() + ", доступно " + available.toPlainString(),
                new FundsShortfall(required, available), null);
    }

    public static <T> ExchangeResult<T> unconfirmed(String orderId, String message) {
        return new ExchangeResult<>(null, ExchangeError.UNCONFIRMED, message, null, orderId);
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean is(ExchangeError kind) {
        return error == kind;
    }
}
