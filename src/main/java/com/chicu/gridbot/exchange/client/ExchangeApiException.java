package com.chicu.gridbot.exchange.client;

import lombok.Getter;

/**
 * Ошибка вызова API биржи с уже определённым типом.
 */
@Getter
public class ExchangeApiException extends RuntimeException {

    private final ExchangeError error;

    /** Рекомендованная биржей пауза перед повтором, мс. {@code null}, если биржа не сказала. */
    private final Long retryAfterMs;

    public ExchangeApiException(ExchangeError error, String message) {
        this(error, message, null, null);
    }

    public ExchangeApiException(ExchangeError error, String message, Throwable cause) {
        this(error, message, null, cause);
    }

    public ExchangeApiException(ExchangeError error, String message, Long retryAfterMs, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.retryAfterMs = retryAfterMs;
    }

    public static ExchangeApiException rateLimited(String message, Long retryAfterMs, Throwable cause) {
        return new ExchangeApiException(ExchangeError.RATE_LIMITED, message, retryAfterMs, cause);
    }
}
