package com.chicu.gridbot.exchange.client;

/**
 * Классификация ошибок биржи. Адаптеры приводят к ней коды конкретных API,
 * дальше по стеку никто не разбирает сырые ответы.
 */
public enum ExchangeError {
    /** Неверные/отсутствующие ключи. Не ретраится. */
    AUTH_ERROR,
    /** Не хватает баланса под ордер. */
    INSUFFICIENT_FUNDS,
    /** Превышен лимит запросов. Один повтор после паузы. */
    RATE_LIMITED,
    /** Ордер не найден (исполнен давно, отменён, чужой id). */
    NOT_FOUND,
    /** Сеть, таймаут, 5xx. Повтор на следующем тике. */
    TRANSIENT,
    /** Биржа отклонила запрос (фильтры, неверный символ и т.п.). */
    REJECTED,
    /** Ответ не разобрать или в нём нет обязательных полей. */
    INVALID_RESPONSE,
    /** Ордер принят биржей, но исполнение пока не подтверждено. Повторять нельзя, только сверять по orderId. */
    UNCONFIRMED
}
