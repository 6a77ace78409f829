package com.chicu.gridbot.exchange.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Поддерживаемые биржи. Имя enum совпадает с именем бина {@code ExchangeClient}.
 */
public enum Exchange {
    BINANCE,
    BYBIT;

    /** "binance" / "Binance" / " BYBIT " → enum; неизвестное имя → empty. */
    public static Optional<Exchange> fromId(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(id.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
