package com.chicu.gridbot.exchange.gateway;

import java.util.Locale;

/**
 * Пара в виде {@code BASE/QUOTE}. Биржевой символ — без разделителя ({@code ETHUSDC}).
 */
public record TradingSymbol(String base, String quote) {

    public static TradingSymbol parse(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Символ не задан");
        }
        String[] parts = symbol.trim().toUpperCase(Locale.ROOT).split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Символ должен быть в формате BASE/QUOTE: " + symbol);
        }
        return new TradingSymbol(parts[0], parts[1]);
    }

    public String exchangeSymbol() {
        return base + quote;
    }

    @Override
    public String toString() {
        return base + "/" + quote;
    }
}
