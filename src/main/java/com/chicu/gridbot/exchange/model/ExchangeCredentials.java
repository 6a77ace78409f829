package com.chicu.gridbot.exchange.model;

import com.chicu.gridbot.exchange.enums.NetworkType;

/**
 * Ключи + сеть, с которыми адаптер биржи подписывает запросы.
 */
public record ExchangeCredentials(String apiKey, String secretKey, NetworkType network) {

    @Override
    public String toString() {
        // секрет в логи не попадает
        return "ExchangeCredentials[network=" + network + ", apiKey=" + mask(apiKey) + "]";
    }

    private static String mask(String key) {
        if (key == null || key.length() < 6) return "***";
        return key.substring(0, 4) + "***";
    }
}
