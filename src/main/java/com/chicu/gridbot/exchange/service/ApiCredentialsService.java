package com.chicu.gridbot.exchange.service;

import com.chicu.gridbot.exchange.enums.Exchange;
import com.chicu.gridbot.exchange.enums.NetworkType;
import com.chicu.gridbot.exchange.model.ExchangeCredentials;

import java.util.Optional;

public interface ApiCredentialsService {

    /**
     * Ключи для биржи и сети: сначала переменные окружения, затем таблица {@code exchange_api_keys}.
     * Заглушки вида {@code your_...} считаются отсутствующими.
     */
    Optional<ExchangeCredentials> find(Exchange exchange, NetworkType network);

    /** Сохранить/заменить ключи в БД. */
    void saveApiKeys(Exchange exchange, NetworkType network, String publicKey, String secretKey);
}
