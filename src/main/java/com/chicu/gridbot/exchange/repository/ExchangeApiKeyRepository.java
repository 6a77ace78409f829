package com.chicu.gridbot.exchange.repository;

import com.chicu.gridbot.exchange.model.ExchangeApiKey;
import com.chicu.gridbot.exchange.model.ExchangeApiKeyId;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ExchangeApiKeyRepository
        extends JpaRepository<ExchangeApiKey, ExchangeApiKeyId> { }
