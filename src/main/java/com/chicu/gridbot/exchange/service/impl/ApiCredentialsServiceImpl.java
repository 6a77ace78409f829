package com.chicu.gridbot.exchange.service.impl;

import com.chicu.gridbot.exchange.enums.Exchange;
import com.chicu.gridbot.exchange.enums.NetworkType;
import com.chicu.gridbot.exchange.model.ExchangeApiKey;
import com.chicu.gridbot.exchange.model.ExchangeApiKeyId;
import com.chicu.gridbot.exchange.model.ExchangeCredentials;
import com.chicu.gridbot.exchange.repository.ExchangeApiKeyRepository;
import com.chicu.gridbot.exchange.service.ApiCredentialsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ApiCredentialsServiceImpl implements ApiCredentialsService {

    private static final String PLACEHOLDER_PREFIX = "your_";

    private final Environment environment;
    private final ExchangeApiKeyRepository apiKeyRepo;

    @Override
    @Transactional(readOnly = true)
    public Optional<ExchangeCredentials> find(Exchange exchange, NetworkType network) {
        String prefix = exchange.name() + "_" + modeName(network);
        String apiKey = environment.getProperty(prefix + "_API_KEY");
        String secret = environment.getProperty(prefix + "_SECRET_KEY");

        if (isMissing(apiKey) || isMissing(secret)) {
            Optional<ExchangeApiKey> stored = apiKeyRepo.findById(
                    ExchangeApiKeyId.builder().exchange(exchange).network(network).build());
            if (isMissing(apiKey)) apiKey = stored.map(ExchangeApiKey::getPublicKey).orElse(null);
            if (isMissing(secret)) secret = stored.map(ExchangeApiKey::getSecretKey).orElse(null);
        }

        if (isMissing(apiKey) || isMissing(secret)) {
            log.warn("🔑 Нет API-ключей для {} {} (переменные {}_API_KEY/{}_SECRET_KEY или exchange_api_keys)",
                    exchange, network, prefix, prefix);
            return Optional.empty();
        }
        return Optional.of(new ExchangeCredentials(apiKey.trim(), secret.trim(), network));
    }

    @Override
    @Transactional
    public void saveApiKeys(Exchange exchange, NetworkType network, String publicKey, String secretKey) {
        ExchangeApiKeyId id = ExchangeApiKeyId.builder()
                .exchange(exchange)
                .network(network)
                .build();
        apiKeyRepo.save(ExchangeApiKey.builder()
                .id(id)
                .publicKey(publicKey)
                .secretKey(secretKey)
                .build());
        log.info("🔑 Ключи {} {} сохранены", exchange, network);
    }

    /** BINANCE_REAL_API_KEY / BINANCE_TESTNET_API_KEY. */
    private static String modeName(NetworkType network) {
        return network == NetworkType.MAINNET ? "REAL" : "TESTNET";
    }

    private static boolean isMissing(String v) {
        return v == null || v.isBlank() || v.trim().startsWith(PLACEHOLDER_PREFIX);
    }
}
