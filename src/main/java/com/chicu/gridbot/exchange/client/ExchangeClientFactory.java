package com.chicu.gridbot.exchange.client;

import com.chicu.gridbot.exchange.enums.Exchange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Реестр адаптеров бирж. Spring внедряет все бины {@link ExchangeClient},
 * ключом служит {@link ExchangeClient#getExchange()}.
 */
@Slf4j
@Component
public class ExchangeClientFactory {

    private final Map<Exchange, ExchangeClient> clients = new EnumMap<>(Exchange.class);

    public ExchangeClientFactory(List<ExchangeClient> all) {
        for (ExchangeClient c : all) {
            ExchangeClient prev = clients.put(c.getExchange(), c);
            if (prev != null) {
                throw new IllegalStateException("Два клиента для биржи " + c.getExchange()
                        + ": " + prev.getClass().getSimpleName() + ", " + c.getClass().getSimpleName());
            }
        }
        log.info("Зарегистрированы клиенты бирж: {}", clients.keySet());
    }

    public Optional<ExchangeClient> find(Exchange exchange) {
        return Optional.ofNullable(clients.get(exchange));
    }
}
