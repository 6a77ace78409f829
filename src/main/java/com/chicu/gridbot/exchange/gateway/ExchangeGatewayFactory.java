package com.chicu.gridbot.exchange.gateway;

import com.chicu.gridbot.config.GridBotProperties;
import com.chicu.gridbot.exchange.client.ExchangeClient;
import com.chicu.gridbot.exchange.client.ExchangeClientFactory;
import com.chicu.gridbot.exchange.client.ExchangeError;
import com.chicu.gridbot.exchange.enums.Exchange;
import com.chicu.gridbot.exchange.enums.NetworkType;
import com.chicu.gridbot.exchange.model.ExchangeCredentials;
import com.chicu.gridbot.exchange.service.ApiCredentialsService;
import com.chicu.gridbot.trading.bot.BotSetupException;
import com.chicu.gridbot.trading.model.PairConfig;
import com.chicu.gridbot.util.Sleeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Собирает шлюз для пары: адаптер биржи + ключи для режима торговли.
 * Все ошибки настройки — {@link BotSetupException}, до запуска воркера.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExchangeGatewayFactory {

    private final ExchangeClientFactory clientFactory;
    private final ApiCredentialsService credentialsService;
    private final GridBotProperties properties;

    public ExchangeGateway create(PairConfig config) {
        Exchange exchange = Exchange.fromId(config.getExchange())
                .orElseThrow(() -> new BotSetupException("Неподдерживаемая биржа: " + config.getExchange()));
        if (config.getTradingMode() == null) {
            throw new BotSetupException("Не задан режим торговли для пары " + config.getPairId());
        }
        NetworkType network = config.getTradingMode().network();

        ExchangeClient client = clientFactory.find(exchange)
                .orElseThrow(() -> new BotSetupException("Нет адаптера для биржи " + exchange));

        ExchangeCredentials credentials = credentialsService.find(exchange, network)
                .orElseThrow(() -> new BotSetupException(
                        "Нет API-ключей для " + exchange + " " + config.getTradingMode()
                                + ": задайте переменные окружения или сохраните ключи"));

        ExchangeGateway gateway = new DefaultExchangeGateway(client, credentials, properties.getExchange(), Sleeper.THREAD);

        if (properties.getBot().isVerifyCredentialsOnStart()) {
            verify(gateway, config);
        }
        log.info("🔌 Шлюз {} {} для пары {} готов", exchange, network, config.getPairId());
        return gateway;
    }

    /** Пробный запрос баланса: отклонённые ключи не должны дойти до воркера. */
    private void verify(ExchangeGateway gateway, PairConfig config) {
        String quote = TradingSymbol.parse(config.getSymbol()).quote();
        ExchangeResult<BigDecimal> balance = gateway.getBalance(quote);
        if (balance.is(ExchangeError.AUTH_ERROR)) {
            throw new BotSetupException("Биржа отклонила API-ключи для пары " + config.getPairId()
                    + ": " + balance.getMessage());
        }
        if (!balance.isOk()) {
            // сеть/5xx при старте не повод отказывать: воркер повторит на тике
            log.warn("Проверка ключей для пары {} не удалась ({}), запускаем без неё",
                    config.getPairId(), balance.getError());
        }
    }
}
