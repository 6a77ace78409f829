package com.chicu.gridbot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Настройки грид-бота. Читаются из application.yml, префикс {@code gridbot}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "gridbot")
public class GridBotProperties {

    @Valid
    private Engine engine = new Engine();

    @Valid
    private Bot bot = new Bot();

    @Valid
    private ExchangeSettings exchange = new ExchangeSettings();

    @Data
    public static class Engine {
        /** Пауза между тиками воркера */
        @NotNull
        private Duration tickInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class Bot {
        /** Сколько ждать завершения воркера при остановке */
        @NotNull
        private Duration stopTimeout = Duration.ofSeconds(5);

        /** Обнулять позицию по символу при остановке пары */
        private boolean clearPositionOnStop = true;

        /** Проверять ключи запросом баланса до запуска воркера */
        private boolean verifyCredentialsOnStart = true;
    }

    @Data
    public static class ExchangeSettings {
        /** Пауза при rate limit, если биржа не сказала, сколько ждать */
        @NotNull
        private Duration rateLimitBackoff = Duration.ofSeconds(1);

        /** Минимальная сумма рыночной покупки в котируемой валюте */
        @NotNull
        @DecimalMin("0")
        private BigDecimal minNotional = new BigDecimal("6.0");

        /** Округление цены, если фильтры символа недоступны */
        @Min(0)
        private int fallbackPriceScale = 4;

        /** Округление количества, если фильтры символа недоступны */
        @Min(0)
        private int fallbackQuantityScale = 6;

        /** Сколько раз запрашивать исполнение рыночного ордера, если его нет в ответе на создание */
        @Min(1)
        private int marketFillPollAttempts = 3;

        /** Пауза между такими запросами */
        @NotNull
        private Duration marketFillPollInterval = Duration.ofMillis(500);
    }
}
