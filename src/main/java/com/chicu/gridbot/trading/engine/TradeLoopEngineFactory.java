package com.chicu.gridbot.trading.engine;

import com.chicu.gridbot.config.GridBotProperties;
import com.chicu.gridbot.exchange.gateway.ExchangeGateway;
import com.chicu.gridbot.exchange.gateway.TradingSymbol;
import com.chicu.gridbot.ledger.order.service.OrderLedger;
import com.chicu.gridbot.ledger.portfolio.service.PortfolioLedger;
import com.chicu.gridbot.ledger.trade.service.TradeLogService;
import com.chicu.gridbot.trading.bot.BotSetupException;
import com.chicu.gridbot.trading.model.PairConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;

@Component
@RequiredArgsConstructor
public class TradeLoopEngineFactory {

    private final OrderLedger orderLedger;
    private final PortfolioLedger portfolio;
    private final TradeLogService tradeLog;
    private final GridBotProperties properties;

    public TradeLoopEngine create(PairConfig config, ExchangeGateway gateway) {
        return new TradeLoopEngine(config, gateway, orderLedger, portfolio, tradeLog,
                properties.getEngine().getTickInterval(), Clock.systemUTC());
    }

    /** Проверка настроек пары до создания шлюза. */
    public void validate(PairConfig config) {
        if (config.getPairId() == null || config.getPairId().isBlank()) {
            throw new BotSetupException("Не задан pairId");
        }
        try {
            TradingSymbol.parse(config.getSymbol());
        } catch (IllegalArgumentException e) {
            throw new BotSetupException(e.getMessage(), e);
        }
        requirePositive(config.getAmount(), "amount", config);
        requirePositive(config.getSellPct(), "sellPct", config);
        if (config.getBuyPct() == null || config.getBuyPct().signum() == 0
                || config.getBuyPct().abs().compareTo(BigDecimal.valueOf(100)) >= 0) {
            throw new BotSetupException("Пара " + config.getPairId() + ": buyPct должен быть в (0, 100) по модулю");
        }
        if (config.getProfitMode() == null) {
            throw new BotSetupException("Пара " + config.getPairId() + ": не задан режим прибыли");
        }
    }

    private static void requirePositive(BigDecimal v, String name, PairConfig config) {
        if (v == null || v.signum() <= 0) {
            throw new BotSetupException("Пара " + config.getPairId() + ": " + name + " должен быть > 0");
        }
    }
}
