package com.chicu.gridbot.trading.engine;

import com.chicu.gridbot.config.GridBotProperties;
import com.chicu.gridbot.ledger.order.service.OrderLedger;
import com.chicu.gridbot.ledger.portfolio.service.PortfolioLedger;
import com.chicu.gridbot.ledger.trade.service.TradeLogService;
import com.chicu.gridbot.trading.bot.BotSetupException;
import com.chicu.gridbot.trading.model.PairConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class TradeLoopEngineFactoryTest {

    @Mock private OrderLedger orderLedger;
    @Mock private PortfolioLedger portfolio;
    @Mock private TradeLogService tradeLog;

    private TradeLoopEngineFactory factory;

    private final PairConfig valid = PairConfig.builder()
            .pairId("p-1")
            .symbol("ETH/USDC")
            .exchange("binance")
            .amount(new BigDecimal("10"))
            .buyPct(new BigDecimal("-1.5"))
            .sellPct(new BigDecimal("2"))
            .build();

    @BeforeEach
    void setUp() {
        factory = new TradeLoopEngineFactory(orderLedger, portfolio, tradeLog, new GridBotProperties());
    }

    @Test
    void validate_negativeBuyPct_isAccepted() {
        assertDoesNotThrow(() -> factory.validate(valid));
    }

    @Test
    void validate_shouldRejectBrokenSettings() {
        assertThrows(BotSetupException.class, () -> factory.validate(valid.toBuilder().pairId(" ").build()));
        assertThrows(BotSetupException.class, () -> factory.validate(valid.toBuilder().symbol("ETHUSDC").build()));
        assertThrows(BotSetupException.class, () -> factory.validate(valid.toBuilder().amount(BigDecimal.ZERO).build()));
        assertThrows(BotSetupException.class, () -> factory.validate(valid.toBuilder().sellPct(null).build()));
        assertThrows(BotSetupException.class, () -> factory.validate(valid.toBuilder().buyPct(BigDecimal.ZERO).build()));
        assertThrows(BotSetupException.class, () -> factory.validate(valid.toBuilder().buyPct(new BigDecimal("100")).build()));
        assertThrows(BotSetupException.class, () -> factory.validate(valid.toBuilder().profitMode(null).build()));
    }

    @Test
    void create_shouldBuildEngineWithFreshState() {
        TradeLoopEngine engine = factory.create(valid, null);

        GridState state = engine.newState();
        assertEquals("ETH/USDC", state.getSymbol());
        assertTrue(state.isLadderEmpty());
        assertEquals("p-1", engine.getStatus().getPairId());
        assertEquals(GridPhase.STARTING, engine.getStatus().getPhase());
    }
}
