package com.chicu.gridbot.ledger.order.service;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.ledger.order.model.OpenOrderEntity;
import com.chicu.gridbot.ledger.order.repository.OpenOrderRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(OrderLedger.class)
class OrderLedgerTest {

    private static final String SYMBOL = "ETH/USDC";

    @Autowired private OrderLedger ledger;
    @Autowired private OpenOrderRepository repo;

    @Test
    void setOrder_buy_shouldKeepSingleRowPerSymbol() {
        ledger.setOrder(SYMBOL, OrderSide.BUY, new BigDecimal("99"), new BigDecimal("0.1"), "b-1", "binance");
        ledger.setOrder(SYMBOL, OrderSide.BUY, new BigDecimal("98"), new BigDecimal("0.102"), "b-2", "binance");

        List<OpenOrderEntity> buys = ledger.findOpenOrders(SYMBOL, OrderSide.BUY);
        assertEquals(1, buys.size(), "BUY — одна строка на символ");
        assertEquals("b-2", buys.get(0).getOrderId());
        assertEquals(0, new BigDecimal("98").compareTo(buys.get(0).getPrice()));
        assertEquals("b-2", ledger.findOrder(SYMBOL, OrderSide.BUY).orElseThrow().getOrderId());
    }

    @Test
    void setOrder_sameSellTwice_shouldBeIdempotent() {
        ledger.setSellOrder(SYMBOL, new BigDecimal("102"), new BigDecimal("0.1"), "s-1", "binance",
                new BigDecimal("100"), BigDecimal.ZERO);
        ledger.setSellOrder(SYMBOL, new BigDecimal("102"), new BigDecimal("0.1"), "s-1", "binance",
                new BigDecimal("100"), BigDecimal.ZERO);
        ledger.setSellOrder(SYMBOL, new BigDecimal("101"), new BigDecimal("0.1"), "s-2", "binance",
                new BigDecimal("99"), BigDecimal.ZERO);

        List<OpenOrderEntity> sells = ledger.findOpenOrders(SYMBOL, OrderSide.SELL);
        assertEquals(2, sells.size(), "SELL — строка на каждый orderId");
        OpenOrderEntity first = repo.findBySymbolAndSideAndOrderId(SYMBOL, OrderSide.SELL, "s-1").orElseThrow();
        assertEquals(0, new BigDecimal("100").compareTo(first.getBuyPrice()), "цена покупки сохранена");
        assertEquals(OrderLedger.STATUS_OPEN, first.getStatus());
    }

    @Test
    void updateFill_shouldStorePartialFill() {
        ledger.setSellOrder(SYMBOL, new BigDecimal("102"), new BigDecimal("0.1"), "s-1", "binance",
                new BigDecimal("100"), BigDecimal.ZERO);

        assertTrue(ledger.updateFill(SYMBOL, "s-1", new BigDecimal("0.04"), null).isPresent());
        assertTrue(ledger.updateFill(SYMBOL, "missing", BigDecimal.ONE, null).isEmpty());

        OpenOrderEntity e = repo.findBySymbolAndOrderId(SYMBOL, "s-1").orElseThrow();
        assertEquals(0, new BigDecimal("0.04").compareTo(e.getFilledQty()));
        assertEquals(OrderLedger.STATUS_OPEN, e.getStatus(), "null статус не затирает прежний");
    }

    @Test
    void remove_shouldAffectOnlyRequestedSymbolAndSide() {
        ledger.setOrder(SYMBOL, OrderSide.BUY, new BigDecimal("99"), new BigDecimal("0.1"), "b-1", "binance");
        ledger.setSellOrder(SYMBOL, new BigDecimal("102"), new BigDecimal("0.1"), "s-1", "binance",
                new BigDecimal("100"), BigDecimal.ZERO);
        ledger.setSellOrder(SYMBOL, new BigDecimal("103"), new BigDecimal("0.1"), "s-2", "binance",
                new BigDecimal("101"), BigDecimal.ZERO);
        ledger.setOrder("BTC/USDT", OrderSide.BUY, new BigDecimal("60000"), new BigDecimal("0.001"), "b-9", "bybit");

        assertTrue(ledger.removeOrder(SYMBOL, "s-1"));
        assertFalse(ledger.removeOrder(SYMBOL, "s-1"), "повторное удаление ничего не находит");
        assertEquals(1, ledger.removeSide(SYMBOL, OrderSide.BUY));
        assertEquals(1, ledger.findOpenOrders(SYMBOL).size());

        assertEquals(1, ledger.removeAll(SYMBOL));
        assertTrue(ledger.findOpenOrders(SYMBOL).isEmpty());
        assertEquals(1, ledger.findOpenOrders("BTC/USDT").size(), "другой символ не тронут");
    }
}
