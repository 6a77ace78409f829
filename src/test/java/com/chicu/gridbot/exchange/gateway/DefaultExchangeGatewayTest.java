package com.chicu.gridbot.exchange.gateway;

import com.chicu.gridbot.config.GridBotProperties;
import com.chicu.gridbot.exchange.client.ExchangeApiException;
import com.chicu.gridbot.exchange.client.ExchangeClient;
import com.chicu.gridbot.exchange.client.ExchangeError;
import com.chicu.gridbot.exchange.enums.NetworkType;
import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.enums.OrderType;
import com.chicu.gridbot.exchange.model.*;
import com.chicu.gridbot.util.Sleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DefaultExchangeGatewayTest {

    private static final String SYMBOL = "ETH/USDC";
    private static final String EX_SYMBOL = "ETHUSDC";

    @Mock private ExchangeClient client;
    @Mock private Sleeper sleeper;

    private final ExchangeCredentials credentials = new ExchangeCredentials("key-123456", "secret", NetworkType.TESTNET);

    private DefaultExchangeGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new DefaultExchangeGateway(client, credentials, new GridBotProperties.ExchangeSettings(), sleeper);
    }

    private static SymbolRules ethRules() {
        return SymbolRules.builder()
                .tickSize(new BigDecimal("0.01"))
                .stepSize(new BigDecimal("0.0001"))
                .minQty(new BigDecimal("0.0001"))
                .minNotional(new BigDecimal("5"))
                .build();
    }

    private static ExchangeApiException rateLimited(Long retryAfterMs) {
        return ExchangeApiException.rateLimited("429 Too Many Requests", retryAfterMs, null);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertNotNull(actual);
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "ожидали " + expected + ", было " + actual);
    }

    /* ====================== rate limit ====================== */

    @Test
    void placeLimitOrder_rateLimitedOnce_shouldWaitAndRetrySuccessfully() throws Exception {
        when(client.getSymbolRules(EX_SYMBOL, NetworkType.TESTNET)).thenReturn(ethRules());
        when(client.placeOrder(eq(credentials), any(OrderRequest.class)))
                .thenThrow(rateLimited(2000L))
                .thenReturn(OrderResponse.builder().orderId("42").status("NEW").build());

        ExchangeResult<PlacedOrder> r = gateway.placeLimitOrder(SYMBOL, OrderSide.SELL,
                new BigDecimal("102.345"), new BigDecimal("0.123456"));

        assertTrue(r.isOk(), "после одного rate limit ордер выставлен: " + r.getMessage());
        assertEquals("42", r.getValue().getOrderId());
        verify(sleeper, times(1)).sleep(Duration.ofMillis(2000));
        verify(client, times(2)).placeOrder(eq(credentials), any(OrderRequest.class));
    }

    @Test
    void placeLimitOrder_rateLimitedTwice_shouldReturnFailure() throws Exception {
        when(client.getSymbolRules(EX_SYMBOL, NetworkType.TESTNET)).thenReturn(ethRules());
        when(client.placeOrder(eq(credentials), any(OrderRequest.class)))
                .thenThrow(rateLimited(null))
                .thenThrow(rateLimited(null));

        ExchangeResult<PlacedOrder> r = gateway.placeLimitOrder(SYMBOL, OrderSide.BUY,
                new BigDecimal("99"), new BigDecimal("0.1"));

        assertTrue(r.is(ExchangeError.RATE_LIMITED));
        // биржа не сказала, сколько ждать → пауза из настроек
        verify(sleeper, times(1)).sleep(Duration.ofSeconds(1));
        verify(client, times(2)).placeOrder(eq(credentials), any(OrderRequest.class));
    }

    @Test
    void withRateLimitRetry_interruptedPause_shouldBecomeTransient() throws Exception {
        doThrow(new InterruptedException()).when(sleeper).sleep(any());

        ExchangeApiException e = assertThrows(ExchangeApiException.class,
                () -> gateway.withRateLimitRetry("op", () -> {
                    throw rateLimited(10L);
                }));

        assertEquals(ExchangeError.TRANSIENT, e.getError());
        assertTrue(Thread.interrupted(), "флаг прерывания восстановлен");
    }

    @Test
    void withRateLimitRetry_otherErrors_shouldNotRetry() {
        assertThrows(ExchangeApiException.class, () -> gateway.withRateLimitRetry("op", () -> {
            throw new ExchangeApiException(ExchangeError.AUTH_ERROR, "bad key");
        }));
        verifyNoInteractions(sleeper);
    }

    /* ====================== точность ====================== */

    @Test
    void placeLimitOrder_shouldSnapPriceAndQuantityToSymbolFilters() {
        when(client.getSymbolRules(EX_SYMBOL, NetworkType.TESTNET)).thenReturn(ethRules());
        when(client.placeOrder(eq(credentials), any(OrderRequest.class)))
                .thenReturn(OrderResponse.builder().orderId("7").status("NEW").build());

        ExchangeResult<PlacedOrder> r = gateway.placeLimitOrder(SYMBOL, OrderSide.SELL,
                new BigDecimal("102.3456"), new BigDecimal("0.123456"));

        ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
        verify(client).placeOrder(eq(credentials), captor.capture());
        OrderRequest sent = captor.getValue();
        assertEquals(EX_SYMBOL, sent.getSymbol());
        assertEquals(OrderType.LIMIT, sent.getType());
        assertAmount("102.34", sent.getPrice());
        assertAmount("0.1234", sent.getQuantity());

        assertAmount("102.34", r.getValue().getPrice());
        assertAmount("0.1234", r.getValue().getQuantity());
    }

    @Test
    void placeLimitOrder_rulesUnavailable_shouldUseFallbackScales() {
        when(client.getSymbolRules(EX_SYMBOL, NetworkType.TESTNET))
                .thenThrow(new ExchangeApiException(ExchangeError.TRANSIENT, "exchangeInfo timeout"));
        when(client.placeOrder(eq(credentials), any(OrderRequest.class)))
                .thenReturn(OrderResponse.builder().orderId("8").status("NEW").build());

        ExchangeResult<PlacedOrder> r = gateway.placeLimitOrder(SYMBOL, OrderSide.BUY,
                new BigDecimal("100.123456"), new BigDecimal("0.1234567"));

        assertTrue(r.isOk());
        assertAmount("100.1235", r.getValue().getPrice());
        assertAmount("0.123456", r.getValue().getQuantity());
    }

    @Test
    void placeLimitOrder_belowMinNotional_shouldRejectWithoutCallingExchange() {
        when(client.getSymbolRules(EX_SYMBOL, NetworkType.TESTNET)).thenReturn(ethRules());

        ExchangeResult<PlacedOrder> r = gateway.placeLimitOrder(SYMBOL, OrderSide.BUY,
                new BigDecimal("10"), new BigDecimal("0.1"));

        assertTrue(r.is(ExchangeError.REJECTED));
        assertTrue(r.getMessage().contains("minNotional"), r.getMessage());
        verify(client, never()).placeOrder(any(), any());
    }

    @Test
    void placeLimitOrder_invalidInput_shouldRejectImmediately() {
        ExchangeResult<PlacedOrder> r = gateway.placeLimitOrder(SYMBOL, OrderSide.BUY, BigDecimal.ZERO, BigDecimal.ONE);

        assertTrue(r.is(ExchangeError.REJECTED));
        verifyNoInteractions(client);
    }

    /* ====================== рыночная покупка ====================== */

    @Test
    void marketBuy_amountBelowMinimum_shouldBeRaisedToMinNotional() {
        when(client.getFreeBalances(credentials)).thenReturn(Map.of("USDC", new BigDecimal("100")));
        when(client.supportsQuoteMarketBuy()).thenReturn(true);
        when(client.placeOrder(eq(credentials), any(OrderRequest.class))).thenReturn(OrderResponse.builder()
                .orderId("m-1").status("FILLED")
                .executedQty(new BigDecimal("0.06"))
                .quoteQty(new BigDecimal("6.0"))
                .build());

        ExchangeResult<MarketFill> r = gateway.marketBuy(SYMBOL, new BigDecimal("5"));

        ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
        verify(client).placeOrder(eq(credentials), captor.capture());
        assertEquals(OrderType.MARKET, captor.getValue().getType());
        assertAmount("6.0", captor.getValue().getQuoteQuantity());
        assertNull(captor.getValue().getQuantity());

        assertTrue(r.isOk(), r.getMessage());
        assertAmount("0.06", r.getValue().getFilledQty());
        assertAmount("100", r.getValue().getAvgPrice());
        assertAmount("6.0", r.getValue().getCost());
    }

    @Test
    void marketBuy_notEnoughQuote_shouldReturnShortfallWithoutOrder() {
        when(client.getFreeBalances(credentials)).thenReturn(Map.of("USDC", new BigDecimal("3.5")));

        ExchangeResult<MarketFill> r = gateway.marketBuy(SYMBOL, new BigDecimal("10"));

        assertTrue(r.is(ExchangeError.INSUFFICIENT_FUNDS));
        assertAmount("10", r.getShortfall().required());
        assertAmount("3.5", r.getShortfall().available());
        verify(client, never()).placeOrder(any(), any());
    }

    @Test
    void marketBuy_exchangeWithoutQuoteOrders_shouldSendBaseQuantity() {
        when(client.getFreeBalances(credentials)).thenReturn(Map.of("USDC", new BigDecimal("50")));
        when(client.supportsQuoteMarketBuy()).thenReturn(false);
        when(client.getLastPrice(EX_SYMBOL, NetworkType.TESTNET)).thenReturn(new BigDecimal("3000"));
        when(client.getSymbolRules(EX_SYMBOL, NetworkType.TESTNET)).thenReturn(ethRules());
        when(client.placeOrder(eq(credentials), any(OrderRequest.class))).thenReturn(OrderResponse.builder()
                .orderId("m-2").status("FILLED")
                .executedQty(new BigDecimal("0.0033"))
                .avgPrice(new BigDecimal("3001"))
                .build());

        ExchangeResult<MarketFill> r = gateway.marketBuy(SYMBOL, new BigDecimal("10"));

        ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
        verify(client).placeOrder(eq(credentials), captor.capture());
        // 10 / 3000 = 0.00333…, вниз до шага 0.0001
        assertAmount("0.0033", captor.getValue().getQuantity());
        assertNull(captor.getValue().getQuoteQuantity());

        assertTrue(r.isOk());
        assertAmount("3001", r.getValue().getAvgPrice());
    }

    @Test
    void marketBuy_fillMissingFromCreate_shouldPollOrderWithoutResending() throws Exception {
        when(client.getFreeBalances(credentials)).thenReturn(Map.of("USDC", new BigDecimal("100")));
        when(client.supportsQuoteMarketBuy()).thenReturn(true);
        when(client.placeOrder(eq(credentials), any(OrderRequest.class))).thenReturn(OrderResponse.builder()
                .orderId("m-3").status("NEW").executedQty(BigDecimal.ZERO).build());
        when(client.getOrder(credentials, EX_SYMBOL, "m-3"))
                .thenThrow(rateLimited(null))
                .thenReturn(Optional.of(OrderInfo.builder()
                        .orderId("m-3").status("FILLED")
                        .executedQty(new BigDecimal("0.1"))
                        .quoteQty(new BigDecimal("10"))
                        .build()));

        ExchangeResult<MarketFill> r = gateway.marketBuy(SYMBOL, new BigDecimal("10"));

        assertTrue(r.isOk(), r.getMessage());
        assertEquals("m-3", r.getValue().getOrderId());
        assertAmount("100", r.getValue().getAvgPrice());
        verify(client, times(1)).placeOrder(eq(credentials), any(OrderRequest.class));
        verify(sleeper).sleep(Duration.ofSeconds(1));
    }

    @Test
    void marketBuy_fillNeverConfirmed_shouldReturnUnconfirmedWithOrderId() throws Exception {
        when(client.getFreeBalances(credentials)).thenReturn(Map.of("USDC", new BigDecimal("100")));
        when(client.supportsQuoteMarketBuy()).thenReturn(true);
        when(client.placeOrder(eq(credentials), any(OrderRequest.class))).thenReturn(OrderResponse.builder()
                .orderId("m-4").status("NEW").executedQty(BigDecimal.ZERO).build());
        when(client.getOrder(credentials, EX_SYMBOL, "m-4"))
                .thenThrow(new ExchangeApiException(ExchangeError.TRANSIENT, "read timeout"));

        ExchangeResult<MarketFill> r = gateway.marketBuy(SYMBOL, new BigDecimal("10"));

        assertTrue(r.is(ExchangeError.UNCONFIRMED), "ожидали UNCONFIRMED, было " + r.getError());
        assertEquals("m-4", r.getOrderId());
        verify(client, times(1)).placeOrder(eq(credentials), any(OrderRequest.class));
        verify(client, times(3)).getOrder(credentials, EX_SYMBOL, "m-4");
        verify(sleeper, times(2)).sleep(Duration.ofMillis(500));
    }

    @Test
    void marketBuy_rateLimitedCreate_shouldRetryCreateOnce() throws Exception {
        when(client.getFreeBalances(credentials)).thenReturn(Map.of("USDC", new BigDecimal("100")));
        when(client.supportsQuoteMarketBuy()).thenReturn(true);
        when(client.placeOrder(eq(credentials), any(OrderRequest.class)))
                .thenThrow(rateLimited(300L))
                .thenReturn(OrderResponse.builder()
                        .orderId("m-5").status("FILLED")
                        .executedQty(new BigDecimal("0.1"))
                        .avgPrice(new BigDecimal("100"))
                        .build());

        ExchangeResult<MarketFill> r = gateway.marketBuy(SYMBOL, new BigDecimal("10"));

        assertTrue(r.isOk(), r.getMessage());
        verify(client, times(2)).placeOrder(eq(credentials), any(OrderRequest.class));
        verify(client, never()).getOrder(any(), anyString(), anyString());
        verify(sleeper).sleep(Duration.ofMillis(300));
    }

    @Test
    void marketBuy_balanceAuthError_shouldPropagateKind() {
        when(client.getFreeBalances(credentials))
                .thenThrow(new ExchangeApiException(ExchangeError.AUTH_ERROR, "Invalid API-key"));

        ExchangeResult<MarketFill> r = gateway.marketBuy(SYMBOL, new BigDecimal("10"));

        assertTrue(r.is(ExchangeError.AUTH_ERROR));
        verify(client, never()).placeOrder(any(), any());
    }

    /* ====================== отмена и статус ====================== */

    @Test
    void cancelOrder_unknownOrder_shouldBeIgnored() {
        doThrow(new ExchangeApiException(ExchangeError.NOT_FOUND, "Unknown order sent"))
                .when(client).cancelOrder(credentials, EX_SYMBOL, "404");

        assertDoesNotThrow(() -> gateway.cancelOrder("404", SYMBOL));
        verify(client, times(1)).cancelOrder(credentials, EX_SYMBOL, "404");
    }

    @Test
    void cancelAllOrders_shouldCancelEachOpenOrderAndCountSuccesses() {
        when(client.getOpenOrders(credentials, EX_SYMBOL)).thenReturn(List.of(
                OrderInfo.builder().orderId("1").build(),
                OrderInfo.builder().orderId("2").build(),
                OrderInfo.builder().orderId("3").build()));
        doAnswer(inv -> {
            if ("2".equals(inv.getArgument(2))) {
                throw new ExchangeApiException(ExchangeError.NOT_FOUND, "gone");
            }
            return null;
        }).when(client).cancelOrder(eq(credentials), eq(EX_SYMBOL), anyString());

        int cancelled = gateway.cancelAllOrders(SYMBOL);

        assertEquals(2, cancelled);
        verify(client).cancelOrder(credentials, EX_SYMBOL, "1");
        verify(client).cancelOrder(credentials, EX_SYMBOL, "3");
    }

    @Test
    void checkOrderStatus_shouldNormalizeExchangeStatus() {
        when(client.getOrder(credentials, EX_SYMBOL, "5")).thenReturn(Optional.of(OrderInfo.builder()
                .orderId("5").status("PARTIALLY_FILLED")
                .origQty(new BigDecimal("1.0"))
                .executedQty(new BigDecimal("0.4"))
                .build()));
        when(client.getOrder(credentials, EX_SYMBOL, "6")).thenReturn(Optional.empty());
        when(client.getOrder(credentials, EX_SYMBOL, "7"))
                .thenThrow(new ExchangeApiException(ExchangeError.TRANSIENT, "HTTP 503"));

        OrderStatusSnapshot partial = gateway.checkOrderStatus("5", SYMBOL);
        assertEquals(OrderState.OPEN, partial.getState());
        assertAmount("0.4", partial.getFilled());
        assertAmount("0.6", partial.getRemaining());

        assertEquals(OrderState.NOT_FOUND, gateway.checkOrderStatus("6", SYMBOL).getState());

        OrderStatusSnapshot failed = gateway.checkOrderStatus("7", SYMBOL);
        assertEquals(OrderState.ERROR, failed.getState());
        assertEquals("HTTP 503", failed.getMessage());
    }

    @Test
    void mapState_shouldCoverExchangeStatuses() {
        assertEquals(OrderState.OPEN, DefaultExchangeGateway.mapState("NEW"));
        assertEquals(OrderState.OPEN, DefaultExchangeGateway.mapState("partially_filled"));
        assertEquals(OrderState.CLOSED, DefaultExchangeGateway.mapState("FILLED"));
        assertEquals(OrderState.CANCELED, DefaultExchangeGateway.mapState("CANCELED"));
        assertEquals(OrderState.CANCELED, DefaultExchangeGateway.mapState("EXPIRED"));
        assertEquals(OrderState.CANCELED, DefaultExchangeGateway.mapState("REJECTED"));
        assertEquals(OrderState.ERROR, DefaultExchangeGateway.mapState("WHATEVER"));
        assertEquals(OrderState.ERROR, DefaultExchangeGateway.mapState(null));
    }
}
