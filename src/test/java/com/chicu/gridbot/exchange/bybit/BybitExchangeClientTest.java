package com.chicu.gridbot.exchange.bybit;

import com.chicu.gridbot.config.GridBotProperties;
import com.chicu.gridbot.exchange.client.ExchangeApiException;
import com.chicu.gridbot.exchange.client.ExchangeError;
import com.chicu.gridbot.exchange.enums.NetworkType;
import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.enums.OrderType;
import com.chicu.gridbot.exchange.gateway.DefaultExchangeGateway;
import com.chicu.gridbot.exchange.gateway.ExchangeResult;
import com.chicu.gridbot.exchange.gateway.MarketFill;
import com.chicu.gridbot.exchange.model.ExchangeCredentials;
import com.chicu.gridbot.exchange.model.OrderInfo;
import com.chicu.gridbot.exchange.model.OrderRequest;
import com.chicu.gridbot.exchange.model.OrderResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class BybitExchangeClientTest {

    private static final String BASE = "https://api-testnet.bybit.com";

    private MockRestServiceServer server;
    private BybitExchangeClient client;

    private final ExchangeCredentials creds = new ExchangeCredentials("bybit-key", "bybit-secret", NetworkType.TESTNET);

    @BeforeEach
    void setUp() {
        RestTemplate rest = new RestTemplate();
        server = MockRestServiceServer.bindTo(rest).build();
        client = new BybitExchangeClient(rest, new ObjectMapper());
        ReflectionTestUtils.setField(client, "testnetBaseUrl", BASE);
        ReflectionTestUtils.setField(client, "mainnetBaseUrl", "https://api.bybit.com");
    }

    private void respond(String pathPrefix, String json) {
        server.expect(requestTo(startsWith(BASE + pathPrefix)))
                .andRespond(withSuccess(json, MediaType.APPLICATION_JSON));
    }

    private ExchangeError errorFor(int retCode) {
        respond("/v5/market/tickers", "{\"retCode\":" + retCode + ",\"retMsg\":\"err\",\"result\":{}}");
        ExchangeApiException e = assertThrows(ExchangeApiException.class,
                () -> client.getLastPrice("ETHUSDT", NetworkType.TESTNET));
        server.reset();
        return e.getError();
    }

    @Test
    void retCodes_shouldMapToErrorKinds() {
        assertEquals(ExchangeError.RATE_LIMITED, errorFor(10006));
        assertEquals(ExchangeError.AUTH_ERROR, errorFor(10003));
        assertEquals(ExchangeError.NOT_FOUND, errorFor(110001));
        assertEquals(ExchangeError.INSUFFICIENT_FUNDS, errorFor(170131));
        assertEquals(ExchangeError.TRANSIENT, errorFor(10016));
        assertEquals(ExchangeError.REJECTED, errorFor(170140));
    }

    @Test
    void getLastPrice_shouldReadFirstTicker() {
        respond("/v5/market/tickers?category=spot&symbol=ETHUSDT",
                "{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{\"list\":[{\"symbol\":\"ETHUSDT\",\"lastPrice\":\"3012.4\"}]}}");

        assertEquals(new BigDecimal("3012.4"), client.getLastPrice("ETHUSDT", NetworkType.TESTNET));
        server.verify();
    }

    @Test
    void getFreeBalances_emptyAvailable_shouldFallBackToWalletMinusLocked() {
        server.expect(requestTo(startsWith(BASE + "/v5/account/wallet-balance")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("X-BAPI-API-KEY", "bybit-key"))
                .andRespond(withSuccess("""
                        {"retCode":0,"retMsg":"OK","result":{"list":[{"coin":[
                          {"coin":"USDT","walletBalance":"100","locked":"30","availableToWithdraw":""},
                          {"coin":"ETH","walletBalance":"1","locked":"0","availableToWithdraw":"0.5"}
                        ]}]}}
                        """, MediaType.APPLICATION_JSON));

        Map<String, BigDecimal> balances = client.getFreeBalances(creds);

        assertEquals(0, new BigDecimal("70").compareTo(balances.get("USDT")));
        assertEquals(0, new BigDecimal("0.5").compareTo(balances.get("ETH")));
    }

    @Test
    void getOrder_notInRealtime_shouldLookInHistoryAndNormalizeStatus() {
        respond("/v5/order/realtime", "{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{\"list\":[]}}");
        respond("/v5/order/history", """
                {"retCode":0,"retMsg":"OK","result":{"list":[{"orderId":"b-1","symbol":"ETHUSDT","side":"Buy",
                 "orderType":"Limit","orderStatus":"Filled","price":"2990","qty":"0.01",
                 "cumExecQty":"0.01","cumExecValue":"29.9","avgPrice":"2990","updatedTime":"1700000000000"}]}}
                """);

        Optional<OrderInfo> info = client.getOrder(creds, "ETHUSDT", "b-1");

        assertTrue(info.isPresent());
        assertEquals("FILLED", info.get().getStatus());
        assertEquals(0, new BigDecimal("0.01").compareTo(info.get().getExecutedQty()));
        server.verify();
    }

    @Test
    void placeOrder_market_shouldSendBaseQtyAndOnlyCreate() {
        server.expect(requestTo(BASE + "/v5/order/create"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().string(containsString("\"marketUnit\":\"baseCoin\"")))
                .andExpect(content().string(containsString("\"qty\":\"0.0033\"")))
                .andRespond(withSuccess("{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{\"orderId\":\"m-1\"}}",
                        MediaType.APPLICATION_JSON));

        OrderResponse r = client.placeOrder(creds, OrderRequest.builder()
                .symbol("ETHUSDT").side(OrderSide.BUY).type(OrderType.MARKET)
                .quantity(new BigDecimal("0.0033"))
                .build());

        assertEquals("m-1", r.getOrderId());
        assertEquals("NEW", r.getStatus());
        assertEquals(0, BigDecimal.ZERO.compareTo(r.getExecutedQty()));
        server.verify();
    }

    @Test
    void marketBuy_fillLookupRateLimited_shouldCreateOrderOnlyOnce() {
        DefaultExchangeGateway gateway = new DefaultExchangeGateway(client, creds,
                new GridBotProperties.ExchangeSettings(), d -> { });

        respond("/v5/account/wallet-balance", """
                {"retCode":0,"retMsg":"OK","result":{"list":[{"coin":[
                  {"coin":"USDT","walletBalance":"100","locked":"0","availableToWithdraw":"100"}]}]}}
                """);
        respond("/v5/market/tickers", "{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{\"list\":[{\"lastPrice\":\"3000\"}]}}");
        respond("/v5/market/instruments-info", """
                {"retCode":0,"retMsg":"OK","result":{"list":[{"symbol":"ETHUSDT",
                 "priceFilter":{"tickSize":"0.01"},
                 "lotSizeFilter":{"basePrecision":"0.0001","minOrderQty":"0.0001","minOrderAmt":"1"}}]}}
                """);
        server.expect(ExpectedCount.once(), requestTo(BASE + "/v5/order/create"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{\"orderId\":\"m-1\"}}",
                        MediaType.APPLICATION_JSON));
        respond("/v5/order/realtime", "{\"retCode\":10006,\"retMsg\":\"Too many visits\",\"result\":{}}");
        respond("/v5/order/realtime", """
                {"retCode":0,"retMsg":"OK","result":{"list":[{"orderId":"m-1","symbol":"ETHUSDT","side":"Buy",
                 "orderType":"Market","orderStatus":"Filled","price":"0","qty":"0.0033",
                 "cumExecQty":"0.0033","cumExecValue":"9.9","avgPrice":"3000","updatedTime":"1700000000000"}]}}
                """);

        ExchangeResult<MarketFill> r = gateway.marketBuy("ETH/USDT", new BigDecimal("10"));

        assertTrue(r.isOk(), r.getMessage());
        assertEquals("m-1", r.getValue().getOrderId());
        assertEquals(0, new BigDecimal("0.0033").compareTo(r.getValue().getFilledQty()));
        assertEquals(0, new BigDecimal("3000").compareTo(r.getValue().getAvgPrice()));
        server.verify();
    }
}
