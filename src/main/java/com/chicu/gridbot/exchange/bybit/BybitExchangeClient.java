package com.chicu.gridbot.exchange.bybit;

import com.chicu.gridbot.exchange.client.ExchangeApiException;
import com.chicu.gridbot.exchange.client.ExchangeClient;
import com.chicu.gridbot.exchange.client.ExchangeError;
import com.chicu.gridbot.exchange.enums.Exchange;
import com.chicu.gridbot.exchange.enums.NetworkType;
import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.enums.OrderType;
import com.chicu.gridbot.exchange.model.*;
import com.chicu.gridbot.exchange.util.HmacUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Bybit v5, категория spot. Подпись: HMAC(timestamp + apiKey + recvWindow + payload) в заголовках X-BAPI-*.
 * <p>
 * MARKET BUY на сумму в USDT/USDC здесь не используется: количество в BASE считает шлюз.
 */
@Slf4j
@Component("BYBIT")
@RequiredArgsConstructor
public class BybitExchangeClient implements ExchangeClient {

    @Value("${bybit.api.mainnet-base-url:https://api.bybit.com}")
    private String mainnetBaseUrl;

    @Value("${bybit.api.testnet-base-url:https://api-testnet.bybit.com}")
    private String testnetBaseUrl;

    private static final String RECV_WINDOW = "5000";

    private static final Set<Integer> AUTH_CODES = Set.of(10003, 10004, 10005, 33004);
    private static final Set<Integer> NOT_FOUND_CODES = Set.of(110001, 170213);

    private final RestTemplate rest;
    private final ObjectMapper objectMapper;

    private final ConcurrentMap<String, SymbolRules> rulesCache = new ConcurrentHashMap<>();

    /* ====================== helpers ====================== */

    private String baseUrl(NetworkType network) {
        String b = (network == NetworkType.MAINNET ? mainnetBaseUrl : testnetBaseUrl);
        return b.replaceAll("/+$", "");
    }

    private static String enc(String v) {
        return URLEncoder.encode(v, StandardCharsets.UTF_8);
    }

    private JsonNode parseJson(String body) {
        if (body == null || body.isBlank()) {
            throw new ExchangeApiException(ExchangeError.INVALID_RESPONSE, "Bybit: пустой ответ");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeApiException(ExchangeError.INVALID_RESPONSE, "Bybit JSON parse error: " + e.getMessage(), e);
        }
    }

    private static BigDecimal dec(JsonNode node, String field) {
        String raw = node.path(field).asText("");
        if (raw.isBlank()) return BigDecimal.ZERO;
        try {
            return new BigDecimal(raw);
        } catch (NumberFormatException e) {
            throw new ExchangeApiException(ExchangeError.INVALID_RESPONSE,
                    "Bybit: поле " + field + " не число: " + raw, e);
        }
    }

    private static BigDecimal decOrNull(JsonNode node, String field) {
        BigDecimal v = dec(node, field);
        return v.signum() > 0 ? v : null;
    }

    private HttpHeaders signedHeaders(ExchangeCredentials c, long ts, String payload) {
        String preSign = ts + c.apiKey() + RECV_WINDOW + (payload == null ? "" : payload);

        HttpHeaders h = new HttpHeaders();
        h.set("X-BAPI-API-KEY", c.apiKey());
        h.set("X-BAPI-TIMESTAMP", String.valueOf(ts));
        h.set("X-BAPI-RECV-WINDOW", RECV_WINDOW);
        h.set("X-BAPI-SIGN", HmacUtil.sha256Hex(c.secretKey(), preSign));
        h.setContentType(MediaType.APPLICATION_JSON);
        return h;
    }

    /** retCode != 0 → {@link ExchangeApiException}. */
    JsonNode checkRetCode(String op, ResponseEntity<String> response) {
        JsonNode root = parseJson(response.getBody());
        int ret = root.path("retCode").asInt(-1);
        if (ret == 0) return root;

        String msg = "Bybit " + op + ": retCode=" + ret + " " + root.path("retMsg").asText();
        if (ret == 10006) {
            throw ExchangeApiException.rateLimited(msg, resetDelayMs(response.getHeaders()), null);
        }
        if (AUTH_CODES.contains(ret)) throw new ExchangeApiException(ExchangeError.AUTH_ERROR, msg);
        if (NOT_FOUND_CODES.contains(ret)) throw new ExchangeApiException(ExchangeError.NOT_FOUND, msg);
        if (ret == 170131) throw new ExchangeApiException(ExchangeError.INSUFFICIENT_FUNDS, msg);
        if (ret == 10016) throw new ExchangeApiException(ExchangeError.TRANSIENT, msg);
        throw new ExchangeApiException(ExchangeError.REJECTED, msg);
    }

    /** X-Bapi-Limit-Reset-Timestamp → сколько ждать, мс. */
    private static Long resetDelayMs(HttpHeaders headers) {
        if (headers == null) return null;
        String v = headers.getFirst("X-Bapi-Limit-Reset-Timestamp");
        if (v == null || v.isBlank()) return null;
        try {
            long delay = Long.parseLong(v.trim()) - System.currentTimeMillis();
            return delay > 0 ? delay : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private ExchangeApiException translate(String op, RestClientException e) {
        if (e instanceof HttpStatusCodeException he) {
            int status = he.getStatusCode().value();
            String body = he.getResponseBodyAsString();
            String msg = "Bybit " + op + ": HTTP " + status + " " + body;
            if (status == 429 || (status == 403 && body.toLowerCase(Locale.ROOT).contains("too frequent"))) {
                return ExchangeApiException.rateLimited(msg, resetDelayMs(he.getResponseHeaders()), e);
            }
            if (status == 401) return new ExchangeApiException(ExchangeError.AUTH_ERROR, msg, e);
            if (status >= 500) return new ExchangeApiException(ExchangeError.TRANSIENT, msg, e);
            return new ExchangeApiException(ExchangeError.REJECTED, msg, e);
        }
        if (e instanceof ResourceAccessException) {
            return new ExchangeApiException(ExchangeError.TRANSIENT, "Bybit " + op + ": " + e.getMessage(), e);
        }
        return new ExchangeApiException(ExchangeError.INVALID_RESPONSE, "Bybit " + op + ": " + e.getMessage(), e);
    }

    private JsonNode publicGet(String op, String url) {
        try {
            return checkRetCode(op, rest.exchange(url, HttpMethod.GET, HttpEntity.EMPTY, String.class));
        } catch (RestClientException e) {
            throw translate(op, e);
        }
    }

    /** Подписанный GET, payload = queryString. */
    private JsonNode signedGet(ExchangeCredentials c, String op, String path, String query) {
        String url = baseUrl(c.network()) + path + "?" + query;
        HttpHeaders headers = signedHeaders(c, System.currentTimeMillis(), query);
        try {
            return checkRetCode(op, rest.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), String.class));
        } catch (RestClientException e) {
            throw translate(op, e);
        }
    }

    /** Подписанный POST, payload = JSON-тело. */
    private JsonNode signedPost(ExchangeCredentials c, String op, String path, Map<String, Object> body) {
        String bodyJson;
        try {
            bodyJson = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Bybit: не удалось сериализовать тело " + op, e);
        }
        HttpHeaders headers = signedHeaders(c, System.currentTimeMillis(), bodyJson);
        try {
            return checkRetCode(op, rest.exchange(baseUrl(c.network()) + path, HttpMethod.POST,
                    new HttpEntity<>(bodyJson, headers), String.class));
        } catch (RestClientException e) {
            throw translate(op, e);
        }
    }

    private static String plain(BigDecimal v) {
        return v.stripTrailingZeros().toPlainString();
    }

    private OrderInfo toOrderInfo(JsonNode n) {
        BigDecimal exec = dec(n, "cumExecQty");
        BigDecimal quote = dec(n, "cumExecValue");
        BigDecimal avg = decOrNull(n, "avgPrice");
        if (avg == null && exec.signum() > 0 && quote.signum() > 0) {
            avg = quote.divide(exec, 12, RoundingMode.HALF_UP);
        }
        return OrderInfo.builder()
                .orderId(n.path("orderId").asText(null))
                .symbol(n.path("symbol").asText(null))
                .status(mapStatus(n.path("orderStatus").asText("")))
                .side("Buy".equalsIgnoreCase(n.path("side").asText()) ? OrderSide.BUY : OrderSide.SELL)
                .type("Market".equalsIgnoreCase(n.path("orderType").asText()) ? OrderType.MARKET : OrderType.LIMIT)
                .price(dec(n, "price"))
                .origQty(dec(n, "qty"))
                .executedQty(exec)
                .avgPrice(avg == null ? BigDecimal.ZERO : avg)
                .quoteQty(quote)
                .updateTime(Instant.ofEpochMilli(n.path("updatedTime").asLong(System.currentTimeMillis())))
                .build();
    }

    /** Статусы Bybit → статусы в стиле Binance, которые понимает шлюз. */
    private static String mapStatus(String s) {
        return switch (s) {
            case "New", "Created", "Untriggered" -> "NEW";
            case "PartiallyFilled" -> "PARTIALLY_FILLED";
            case "Filled" -> "FILLED";
            case "Cancelled", "PartiallyFilledCanceled", "Deactivated" -> "CANCELED";
            case "Rejected" -> "REJECTED";
            default -> s.toUpperCase(Locale.ROOT);
        };
    }

    /* ====================== ExchangeClient ====================== */

    @Override
    public Exchange getExchange() {
        return Exchange.BYBIT;
    }

    @Override
    public boolean supportsQuoteMarketBuy() {
        return false;
    }

    @Override
    public BigDecimal getLastPrice(String symbol, NetworkType network) {
        String url = baseUrl(network) + "/v5/market/tickers?category=spot&symbol=" + enc(symbol);
        JsonNode list = publicGet("tickers", url).path("result").path("list");
        if (!list.isArray() || list.isEmpty()) {
            throw new ExchangeApiException(ExchangeError.INVALID_RESPONSE, "Bybit: нет тикера для " + symbol);
        }
        BigDecimal price = dec(list.get(0), "lastPrice");
        if (price.signum() <= 0) {
            throw new ExchangeApiException(ExchangeError.INVALID_RESPONSE, "Bybit: нет цены для " + symbol);
        }
        return price;
    }

    @Override
    public SymbolRules getSymbolRules(String symbol, NetworkType network) {
        return rulesCache.computeIfAbsent(network.name() + ":" + symbol, k -> fetchRules(symbol, network));
    }

    private SymbolRules fetchRules(String symbol, NetworkType network) {
        String url = baseUrl(network) + "/v5/market/instruments-info?category=spot&symbol=" + enc(symbol);
        JsonNode list = publicGet("instruments-info", url).path("result").path("list");
        if (!list.isArray() || list.isEmpty()) {
            throw new ExchangeApiException(ExchangeError.REJECTED, "Bybit: нет instruments-info для " + symbol);
        }
        JsonNode info = list.get(0);
        JsonNode lot = info.path("lotSizeFilter");
        BigDecimal step = decOrNull(lot, "basePrecision");
        if (step == null) step = decOrNull(lot, "qtyStep");

        SymbolRules rules = SymbolRules.builder()
                .tickSize(decOrNull(info.path("priceFilter"), "tickSize"))
                .stepSize(step)
                .minQty(decOrNull(lot, "minOrderQty"))
                .minNotional(decOrNull(lot, "minOrderAmt"))
                .build();
        log.debug("Bybit rules {}: {}", symbol, rules);
        return rules;
    }

    @Override
    public Map<String, BigDecimal> getFreeBalances(ExchangeCredentials c) {
        JsonNode list = signedGet(c, "wallet-balance", "/v5/account/wallet-balance", "accountType=UNIFIED")
                .path("result").path("list");
        if (!list.isArray()) {
            throw new ExchangeApiException(ExchangeError.INVALID_RESPONSE, "Bybit: в wallet-balance нет list");
        }
        Map<String, BigDecimal> map = new HashMap<>();
        for (JsonNode acc : list) {
            for (JsonNode coin : acc.path("coin")) {
                // availableToWithdraw на UTA бывает пустым — тогда walletBalance − locked
                BigDecimal free = dec(coin, "availableToWithdraw");
                if (free.signum() == 0) {
                    free = dec(coin, "walletBalance").subtract(dec(coin, "locked")).max(BigDecimal.ZERO);
                }
                map.merge(coin.path("coin").asText(), free, BigDecimal::add);
            }
        }
        return map;
    }

    @Override
    public OrderResponse placeOrder(ExchangeCredentials c, OrderRequest req) {
        if (req.getQuantity() == null || req.getQuantity().signum() <= 0) {
            throw new ExchangeApiException(ExchangeError.REJECTED, "Bybit: количество должно быть > 0");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", "spot");
        body.put("symbol", req.getSymbol());
        body.put("side", req.getSide() == OrderSide.BUY ? "Buy" : "Sell");
        body.put("orderType", req.getType() == OrderType.MARKET ? "Market" : "Limit");
        body.put("qty", plain(req.getQuantity()));
        if (req.getType() == OrderType.MARKET) {
            // qty в BASE, а не в QUOTE (по умолчанию для Market Buy Bybit ждёт QUOTE)
            body.put("marketUnit", "baseCoin");
        } else {
            body.put("price", plain(req.getPrice()));
            body.put("timeInForce", "GTC");
        }

        JsonNode result = signedPost(c, "order/create", "/v5/order/create", body).path("result");
        String orderId = result.path("orderId").asText(null);

        // create отдаёт только id: исполнение (в т.ч. рыночного) запрашивается отдельно через getOrder
        return OrderResponse.builder()
                .orderId(orderId)
                .symbol(req.getSymbol())
                .status("NEW")
                .price(req.getPrice())
                .origQty(req.getQuantity())
                .executedQty(BigDecimal.ZERO)
                .transactTime(Instant.now())
                .build();
    }

    /** Сначала realtime (открытые и недавние), затем history. */
    @Override
    public Optional<OrderInfo> getOrder(ExchangeCredentials c, String symbol, String orderId) {
        String q = "category=spot&symbol=" + enc(symbol) + "&orderId=" + enc(orderId);

        JsonNode list = signedGet(c, "order/realtime", "/v5/order/realtime", q).path("result").path("list");
        if (list.isArray() && !list.isEmpty()) {
            return Optional.of(toOrderInfo(list.get(0)));
        }
        list = signedGet(c, "order/history", "/v5/order/history", q).path("result").path("list");
        if (list.isArray() && !list.isEmpty()) {
            return Optional.of(toOrderInfo(list.get(0)));
        }
        return Optional.empty();
    }

    @Override
    public List<OrderInfo> getOpenOrders(ExchangeCredentials c, String symbol) {
        String q = "category=spot&symbol=" + enc(symbol) + "&openOnly=0";
        JsonNode list = signedGet(c, "order/realtime", "/v5/order/realtime", q).path("result").path("list");
        List<OrderInfo> out = new ArrayList<>();
        if (list.isArray()) {
            for (JsonNode n : list) out.add(toOrderInfo(n));
        }
        return out;
    }

    @Override
    public void cancelOrder(ExchangeCredentials c, String symbol, String orderId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", "spot");
        body.put("symbol", symbol);
        body.put("orderId", orderId);
        signedPost(c, "order/cancel", "/v5/order/cancel", body);
    }
}
