package com.chicu.gridbot.exchange.binance;

import com.chicu.gridbot.exchange.client.ExchangeApiException;
import com.chicu.gridbot.exchange.client.ExchangeClient;
import com.chicu.gridbot.exchange.client.ExchangeError;
import com.chicu.gridbot.exchange.enums.Exchange;
import com.chicu.gridbot.exchange.enums.NetworkType;
import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.enums.OrderType;
import com.chicu.gridbot.exchange.model.*;
import com.chicu.gridbot.exchange.util.HmacUtil;
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
 * Binance Spot REST (/api/v3).
 */
@Slf4j
@Component("BINANCE")
@RequiredArgsConstructor
public class BinanceExchangeClient implements ExchangeClient {

    @Value("${binance.api.mainnet-base-url:https://api.binance.com}")
    private String mainnetBaseUrl;

    @Value("${binance.api.testnet-base-url:https://testnet.binance.vision}")
    private String testnetBaseUrl;

    private static final String RECV_WINDOW = "5000";

    private final RestTemplate rest;
    private final ObjectMapper objectMapper;
    private final BinanceTimeService timeService;

    private final ConcurrentMap<String, SymbolRules> rulesCache = new ConcurrentHashMap<>();

    /* ========== helpers ========== */

    private String baseUrl(NetworkType network) {
        String b = (network == NetworkType.MAINNET ? mainnetBaseUrl : testnetBaseUrl);
        if (b == null || b.isBlank()) b = "https://api.binance.com";
        if (!b.startsWith("http")) b = "https://" + b;
        return b.replaceAll("/+$", "");
    }

    private static String enc(String v) {
        return URLEncoder.encode(v, StandardCharsets.UTF_8);
    }

    private HttpHeaders apiKeyHeader(String apiKey) {
        HttpHeaders h = new HttpHeaders();
        h.set("X-MBX-APIKEY", apiKey);
        h.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        return h;
    }

    private JsonNode parseJson(String body) {
        if (body == null || body.isBlank()) {
            throw new ExchangeApiException(ExchangeError.INVALID_RESPONSE, "Binance: пустой ответ");
        }
        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            throw new ExchangeApiException(ExchangeError.INVALID_RESPONSE, "Binance JSON parse error: " + e.getMessage(), e);
        }
    }

    private static BigDecimal dec(JsonNode node, String field) {
        String raw = node.path(field).asText("");
        if (raw.isBlank()) return BigDecimal.ZERO;
        try {
            return new BigDecimal(raw);
        } catch (NumberFormatException e) {
            throw new ExchangeApiException(ExchangeError.INVALID_RESPONSE,
                    "Binance: поле " + field + " не число: " + raw, e);
        }
    }

    private static int errorCode(String body) {
        if (body == null) return 0;
        int i = body.indexOf("\"code\":");
        if (i < 0) return 0;
        int start = i + 7;
        int end = start;
        while (end < body.length() && (body.charAt(end) == '-' || Character.isDigit(body.charAt(end)))) end++;
        try {
            return Integer.parseInt(body.substring(start, end));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static Long retryAfterMs(HttpHeaders headers) {
        if (headers == null) return null;
        String v = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (v == null || v.isBlank()) return null;
        try {
            return (long) (Double.parseDouble(v.trim()) * 1000);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** HTTP/коды Binance → {@link ExchangeError}. */
    ExchangeApiException translate(String op, RestClientException e) {
        if (e instanceof HttpStatusCodeException he) {
            int status = he.getStatusCode().value();
            String body = he.getResponseBodyAsString();
            int code = errorCode(body);
            String msg = "Binance " + op + ": HTTP " + status + " " + body;

            if (status == 429 || status == 418) {
                return ExchangeApiException.rateLimited(msg, retryAfterMs(he.getResponseHeaders()), e);
            }
            if (status == 401 || code == -2014 || code == -2015 || code == -1022) {
                return new ExchangeApiException(ExchangeError.AUTH_ERROR, msg, e);
            }
            if (code == -2013 || (code == -2011 && body.contains("Unknown order"))) {
                return new ExchangeApiException(ExchangeError.NOT_FOUND, msg, e);
            }
            if (code == -2010 && body.toLowerCase(Locale.ROOT).contains("insufficient balance")) {
                return new ExchangeApiException(ExchangeError.INSUFFICIENT_FUNDS, msg, e);
            }
            if (status >= 500) {
                return new ExchangeApiException(ExchangeError.TRANSIENT, msg, e);
            }
            return new ExchangeApiException(ExchangeError.REJECTED, msg, e);
        }
        if (e instanceof ResourceAccessException) {
            return new ExchangeApiException(ExchangeError.TRANSIENT, "Binance " + op + ": " + e.getMessage(), e);
        }
        return new ExchangeApiException(ExchangeError.INVALID_RESPONSE, "Binance " + op + ": " + e.getMessage(), e);
    }

    private String publicGet(String op, String url) {
        try {
            return rest.getForObject(url, String.class);
        } catch (RestClientException e) {
            throw translate(op, e);
        }
    }

    private static boolean isTimestampError(RestClientException e) {
        return e instanceof HttpStatusCodeException he
                && errorCode(he.getResponseBodyAsString()) == -1021;
    }

    /** Подписанный вызов с одним повтором после ресинхронизации времени при -1021. */
    private String signedRequest(ExchangeCredentials c, String op, String path, String partialQuery, HttpMethod method) {
        String base = baseUrl(c.network());
        try {
            return exchangeSigned(c, base, path, partialQuery, method);
        } catch (RestClientException e) {
            if (!isTimestampError(e)) throw translate(op, e);
            log.warn("{} {} -> -1021 (timestamp), resync and retry once", method, path);
            timeService.forceResync(base);
            try {
                return exchangeSigned(c, base, path, partialQuery, method);
            } catch (RestClientException again) {
                throw translate(op, again);
            }
        }
    }

    private String exchangeSigned(ExchangeCredentials c, String base, String path, String partialQuery, HttpMethod method) {
        String q = buildQuery(partialQuery, timeService.currentTimestampMs(base));
        String url = base + path + "?" + q + "&signature=" + HmacUtil.sha256Hex(c.secretKey(), q);
        ResponseEntity<String> r = rest.exchange(url, method, new HttpEntity<>((String) null, apiKeyHeader(c.apiKey())), String.class);
        return r.getBody();
    }

    private static String buildQuery(String partialQuery, long timestamp) {
        StringBuilder sb = new StringBuilder();
        if (partialQuery != null && !partialQuery.isBlank()) sb.append(partialQuery).append("&");
        sb.append("recvWindow=").append(RECV_WINDOW)
                .append("&timestamp=").append(timestamp);
        return sb.toString();
    }

    private static String plain(BigDecimal v) {
        return v.stripTrailingZeros().toPlainString();
    }

    private OrderInfo toOrderInfo(JsonNode j) {
        BigDecimal exec = dec(j, "executedQty");
        BigDecimal cummQuote = dec(j, "cummulativeQuoteQty");
        BigDecimal avg = (exec.signum() > 0) ? cummQuote.divide(exec, 12, RoundingMode.HALF_UP) : BigDecimal.ZERO;
        String type = j.path("type").asText("LIMIT");
        return OrderInfo.builder()
                .orderId(j.path("orderId").asText(null))
                .symbol(j.path("symbol").asText(null))
                .status(j.path("status").asText(null))
                .side("BUY".equalsIgnoreCase(j.path("side").asText()) ? OrderSide.BUY : OrderSide.SELL)
                .type("MARKET".equalsIgnoreCase(type) ? OrderType.MARKET : OrderType.LIMIT)
                .price(dec(j, "price"))
                .origQty(dec(j, "origQty"))
                .executedQty(exec)
                .avgPrice(avg)
                .quoteQty(cummQuote)
                .updateTime(Instant.ofEpochMilli(j.path("updateTime").asLong(System.currentTimeMillis())))
                .build();
    }

    /* ========== ExchangeClient ========== */

    @Override
    public Exchange getExchange() {
        return Exchange.BINANCE;
    }

    @Override
    public boolean supportsQuoteMarketBuy() {
        return true;
    }

    @Override
    public BigDecimal getLastPrice(String symbol, NetworkType network) {
        JsonNode j = parseJson(publicGet("lastPrice", baseUrl(network) + "/api/v3/ticker/price?symbol=" + enc(symbol)));
        BigDecimal price = dec(j, "price");
        if (price.signum() <= 0) {
            throw new ExchangeApiException(ExchangeError.INVALID_RESPONSE, "Binance: нет цены для " + symbol);
        }
        return price;
    }

    @Override
    public SymbolRules getSymbolRules(String symbol, NetworkType network) {
        // неудачный запрос не кэшируется: computeIfAbsent пробрасывает исключение
        return rulesCache.computeIfAbsent(network.name() + ":" + symbol, k -> fetchRules(symbol, network));
    }

    private SymbolRules fetchRules(String symbol, NetworkType network) {
        String url = baseUrl(network) + "/api/v3/exchangeInfo?symbol=" + enc(symbol);
        JsonNode sym = parseJson(publicGet("exchangeInfo", url)).path("symbols");
        if (!sym.isArray() || sym.isEmpty()) {
            throw new ExchangeApiException(ExchangeError.REJECTED, "Binance: нет exchangeInfo для " + symbol);
        }
        SymbolRules rules = new SymbolRules();
        for (JsonNode f : sym.get(0).path("filters")) {
            switch (f.path("filterType").asText()) {
                case "PRICE_FILTER" -> rules.setTickSize(dec(f, "tickSize"));
                case "LOT_SIZE" -> {
                    rules.setStepSize(dec(f, "stepSize"));
                    rules.setMinQty(dec(f, "minQty"));
                }
                case "MIN_NOTIONAL", "NOTIONAL" -> rules.setMinNotional(
                        f.hasNonNull("minNotional") ? dec(f, "minNotional") : dec(f, "notional"));
                default -> {}
            }
        }
        log.debug("Binance rules {}: {}", symbol, rules);
        return rules;
    }

    @Override
    public Map<String, BigDecimal> getFreeBalances(ExchangeCredentials c) {
        JsonNode acc = parseJson(signedRequest(c, "account", "/api/v3/account", "", HttpMethod.GET));
        if (!acc.path("balances").isArray()) {
            throw new ExchangeApiException(ExchangeError.INVALID_RESPONSE, "Binance: в ответе account нет balances");
        }
        Map<String, BigDecimal> map = new HashMap<>();
        for (JsonNode b : acc.path("balances")) {
            map.put(b.path("asset").asText(), dec(b, "free"));
        }
        return map;
    }

    @Override
    public OrderResponse placeOrder(ExchangeCredentials c, OrderRequest req) {
        StringBuilder pq = new StringBuilder()
                .append("symbol=").append(enc(req.getSymbol()))
                .append("&side=").append(req.getSide().name())
                .append("&type=").append(req.getType().name());

        if (req.getType() == OrderType.MARKET) {
            if (req.getSide() == OrderSide.BUY && req.getQuoteQuantity() != null) {
                pq.append("&quoteOrderQty=").append(plain(req.getQuoteQuantity()));
            } else {
                pq.append("&quantity=").append(plain(req.getQuantity()));
            }
            pq.append("&newOrderRespType=FULL");
        } else {
            pq.append("&quantity=").append(plain(req.getQuantity()))
                    .append("&price=").append(plain(req.getPrice()))
                    .append("&timeInForce=GTC");
        }

        JsonNode r = parseJson(signedRequest(c, "placeOrder", "/api/v3/order", pq.toString(), HttpMethod.POST));
        BigDecimal exec = dec(r, "executedQty");
        BigDecimal quote = dec(r, "cummulativeQuoteQty");

        return OrderResponse.builder()
                .orderId(r.path("orderId").asText(null))
                .symbol(r.path("symbol").asText(null))
                .status(r.path("status").asText(null))
                .price(dec(r, "price"))
                .origQty(dec(r, "origQty"))
                .executedQty(exec)
                .quoteQty(quote)
                .avgPrice(exec.signum() > 0 ? quote.divide(exec, 12, RoundingMode.HALF_UP) : null)
                .transactTime(Instant.ofEpochMilli(r.path("transactTime").asLong(System.currentTimeMillis())))
                .build();
    }

    @Override
    public Optional<OrderInfo> getOrder(ExchangeCredentials c, String symbol, String orderId) {
        String pq = "symbol=" + enc(symbol) + "&orderId=" + enc(orderId);
        try {
            return Optional.of(toOrderInfo(parseJson(signedRequest(c, "getOrder", "/api/v3/order", pq, HttpMethod.GET))));
        } catch (ExchangeApiException e) {
            if (e.getError() == ExchangeError.NOT_FOUND) return Optional.empty();
            throw e;
        }
    }

    @Override
    public List<OrderInfo> getOpenOrders(ExchangeCredentials c, String symbol) {
        JsonNode arr = parseJson(signedRequest(c, "openOrders", "/api/v3/openOrders", "symbol=" + enc(symbol), HttpMethod.GET));
        List<OrderInfo> out = new ArrayList<>();
        for (JsonNode j : arr) {
            out.add(toOrderInfo(j));
        }
        return out;
    }

    @Override
    public void cancelOrder(ExchangeCredentials c, String symbol, String orderId) {
        String pq = "symbol=" + enc(symbol) + "&orderId=" + enc(orderId);
        signedRequest(c, "cancelOrder", "/api/v3/order", pq, HttpMethod.DELETE);
    }
}
