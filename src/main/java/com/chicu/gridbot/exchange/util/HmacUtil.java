package com.chicu.gridbot.exchange.util;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/**
 * Подпись запросов к биржам.
 */
public final class HmacUtil {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private HmacUtil() {
    }

    /**
     * HMAC-SHA256 от {@code message}, hex в нижнем регистре.
     * Так подписывают и Binance (query string), и Bybit (timestamp+key+recvWindow+payload).
     */
    public static String sha256Hex(String secret, String message) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Пустой секретный ключ");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            byte[] raw = mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(raw);
        } catch (Exception e) {
            throw new IllegalStateException("❌ Ошибка HMAC-SHA256: " + e.getMessage(), e);
        }
    }
}
