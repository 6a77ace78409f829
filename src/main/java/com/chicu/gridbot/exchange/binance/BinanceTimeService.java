package com.chicu.gridbot.exchange.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Смещение часов относительно сервера Binance, отдельно для каждого base URL
 * (у mainnet и testnet оно разное).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BinanceTimeService {

    private static final long TIME_SYNC_EVERY_MS = 60_000; // 1 минута

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    private record Offset(long offsetMs, long syncedAt) {}

    private final ConcurrentMap<String, Offset> offsets = new ConcurrentHashMap<>();

    /** Серверное время, мс. Пересинхронизируется не чаще раза в минуту. */
    public long currentTimestampMs(String baseUrl) {
        Offset o = offsets.get(baseUrl);
        if (o == null || System.currentTimeMillis() - o.syncedAt() > TIME_SYNC_EVERY_MS) {
            o = sync(baseUrl);
        }
        return System.currentTimeMillis() + o.offsetMs();
    }

    /** Принудительная синхронизация (после -1021). */
    public void forceResync(String baseUrl) {
        sync(baseUrl);
    }

    private Offset sync(String baseUrl) {
        try {
            long t0 = System.currentTimeMillis();
            String body = restTemplate.getForObject(baseUrl + "/api/v3/time", String.class);
            long t1 = System.currentTimeMillis();

            JsonNode node = objectMapper.readTree(body);
            long serverTime = node.path("serverTime").asLong();
            long localMid = (t0 + t1) / 2L;

            Offset o = new Offset(serverTime - localMid, System.currentTimeMillis());
            offsets.put(baseUrl, o);
            log.info("Binance time sync [{}]: offset={} ms (server={}, localMid={})",
                    baseUrl, o.offsetMs(), serverTime, localMid);
            return o;
        } catch (Exception e) {
            log.warn("Binance time sync failed [{}]: {}", baseUrl, e.getMessage());
            // оставляем прежнее смещение; при первом запуске — ноль
            Offset prev = offsets.get(baseUrl);
            Offset fallback = new Offset(prev == null ? 0L : prev.offsetMs(), System.currentTimeMillis());
            offsets.put(baseUrl, fallback);
            return fallback;
        }
    }
}
