package com.chicu.gridbot.trading.bot;

import com.chicu.gridbot.exchange.gateway.ExchangeGateway;
import com.chicu.gridbot.trading.engine.TradeLoopEngine;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Запущенный воркер пары: флаг работы, сигнал остановки и его Future.
 */
@Getter
@RequiredArgsConstructor
class BotHandle {

    private final String pairId;
    private final String symbol;
    private final ExchangeGateway gateway;
    private final TradeLoopEngine engine;
    private final Instant startedAt;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    @Setter
    private volatile Future<?> future;

    boolean isRunning() {
        return running.get();
    }

    void requestStop() {
        running.set(false);
        stopSignal.countDown();
    }

    /** Пауза между тиками, прерывается сигналом остановки. */
    void await(Duration duration) throws InterruptedException {
        stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }
}
