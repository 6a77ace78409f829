package com.chicu.gridbot.trading.bot;

import com.chicu.gridbot.config.GridBotProperties;
import com.chicu.gridbot.exchange.gateway.ExchangeGateway;
import com.chicu.gridbot.exchange.gateway.ExchangeGatewayFactory;
import com.chicu.gridbot.ledger.order.service.OrderLedger;
import com.chicu.gridbot.ledger.portfolio.service.PortfolioLedger;
import com.chicu.gridbot.trading.engine.GridPhase;
import com.chicu.gridbot.trading.engine.GridStatus;
import com.chicu.gridbot.trading.engine.TradeLoopEngine;
import com.chicu.gridbot.trading.engine.TradeLoopEngineFactory;
import com.chicu.gridbot.trading.model.PairConfig;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Реестр воркеров: не больше одного на пару. Старт, остановка, статус.
 * <p>
 * Запись о паре удаляет только сам воркер при выходе (в finally), поэтому пока
 * остановленный воркер дорабатывает тик, повторный старт той же пары не проходит.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BotManager {

    private static final AtomicLong WORKER_THREAD_SEQ = new AtomicLong();

    private final ExchangeGatewayFactory gatewayFactory;
    private final TradeLoopEngineFactory engineFactory;
    private final OrderLedger orderLedger;
    private final PortfolioLedger portfolio;
    private final GridBotProperties properties;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, BotHandle> bots = new HashMap<>();

    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r);
        t.setName("grid-worker-" + WORKER_THREAD_SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public boolean isRunning(String pairId) {
        lock.lock();
        try {
            BotHandle h = bots.get(pairId);
            return h != null && h.isRunning();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Запустить воркер пары.
     *
     * @return false, если пара уже запущена (или ещё останавливается)
     * @throws BotSetupException неподдерживаемая биржа/режим, нет или отклонены ключи, неверные настройки
     */
    public boolean startBot(String pairId, String symbol, PairConfig config) {
        Optional<Boolean> running = entryState(pairId);
        if (running.isPresent()) {
            if (running.get()) {
                log.warn("⚠️ Пара {} уже запущена", pairId);
            } else {
                log.warn("⏳ Пара {} ещё останавливается: воркер не вышел из тика, повторный старт отклонён", pairId);
            }
            return false;
        }

        PairConfig cfg = config.toBuilder().pairId(pairId).symbol(symbol).build();
        engineFactory.validate(cfg);
        ExchangeGateway gateway = gatewayFactory.create(cfg);
        TradeLoopEngine engine = engineFactory.create(cfg, gateway);

        lock.lock();
        try {
            if (bots.containsKey(pairId)) {
                log.warn("⚠️ Пара {} запущена параллельно, повторный старт отклонён", pairId);
                return false;
            }
            BotHandle handle = new BotHandle(pairId, symbol, gateway, engine, Instant.now());
            bots.put(pairId, handle);
            try {
                handle.setFuture(executor.submit(() -> runWorker(handle)));
            } catch (RejectedExecutionException e) {
                bots.remove(pairId);
                throw new BotSetupException("Пул воркеров остановлен, пара " + pairId + " не запущена", e);
            }
        } finally {
            lock.unlock();
        }
        log.info("▶️ Пара {} ({}) запущена", pairId, symbol);
        return true;
    }

    private void runWorker(BotHandle handle) {
        String symbol = handle.getSymbol();
        try {
            handle.getEngine().run(handle::isRunning, handle::await);
        } catch (RuntimeException e) {
            log.error("❌ Воркер пары {} упал: {}", handle.getPairId(), e.getMessage(), e);
        } finally {
            // запись о паре снимается последней: пока идёт очистка, новый воркер пары не стартует
            if (!handle.isRunning()) {
                try {
                    // после таймаута stopBot тик мог успеть выставить ещё ордера
                    handle.getGateway().cancelAllOrders(symbol);
                } catch (RuntimeException e) {
                    log.warn("Ордера {} при выходе воркера не отменены: {}", symbol, e.getMessage());
                }
            }
            try {
                orderLedger.removeAll(symbol);
            } catch (RuntimeException e) {
                log.warn("Журнал ордеров {} не очищен: {}", symbol, e.getMessage());
            }
            lock.lock();
            try {
                // запись могла смениться, если пару успели перезапустить
                bots.remove(handle.getPairId(), handle);
            } finally {
                lock.unlock();
            }
            log.info("Воркер пары {} завершён", handle.getPairId());
        }
    }

    /**
     * Остановить пару: снять флаг, разбудить воркер, дождаться его с таймаутом.
     * Вышедший воркер сам отменяет ордера символа; если он не уложился в таймаут,
     * ордера отменяются здесь и ещё раз самим воркером при выходе.
     */
    public void stopBot(String pairId) {
        BotHandle handle;
        lock.lock();
        try {
            handle = bots.get(pairId);
            if (handle == null) {
                log.info("Пара {} не запущена", pairId);
                return;
            }
            handle.requestStop();
        } finally {
            lock.unlock();
        }

        boolean exited = awaitWorker(handle, properties.getBot().getStopTimeout());

        String symbol = handle.getSymbol();
        try {
            if (!exited) {
                handle.getGateway().cancelAllOrders(symbol);
                orderLedger.removeAll(symbol);
            }
            if (properties.getBot().isClearPositionOnStop()) {
                portfolio.clearPosition(symbol);
            }
        } catch (RuntimeException e) {
            log.warn("Очистка после остановки пары {} не завершена: {}", pairId, e.getMessage());
        }
        log.info("⏹️ Пара {} ({}) остановлена", pairId, symbol);
    }

    /** @return true, если воркер завершился (в т.ч. с ошибкой) */
    private boolean awaitWorker(BotHandle handle, Duration timeout) {
        Future<?> future = handle.getFuture();
        if (future == null) return false;
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("⏳ Воркер пары {} не завершился за {} мс, продолжаем остановку",
                    handle.getPairId(), timeout.toMillis());
            return false;
        } catch (ExecutionException e) {
            log.warn("Воркер пары {} завершился с ошибкой: {}", handle.getPairId(), String.valueOf(e.getCause()));
            return true;
        } catch (CancellationException e) {
            log.debug("Воркер пары {} отменён", handle.getPairId());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Ожидание воркера пары {} прервано", handle.getPairId());
            return false;
        }
    }

    /** Снимок лестницы пары; {@code stopping} — остановка запрошена, но воркер ещё не вышел. */
    public Optional<GridStatus> status(String pairId) {
        lock.lock();
        try {
            return Optional.ofNullable(bots.get(pairId)).map(h -> {
                GridStatus s = h.getEngine().getStatus();
                if (s == null) {
                    s = GridStatus.builder().pairId(pairId).symbol(h.getSymbol()).phase(GridPhase.STARTING).build();
                }
                return h.isRunning() ? s : s.toBuilder().stopping(true).build();
            });
        } finally {
            lock.unlock();
        }
    }

    public Set<String> runningPairs() {
        lock.lock();
        try {
            Set<String> out = new TreeSet<>();
            bots.forEach((id, h) -> {
                if (h.isRunning()) out.add(id);
            });
            return out;
        } finally {
            lock.unlock();
        }
    }

    /** empty — записи нет; иначе флаг работы (false — воркер останавливается). */
    private Optional<Boolean> entryState(String pairId) {
        lock.lock();
        try {
            return Optional.ofNullable(bots.get(pairId)).map(BotHandle::isRunning);
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        Set<String> pairs = runningPairs();
        if (!pairs.isEmpty()) {
            log.info("Остановка всех пар: {}", pairs);
        }
        for (String pairId : pairs) {
            stopBot(pairId);
        }
        executor.shutdownNow();
    }
}
