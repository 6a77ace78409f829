package com.chicu.gridbot.ledger.portfolio.service;

import com.chicu.gridbot.ledger.portfolio.model.PairProfitEntity;
import com.chicu.gridbot.ledger.portfolio.model.PositionEntity;
import com.chicu.gridbot.ledger.portfolio.model.ProfitEventEntity;
import com.chicu.gridbot.ledger.portfolio.model.SellFill;
import com.chicu.gridbot.ledger.portfolio.repository.PairProfitRepository;
import com.chicu.gridbot.ledger.portfolio.repository.PositionRepository;
import com.chicu.gridbot.ledger.portfolio.repository.ProfitEventRepository;
import com.chicu.gridbot.trading.model.ProfitMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Позиции и реализованная прибыль. Единственный писатель positions / profit_events / pair_profits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioLedger {

    /** Остаток позиции меньше этого считается нулём */
    static final BigDecimal DUST = new BigDecimal("0.000001");

    private static final int PRICE_SCALE = 12;

    private final PositionRepository positionRepo;
    private final ProfitEventRepository profitEventRepo;
    private final PairProfitRepository pairProfitRepo;

    /**
     * Покупка: количество добавляется к позиции, цена усредняется по объёму.
     */
    @Transactional
    public PositionEntity recordBuy(String symbol, BigDecimal quantity, BigDecimal price) {
        if (quantity == null || quantity.signum() <= 0 || price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Покупка " + symbol + ": qty и price должны быть > 0");
        }
        PositionEntity p = positionRepo.findById(symbol)
                .orElseGet(() -> PositionEntity.builder()
                        .symbol(symbol)
                        .amount(BigDecimal.ZERO)
                        .avgBuyPrice(BigDecimal.ZERO)
                        .build());

        BigDecimal total = p.getAmount().add(quantity);
        BigDecimal avg = p.getAmount().multiply(p.getAvgBuyPrice())
                .add(quantity.multiply(price))
                .divide(total, PRICE_SCALE, RoundingMode.HALF_UP);

        p.setAmount(total);
        p.setAvgBuyPrice(avg);
        p.setUpdatedAt(Instant.now());
        log.info("📈 {}: +{} @ {} → позиция {} @ {}", symbol, quantity, price, total, avg);
        return positionRepo.save(p);
    }

    /**
     * Продажа: событие прибыли, итог пары, уменьшение позиции.
     *
     * @return empty, если цена покупки неизвестна (продажа не учитывается)
     */
    @Transactional
    public Optional<ProfitEventEntity> recordSell(SellFill fill) {
        if (fill.getBuyPrice() == null || fill.getBuyPrice().signum() <= 0) {
            log.error("Продажа {} не учтена: неизвестна цена покупки", fill.getSymbol());
            return Optional.empty();
        }
        BigDecimal retained = fill.getRetainedQty() == null ? BigDecimal.ZERO : fill.getRetainedQty();
        BigDecimal profit = fill.getSellPrice().subtract(fill.getBuyPrice()).multiply(fill.getQuantity());
        Instant now = Instant.now();

        ProfitEventEntity event = profitEventRepo.save(ProfitEventEntity.builder()
                .symbol(fill.getSymbol())
                .pairId(fill.getPairId())
                .buyPrice(fill.getBuyPrice())
                .sellPrice(fill.getSellPrice())
                .quantity(fill.getQuantity())
                .retainedQty(retained)
                .profit(profit)
                .exchange(fill.getExchange())
                .tradingMode(fill.getTradingMode())
                .profitMode(fill.getProfitMode())
                .createdAt(now)
                .build());

        if (fill.getPairId() != null) {
            PairProfitEntity pp = pairProfitRepo.findById(fill.getPairId())
                    .orElseGet(() -> PairProfitEntity.builder()
                            .pairId(fill.getPairId())
                            .symbol(fill.getSymbol())
                            .exchange(fill.getExchange())
                            .tradingMode(fill.getTradingMode())
                            .build());
            pp.setProfitQuote(pp.getProfitQuote().add(profit));
            if (fill.getProfitMode() == ProfitMode.CRYPTO) {
                pp.setProfitCrypto(pp.getProfitCrypto().add(retained));
            }
            pp.setUpdatedAt(now);
            pairProfitRepo.save(pp);
        }

        reducePosition(fill.getSymbol(), fill.getQuantity(), now);

        log.info("💰 Продано {} {} по {} (покупка {}), прибыль {}",
                fill.getQuantity(), fill.getSymbol(), fill.getSellPrice(), fill.getBuyPrice(),
                profit.setScale(6, RoundingMode.HALF_UP));
        return Optional.of(event);
    }

    private void reducePosition(String symbol, BigDecimal sold, Instant now) {
        Optional<PositionEntity> existing = positionRepo.findById(symbol);
        if (existing.isEmpty()) {
            log.warn("{}: продажа без позиции в журнале", symbol);
            return;
        }
        PositionEntity p = existing.get();
        BigDecimal left = p.getAmount().subtract(sold);
        if (left.compareTo(DUST) < 0) {
            if (left.signum() < 0 && left.abs().compareTo(DUST) >= 0) {
                log.warn("{}: продано {} больше позиции {}, позиция обнулена", symbol, sold, p.getAmount());
            }
            p.setAmount(BigDecimal.ZERO);
            p.setAvgBuyPrice(BigDecimal.ZERO);
        } else {
            p.setAmount(left);
        }
        p.setUpdatedAt(now);
        positionRepo.save(p);
    }

    @Transactional(readOnly = true)
    public Optional<PositionEntity> getPosition(String symbol) {
        return positionRepo.findById(symbol);
    }

    @Transactional
    public void clearPosition(String symbol) {
        if (positionRepo.existsById(symbol)) {
            positionRepo.deleteById(symbol);
            log.info("{}: позиция удалена", symbol);
        }
    }

    /* ====================== прибыль ====================== */

    @Transactional(readOnly = true)
    public BigDecimal totalProfit() {
        return scaled(profitEventRepo.sumProfit());
    }

    @Transactional(readOnly = true)
    public BigDecimal symbolProfit(String symbol) {
        return scaled(profitEventRepo.sumProfitBySymbol(symbol));
    }

    @Transactional(readOnly = true)
    public Optional<PairProfitEntity> pairProfit(String pairId) {
        return pairProfitRepo.findById(pairId);
    }

    /** Итоги по парам, сгруппированные как {@code BINANCE_TESTNET}. */
    @Transactional(readOnly = true)
    public Map<String, List<PairProfitEntity>> pairProfitsByExchangeAndMode() {
        Map<String, List<PairProfitEntity>> grouped = new LinkedHashMap<>();
        for (PairProfitEntity p : pairProfitRepo.findAll()) {
            String key = String.valueOf(p.getExchange()).toUpperCase() + "_" + p.getTradingMode();
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(p);
        }
        return grouped;
    }

    /** Обнулить итоги пары. false — записи нет. */
    @Transactional
    public boolean resetPairProfit(String pairId) {
        return pairProfitRepo.findById(pairId).map(pp -> {
            pp.setProfitQuote(BigDecimal.ZERO);
            pp.setProfitCrypto(BigDecimal.ZERO);
            pp.setUpdatedAt(Instant.now());
            pairProfitRepo.save(pp);
            log.info("Прибыль пары {} обнулена", pairId);
            return true;
        }).orElse(false);
    }

    @Transactional
    public boolean removePairProfit(String pairId) {
        if (!pairProfitRepo.existsById(pairId)) return false;
        pairProfitRepo.deleteById(pairId);
        return true;
    }

    private static BigDecimal scaled(BigDecimal sum) {
        return (sum == null ? BigDecimal.ZERO : sum).setScale(6, RoundingMode.HALF_UP);
    }
}
