package com.chicu.gridbot.ledger.portfolio.model;

import com.chicu.gridbot.trading.model.TradingMode;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Накопленная прибыль пары: в котируемой валюте и удержанными монетами (режим CRYPTO).
 */
@Entity
@Table(name = "pair_profits")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PairProfitEntity {

    @Id
    private String pairId;

    private String symbol;
    private String exchange;

    @Enumerated(EnumType.STRING)
    private TradingMode tradingMode;

    @Builder.Default
    @Column(precision = 38, scale = 18, nullable = false)
    private BigDecimal profitQuote = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 38, scale = 18, nullable = false)
    private BigDecimal profitCrypto = BigDecimal.ZERO;

    private Instant updatedAt;
}
