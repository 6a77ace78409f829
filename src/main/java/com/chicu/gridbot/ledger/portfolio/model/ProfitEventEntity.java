package com.chicu.gridbot.ledger.portfolio.model;

import com.chicu.gridbot.trading.model.ProfitMode;
import com.chicu.gridbot.trading.model.TradingMode;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "profit_events", indexes = {
        @Index(name = "idx_profit_events_symbol", columnList = "symbol"),
        @Index(name = "idx_profit_events_pair", columnList = "pair_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfitEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String symbol;

    @Column(name = "pair_id")
    private String pairId;

    @Column(precision = 38, scale = 18)
    private BigDecimal buyPrice;
    @Column(precision = 38, scale = 18)
    private BigDecimal sellPrice;
    @Column(precision = 38, scale = 18)
    private BigDecimal quantity;
    @Column(precision = 38, scale = 18)
    private BigDecimal retainedQty;

    /** (sell − buy) × qty, в котируемой валюте */
    @Column(precision = 38, scale = 18)
    private BigDecimal profit;

    private String exchange;

    @Enumerated(EnumType.STRING)
    private TradingMode tradingMode;

    @Enumerated(EnumType.STRING)
    private ProfitMode profitMode;

    private Instant createdAt;
}
