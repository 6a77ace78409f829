package com.chicu.gridbot.ledger.trade.model;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.trading.model.TradingMode;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "trade_logs", indexes = {
        @Index(name = "idx_trade_logs_symbol_time", columnList = "symbol, executed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String symbol;

    @Enumerated(EnumType.STRING)
    private OrderSide side;

    @Column(precision = 38, scale = 18)
    private BigDecimal price;
    @Column(precision = 38, scale = 18)
    private BigDecimal amount;      // BASE
    @Column(precision = 38, scale = 2)
    private BigDecimal quoteValue;  // price × amount

    private String exchange;

    @Enumerated(EnumType.STRING)
    private TradingMode tradingMode;

    @Column(name = "executed_at")
    private Instant executedAt;
}
