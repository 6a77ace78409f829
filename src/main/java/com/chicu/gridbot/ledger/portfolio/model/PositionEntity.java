package com.chicu.gridbot.ledger.portfolio.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Позиция по символу: сколько BASE на руках и средневзвешенная цена покупки.
 */
@Entity
@Table(name = "positions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionEntity {

    @Id
    private String symbol;

    @Column(precision = 38, scale = 18, nullable = false)
    private BigDecimal amount;

    @Column(precision = 38, scale = 18, nullable = false)
    private BigDecimal avgBuyPrice;

    private Instant updatedAt;
}
