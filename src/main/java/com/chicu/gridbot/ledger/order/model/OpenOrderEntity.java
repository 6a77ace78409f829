package com.chicu.gridbot.ledger.order.model;

import com.chicu.gridbot.exchange.enums.OrderSide;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Ордер, который воркер считает открытым на бирже.
 * BUY — не больше одной строки на символ, SELL — строка на каждый orderId.
 */
@Entity
@Table(name = "open_orders", indexes = {
        @Index(name = "idx_open_orders_symbol_side", columnList = "symbol, side")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenOrderEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderSide side;

    private String exchange;

    @Column(nullable = false)
    private String orderId;

    @Column(precision = 38, scale = 18)
    private BigDecimal price;
    @Column(precision = 38, scale = 18)
    private BigDecimal quantity;
    @Column(precision = 38, scale = 18)
    private BigDecimal filledQty;

    private String status;     // open / closed / canceled

    // только для SELL: цена покупки, из которой выставлена продажа, и удержанный остаток (CRYPTO)
    @Column(precision = 38, scale = 18)
    private BigDecimal buyPrice;
    @Column(precision = 38, scale = 18)
    private BigDecimal retainedQty;

    private Instant createdAt;
    private Instant updatedAt;
}
