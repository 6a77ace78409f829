package com.chicu.gridbot.exchange.model;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.enums.OrderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Состояние ордера, как его видит биржа.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderInfo {

    private String orderId;
    private String symbol;
    private String status;            // NEW / PARTIALLY_FILLED / FILLED / CANCELED / EXPIRED / REJECTED...

    private BigDecimal origQty;
    private BigDecimal executedQty;

    private BigDecimal price;
    private BigDecimal avgPrice;
    private BigDecimal quoteQty;

    private OrderSide side;
    private OrderType type;
    private Instant updateTime;
}
