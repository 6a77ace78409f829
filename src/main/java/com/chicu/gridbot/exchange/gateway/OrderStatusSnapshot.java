package com.chicu.gridbot.exchange.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Нормализованный статус ордера.
 */
@Value
@Builder
public class OrderStatusSnapshot {
    OrderState state;
    @Builder.Default
    BigDecimal filled = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal remaining = BigDecimal.ZERO;
    BigDecimal avgPrice;
    String message;

    public static OrderStatusSnapshot of(OrderState state) {
        return OrderStatusSnapshot.builder().state(state).build();
    }

    public static OrderStatusSnapshot error(String message) {
        return OrderStatusSnapshot.builder().state(OrderState.ERROR).message(message).build();
    }
}
