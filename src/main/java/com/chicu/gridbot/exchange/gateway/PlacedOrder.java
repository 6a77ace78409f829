package com.chicu.gridbot.exchange.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Выставленный лимитный ордер; цена и количество уже после округления под фильтры биржи.
 */
@Value
@Builder
public class PlacedOrder {
    String orderId;
    BigDecimal price;
    BigDecimal quantity;
    String status;
}
