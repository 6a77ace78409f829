package com.chicu.gridbot.exchange.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Исполненная рыночная покупка.
 */
@Value
@Builder
public class MarketFill {
    String orderId;
    BigDecimal avgPrice;
    BigDecimal filledQty;   // BASE
    BigDecimal cost;        // QUOTE
}
