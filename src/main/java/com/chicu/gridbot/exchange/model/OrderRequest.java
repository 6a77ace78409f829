package com.chicu.gridbot.exchange.model;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.enums.OrderType;
import lombok.*;

import java.math.BigDecimal;

/**
 * Запрос на размещение ордера в формате, понятном адаптеру биржи.
 * Для MARKET BUY на сумму в котируемой валюте заполняется {@code quoteQuantity}, а не {@code quantity}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderRequest {
    private String symbol;          // биржевой символ, например ETHUSDC
    private OrderSide side;
    private OrderType type;
    private BigDecimal quantity;    // BASE
    private BigDecimal quoteQuantity; // QUOTE, только MARKET BUY
    private BigDecimal price;       // только LIMIT
}
