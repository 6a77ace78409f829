package com.chicu.gridbot.exchange.model;

import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Унифицированный ответ на размещение ордера.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderResponse {

    private String orderId;          // ID ордера на бирже
    private String symbol;
    private String status;           // сырой статус биржи (NEW, FILLED, ...)

    private BigDecimal price;        // LIMIT = лимитная цена
    private BigDecimal origQty;      // запрошенный объём (BASE)
    private BigDecimal executedQty;  // исполнено (BASE)
    private BigDecimal avgPrice;     // средняя цена исполнения, если биржа её вернула
    private BigDecimal quoteQty;     // потрачено/получено в QUOTE

    private Instant transactTime;
}
