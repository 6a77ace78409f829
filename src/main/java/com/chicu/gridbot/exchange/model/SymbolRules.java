package com.chicu.gridbot.exchange.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Торговые фильтры символа. Любое поле может быть {@code null}, если биржа его не отдала.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SymbolRules {
    /** Шаг цены (PRICE_FILTER.tickSize / priceFilter.tickSize) */
    private BigDecimal tickSize;

    /** Шаг количества (LOT_SIZE.stepSize / lotSizeFilter.basePrecision) */
    private BigDecimal stepSize;

    private BigDecimal minQty;
    private BigDecimal minNotional;
}
