package com.chicu.gridbot.trading.engine;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Ступень лестницы: выставленный лимитный ордер.
 */
@Value
@Builder
public class LadderOrder {
    String orderId;
    BigDecimal price;
    BigDecimal quantity;

    /** Для продажи: цена покупки, из которой она выставлена */
    BigDecimal buyPrice;

    /** Для продажи: сколько монет оставлено на руках при её выставлении */
    @Builder.Default
    BigDecimal retainedQty = BigDecimal.ZERO;
}
