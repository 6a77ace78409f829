package com.chicu.gridbot.trading.model;

/**
 * Как фиксировать прибыль на продаже.
 */
public enum ProfitMode {
    /** Продаётся всё купленное количество */
    USDC,
    /** Продаётся только на сумму цикла, остаток монет удерживается */
    CRYPTO
}
