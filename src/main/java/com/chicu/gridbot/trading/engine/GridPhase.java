package com.chicu.gridbot.trading.engine;

public enum GridPhase {
    /** Лестница пуста: следующий тик начнёт цикл рыночной покупкой */
    STARTING,
    /** Рыночная покупка отправлена, исполнение сверяется по orderId; новая не отправляется */
    AWAITING_FILL,
    /** Есть открытая покупка и/или продажи */
    LADDER_ACTIVE
}
