package com.chicu.gridbot.exchange.enums;

public enum OrderSide {
    BUY,
    SELL
}
