package com.chicu.gridbot.exchange.enums;

public enum OrderType {
    MARKET,
    LIMIT
}
