package com.chicu.gridbot.exchange.gateway;

public enum OrderState {
    OPEN,
    CLOSED,
    CANCELED,
    NOT_FOUND,
    ERROR
}
