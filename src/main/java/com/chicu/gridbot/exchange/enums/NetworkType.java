package com.chicu.gridbot.exchange.enums;

public enum NetworkType {
    MAINNET,
    TESTNET
}
