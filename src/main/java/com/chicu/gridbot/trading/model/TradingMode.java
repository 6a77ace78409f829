package com.chicu.gridbot.trading.model;

import com.chicu.gridbot.exchange.enums.NetworkType;

public enum TradingMode {
    TESTNET(NetworkType.TESTNET),
    REAL(NetworkType.MAINNET);

    private final NetworkType network;

    TradingMode(NetworkType network) {
        this.network = network;
    }

    public NetworkType network() {
        return network;
    }
}
