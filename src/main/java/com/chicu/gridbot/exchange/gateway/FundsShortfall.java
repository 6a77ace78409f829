package com.chicu.gridbot.exchange.gateway;

import java.math.BigDecimal;

/** Сколько нужно и сколько есть в котируемой валюте. */
public record FundsShortfall(BigDecimal required, BigDecimal available) {
}
