package com.trade.gateway.core;

import java.math.BigDecimal;

/**
 * maker/taker 手续费率，以名义价值的正小数表示（0.0005 = 5 个基点）
 */
public record FeeSchedule(BigDecimal makerRate, BigDecimal takerRate) {

    public static final FeeSchedule DEFAULT = new FeeSchedule(new BigDecimal("0.0002"), new BigDecimal("0.0005"));

    public BigDecimal rateFor(OrderType type) {
        return type == OrderType.LIMIT ? makerRate : takerRate;
    }
}
