package com.trade.gateway.core;

import java.math.BigDecimal;

/**
 * 单个合约的账户下单上限（合约张数）
 * 字段为 null 表示交易所未返回该上限
 */
public record SizeLimits(BigDecimal maxBuy,
                         BigDecimal maxSell,
                         BigDecimal availableBuy,
                         BigDecimal availableSell) {

    public BigDecimal maxFor(Side side) {
        return side == Side.BUY ? maxBuy : maxSell;
    }

    public BigDecimal availableFor(Side side) {
        return side == Side.BUY ? availableBuy : availableSell;
    }
}
