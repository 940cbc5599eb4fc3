package com.trade.gateway.core;

import java.math.BigDecimal;

/**
 * 交易所上的挂单（未成交或部分成交）
 */
public record PendingOrder(String orderId,
                           String clientOrderId,
                           Symbol symbol,
                           Side side,
                           String orderType,
                           BigDecimal price,
                           BigDecimal quantityCoins,
                           BigDecimal filledCoins,
                           String state,
                           boolean reduceOnly) {
}
