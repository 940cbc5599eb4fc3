package com.trade.gateway.exchange;

import com.trade.gateway.core.MarginMode;
import com.trade.gateway.core.PositionSide;

import java.math.BigDecimal;

/**
 * Position as reported by the exchange, size in contracts (always positive).
 */
public record ExchangePosition(String instrumentId,
                               PositionSide side,
                               BigDecimal contracts,
                               BigDecimal leverage,
                               BigDecimal averagePrice,
                               BigDecimal unrealizedPnl,
                               MarginMode marginMode) {
}
