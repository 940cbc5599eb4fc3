package com.trade.gateway.exchange;

import com.trade.gateway.core.Side;

import java.math.BigDecimal;

/**
 * Order as reported by the exchange, sizes in contracts.
 */
public record ExchangeOrder(String orderId,
                            String clientOrderId,
                            String instrumentId,
                            Side side,
                            String orderType,
                            BigDecimal price,
                            BigDecimal contracts,
                            BigDecimal filledContracts,
                            BigDecimal averagePrice,
                            String state,
                            boolean reduceOnly) {
}
