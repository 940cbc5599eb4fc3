package com.trade.gateway.core;

/**
 * 订单类型
 * 条件单通过 {@link AlgoOrderRequest} 提交
 */
public enum OrderType {
    MARKET,
    LIMIT
}
