package com.trade.gateway.core;

/**
 * 已有订单的引用（订单号、客户端订单号或条件单号之一）
 */
public record OrderRef(Kind kind, String value) {

    public enum Kind {
        ORDER_ID,
        CLIENT_ORDER_ID,
        ALGO_ID
    }

    public OrderRef {
        if (kind == null || value == null || value.isBlank()) {
            throw new IllegalArgumentException("订单引用必须包含类型和值");
        }
    }

    public static OrderRef orderId(String orderId) {
        return new OrderRef(Kind.ORDER_ID, orderId);
    }

    public static OrderRef clientOrderId(String clientOrderId) {
        return new OrderRef(Kind.CLIENT_ORDER_ID, clientOrderId);
    }

    public static OrderRef algoId(String algoId) {
        return new OrderRef(Kind.ALGO_ID, algoId);
    }
}
