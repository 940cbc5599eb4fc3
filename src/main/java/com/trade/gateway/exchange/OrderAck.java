package com.trade.gateway.exchange;

/**
 * Per-order acknowledgement. code is the exchange's row-level status, the success
 * code when the order was accepted.
 */
public record OrderAck(String orderId, String clientOrderId, String code, String message, boolean accepted) {

    public static OrderAck accepted(String orderId, String clientOrderId) {
        return new OrderAck(orderId, clientOrderId, "0", null, true);
    }

    public static OrderAck rejected(String clientOrderId, String code, String message) {
        return new OrderAck(null, clientOrderId, code, message, false);
    }
}
