package com.trade.gateway.execution;

import com.trade.gateway.exchange.ExchangeException;

import java.math.BigDecimal;

/**
 * 单次订单操作的结果
 * 成功字段（订单号、成交、手续费）与错误字段（类型、交易所错误码、消息）不会同时存在。
 */
public final class OrderResult {
    private final boolean success;
    private final String orderId;
    private final String clientOrderId;
    private final BigDecimal requestedQuantity;  // 币数量
    private final BigDecimal filledQuantity;     // 币数量，未知时为 null
    private final BigDecimal averagePrice;
    private final BigDecimal estimatedFee;       // USDT
    private final ExchangeException.ErrorCode errorKind;
    private final String exchangeCode;
    private final String errorMessage;
    private final String rawResponse;

    private OrderResult(boolean success,
                        String orderId,
                        String clientOrderId,
                        BigDecimal requestedQuantity,
                        BigDecimal filledQuantity,
                        BigDecimal averagePrice,
                        BigDecimal estimatedFee,
                        ExchangeException.ErrorCode errorKind,
                        String exchangeCode,
                        String errorMessage,
                        String rawResponse) {
        this.success = success;
        this.orderId = orderId;
        this.clientOrderId = clientOrderId;
        this.requestedQuantity = requestedQuantity;
        this.filledQuantity = filledQuantity;
        this.averagePrice = averagePrice;
        this.estimatedFee = estimatedFee;
        this.errorKind = errorKind;
        this.exchangeCode = exchangeCode;
        this.errorMessage = errorMessage;
        this.rawResponse = rawResponse;
    }

    public static OrderResult success(String orderId,
                                      String clientOrderId,
                                      BigDecimal requestedQuantity,
                                      BigDecimal filledQuantity,
                                      BigDecimal averagePrice,
                                      BigDecimal estimatedFee,
                                      String rawResponse) {
        return new OrderResult(true, orderId, clientOrderId, requestedQuantity, filledQuantity,
                averagePrice, estimatedFee, null, null, null, rawResponse);
    }

    public static OrderResult failure(String clientOrderId,
                                      ExchangeException.ErrorCode errorKind,
                                      String exchangeCode,
                                      String errorMessage,
                                      String rawResponse) {
        if (errorKind == null) {
            throw new IllegalArgumentException("失败结果必须包含错误类型");
        }
        return new OrderResult(false, null, clientOrderId, null, null, null, null,
                errorKind, exchangeCode, errorMessage, rawResponse);
    }

    public static OrderResult fromException(String clientOrderId, ExchangeException e) {
        return failure(clientOrderId, e.getErrorCode(), e.getExchangeCode(), e.describe(), e.getResponseBody());
    }

    public boolean isSuccess() { return success; }
    public String getOrderId() { return orderId; }
    public String getClientOrderId() { return clientOrderId; }
    public BigDecimal getRequestedQuantity() { return requestedQuantity; }
    public BigDecimal getFilledQuantity() { return filledQuantity; }
    public BigDecimal getAveragePrice() { return averagePrice; }
    public BigDecimal getEstimatedFee() { return estimatedFee; }
    public ExchangeException.ErrorCode getErrorKind() { return errorKind; }
    public String getExchangeCode() { return exchangeCode; }
    public String getErrorMessage() { return errorMessage; }
    public String getRawResponse() { return rawResponse; }

    @Override
    public String toString() {
        if (success) {
            return String.format("OrderResult{success, ordId=%s, clOrdId=%s, qty=%s, filled=%s, avgPx=%s, fee=%s}",
                    orderId, clientOrderId, requestedQuantity, filledQuantity, averagePrice, estimatedFee);
        }
        return String.format("OrderResult{failed, clOrdId=%s, kind=%s, code=%s, msg=%s}",
                clientOrderId, errorKind, exchangeCode, errorMessage);
    }
}
