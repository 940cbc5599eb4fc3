package com.trade.gateway.exchange;

/**
 * 交易所异常
 * 携带交易所自己的错误码，已知时附带处理建议。
 */
public class ExchangeException extends Exception {

    private final ErrorCode errorCode;
    private final String exchangeCode;
    private final String hint;
    private final String responseBody;

    public ExchangeException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null, null);
    }

    public ExchangeException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, null, cause);
    }

    public ExchangeException(ErrorCode errorCode, String message, String exchangeCode, String hint) {
        this(errorCode, message, exchangeCode, hint, null);
    }

    public ExchangeException(ErrorCode errorCode, String message, String exchangeCode, String hint, Throwable cause) {
        this(errorCode, message, exchangeCode, hint, null, cause);
    }

    public ExchangeException(ErrorCode errorCode,
                             String message,
                             String exchangeCode,
                             String hint,
                             String responseBody,
                             Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.exchangeCode = exchangeCode;
        this.hint = hint;
        this.responseBody = responseBody;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getExchangeCode() {
        return exchangeCode;
    }

    public String getHint() {
        return hint;
    }

    /**
     * 交易所原始响应，未收到时为 null
     */
    public String getResponseBody() {
        return responseBody;
    }

    /**
     * 消息加处理建议，用于诊断
     */
    public String describe() {
        return hint == null ? getMessage() : getMessage() + " (提示: " + hint + ")";
    }

    public enum ErrorCode {
        NETWORK_ERROR,          // 网络错误（所有通道均失败）
        API_ERROR,              // API错误（响应异常或格式错误）
        AUTH_FAILED,            // 认证失败（密钥、签名、口令或环境错误）
        INVALID_SYMBOL,         // 无效交易对
        VALIDATION_FAILED,      // 本地校验失败，未发送请求
        ORDER_REJECTED          // 订单被拒绝
    }
}
