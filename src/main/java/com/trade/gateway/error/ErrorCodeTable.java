package com.trade.gateway.error;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Exchange-specific error codes, consulted by {@link ErrorClassifier} and the execution service.
 */
public final class ErrorCodeTable {

    private final String successCode;
    private final Set<String> authenticationCodes;
    private final Set<String> retryableCodes;
    private final Set<String> leverageUnchangedCodes;
    private final Set<String> duplicateClientOrderIdCodes;
    private final Map<String, String> hints;

    public ErrorCodeTable(String successCode,
                          Set<String> authenticationCodes,
                          Set<String> retryableCodes,
                          Set<String> leverageUnchangedCodes,
                          Set<String> duplicateClientOrderIdCodes,
                          Map<String, String> hints) {
        this.successCode = successCode;
        this.authenticationCodes = Set.copyOf(authenticationCodes);
        this.retryableCodes = Set.copyOf(retryableCodes);
        this.leverageUnchangedCodes = Set.copyOf(leverageUnchangedCodes);
        this.duplicateClientOrderIdCodes = Set.copyOf(duplicateClientOrderIdCodes);
        this.hints = Map.copyOf(hints);
    }

    public static ErrorCodeTable okx() {
        Map<String, String> hints = new HashMap<>();
        hints.put("50101", "API key does not match the environment; demo keys need demo trading enabled (okx.demo=true) and live keys need it off");
        hints.put("50102", "Request timestamp expired; check the host clock (NTP)");
        hints.put("50103", "OK-ACCESS-KEY header missing or empty; check okx.api.key");
        hints.put("50104", "OK-ACCESS-PASSPHRASE missing; check okx.passphrase");
        hints.put("50105", "Passphrase is wrong for this API key");
        hints.put("50111", "Invalid API key; regenerate it or check for stray whitespace");
        hints.put("50113", "Invalid signature; check okx.secret.key and the system clock");
        hints.put("50110", "Request IP is not on the API key whitelist");
        hints.put("51000", "Parameter error; check size, price and instrument fields");
        hints.put("51001", "Instrument does not exist; check the symbol or contract type");
        hints.put("51008", "Insufficient margin; lower the size or leverage, or add funds");
        hints.put("51010", "Account mode does not support this order; switch to single-currency or multi-currency margin mode");
        hints.put("51020", "Order size below the instrument minimum");
        hints.put("51121", "Order size must be a multiple of the lot size");
        hints.put("51202", "Market order size exceeds the maximum allowed");
        hints.put("51016", "Duplicate clOrdId; an order with this client id already exists");
        hints.put("59000", "Cancel pending orders or close positions before changing this setting");
        return new ErrorCodeTable(
                "0",
                Set.of("50100", "50101", "50102", "50103", "50104", "50105", "50106", "50107",
                        "50111", "50112", "50113", "50114"),
                Set.of("50001", "50004", "50011", "50013", "50026"),
                Set.of(),
                Set.of("51016"),
                hints
        );
    }

    public static ErrorCodeTable bybit() {
        Map<String, String> hints = new HashMap<>();
        hints.put("10002", "Request timestamp outside recvWindow; check the host clock (NTP)");
        hints.put("10003", "Invalid API key; check bybit.api.key and whether it belongs to testnet or mainnet");
        hints.put("10004", "Invalid signature; check bybit.secret.key and the parameter encoding");
        hints.put("10005", "API key lacks the required permission (enable Contract trading)");
        hints.put("10010", "Request IP is not on the API key whitelist");
        hints.put("110007", "Insufficient available balance; lower the size or leverage, or add funds");
        hints.put("110043", "Leverage already set to this value");
        hints.put("110072", "Duplicate orderLinkId; an order with this client id already exists");
        hints.put("10001", "Parameter error; check size, price and symbol fields");
        return new ErrorCodeTable(
                "0",
                Set.of("10002", "10003", "10004", "10005", "10007", "10009", "33004"),
                Set.of("10000", "10006", "10016"),
                Set.of("110043"),
                Set.of("110072"),
                hints
        );
    }

    public String getSuccessCode() {
        return successCode;
    }

    public boolean isSuccess(String code) {
        return successCode.equals(code);
    }

    public boolean isAuthentication(String code) {
        return code != null && authenticationCodes.contains(code);
    }

    public boolean isRetryable(String code) {
        return code != null && retryableCodes.contains(code);
    }

    public boolean isLeverageUnchanged(String code) {
        return code != null && leverageUnchangedCodes.contains(code);
    }

    public boolean isDuplicateClientOrderId(String code) {
        return code != null && duplicateClientOrderIdCodes.contains(code);
    }

    public String hintFor(String code) {
        return code == null ? null : hints.get(code);
    }
}
