package com.trade.gateway.auth;

/**
 * Request canonicalization used before HMAC-SHA256.
 */
public enum SignatureScheme {
    /** timestamp(ISO-8601 ms) + METHOD + path?query + body, base64 digest (OKX). */
    ISO_TIMESTAMP_BASE64,
    /** sorted key=value&... over query, body fields, timestamp and recvWindow, hex digest (Bybit). */
    SORTED_PARAMS_HEX
}
