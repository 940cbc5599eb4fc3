package com.trade.gateway.transport;

import java.util.Locale;

/**
 * How a request reaches the exchange.
 */
public enum TransportKind {
    /** Straight to the exchange host. */
    DIRECT,
    /** Through an HTTP proxy socket (CONNECT tunnel for https). */
    FORWARD_PROXY,
    /** To a scraping-proxy service that takes the target URL and headers as its own query parameters. */
    PARAM_PROXY;

    public static TransportKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Transport type is required");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
