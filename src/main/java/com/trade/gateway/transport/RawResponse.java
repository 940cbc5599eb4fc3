package com.trade.gateway.transport;

/**
 * Unparsed response plus the transport that produced it.
 */
public record RawResponse(String transportName, int httpStatus, String body) {
}
