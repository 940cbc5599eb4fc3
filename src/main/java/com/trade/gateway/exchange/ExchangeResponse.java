package com.trade.gateway.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.transport.RawResponse;
import com.trade.gateway.transport.TransportFailure;

import java.util.List;

/**
 * Accepted exchange response: parsed root, raw body and the transports passed on the way.
 */
public record ExchangeResponse(JsonNode root, RawResponse raw, List<TransportFailure> failures) {

    public String body() {
        return raw.body();
    }
}
