package com.trade.gateway.transport;

import com.trade.gateway.error.Classification;

/**
 * One abandoned transport: how many attempts it got and why it was left.
 */
public record TransportFailure(String transport, int attempts, Classification classification, String message) {

    @Override
    public String toString() {
        return transport + "(" + attempts + "x " + classification + "): " + message;
    }
}
