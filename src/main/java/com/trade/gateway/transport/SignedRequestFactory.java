package com.trade.gateway.transport;

/**
 * Produces a freshly signed request. Called once per attempt so every attempt
 * carries its own timestamp.
 */
@FunctionalInterface
public interface SignedRequestFactory {

    SignedRequest create();
}
