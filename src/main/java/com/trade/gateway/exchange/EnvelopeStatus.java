package com.trade.gateway.exchange;

/**
 * Top-level code and message of an exchange response envelope. code is null when
 * the body was not a recognizable envelope.
 */
public record EnvelopeStatus(String code, String message) {

    public static final EnvelopeStatus UNPARSEABLE = new EnvelopeStatus(null, null);
}
